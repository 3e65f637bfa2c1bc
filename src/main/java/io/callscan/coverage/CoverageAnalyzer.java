package io.callscan.coverage;

import io.callscan.model.FunctionDescriptor;
import io.callscan.source.ProjectIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Marks each indexed function tested or untested from a coverage profile.
 * <p>
 * A function is tested only if a block with a positive hit count overlaps its own
 * line span; covered code elsewhere in the same file does not count.
 */
public class CoverageAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(CoverageAnalyzer.class);

    public CoverageReport analyze(Path profile, ProjectIndex index) throws CoverageProfileException {
        return analyze(CoverageProfile.parse(profile), index);
    }

    public CoverageReport analyze(CoverageProfile profile, ProjectIndex index) {
        List<String> tested = new ArrayList<>();
        List<String> untested = new ArrayList<>();

        for (FunctionDescriptor function : index.registry().all()) {
            if (isCovered(function, blocksFor(function, profile, index))) {
                tested.add(function.identity());
            } else {
                untested.add(function.identity());
            }
        }
        if (profile.malformedLines() > 0) {
            log.warn("{} malformed coverage line(s) skipped", profile.malformedLines());
        }
        log.info("Coverage: {} tested, {} untested", tested.size(), untested.size());
        return new CoverageReport(profile.mode(), tested, untested, profile.malformedLines());
    }

    static boolean isCovered(FunctionDescriptor function, List<CoverageBlock> blocks) {
        if (!function.hasBody()) {
            return false;
        }
        for (CoverageBlock block : blocks) {
            if (block.isCovered() && block.overlaps(function.startLine(), function.endLine())) {
                return true;
            }
        }
        return false;
    }

    /**
     * Blocks recorded for the function's file. Profiles name files by import path;
     * absolute paths and paths relative to the go.mod directory are accepted too.
     */
    static List<CoverageBlock> blocksFor(FunctionDescriptor function, CoverageProfile profile, ProjectIndex index) {
        for (String key : fileKeys(function, index)) {
            if (profile.hasFile(key)) {
                return profile.blocks(key);
            }
        }
        return List.of();
    }

    private static List<String> fileKeys(FunctionDescriptor function, ProjectIndex index) {
        Path file = function.file().toAbsolutePath().normalize();
        List<String> keys = new ArrayList<>();
        keys.add(function.importFileKey());
        keys.add(slashes(file.toString()));
        Path manifestDir = index.manifest().directory();
        if (file.startsWith(manifestDir)) {
            keys.add(slashes(manifestDir.relativize(file).toString()));
        }
        return keys;
    }

    private static String slashes(String path) {
        return path.replace('\\', '/');
    }
}
