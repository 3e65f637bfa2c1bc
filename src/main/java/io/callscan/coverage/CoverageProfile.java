package io.callscan.coverage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A parsed {@code go test -coverprofile} file.
 * <p>
 * Data lines look like {@code path:startLine.startCol,endLine.endCol numStmt count};
 * the statement count may be missing. Lines that do not match are skipped and counted.
 */
public final class CoverageProfile {

    private static final Logger log = LoggerFactory.getLogger(CoverageProfile.class);

    private static final String MODE_HEADER = "mode:";
    private static final Pattern BLOCK = Pattern.compile(
        "^(.+):(\\d+)\\.(\\d+),(\\d+)\\.(\\d+)\\s+(\\d+)(?:\\s+(\\d+))?$");

    private final String mode;
    private final Map<String, List<CoverageBlock>> blocksByFile;
    private final int malformedLines;

    private CoverageProfile(String mode, Map<String, List<CoverageBlock>> blocksByFile, int malformedLines) {
        this.mode = mode;
        Map<String, List<CoverageBlock>> copy = new LinkedHashMap<>();
        blocksByFile.forEach((file, blocks) -> copy.put(file, List.copyOf(blocks)));
        this.blocksByFile = Collections.unmodifiableMap(copy);
        this.malformedLines = malformedLines;
    }

    public static CoverageProfile parse(Path profile) throws CoverageProfileException {
        try (BufferedReader reader = Files.newBufferedReader(profile, StandardCharsets.UTF_8)) {
            return parse(reader);
        } catch (IOException e) {
            throw new CoverageProfileException("Cannot read coverage profile " + profile + ": " + e.getMessage(), e);
        }
    }

    public static CoverageProfile parse(Reader source) throws IOException {
        BufferedReader reader = source instanceof BufferedReader b ? b : new BufferedReader(source);
        String mode = "";
        Map<String, List<CoverageBlock>> blocks = new LinkedHashMap<>();
        int malformed = 0;
        int lineNumber = 0;

        String line;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            String trimmed = line.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            if (trimmed.startsWith(MODE_HEADER)) {
                mode = trimmed.substring(MODE_HEADER.length()).trim();
                continue;
            }
            CoverageBlock block = parseBlock(trimmed);
            if (block == null) {
                malformed++;
                log.debug("Skipping malformed coverage line {}: {}", lineNumber, trimmed);
                continue;
            }
            blocks.computeIfAbsent(block.file(), f -> new ArrayList<>()).add(block);
        }
        return new CoverageProfile(mode, blocks, malformed);
    }

    /**
     * Parses one data line, or returns null when it is malformed.
     */
    static CoverageBlock parseBlock(String line) {
        Matcher m = BLOCK.matcher(line);
        if (!m.matches()) {
            return null;
        }
        try {
            int startLine = Integer.parseInt(m.group(2));
            int endLine = Integer.parseInt(m.group(4));
            if (endLine < startLine) {
                return null;
            }
            boolean hasStatements = m.group(7) != null;
            int statements = hasStatements ? Integer.parseInt(m.group(6)) : -1;
            long count = Long.parseLong(hasStatements ? m.group(7) : m.group(6));
            return new CoverageBlock(m.group(1).replace('\\', '/'), startLine, Integer.parseInt(m.group(3)),
                endLine, Integer.parseInt(m.group(5)), statements, count);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public String mode() {
        return mode;
    }

    public List<CoverageBlock> blocks(String file) {
        return blocksByFile.getOrDefault(file, List.of());
    }

    public boolean hasFile(String file) {
        return blocksByFile.containsKey(file);
    }

    public Map<String, List<CoverageBlock>> blocksByFile() {
        return blocksByFile;
    }

    public int malformedLines() {
        return malformedLines;
    }
}
