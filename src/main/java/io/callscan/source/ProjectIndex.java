package io.callscan.source;

import io.callscan.model.FunctionRegistry;
import io.callscan.model.ImportTable;
import io.callscan.model.ScanWarning;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of indexing a source tree.
 *
 * @param manifest Module the tree belongs to
 * @param root     Directory that was walked
 * @param registry Every function and method found
 * @param imports  Import table per successfully parsed file
 * @param files    Files that were parsed, sorted
 * @param warnings Files skipped and identity collisions
 */
public record ProjectIndex(
    ModuleManifest manifest,
    Path root,
    FunctionRegistry registry,
    Map<Path, ImportTable> imports,
    List<Path> files,
    List<ScanWarning> warnings
) {
    public ProjectIndex {
        imports = Collections.unmodifiableMap(new LinkedHashMap<>(imports));
        files = List.copyOf(files);
        warnings = List.copyOf(warnings);
    }

    public ImportTable importsOf(Path file) {
        return imports.getOrDefault(file, ImportTable.empty());
    }

    public String modulePath() {
        return manifest.modulePath();
    }

    /**
     * Whether an import path belongs to the indexed module.
     */
    public boolean isInternal(String importPath) {
        return manifest.contains(importPath);
    }
}
