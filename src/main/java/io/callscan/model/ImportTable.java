package io.callscan.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Import aliases of one source file, mapped to their full import paths.
 *
 * @param aliases    alias -> import path, in declaration order (blank imports included)
 * @param dotImports paths imported with {@code import . "path"}
 */
public record ImportTable(Map<String, String> aliases, List<String> dotImports) {

    public static final String DOT_IMPORT = ".";
    public static final String BLANK_IMPORT = "_";

    public ImportTable {
        aliases = Collections.unmodifiableMap(new LinkedHashMap<>(aliases));
        dotImports = List.copyOf(dotImports);
    }

    public static ImportTable empty() {
        return new ImportTable(Map.of(), List.of());
    }

    /**
     * Whether {@code name} can qualify a call as {@code name.F()}.
     */
    public boolean isPackageAlias(String name) {
        return !BLANK_IMPORT.equals(name) && aliases.containsKey(name);
    }

    public Optional<String> importPath(String alias) {
        return Optional.ofNullable(aliases.get(alias));
    }

    public int size() {
        return aliases.size() + dotImports.size();
    }
}
