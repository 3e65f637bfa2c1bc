package io.callscan.source;

import io.callscan.model.ImportTable;
import org.treesitter.TSNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the alias -> import path table of a parsed file.
 * Without an explicit alias the last path segment is used.
 */
public final class ImportTableBuilder {

    private ImportTableBuilder() {
    }

    public static ImportTable build(GoSourceFile file) {
        Map<String, String> aliases = new LinkedHashMap<>();
        List<String> dotImports = new ArrayList<>();

        for (TSNode decl : GoSourceFile.namedChildren(file.root())) {
            if (!"import_declaration".equals(decl.getType())) {
                continue;
            }
            for (TSNode spec : importSpecs(decl)) {
                TSNode pathNode = GoSourceFile.field(spec, "path");
                if (pathNode == null) {
                    continue;
                }
                String importPath = unquote(file.text(pathNode));
                TSNode nameNode = GoSourceFile.field(spec, "name");
                String alias = nameNode != null ? file.text(nameNode).trim() : defaultAlias(importPath);

                if (ImportTable.DOT_IMPORT.equals(alias)) {
                    dotImports.add(importPath);
                } else {
                    aliases.put(alias, importPath);
                }
            }
        }
        return new ImportTable(aliases, dotImports);
    }

    /**
     * Last element of the import path: "github.com/acme/util" -> "util".
     */
    public static String defaultAlias(String importPath) {
        String trimmed = importPath.endsWith("/") ? importPath.substring(0, importPath.length() - 1) : importPath;
        int slash = trimmed.lastIndexOf('/');
        return slash >= 0 ? trimmed.substring(slash + 1) : trimmed;
    }

    private static List<TSNode> importSpecs(TSNode decl) {
        List<TSNode> specs = new ArrayList<>();
        for (TSNode child : GoSourceFile.namedChildren(decl)) {
            if ("import_spec".equals(child.getType())) {
                specs.add(child);
            } else if ("import_spec_list".equals(child.getType())) {
                for (TSNode spec : GoSourceFile.namedChildren(child)) {
                    if ("import_spec".equals(spec.getType())) {
                        specs.add(spec);
                    }
                }
            }
        }
        return specs;
    }

    private static String unquote(String literal) {
        String value = literal.trim();
        if (value.length() >= 2 && (value.startsWith("\"") || value.startsWith("`"))) {
            return value.substring(1, value.length() - 1);
        }
        return value;
    }
}
