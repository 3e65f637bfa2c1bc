package io.callscan.source;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * The project's go.mod: its module path and the directory it was found in.
 *
 * @param modulePath Module path from the {@code module} directive
 * @param directory  Directory containing go.mod; package import paths are relative to it
 */
public record ModuleManifest(String modulePath, Path directory) {

    public static final String FILE_NAME = "go.mod";

    /**
     * Walks upward from {@code start} until a go.mod is found.
     *
     * @throws ManifestNotFoundException if no go.mod exists up to the filesystem root, or it has no module directive
     */
    public static ModuleManifest locate(Path start) throws IOException {
        Path dir = start.toAbsolutePath().normalize();
        while (dir != null) {
            Path candidate = dir.resolve(FILE_NAME);
            if (Files.isRegularFile(candidate)) {
                return read(candidate);
            }
            dir = dir.getParent();
        }
        throw new ManifestNotFoundException(FILE_NAME + " not found in " + start + " or any parent directory");
    }

    /**
     * Reads the module directive of a go.mod file.
     */
    public static ModuleManifest read(Path goMod) throws IOException {
        List<String> lines = Files.readAllLines(goMod, StandardCharsets.UTF_8);
        for (String raw : lines) {
            String line = stripComment(raw).trim();
            if (!line.startsWith("module")) {
                continue;
            }
            String rest = line.substring("module".length());
            if (rest.isEmpty() || !Character.isWhitespace(rest.charAt(0))) {
                continue;
            }
            String path = unquote(rest.trim());
            if (!path.isEmpty()) {
                return new ModuleManifest(path, goMod.toAbsolutePath().normalize().getParent());
            }
        }
        throw new ManifestNotFoundException("module path not declared in " + goMod);
    }

    /**
     * Import path of the package stored in {@code packageDir}.
     */
    public String packagePathFor(Path packageDir) {
        Path absolute = packageDir.toAbsolutePath().normalize();
        if (!absolute.startsWith(directory)) {
            return modulePath;
        }
        Path relative = directory.relativize(absolute);
        String rel = relative.toString().replace('\\', '/');
        return rel.isEmpty() ? modulePath : modulePath + "/" + rel;
    }

    /**
     * Directory of an in-module package relative to the module root, empty for the root package.
     */
    public String relativeDirectory(String importPath) {
        if (!importPath.startsWith(modulePath + "/")) {
            return "";
        }
        return importPath.substring(modulePath.length() + 1);
    }

    /**
     * Whether an import path names a package of this module.
     */
    public boolean contains(String importPath) {
        return importPath.equals(modulePath) || importPath.startsWith(modulePath + "/");
    }

    private static String stripComment(String line) {
        int idx = line.indexOf("//");
        return idx >= 0 ? line.substring(0, idx) : line;
    }

    private static String unquote(String value) {
        if (value.length() >= 2) {
            char first = value.charAt(0);
            char last = value.charAt(value.length() - 1);
            if ((first == '"' && last == '"') || (first == '`' && last == '`')) {
                return value.substring(1, value.length() - 1).trim();
            }
        }
        return value;
    }
}
