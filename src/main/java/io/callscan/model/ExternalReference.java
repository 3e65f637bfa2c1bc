package io.callscan.model;

/**
 * A call target not resolvable to any indexed function.
 *
 * @param name            Called function name
 * @param alias           Import alias used at the call site (empty for bare calls)
 * @param importPath      Import path, empty when unknown
 * @param standardLibrary Whether the import path belongs to the Go standard library
 */
public record ExternalReference(
    String name,
    String alias,
    String importPath,
    boolean standardLibrary
) {
    public static ExternalReference of(CallTarget.ExternalCall call) {
        return new ExternalReference(call.name(), call.alias(), call.importPath(),
            isStandardLibrary(call.importPath()));
    }

    /**
     * Standard library import paths have no dot in their first element ("fmt", "net/http").
     */
    public static boolean isStandardLibrary(String importPath) {
        if (importPath == null || importPath.isEmpty()) {
            return false;
        }
        int slash = importPath.indexOf('/');
        String first = slash >= 0 ? importPath.substring(0, slash) : importPath;
        return !first.contains(".");
    }

    /**
     * {@code importPath.name} when the import path is known, otherwise {@code name}.
     */
    public String qualifiedName() {
        return importPath.isEmpty() ? name : importPath + "." + name;
    }
}
