package io.callscan.model;

import java.nio.file.Path;
import java.util.List;

/**
 * A function or method declared in the indexed source tree.
 *
 * @param packageName Declared package name (from the package clause)
 * @param packagePath Import path of the package (module path + directory)
 * @param receiver    Receiver type name with pointer marker and type arguments stripped, empty for free functions
 * @param name        Declared function name
 * @param file        Source file the declaration lives in
 * @param startLine   Line of the {@code func} keyword (1-based)
 * @param endLine     Line of the closing brace (1-based)
 * @param parameters  Parameters in declaration order
 * @param returns     Result types in declaration order (named results rendered as "name type")
 * @param hasBody     False for body-less declarations (assembly-backed functions)
 * @param qualifier   Identity prefix: the package name, or the module-relative directory plus the package name
 *                    when several packages of the module share that name
 */
public record FunctionDescriptor(
    String packageName,
    String packagePath,
    String receiver,
    String name,
    Path file,
    int startLine,
    int endLine,
    List<Parameter> parameters,
    List<String> returns,
    boolean hasBody,
    String qualifier
) {
    public FunctionDescriptor {
        receiver = receiver != null ? receiver : "";
        qualifier = qualifier != null && !qualifier.isEmpty() ? qualifier : packageName;
        parameters = List.copyOf(parameters);
        returns = List.copyOf(returns);
    }

    public FunctionDescriptor(String packageName, String packagePath, String receiver, String name, Path file,
                              int startLine, int endLine, List<Parameter> parameters, List<String> returns,
                              boolean hasBody) {
        this(packageName, packagePath, receiver, name, file, startLine, endLine, parameters, returns, hasBody,
            packageName);
    }

    public FunctionDescriptor withQualifier(String newQualifier) {
        return new FunctionDescriptor(packageName, packagePath, receiver, name, file, startLine, endLine,
            parameters, returns, hasBody, newQualifier);
    }

    /**
     * Canonical identity, unique across the indexed tree:
     * {@code qualifier/Receiver.name} for methods, {@code qualifier.name} otherwise.
     */
    public String identity() {
        return identityOf(qualifier, receiver, name);
    }

    private static String identityOf(String qualifier, String receiver, String name) {
        if (receiver == null || receiver.isEmpty()) {
            return qualifier + "." + name;
        }
        return qualifier + "/" + receiver + "." + name;
    }

    public boolean isMethod() {
        return !receiver.isEmpty();
    }

    /**
     * Name as written at a call site: {@code Receiver.name} or {@code name}.
     */
    public String displayName() {
        return isMethod() ? receiver + "." + name : name;
    }

    public String fileName() {
        return file.getFileName().toString();
    }

    /**
     * Key used by coverage profiles: the package import path followed by the file name.
     */
    public String importFileKey() {
        return packagePath + "/" + fileName();
    }

    public List<String> renderedParameters() {
        return parameters.stream().map(Parameter::render).toList();
    }
}
