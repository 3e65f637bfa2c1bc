package io.callscan.source;

import io.callscan.model.FunctionDescriptor;
import io.callscan.model.Parameter;
import org.treesitter.TSNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns function and method declaration nodes into {@link FunctionDescriptor}s.
 */
public final class DeclarationReader {

    private DeclarationReader() {
    }

    public static FunctionDescriptor read(GoSourceFile file, String packagePath, TSNode decl) {
        String name = file.text(GoSourceFile.field(decl, "name")).trim();
        String receiver = "method_declaration".equals(decl.getType())
            ? receiverType(file, GoSourceFile.field(decl, "receiver"))
            : "";

        return new FunctionDescriptor(
            file.packageName(),
            packagePath,
            receiver,
            name,
            file.path(),
            file.line(decl),
            file.endLine(decl),
            parameters(file, GoSourceFile.field(decl, "parameters")),
            results(file, GoSourceFile.field(decl, "result")),
            GoSourceFile.field(decl, "body") != null
        );
    }

    /**
     * Names declared by top-level type declarations, aliases included.
     */
    public static List<String> typeNames(GoSourceFile file) {
        List<String> names = new ArrayList<>();
        for (TSNode decl : GoSourceFile.namedChildren(file.root())) {
            if (!"type_declaration".equals(decl.getType())) {
                continue;
            }
            for (TSNode spec : GoSourceFile.namedChildren(decl)) {
                TSNode name = GoSourceFile.field(spec, "name");
                if (name != null) {
                    names.add(file.text(name).trim());
                }
            }
        }
        return names;
    }

    /**
     * Receiver type with the pointer marker and type arguments removed: {@code (s *Store[K])} -> {@code Store}.
     */
    static String receiverType(GoSourceFile file, TSNode receiverList) {
        for (TSNode param : GoSourceFile.namedChildren(receiverList)) {
            TSNode type = GoSourceFile.field(param, "type");
            if (type != null) {
                return normalizeReceiver(file.text(type));
            }
        }
        return "";
    }

    static String normalizeReceiver(String typeText) {
        String type = typeText.trim();
        while (type.startsWith("*") || type.startsWith("(")) {
            type = type.substring(1).trim();
        }
        int bracket = type.indexOf('[');
        if (bracket >= 0) {
            type = type.substring(0, bracket);
        }
        int paren = type.indexOf(')');
        if (paren >= 0) {
            type = type.substring(0, paren);
        }
        return type.trim();
    }

    static List<Parameter> parameters(GoSourceFile file, TSNode parameterList) {
        List<Parameter> params = new ArrayList<>();
        for (TSNode param : GoSourceFile.namedChildren(parameterList)) {
            String kind = param.getType();
            if (!"parameter_declaration".equals(kind) && !"variadic_parameter_declaration".equals(kind)) {
                continue;
            }
            TSNode typeNode = GoSourceFile.field(param, "type");
            String type = file.text(typeNode).trim();
            if ("variadic_parameter_declaration".equals(kind)) {
                type = "..." + type;
            }
            List<String> names = declaredNames(file, param, typeNode);
            if (names.isEmpty()) {
                params.add(new Parameter("", type));
            } else {
                for (String name : names) {
                    params.add(new Parameter(name, type));
                }
            }
        }
        return params;
    }

    static List<String> results(GoSourceFile file, TSNode result) {
        if (result == null) {
            return List.of();
        }
        if (!"parameter_list".equals(result.getType())) {
            return List.of(file.text(result).trim());
        }
        return parameters(file, result).stream().map(Parameter::render).toList();
    }

    private static List<String> declaredNames(GoSourceFile file, TSNode param, TSNode typeNode) {
        List<String> names = new ArrayList<>();
        int typeStart = typeNode != null ? typeNode.getStartByte() : Integer.MAX_VALUE;
        for (TSNode child : GoSourceFile.namedChildren(param)) {
            if ("identifier".equals(child.getType()) && child.getStartByte() < typeStart) {
                names.add(file.text(child).trim());
            }
        }
        return names;
    }
}
