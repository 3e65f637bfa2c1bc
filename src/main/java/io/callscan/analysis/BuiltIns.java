package io.callscan.analysis;

import java.util.Set;

/**
 * Predeclared Go identifiers that look like calls but are not function calls worth recording:
 * built-in functions and conversions to predeclared types.
 */
final class BuiltIns {

    private static final Set<String> FUNCTIONS = Set.of(
        "append", "cap", "clear", "close", "complex", "copy", "delete", "imag", "len",
        "make", "max", "min", "new", "panic", "print", "println", "real", "recover"
    );

    private static final Set<String> TYPES = Set.of(
        "any", "bool", "byte", "comparable", "complex64", "complex128", "error",
        "float32", "float64", "int", "int8", "int16", "int32", "int64", "rune", "string",
        "uint", "uint8", "uint16", "uint32", "uint64", "uintptr"
    );

    private BuiltIns() {
    }

    static boolean isBuiltIn(String identifier) {
        return FUNCTIONS.contains(identifier) || TYPES.contains(identifier);
    }
}
