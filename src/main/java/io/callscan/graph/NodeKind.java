package io.callscan.graph;

/**
 * What a call graph node stands for.
 */
public enum NodeKind {
    /** Function or method declared in the indexed source tree */
    INTERNAL,
    /** Function of a package outside the module */
    EXTERNAL,
    /** Call that could not be tied to a declaration: unknown names, missing internal functions, method calls */
    UNRESOLVED,
    /** Function literal invoked in place */
    ANONYMOUS
}
