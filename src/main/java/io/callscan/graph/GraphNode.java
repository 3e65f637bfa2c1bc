package io.callscan.graph;

/**
 * A node of the call graph.
 *
 * @param handle      Position in the graph's node table
 * @param identity    Canonical identity for internal nodes, namespaced key ({@code ext:}, {@code unresolved:},
 *                    {@code method:}, {@code literal:}) for the others
 * @param kind        What the node stands for
 * @param label       Text to display
 * @param packageName Identity prefix of the owning package for internal nodes, empty otherwise
 * @param receiver    Receiver type for internal methods, empty otherwise
 */
public record GraphNode(
    int handle,
    String identity,
    NodeKind kind,
    String label,
    String packageName,
    String receiver
) {
    public GraphNode {
        if (identity == null || identity.isBlank()) {
            throw new IllegalArgumentException("Node identity cannot be null or blank");
        }
        label = label != null ? label : identity;
        packageName = packageName != null ? packageName : "";
        receiver = receiver != null ? receiver : "";
    }

    public boolean isInternal() {
        return kind == NodeKind.INTERNAL;
    }

    public boolean isMethod() {
        return !receiver.isEmpty();
    }
}
