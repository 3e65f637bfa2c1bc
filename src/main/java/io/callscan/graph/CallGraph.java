package io.callscan.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.IntFunction;

/**
 * Whole-program call graph.
 * <p>
 * Nodes live in a flat table and are referred to by integer handle; edges are handle
 * pairs stored twice, once in {@code calls} of the caller and once in {@code calledBy}
 * of the callee. Recursive calls are ordinary edges.
 */
public class CallGraph {

    /**
     * A directed edge between two node identities.
     */
    public record Edge(String caller, String callee) {
    }

    private final List<GraphNode> nodes;
    private final Map<String, Integer> handles;
    private final List<Set<Integer>> calls;
    private final List<Set<Integer>> calledBy;
    private final int edgeCount;

    private CallGraph(List<GraphNode> nodes, Map<String, Integer> handles,
                      List<Set<Integer>> calls, List<Set<Integer>> calledBy, int edgeCount) {
        this.nodes = List.copyOf(nodes);
        this.handles = Map.copyOf(handles);
        this.calls = freeze(calls);
        this.calledBy = freeze(calledBy);
        this.edgeCount = edgeCount;
    }

    private static List<Set<Integer>> freeze(List<Set<Integer>> adjacency) {
        List<Set<Integer>> copy = new ArrayList<>(adjacency.size());
        for (Set<Integer> set : adjacency) {
            copy.add(Collections.unmodifiableSet(new LinkedHashSet<>(set)));
        }
        return List.copyOf(copy);
    }

    public Optional<GraphNode> node(String identity) {
        Integer handle = handles.get(identity);
        return handle == null ? Optional.empty() : Optional.of(nodes.get(handle));
    }

    public boolean contains(String identity) {
        return handles.containsKey(identity);
    }

    /**
     * All nodes in insertion order.
     */
    public List<GraphNode> nodes() {
        return nodes;
    }

    public List<GraphNode> nodes(NodeKind kind) {
        return nodes.stream().filter(n -> n.kind() == kind).toList();
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edgeCount;
    }

    /**
     * Direct callees of a node, in the order the edges were added.
     */
    public List<GraphNode> callees(String identity) {
        return adjacent(identity, calls);
    }

    /**
     * Direct callers of a node.
     */
    public List<GraphNode> callers(String identity) {
        return adjacent(identity, calledBy);
    }

    private List<GraphNode> adjacent(String identity, List<Set<Integer>> adjacency) {
        Integer handle = handles.get(identity);
        if (handle == null) {
            return List.of();
        }
        return adjacency.get(handle).stream().map(nodes::get).toList();
    }

    public List<Edge> edges() {
        List<Edge> edges = new ArrayList<>(edgeCount);
        for (int from = 0; from < nodes.size(); from++) {
            for (int to : calls.get(from)) {
                edges.add(new Edge(nodes.get(from).identity(), nodes.get(to).identity()));
            }
        }
        return edges;
    }

    /**
     * Internal nodes that no internal node calls: entry points.
     */
    public List<GraphNode> rootNodes() {
        return internalWithout(calledBy);
    }

    /**
     * Internal nodes that call no internal node.
     */
    public List<GraphNode> leafNodes() {
        return internalWithout(calls);
    }

    private List<GraphNode> internalWithout(List<Set<Integer>> adjacency) {
        return nodes.stream()
            .filter(GraphNode::isInternal)
            .filter(n -> adjacency.get(n.handle()).stream().noneMatch(h -> nodes.get(h).isInternal()))
            .toList();
    }

    /**
     * Identities reachable from {@code identity} by following calls, the start excluded unless it is
     * reached again through recursion.
     */
    public Set<String> reachableFrom(String identity) {
        return traverse(identity, h -> calls.get(h));
    }

    /**
     * Identities from which {@code identity} can be reached.
     */
    public Set<String> callersTransitive(String identity) {
        return traverse(identity, h -> calledBy.get(h));
    }

    private Set<String> traverse(String identity, IntFunction<Set<Integer>> next) {
        Integer start = handles.get(identity);
        if (start == null) {
            return Set.of();
        }
        Set<Integer> visited = new LinkedHashSet<>();
        Deque<Integer> queue = new ArrayDeque<>();
        queue.add(start);
        while (!queue.isEmpty()) {
            int current = queue.poll();
            for (int neighbour : next.apply(current)) {
                if (visited.add(neighbour)) {
                    queue.add(neighbour);
                }
            }
        }
        Set<String> result = new TreeSet<>();
        for (int handle : visited) {
            result.add(nodes.get(handle).identity());
        }
        return result;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final List<GraphNode> nodes = new ArrayList<>();
        private final Map<String, Integer> handles = new HashMap<>();
        private final List<Set<Integer>> calls = new ArrayList<>();
        private final List<Set<Integer>> calledBy = new ArrayList<>();
        private int edgeCount;

        /**
         * Returns the handle of the node with this identity, creating the node if needed.
         * An existing node keeps its kind and label.
         */
        public int ensureNode(String identity, NodeKind kind, String label, String packageName, String receiver) {
            Integer existing = handles.get(identity);
            if (existing != null) {
                return existing;
            }
            int handle = nodes.size();
            nodes.add(new GraphNode(handle, identity, kind, label, packageName, receiver));
            handles.put(identity, handle);
            calls.add(new LinkedHashSet<>());
            calledBy.add(new LinkedHashSet<>());
            return handle;
        }

        /**
         * Adds an edge between two existing nodes. Both adjacency sets are updated together.
         *
         * @return false if the edge was already present
         */
        public boolean addEdge(int caller, int callee) {
            if (caller < 0 || caller >= nodes.size() || callee < 0 || callee >= nodes.size()) {
                throw new IllegalArgumentException("Unknown node handle: " + caller + " -> " + callee);
            }
            if (!calls.get(caller).add(callee)) {
                return false;
            }
            calledBy.get(callee).add(caller);
            edgeCount++;
            return true;
        }

        public CallGraph build() {
            return new CallGraph(nodes, handles, calls, calledBy, edgeCount);
        }
    }
}
