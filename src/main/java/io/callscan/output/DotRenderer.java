package io.callscan.output;

import io.callscan.ScanResult;
import io.callscan.graph.CallGraph;
import io.callscan.graph.GraphNode;
import io.callscan.graph.NodeKind;

import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Renders the call graph in Graphviz DOT.
 * <p>
 * Internal functions are grouped in one cluster per package, methods in one cluster per
 * receiver type. Nodes outside the module are drawn outside every cluster with their own shapes.
 */
public class DotRenderer implements Exporter {

    static final String PACKAGE_COLOR = "#AED6F1";
    static final String STRUCT_COLOR = "#F9E79F";

    @Override
    public String format() {
        return "dot";
    }

    @Override
    public void write(ScanResult result, Writer writer) throws IOException {
        writer.write(render(result.graph()));
        writer.flush();
    }

    public String render(CallGraph graph) {
        StringBuilder sb = new StringBuilder();
        sb.append("digraph G {\n");
        sb.append("    rankdir=LR;\n");
        sb.append("    node [style=filled, fillcolor=lightgray];\n");
        sb.append("    edge [color=gray50];\n");

        Map<String, List<GraphNode>> packages = new TreeMap<>();
        Map<String, List<GraphNode>> structs = new TreeMap<>();
        List<GraphNode> others = new ArrayList<>();
        for (GraphNode node : graph.nodes()) {
            if (!node.isInternal()) {
                others.add(node);
            } else if (node.isMethod()) {
                structs.computeIfAbsent(node.packageName() + "." + node.receiver(), k -> new ArrayList<>()).add(node);
            } else {
                packages.computeIfAbsent(node.packageName(), k -> new ArrayList<>()).add(node);
            }
        }

        packages.forEach((pkg, nodes) ->
            writeCluster(sb, "pkg_" + pkg, "Package: " + pkg, PACKAGE_COLOR, nodes));
        structs.forEach((type, nodes) ->
            writeCluster(sb, "struct_" + type, "Struct: " + type, STRUCT_COLOR, nodes));

        for (GraphNode node : others) {
            sb.append("    ").append(quote(node.identity()))
                .append(" [label=").append(quote(node.label()))
                .append(", ").append(style(node.kind())).append("];\n");
        }

        for (CallGraph.Edge edge : graph.edges()) {
            sb.append("    ").append(quote(edge.caller()))
                .append(" -> ").append(quote(edge.callee())).append(";\n");
        }
        sb.append("}\n");
        return sb.toString();
    }

    private static void writeCluster(StringBuilder sb, String name, String label, String color, List<GraphNode> nodes) {
        sb.append("    subgraph cluster_").append(sanitize(name)).append(" {\n");
        sb.append("        style=filled;\n");
        sb.append("        color=").append(quote(color)).append(";\n");
        sb.append("        label=").append(quote(label)).append(";\n");
        for (GraphNode node : nodes) {
            sb.append("        ").append(quote(node.identity()))
                .append(" [label=").append(quote(node.label())).append(", shape=rectangle];\n");
        }
        sb.append("    }\n");
    }

    private static String style(NodeKind kind) {
        switch (kind) {
            case EXTERNAL:
                return "shape=ellipse, style=\"filled,dashed\", fillcolor=white";
            case ANONYMOUS:
                return "shape=plaintext, fillcolor=white";
            case UNRESOLVED:
                return "shape=diamond, style=\"filled,dotted\", fillcolor=\"#FADBD8\"";
            default:
                return "shape=rectangle";
        }
    }

    /**
     * Escapes backslashes, double quotes and line breaks for a quoted DOT string.
     */
    static String escape(String s) {
        return s.replace("\\", "\\\\")
            .replace("\"", "\\\"")
            .replace("\n", "\\n")
            .replace("\r", "");
    }

    static String quote(String s) {
        return "\"" + escape(s) + "\"";
    }

    /**
     * ASCII letters and digits kept, {@code _} doubled, anything else written as {@code _} plus six hex digits.
     * Distinct names always map to distinct identifiers.
     */
    static String sanitize(String name) {
        StringBuilder sb = new StringBuilder(name.length() + 8);
        name.codePoints().forEach(cp -> {
            if (cp == '_') {
                sb.append("__");
            } else if (cp < 128 && Character.isLetterOrDigit(cp)) {
                sb.appendCodePoint(cp);
            } else {
                sb.append(String.format("_%06x", cp));
            }
        });
        return sb.toString();
    }
}
