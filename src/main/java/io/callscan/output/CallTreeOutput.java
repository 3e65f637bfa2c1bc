package io.callscan.output;

import io.callscan.graph.CallGraph;
import io.callscan.graph.GraphNode;
import io.callscan.graph.NodeKind;
import io.callscan.model.CallSite;
import io.callscan.model.CallTarget;

import java.io.PrintStream;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Prints the call sites of a function and the call tree below it.
 */
public class CallTreeOutput {

    private final PrintStream out;
    private final boolean useColor;

    // ANSI color codes
    private static final String RESET = "\u001B[0m";
    private static final String CYAN = "\u001B[36m";
    private static final String GREEN = "\u001B[32m";
    private static final String YELLOW = "\u001B[33m";
    private static final String DIM = "\u001B[2m";

    public CallTreeOutput() {
        this(System.out, true);
    }

    public CallTreeOutput(PrintStream out, boolean useColor) {
        this.out = out;
        this.useColor = useColor;
    }

    /**
     * Prints each call site with its arguments and the calls nested in them.
     */
    public void printCallSites(List<CallSite> sites, int indent) {
        String prefix = spaces(indent);
        for (CallSite site : sites) {
            out.println(prefix + "Function Call: " + color(GREEN, site.target().calleeName())
                + " " + site.line() + " " + color(DIM, kindOf(site.target())));
            if (!site.arguments().isEmpty()) {
                out.println(prefix + "Arguments: [" + String.join(", ", site.arguments()) + "]");
            }
            if (!site.nested().isEmpty()) {
                out.println(prefix + "Nested Calls:");
                printCallSites(site.nested(), indent + 2);
            }
        }
    }

    /**
     * Prints the functions reachable from {@code identity}. A function whose subtree was
     * already printed is listed without it; cycles are marked.
     */
    public void printCallTree(CallGraph graph, String identity) {
        out.println(color(CYAN, identity) + ":");
        Set<String> printed = new HashSet<>();
        Set<String> path = new HashSet<>();
        path.add(identity);
        printCallTreeRecursive(graph, identity, 2, path, printed);
    }

    private void printCallTreeRecursive(CallGraph graph, String identity, int indent,
                                        Set<String> path, Set<String> printed) {
        List<GraphNode> callees = graph.callees(identity).stream()
            .sorted(Comparator.comparing(GraphNode::identity))
            .toList();

        for (GraphNode callee : callees) {
            String name = callee.kind() == NodeKind.INTERNAL ? callee.identity() : callee.label();
            String tag = callee.kind() == NodeKind.INTERNAL ? "" : color(DIM, " [" + callee.kind().name().toLowerCase() + "]");

            if (path.contains(callee.identity())) {
                out.println(spaces(indent) + color(YELLOW, name) + color(DIM, " (cycle)"));
            } else if (graph.callees(callee.identity()).isEmpty() || printed.contains(callee.identity())) {
                out.println(spaces(indent) + color(YELLOW, name) + tag);
            } else {
                printed.add(callee.identity());
                out.println(spaces(indent) + color(YELLOW, name) + tag + ":");
                path.add(callee.identity());
                printCallTreeRecursive(graph, callee.identity(), indent + 2, path, printed);
                path.remove(callee.identity());
            }
        }
    }

    static String kindOf(CallTarget target) {
        return target.accept(new CallTarget.Visitor<>() {
            @Override
            public String visitLocal(CallTarget.LocalCall call) {
                return "local " + call.target().identity();
            }

            @Override
            public String visitCrossModule(CallTarget.CrossModuleCall call) {
                return "module " + call.target().identity();
            }

            @Override
            public String visitMethod(CallTarget.MethodCall call) {
                return "method";
            }

            @Override
            public String visitExternal(CallTarget.ExternalCall call) {
                String where = call.importPath().isEmpty() ? "" : " " + call.importPath();
                return "external(" + call.origin().name().toLowerCase() + ")" + where;
            }

            @Override
            public String visitLiteral(CallTarget.LiteralInvocation call) {
                return "literal";
            }
        });
    }

    private String spaces(int count) {
        return " ".repeat(count);
    }

    private String color(String code, String text) {
        if (useColor) {
            return code + text + RESET;
        }
        return text;
    }
}
