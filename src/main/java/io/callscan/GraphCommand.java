package io.callscan;

import io.callscan.graph.CallGraph;
import io.callscan.graph.NodeKind;
import io.callscan.output.DotRenderer;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(
    name = "graph",
    mixinStandardHelpOptions = true,
    description = "Write the call graph as a Graphviz DOT file."
)
public class GraphCommand implements Callable<Integer> {

    @Mixin
    ScanOptions options;

    @Option(names = {"-o", "--output"},
            description = "DOT file to write (default: <root-dir-name>.dot)")
    Path output;

    @Option(names = {"--hide-stdlib"},
            description = "Leave calls into the Go standard library out of the graph")
    boolean hideStandardLibrary = false;

    @Override
    public Integer call() {
        ScanResult result;
        try {
            ScanConfig config = options.loadConfig();
            if (hideStandardLibrary) {
                config = config.withHideStandardLibrary(true);
            }
            result = new CallScanner(config).scan(options.projectPath());
        } catch (IOException e) {
            System.err.println("Error: " + e.getMessage());
            return 1;
        }

        Path target = output != null ? output : defaultOutput(result.index().root());
        try {
            new DotRenderer().write(result, target);
        } catch (IOException e) {
            System.err.println("Error writing DOT file: " + e.getMessage());
            return 1;
        }

        CallGraph graph = result.graph();
        System.out.println("Call graph generated in " + target);
        System.out.println("  Functions:  " + graph.nodes(NodeKind.INTERNAL).size());
        System.out.println("  External:   " + graph.nodes(NodeKind.EXTERNAL).size());
        System.out.println("  Unresolved: " + graph.nodes(NodeKind.UNRESOLVED).size());
        System.out.println("  Edges:      " + graph.edgeCount());
        System.out.println("  Entry points: " + graph.rootNodes().size());
        if (!result.warnings().isEmpty()) {
            System.out.println("  Warnings:   " + result.warnings().size());
        }
        return 0;
    }

    static Path defaultOutput(Path root) {
        Path name = root.getFileName();
        return Path.of((name != null ? name.toString() : "callgraph") + ".dot");
    }
}
