package io.callscan;

import io.callscan.model.CallSite;
import io.callscan.model.FunctionDescriptor;
import io.callscan.output.CallTreeOutput;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

@Command(
    name = "calls",
    mixinStandardHelpOptions = true,
    description = "Show the call sites of one function and the call tree below it."
)
public class CallsCommand implements Callable<Integer> {

    @Mixin
    ScanOptions options;

    @Parameters(index = "1", paramLabel = "<identity>",
            description = "Function identity, e.g. main.run or store/Cache.Get")
    String identity;

    @Option(names = {"--no-color"},
            description = "Disable colored output")
    boolean noColor = false;

    @Override
    public Integer call() {
        ScanResult result;
        try {
            result = new CallScanner(options.loadConfig()).scan(options.projectPath());
        } catch (IOException e) {
            System.err.println("Error: " + e.getMessage());
            return 1;
        }

        Optional<FunctionDescriptor> function = result.index().registry().get(identity);
        if (function.isEmpty()) {
            System.err.println("Error: Function not found: " + identity);
            return 1;
        }

        FunctionDescriptor fn = function.get();
        CallTreeOutput output = new CallTreeOutput(System.out, !noColor);
        System.out.println(fn.identity() + " (" + fn.file() + ":" + fn.startLine() + ")");

        List<CallSite> sites = result.resolution().callSites(identity);
        if (sites.isEmpty()) {
            System.out.println("  (no calls)");
        } else {
            output.printCallSites(sites, 2);
        }
        System.out.println();
        output.printCallTree(result.graph(), identity);
        return 0;
    }
}
