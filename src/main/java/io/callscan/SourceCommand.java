package io.callscan;

import io.callscan.model.FunctionDescriptor;
import io.callscan.source.FunctionSourceReader;
import io.callscan.source.ProjectIndex;
import io.callscan.source.SourceParseException;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.util.Optional;
import java.util.concurrent.Callable;

@Command(
    name = "source",
    mixinStandardHelpOptions = true,
    description = "Print a function's source together with its doc comment."
)
public class SourceCommand implements Callable<Integer> {

    @Mixin
    ScanOptions options;

    @Parameters(index = "1", paramLabel = "<identity>",
            description = "Function identity, e.g. main.run or store/Cache.Get")
    String identity;

    @Override
    public Integer call() {
        ProjectIndex index;
        try {
            index = new CallScanner(options.loadConfig()).index(options.projectPath());
        } catch (IOException e) {
            System.err.println("Error: " + e.getMessage());
            return 1;
        }

        Optional<FunctionDescriptor> function = index.registry().get(identity);
        if (function.isEmpty()) {
            System.err.println("Error: Function not found: " + identity);
            return 1;
        }

        try {
            System.out.println(new FunctionSourceReader().read(function.get()).render());
        } catch (SourceParseException e) {
            System.err.println("Error: " + e.getMessage());
            return 1;
        }
        return 0;
    }
}
