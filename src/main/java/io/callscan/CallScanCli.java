package io.callscan;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

@Command(
    name = "call-scan",
    mixinStandardHelpOptions = true,
    version = "call-scan 1.0.0",
    description = "Build a static call graph of a Go module from its source.",
    subcommands = {
        GraphCommand.class,
        ListCommand.class,
        CallsCommand.class,
        UntestedCommand.class,
        SourceCommand.class
    }
)
public class CallScanCli implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Override
    public Integer call() {
        spec.commandLine().usage(System.err);
        return 1;
    }

    public static CommandLine commandLine() {
        return new CommandLine(new CallScanCli())
            .setCaseInsensitiveEnumValuesAllowed(true);
    }

    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
