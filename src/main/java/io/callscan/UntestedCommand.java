package io.callscan;

import io.callscan.coverage.CoverageReport;
import io.callscan.model.FunctionDescriptor;
import io.callscan.source.ProjectIndex;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(
    name = "untested",
    mixinStandardHelpOptions = true,
    description = "List functions that no covered block of a go test coverage profile touches."
)
public class UntestedCommand implements Callable<Integer> {

    @Mixin
    ScanOptions options;

    @Option(names = {"--coverage"}, required = true,
            description = "Coverage profile written by go test -coverprofile")
    Path coverage;

    @Override
    public Integer call() {
        CallScanner scanner;
        ProjectIndex index;
        try {
            scanner = new CallScanner(options.loadConfig());
            index = scanner.index(options.projectPath());
        } catch (IOException e) {
            System.err.println("Error: " + e.getMessage());
            return 1;
        }

        CoverageReport report;
        try {
            report = scanner.analyzeCoverage(coverage, index);
        } catch (IOException e) {
            System.err.println("Error: " + e.getMessage());
            return 1;
        }

        for (String identity : report.untested()) {
            FunctionDescriptor fn = index.registry().get(identity).orElseThrow();
            System.out.println(identity + "  " + index.root().relativize(fn.file()) + ":" + fn.startLine());
        }
        System.out.println();
        System.out.println(report.untested().size() + " of " + report.total() + " function(s) untested"
            + (report.mode().isEmpty() ? "" : " (mode: " + report.mode() + ")"));
        if (report.malformedLines() > 0) {
            System.out.println(report.malformedLines() + " malformed profile line(s) skipped");
        }
        return 0;
    }
}
