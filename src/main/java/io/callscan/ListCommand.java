package io.callscan;

import io.callscan.output.CsvExporter;
import io.callscan.output.Exporter;
import io.callscan.output.FunctionRecord;
import io.callscan.output.FunctionTableOutput;
import io.callscan.output.JsonExporter;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(
    name = "list",
    mixinStandardHelpOptions = true,
    description = "List every function with its signature, external references and calls."
)
public class ListCommand implements Callable<Integer> {

    enum Format { TABLE, CSV, JSON }

    @Mixin
    ScanOptions options;

    @Option(names = {"--format"},
            description = "Output format: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    Format format = Format.TABLE;

    @Option(names = {"-f", "--file"},
            description = "Write csv or json output to this file instead of stdout")
    Path file;

    @Override
    public Integer call() {
        ScanResult result;
        try {
            result = new CallScanner(options.loadConfig()).scan(options.projectPath());
        } catch (IOException e) {
            System.err.println("Error: " + e.getMessage());
            return 1;
        }

        if (format == Format.TABLE) {
            new FunctionTableOutput(System.out).print(FunctionRecord.all(result));
            return 0;
        }

        Exporter exporter = format == Format.CSV ? new CsvExporter() : new JsonExporter();
        try {
            if (file != null) {
                exporter.write(result, file);
                System.out.println("Exported " + result.index().registry().size() + " function(s) to " + file);
            } else {
                Writer writer = new OutputStreamWriter(System.out, StandardCharsets.UTF_8);
                exporter.write(result, writer);
            }
        } catch (IOException e) {
            System.err.println("Error writing " + exporter.format() + " output: " + e.getMessage());
            return 1;
        }
        return 0;
    }
}
