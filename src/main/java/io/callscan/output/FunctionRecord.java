package io.callscan.output;

import io.callscan.ScanResult;
import io.callscan.model.ExternalReference;
import io.callscan.model.FunctionDescriptor;

import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;

/**
 * One row of the function listing shared by the table, CSV and JSON outputs.
 *
 * @param file       Path relative to the scanned root, with forward slashes
 * @param function   Name as written at a call site ({@code Receiver.name} for methods)
 * @param identity   Canonical identity
 * @param receiver   Receiver type, empty for free functions
 * @param line       First line of the declaration
 * @param endLine    Last line of the declaration
 * @param parameters Rendered parameters
 * @param returns    Result types
 * @param externals  External references, qualified by import path where known
 * @param calls      Identities of indexed functions called
 */
public record FunctionRecord(
    String file,
    String function,
    String identity,
    String receiver,
    int line,
    int endLine,
    List<String> parameters,
    List<String> returns,
    List<String> externals,
    List<String> calls
) {
    public FunctionRecord {
        parameters = List.copyOf(parameters);
        returns = List.copyOf(returns);
        externals = List.copyOf(externals);
        calls = List.copyOf(calls);
    }

    public static FunctionRecord of(FunctionDescriptor function, ScanResult result) {
        String identity = function.identity();
        return new FunctionRecord(
            relativeFile(result.index().root(), function.file()),
            function.displayName(),
            identity,
            function.receiver(),
            function.startLine(),
            function.endLine(),
            function.renderedParameters(),
            function.returns(),
            result.resolution().externals(identity).stream().map(ExternalReference::qualifiedName).toList(),
            result.resolution().internalCallees(identity)
        );
    }

    /**
     * Rows for every indexed function, ordered by file and line.
     */
    public static List<FunctionRecord> all(ScanResult result) {
        return result.index().registry().all().stream()
            .map(f -> of(f, result))
            .sorted(Comparator.comparing(FunctionRecord::file).thenComparingInt(FunctionRecord::line))
            .toList();
    }

    static String relativeFile(Path root, Path file) {
        Path absolute = file.toAbsolutePath().normalize();
        Path relative = absolute.startsWith(root) ? root.relativize(absolute) : absolute;
        return relative.toString().replace('\\', '/');
    }
}
