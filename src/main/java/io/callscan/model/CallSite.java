package io.callscan.model;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * One call expression found in a function body.
 *
 * @param target     Resolved classification of the callee
 * @param line       Source line (1-based); for go/defer statements, the statement line
 * @param expression Full source text of the call expression
 * @param arguments  Source text of each argument, in order
 * @param nested     Calls found inside the arguments (and, for literal invocations, inside the literal body)
 */
public record CallSite(
    CallTarget target,
    int line,
    String expression,
    List<String> arguments,
    List<CallSite> nested
) {
    public CallSite {
        arguments = List.copyOf(arguments);
        nested = List.copyOf(nested);
    }

    /**
     * This call followed by all nested calls, depth first.
     */
    public Stream<CallSite> flatten() {
        return Stream.concat(Stream.of(this), nested.stream().flatMap(CallSite::flatten));
    }

    public static List<CallSite> flattenAll(List<CallSite> sites) {
        List<CallSite> all = new ArrayList<>();
        for (CallSite site : sites) {
            site.flatten().forEach(all::add);
        }
        return all;
    }
}
