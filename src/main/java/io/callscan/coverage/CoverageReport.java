package io.callscan.coverage;

import java.util.List;

/**
 * Per-function coverage status.
 *
 * @param mode           Mode from the profile header ("set", "count", "atomic"), empty if missing
 * @param tested         Identities with at least one covered block inside their span, sorted
 * @param untested       All other identities, sorted
 * @param malformedLines Profile lines that were skipped
 */
public record CoverageReport(String mode, List<String> tested, List<String> untested, int malformedLines) {

    public CoverageReport {
        tested = List.copyOf(tested);
        untested = List.copyOf(untested);
    }

    public boolean isTested(String identity) {
        return tested.contains(identity);
    }

    public int total() {
        return tested.size() + untested.size();
    }
}
