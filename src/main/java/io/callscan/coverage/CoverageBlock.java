package io.callscan.coverage;

/**
 * One block of a coverage profile.
 *
 * @param file        File as written in the profile (usually {@code <importPath>/<file>.go})
 * @param startLine   First line of the block
 * @param startColumn Column the block starts at
 * @param endLine     Last line of the block
 * @param endColumn   Column the block ends at
 * @param statements  Statement count, -1 when the profile line omitted it
 * @param count       Hit count
 */
public record CoverageBlock(
    String file,
    int startLine,
    int startColumn,
    int endLine,
    int endColumn,
    int statements,
    long count
) {
    public boolean isCovered() {
        return count > 0;
    }

    /**
     * Whether the block shares at least one line with {@code [start, end]}.
     */
    public boolean overlaps(int start, int end) {
        return startLine <= end && endLine >= start;
    }
}
