package io.github.cyfko.curatorkit.core.rewrite;

/**
 * Counts of one {@link LeafOverwriter} run.
 *
 * @param visited   leaves of the target type visited
 * @param rewritten leaves whose fields were replaced
 * @param moved     leaves replaced by a leaf of another type
 * @param removed   leaves removed, with any parent removed along with them
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record OverwriteReport(int visited, int rewritten, int moved, int removed) {

    public static OverwriteReport empty() {
        return new OverwriteReport(0, 0, 0, 0);
    }

    /**
     * @param other counts of another run
     * @return the sum of both runs
     */
    public OverwriteReport plus(OverwriteReport other) {
        return new OverwriteReport(visited + other.visited, rewritten + other.rewritten,
                moved + other.moved, removed + other.removed);
    }
}
