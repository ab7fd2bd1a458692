package io.surfworks.arrowforge.category.verify;

/**
 * Snapshot of a verifier's cache sizes and hit counts.
 */
public record CacheStats(int pathEntries, int compositionEntries, int commutativityEntries, long hits, long misses) {

    @Override
    public String toString() {
        return String.format("CacheStats[paths=%d, compositions=%d, commutativity=%d, hits=%d, misses=%d]",
                pathEntries, compositionEntries, commutativityEntries, hits, misses);
    }
}
