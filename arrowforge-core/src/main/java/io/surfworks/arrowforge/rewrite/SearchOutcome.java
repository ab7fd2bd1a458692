package io.surfworks.arrowforge.rewrite;

/**
 * Verdict of a bounded rewrite search.
 *
 * <p>The word problem is undecidable in general, so a search that stops on its
 * budget cannot say the two paths differ. The engine therefore separates the
 * two ways a search can fail.
 */
public enum SearchOutcome {

    /** The end path was reached; the result carries a certificate. */
    PROVED,

    /**
     * The frontier emptied before the budget ran out: every path equivalent to
     * the start under the registered relations was visited and none equals the
     * end path.
     */
    REFUTED,

    /** The budget was exhausted with paths still queued. Nothing is known. */
    UNKNOWN
}
