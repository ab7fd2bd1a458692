package io.surfworks.arrowforge.rewrite;

/**
 * Result of a bounded rewrite search.
 *
 * @param outcome the three-valued verdict
 * @param certificate the proof trace (empty unless {@link SearchOutcome#PROVED}, and
 *                    empty for the reflexive case)
 * @param expansions number of paths dequeued and expanded
 * @param visited number of distinct paths seen, including the start path
 */
public record SearchResult(SearchOutcome outcome, Certificate certificate, int expansions, int visited) {

    public SearchResult {
        if (outcome == null) {
            throw new IllegalArgumentException("outcome must not be null");
        }
        if (certificate == null) {
            throw new IllegalArgumentException("certificate must not be null");
        }
        if (outcome != SearchOutcome.PROVED && !certificate.isEmpty()) {
            throw new IllegalArgumentException("only proved results carry a certificate");
        }
    }

    static SearchResult proved(Certificate certificate, int expansions, int visited) {
        return new SearchResult(SearchOutcome.PROVED, certificate, expansions, visited);
    }

    static SearchResult refuted(int expansions, int visited) {
        return new SearchResult(SearchOutcome.REFUTED, Certificate.empty(), expansions, visited);
    }

    static SearchResult unknown(int expansions, int visited) {
        return new SearchResult(SearchOutcome.UNKNOWN, Certificate.empty(), expansions, visited);
    }

    /**
     * Boolean view: true only when the paths were proved equal.
     * REFUTED and UNKNOWN both map to false.
     */
    public boolean verdict() {
        return outcome == SearchOutcome.PROVED;
    }

    public boolean isUnknown() {
        return outcome == SearchOutcome.UNKNOWN;
    }

    @Override
    public String toString() {
        return String.format("SearchResult[%s, cert=%s, expansions=%d, visited=%d]",
                outcome, certificate, expansions, visited);
    }
}
