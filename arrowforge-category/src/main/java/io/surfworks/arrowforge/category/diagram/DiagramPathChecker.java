package io.surfworks.arrowforge.category.diagram;

import java.util.logging.Logger;

import io.surfworks.arrowforge.category.MorphismPath;
import io.surfworks.arrowforge.config.SearchConfig;
import io.surfworks.arrowforge.path.InvalidPathException;
import io.surfworks.arrowforge.rewrite.Certificate;
import io.surfworks.arrowforge.rewrite.RelationSet;
import io.surfworks.arrowforge.rewrite.RewriteEngine;
import io.surfworks.arrowforge.rewrite.SearchOutcome;
import io.surfworks.arrowforge.rewrite.SearchResult;

/**
 * Decides equality of two morphism paths by rewriting their labels.
 *
 * <p>The rewrite engine only sees symbol sequences, so endpoints are checked
 * here first: paths with different source or target are REFUTED without
 * searching. Otherwise the engine runs on the label paths (morphism names in
 * diagrammatic order) against relations written over those names.
 *
 * <p>Example:
 * <pre>{@code
 * RelationSet<String> relations = new RelationSet<String>()
 *     .add("naturality", List.of("f", "g"), List.of("h"));
 * DiagramPathChecker checker = new DiagramPathChecker(relations);
 *
 * checker.check(MorphismPath.of(f, g), MorphismPath.of(h)).verdict();   // true
 * }</pre>
 */
public final class DiagramPathChecker {

    private static final Logger LOG = Logger.getLogger(DiagramPathChecker.class.getName());

    private final RewriteEngine<String> engine;

    public DiagramPathChecker(RelationSet<String> relations) {
        this(relations, SearchConfig.defaults());
    }

    public DiagramPathChecker(RelationSet<String> relations, SearchConfig config) {
        this.engine = new RewriteEngine<>(relations, config);
    }

    /**
     * Checks with the configured default budget.
     */
    public SearchResult check(MorphismPath first, MorphismPath second) {
        return check(first, second, engine.config().budget());
    }

    /**
     * Searches for a rewrite of {@code first}'s labels into {@code second}'s.
     *
     * @throws InvalidPathException if either path is empty or does not chain
     */
    public SearchResult check(MorphismPath first, MorphismPath second, int budget) {
        requireComposable(first);
        requireComposable(second);
        if (!first.source().equals(second.source()) || !first.target().equals(second.target())) {
            LOG.fine(() -> "Endpoints differ: " + first.name() + " vs " + second.name());
            return new SearchResult(SearchOutcome.REFUTED, Certificate.empty(), 0, 0);
        }
        return engine.search(first.labels(), second.labels(), budget);
    }

    public RewriteEngine<String> engine() {
        return engine;
    }

    private static void requireComposable(MorphismPath path) {
        if (path.isEmpty()) {
            throw new InvalidPathException("Cannot check an empty morphism path");
        }
        if (!path.isComposable()) {
            throw new InvalidPathException("Morphism path does not chain: " + path.name());
        }
    }
}
