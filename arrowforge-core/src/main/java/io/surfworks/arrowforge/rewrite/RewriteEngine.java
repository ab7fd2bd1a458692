package io.surfworks.arrowforge.rewrite;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

import io.surfworks.arrowforge.config.SearchConfig;
import io.surfworks.arrowforge.path.Path;

/**
 * Bounded breadth-first search over single-step rewrites.
 *
 * <p>Given a registry of bidirectional relations, the engine decides whether
 * one path can be rewritten into another and, if so, returns the certificate
 * that witnesses it. The search:
 * <ol>
 *   <li>returns an empty certificate immediately if {@code start.equals(end)};</li>
 *   <li>expands paths in BFS order, trying relations in registration order,
 *       {@link Direction#FORWARD} before {@link Direction#BACKWARD}, offsets
 *       ascending;</li>
 *   <li>stops at the first rewrite that produces the end path;</li>
 *   <li>stops after {@code budget} expansions otherwise.</li>
 * </ol>
 *
 * <p>The certificate is the first one found, not necessarily the shortest,
 * but the iteration order is fixed so the same registry, inputs and budget
 * always produce the same certificate. Raising the budget replays the same
 * search further, so a proof found with budget N is found with any M &gt;= N.
 *
 * <p>Endpoints are never checked: the engine is purely syntactic.
 *
 * <p>Example usage:
 * <pre>{@code
 * RelationSet<String> relations = new RelationSet<String>()
 *     .add("swap", List.of("a", "b"), List.of("b", "a"));
 * RewriteEngine<String> engine = new RewriteEngine<>(relations);
 *
 * SearchResult result = engine.search(Path.of("x", "a", "b"), Path.of("x", "b", "a"), 64);
 * result.verdict();       // true
 * result.certificate();   // [(swap, 1, →)]
 * }</pre>
 *
 * <p>The engine keeps no state between calls. Searches may run concurrently
 * as long as nobody appends to the registry at the same time.
 *
 * @param <S> the symbol type
 */
public final class RewriteEngine<S> {

    private static final Logger LOG = Logger.getLogger(RewriteEngine.class.getName());

    private final RelationSet<S> relations;
    private final SearchConfig config;

    /**
     * Creates an engine with the default search configuration.
     *
     * @param relations the registry to rewrite with
     */
    public RewriteEngine(RelationSet<S> relations) {
        this(relations, SearchConfig.defaults());
    }

    /**
     * Creates an engine.
     *
     * @param relations the registry to rewrite with
     * @param config the search configuration (default budget)
     */
    public RewriteEngine(RelationSet<S> relations, SearchConfig config) {
        if (relations == null) {
            throw new IllegalArgumentException("relations must not be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config must not be null");
        }
        this.relations = relations;
        this.config = config;
    }

    /**
     * Searches with the configured default budget.
     */
    public SearchResult search(Path<S> start, Path<S> end) {
        return search(start, end, config.budget());
    }

    /**
     * Searches for a labeled diagram's right path starting from its left path.
     */
    public SearchResult search(Diagram<S> diagram) {
        return search(diagram.left(), diagram.right(), config.budget());
    }

    /**
     * Searches for a rewrite sequence from {@code start} to {@code end}.
     *
     * @param start the path to rewrite from
     * @param end the path to reach
     * @param budget the maximum number of expansions ({@code >= 0})
     * @return PROVED with a certificate, REFUTED if the equivalence class of
     *         {@code start} was exhausted, UNKNOWN if the budget ran out
     */
    public SearchResult search(Path<S> start, Path<S> end, int budget) {
        if (start == null || end == null) {
            throw new IllegalArgumentException("start and end paths must not be null");
        }
        if (budget < 0) {
            throw new IllegalArgumentException("budget must be >= 0, got " + budget);
        }

        if (start.equals(end)) {
            return SearchResult.proved(Certificate.empty(), 0, 1);
        }

        List<Relation<S>> rules = relations.relations();
        ArrayDeque<SearchState<S>> queue = new ArrayDeque<>();
        Set<Path<S>> seen = new HashSet<>();
        queue.add(new SearchState<>(start, Certificate.empty()));
        seen.add(start);

        int expansions = 0;
        while (!queue.isEmpty() && expansions < budget) {
            expansions++;
            SearchState<S> state = queue.poll();

            for (Relation<S> rule : rules) {
                for (Direction direction : Direction.values()) {
                    List<S> pattern = rule.pattern(direction);
                    List<S> replacement = rule.replacement(direction);
                    for (int offset : state.path().occurrencesOf(pattern)) {
                        Path<S> rewritten = state.path().replace(offset, pattern.size(), replacement);
                        RewriteStep step = new RewriteStep(rule.name(), offset, direction);

                        if (rewritten.equals(end)) {
                            Certificate certificate = state.certificate().append(step);
                            LOG.fine("Proved " + start + " = " + end + " in " + certificate.length()
                                    + " steps after " + expansions + " expansions");
                            return SearchResult.proved(certificate, expansions, seen.size() + 1);
                        }
                        if (seen.add(rewritten)) {
                            queue.add(new SearchState<>(rewritten, state.certificate().append(step)));
                        }
                    }
                }
            }
        }

        if (queue.isEmpty()) {
            LOG.fine("Refuted " + start + " = " + end + ": equivalence class of "
                    + seen.size() + " paths exhausted");
            return SearchResult.refuted(expansions, seen.size());
        }
        LOG.fine("Budget " + budget + " exhausted searching " + start + " = " + end
                + " (" + queue.size() + " paths queued)");
        return SearchResult.unknown(expansions, seen.size());
    }

    /**
     * Boolean view of {@link #search(Path, Path, int)}.
     */
    public boolean check(Path<S> start, Path<S> end, int budget) {
        return search(start, end, budget).verdict();
    }

    /**
     * Boolean view of {@link #search(Path, Path)}.
     */
    public boolean check(Path<S> start, Path<S> end) {
        return search(start, end).verdict();
    }

    /**
     * Returns every path reachable from {@code path} by one rewrite, paired with
     * the step that produced it, in the order the search would try them.
     */
    public List<Rewrite<S>> neighbours(Path<S> path) {
        List<Rewrite<S>> result = new ArrayList<>();
        for (Relation<S> rule : relations.relations()) {
            for (Direction direction : Direction.values()) {
                List<S> pattern = rule.pattern(direction);
                for (int offset : path.occurrencesOf(pattern)) {
                    result.add(new Rewrite<>(
                            path.replace(offset, pattern.size(), rule.replacement(direction)),
                            new RewriteStep(rule.name(), offset, direction)));
                }
            }
        }
        return result;
    }

    /**
     * Returns the registry this engine rewrites with.
     */
    public RelationSet<S> relations() {
        return relations;
    }

    public SearchConfig config() {
        return config;
    }

    @Override
    public String toString() {
        return String.format("RewriteEngine[relations=%d, budget=%d]", relations.size(), config.budget());
    }

    /**
     * A single-step rewrite: the resulting path and the step that produced it.
     */
    public record Rewrite<S>(Path<S> path, RewriteStep step) {}

    private record SearchState<S>(Path<S> path, Certificate certificate) {}
}
