package io.surfworks.arrowforge.path;

import java.util.Optional;

/**
 * Resolves the source and target of individual symbols.
 *
 * <p>The rewrite engine is purely syntactic and never looks at endpoints.
 * Callers that need to know whether two paths are parallel, or whether a path
 * is composable at all, supply a Boundary for their symbol type.
 *
 * @param <S> the symbol type
 * @param <O> the endpoint (object) type
 */
public interface Boundary<S, O> {

    /**
     * Returns the source of a single symbol.
     */
    O sourceOf(S symbol);

    /**
     * Returns the target of a single symbol.
     */
    O targetOf(S symbol);

    /**
     * Source of a path: the source of its first symbol.
     */
    default O source(Path<S> path) {
        return sourceOf(path.first());
    }

    /**
     * Target of a path: the target of its last symbol.
     */
    default O target(Path<S> path) {
        return targetOf(path.last());
    }

    /**
     * Returns true if every consecutive pair of symbols chains target to source.
     */
    default boolean isComposable(Path<S> path) {
        return firstBreak(path).isEmpty();
    }

    /**
     * Returns the index of the first symbol whose source does not match the
     * previous symbol's target, or empty if the path composes.
     */
    default Optional<Integer> firstBreak(Path<S> path) {
        for (int i = 1; i < path.size(); i++) {
            if (!targetOf(path.get(i - 1)).equals(sourceOf(path.get(i)))) {
                return Optional.of(i);
            }
        }
        return Optional.empty();
    }

    /**
     * Returns true if both paths share source and target.
     */
    default boolean parallel(Path<S> a, Path<S> b) {
        return source(a).equals(source(b)) && target(a).equals(target(b));
    }
}
