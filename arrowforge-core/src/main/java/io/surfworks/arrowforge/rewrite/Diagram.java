package io.surfworks.arrowforge.rewrite;

import io.surfworks.arrowforge.path.Path;

/**
 * Two labeled paths asserted to be equal.
 *
 * @param left the path searched from
 * @param right the path searched for
 * @param <S> the symbol type
 */
public record Diagram<S>(Path<S> left, Path<S> right) {

    public Diagram {
        if (left == null || right == null) {
            throw new IllegalArgumentException("diagram paths must not be null");
        }
    }

    public static <S> Diagram<S> of(Path<S> left, Path<S> right) {
        return new Diagram<>(left, right);
    }
}
