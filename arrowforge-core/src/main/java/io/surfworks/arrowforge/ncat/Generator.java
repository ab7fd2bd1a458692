package io.surfworks.arrowforge.ncat;

/**
 * An atomic typed arrow at a fixed dimension.
 *
 * <p>Generators are referenced by their index within their dimension once
 * registered with a {@link FiniteWeakNCategory}; they are never duplicated or
 * mutated.
 *
 * @param dim the dimension (1..n of the owning category)
 * @param name the display name
 * @param src the source endpoint index
 * @param tgt the target endpoint index
 */
public record Generator(int dim, String name, int src, int tgt) {

    public Generator {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("generator name must not be blank");
        }
        if (src < 0 || tgt < 0) {
            throw new IllegalArgumentException(String.format(
                    "generator '%s' endpoints must be >= 0, got %d → %d", name, src, tgt));
        }
    }

    @Override
    public String toString() {
        return String.format("%s: %d → %d (dim %d)", name, src, tgt, dim);
    }
}
