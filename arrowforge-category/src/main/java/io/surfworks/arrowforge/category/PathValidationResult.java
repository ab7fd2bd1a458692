package io.surfworks.arrowforge.category;

/**
 * Outcome of validating a morphism path or a shape against a category.
 */
public enum PathValidationResult {

    VALID,

    /** A morphism on the path does not belong to the category. */
    INVALID_COMPOSITION,

    /** Two consecutive morphisms do not chain target to source. */
    BROKEN_CHAIN,

    EMPTY_PATH,

    /** The morphisms of a triangle or square do not connect its stated vertices. */
    SHAPE_MISMATCH;

    public boolean isValid() {
        return this == VALID;
    }
}
