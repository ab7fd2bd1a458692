package io.surfworks.arrowforge.category.verify;

/**
 * A shape found by enumeration together with its proof.
 *
 * @param shape the triangle or square
 * @param proof the successful proof
 * @param <T> the shape type
 */
public record ShapeMatch<T>(T shape, CommutativityProof proof) {}
