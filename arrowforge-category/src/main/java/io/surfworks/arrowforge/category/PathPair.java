package io.surfworks.arrowforge.category;

/**
 * The two composite paths around a shape that are compared for equality.
 */
public record PathPair(MorphismPath first, MorphismPath second) {}
