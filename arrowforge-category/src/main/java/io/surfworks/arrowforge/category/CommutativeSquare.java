package io.surfworks.arrowforge.category;

import java.util.ArrayList;
import java.util.List;

/**
 * A square with corners TL, TR, BL, BR and edges
 * {@code top: TL → TR}, {@code right: TR → BR}, {@code left: TL → BL}, {@code bottom: BL → BR}.
 *
 * <p>The square commutes when {@code right ∘ top = bottom ∘ left}.
 */
public record CommutativeSquare(
        CategoryObject topLeft,
        CategoryObject topRight,
        CategoryObject bottomLeft,
        CategoryObject bottomRight,
        Morphism top,
        Morphism right,
        Morphism left,
        Morphism bottom,
        String name
) {

    public CommutativeSquare {
        if (topLeft == null || topRight == null || bottomLeft == null || bottomRight == null
                || top == null || right == null || left == null || bottom == null) {
            throw new IllegalArgumentException("square vertices and edges must not be null");
        }
        if (name == null) {
            name = "square_" + top.name() + "_" + right.name() + "_" + left.name() + "_" + bottom.name();
        }
    }

    /**
     * Creates a square with a generated name.
     */
    public static CommutativeSquare of(CategoryObject topLeft, CategoryObject topRight,
                                       CategoryObject bottomLeft, CategoryObject bottomRight,
                                       Morphism top, Morphism right, Morphism left, Morphism bottom) {
        return new CommutativeSquare(topLeft, topRight, bottomLeft, bottomRight, top, right, left, bottom, null);
    }

    /**
     * Returns a copy of this square under another name.
     */
    public CommutativeSquare named(String newName) {
        return new CommutativeSquare(topLeft, topRight, bottomLeft, bottomRight, top, right, left, bottom, newName);
    }

    /**
     * Returns the two paths that must agree: {@code top;right} and {@code left;bottom}.
     */
    public PathPair paths() {
        return new PathPair(
                new MorphismPath(List.of(top, right), "path_" + top.name() + "_" + right.name()),
                new MorphismPath(List.of(left, bottom), "path_" + left.name() + "_" + bottom.name()));
    }

    /**
     * Lists every edge that does not connect the corners it is drawn between.
     */
    public List<String> mismatches() {
        List<String> problems = new ArrayList<>();
        CommutativeTriangle.expect(problems, top, topLeft, topRight);
        CommutativeTriangle.expect(problems, right, topRight, bottomRight);
        CommutativeTriangle.expect(problems, left, topLeft, bottomLeft);
        CommutativeTriangle.expect(problems, bottom, bottomLeft, bottomRight);
        return problems;
    }
}
