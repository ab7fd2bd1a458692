package io.surfworks.arrowforge.category;

import java.util.ArrayList;
import java.util.List;

/**
 * A triangle {@code f: A → B}, {@code g: B → C}, {@code h: A → C}.
 *
 * <p>The triangle commutes when {@code g ∘ f = h}.
 */
public record CommutativeTriangle(
        CategoryObject a,
        CategoryObject b,
        CategoryObject c,
        Morphism f,
        Morphism g,
        Morphism h,
        String name
) {

    public CommutativeTriangle {
        if (a == null || b == null || c == null || f == null || g == null || h == null) {
            throw new IllegalArgumentException("triangle vertices and edges must not be null");
        }
        if (name == null) {
            name = "triangle_" + f.name() + "_" + g.name() + "_" + h.name();
        }
    }

    /**
     * Creates a triangle with a generated name.
     */
    public static CommutativeTriangle of(CategoryObject a, CategoryObject b, CategoryObject c,
                                         Morphism f, Morphism g, Morphism h) {
        return new CommutativeTriangle(a, b, c, f, g, h, null);
    }

    /**
     * Returns the two paths that must agree: {@code f;g} and {@code h}.
     */
    public PathPair paths() {
        return new PathPair(
                new MorphismPath(List.of(f, g), "path_" + f.name() + "_" + g.name()),
                new MorphismPath(List.of(h), "path_" + h.name()));
    }

    /**
     * Lists every edge that does not connect the vertices it is drawn between.
     * An empty list means the shape is well formed.
     */
    public List<String> mismatches() {
        List<String> problems = new ArrayList<>();
        expect(problems, f, a, b);
        expect(problems, g, b, c);
        expect(problems, h, a, c);
        return problems;
    }

    static void expect(List<String> problems, Morphism m, CategoryObject from, CategoryObject to) {
        if (!m.connects(from, to)) {
            problems.add(String.format("%s goes %s → %s, expected %s → %s",
                    m.name(), m.source(), m.target(), from, to));
        }
    }
}
