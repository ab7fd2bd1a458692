package io.surfworks.arrowforge.category;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import io.surfworks.arrowforge.path.Path;

/**
 * A sequence of morphisms read in diagrammatic order (first morphism applied first).
 *
 * <p>A MorphismPath may be empty or broken; {@link #validate(CategoryView)}
 * reports why. This lets the verifier describe a bad shape instead of failing
 * to construct it. Equality is by the morphism sequence; the name is only a label.
 */
public final class MorphismPath {

    private final List<Morphism> morphisms;
    private final String name;

    public MorphismPath(List<Morphism> morphisms) {
        this(morphisms, null);
    }

    /**
     * Creates a path with an explicit display name.
     *
     * @param morphisms the morphisms, first applied first
     * @param name the display name, or null to render {@code g ∘ f}
     */
    public MorphismPath(List<Morphism> morphisms, String name) {
        if (morphisms == null) {
            throw new IllegalArgumentException("morphisms must not be null");
        }
        this.morphisms = List.copyOf(morphisms);
        this.name = name != null ? name : generateName(this.morphisms);
    }

    public static MorphismPath of(Morphism... morphisms) {
        return new MorphismPath(List.of(morphisms));
    }

    private static String generateName(List<Morphism> morphisms) {
        if (morphisms.isEmpty()) {
            return "empty_path";
        }
        List<String> names = new ArrayList<>(morphisms.size());
        for (int i = morphisms.size() - 1; i >= 0; i--) {
            names.add(morphisms.get(i).name());
        }
        return String.join(" ∘ ", names);
    }

    public List<Morphism> morphisms() {
        return morphisms;
    }

    public String name() {
        return name;
    }

    public int length() {
        return morphisms.size();
    }

    public boolean isEmpty() {
        return morphisms.isEmpty();
    }

    /**
     * Source of the first morphism, or null for the empty path.
     */
    public CategoryObject source() {
        return morphisms.isEmpty() ? null : morphisms.get(0).source();
    }

    /**
     * Target of the last morphism, or null for the empty path.
     */
    public CategoryObject target() {
        return morphisms.isEmpty() ? null : morphisms.get(morphisms.size() - 1).target();
    }

    /**
     * Returns true if consecutive morphisms chain target to source.
     */
    public boolean isComposable() {
        for (int i = 1; i < morphisms.size(); i++) {
            if (!morphisms.get(i - 1).target().equals(morphisms.get(i).source())) {
                return false;
            }
        }
        return true;
    }

    /**
     * Validates this path against {@code category}.
     */
    public PathValidationResult validate(CategoryView category) {
        if (morphisms.isEmpty()) {
            return PathValidationResult.EMPTY_PATH;
        }
        for (Morphism m : morphisms) {
            if (!category.contains(m)) {
                return PathValidationResult.INVALID_COMPOSITION;
            }
        }
        return isComposable() ? PathValidationResult.VALID : PathValidationResult.BROKEN_CHAIN;
    }

    /**
     * Returns a path of this path followed by {@code next}.
     */
    public MorphismPath then(Morphism next) {
        List<Morphism> extended = new ArrayList<>(morphisms.size() + 1);
        extended.addAll(morphisms);
        extended.add(next);
        return new MorphismPath(extended);
    }

    /**
     * Returns the morphism names as a symbol path for the rewrite engine.
     *
     * @throws io.surfworks.arrowforge.path.InvalidPathException if this path is empty
     */
    public Path<String> labels() {
        return Path.of(morphisms.stream().map(Morphism::name).collect(Collectors.toList()));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MorphismPath other)) return false;
        return morphisms.equals(other.morphisms);
    }

    @Override
    public int hashCode() {
        return morphisms.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}
