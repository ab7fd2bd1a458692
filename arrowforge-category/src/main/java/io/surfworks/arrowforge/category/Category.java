package io.surfworks.arrowforge.category;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A finite category given by an explicit composition table.
 *
 * <p>Adding an object also adds its identity {@code id_X}. Composites that are
 * not in the table are unknown, except where an identity law decides them.
 *
 * <p>Example:
 * <pre>{@code
 * Category c = new Category("C");
 * CategoryObject a = c.addObject("A");
 * CategoryObject b = c.addObject("B");
 * CategoryObject x = c.addObject("C");
 * Morphism f = c.addMorphism("f", a, b);
 * Morphism g = c.addMorphism("g", b, x);
 * Morphism h = c.addMorphism("h", a, x);
 * c.setComposition(f, g, h);   // g ∘ f = h
 * }</pre>
 */
public final class Category implements CategoryView {

    private final String name;
    private final Set<CategoryObject> objects = new LinkedHashSet<>();
    private final Set<Morphism> morphisms = new LinkedHashSet<>();
    private final Map<CategoryObject, Morphism> identities = new LinkedHashMap<>();
    private final Map<ComposablePair, Morphism> composition = new HashMap<>();

    public Category(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("category name must not be blank");
        }
        this.name = name;
    }

    @Override
    public String name() {
        return name;
    }

    /**
     * Adds an object and its identity morphism. Adding an existing object is a no-op.
     *
     * @return this category for chaining
     */
    public Category addObject(CategoryObject object) {
        if (objects.add(object)) {
            Morphism id = new Morphism("id_" + object.name(), object, object);
            morphisms.add(id);
            identities.put(object, id);
        }
        return this;
    }

    /**
     * Adds an object by name and returns it.
     */
    public CategoryObject addObject(String objectName) {
        CategoryObject object = new CategoryObject(objectName);
        addObject(object);
        return object;
    }

    /**
     * Adds a morphism, adding its endpoints if needed.
     *
     * @return this category for chaining
     */
    public Category addMorphism(Morphism morphism) {
        addObject(morphism.source());
        addObject(morphism.target());
        morphisms.add(morphism);
        return this;
    }

    /**
     * Adds a morphism by name and returns it.
     */
    public Morphism addMorphism(String morphismName, CategoryObject source, CategoryObject target) {
        Morphism morphism = new Morphism(morphismName, source, target);
        addMorphism(morphism);
        return morphism;
    }

    /**
     * Records {@code g ∘ f = h}.
     *
     * @return this category for chaining
     * @throws IllegalArgumentException if f and g do not compose, if h does not
     *         go from f's source to g's target, or if any of them is not in this category
     */
    public Category setComposition(Morphism f, Morphism g, Morphism h) {
        for (Morphism m : new Morphism[] {f, g, h}) {
            if (!morphisms.contains(m)) {
                throw new IllegalArgumentException("Morphism " + m + " is not in category " + name);
            }
        }
        if (!f.target().equals(g.source())) {
            throw new IllegalArgumentException(String.format(
                    "Cannot compose %s and %s: target/source mismatch", f, g));
        }
        if (!h.connects(f.source(), g.target())) {
            throw new IllegalArgumentException(String.format(
                    "Composition result %s must go from %s to %s", h, f.source(), g.target()));
        }
        composition.put(new ComposablePair(f, g), h);
        return this;
    }

    @Override
    public Optional<Morphism> compose(Morphism f, Morphism g) {
        if (!f.target().equals(g.source())) {
            return Optional.empty();
        }
        Morphism tabled = composition.get(new ComposablePair(f, g));
        if (tabled != null) {
            return Optional.of(tabled);
        }
        if (f.equals(identities.get(f.source()))) {
            return Optional.of(g);
        }
        if (g.equals(identities.get(g.target()))) {
            return Optional.of(f);
        }
        return Optional.empty();
    }

    @Override
    public Optional<Morphism> identity(CategoryObject object) {
        return Optional.ofNullable(identities.get(object));
    }

    @Override
    public Collection<CategoryObject> objects() {
        return Collections.unmodifiableSet(objects);
    }

    @Override
    public Collection<Morphism> morphisms() {
        return Collections.unmodifiableSet(morphisms);
    }

    @Override
    public boolean contains(Morphism morphism) {
        return morphisms.contains(morphism);
    }

    /**
     * Returns the number of explicitly tabled composites.
     */
    public int compositionCount() {
        return composition.size();
    }

    @Override
    public String toString() {
        return String.format("Category[%s, objects=%d, morphisms=%d, composites=%d]",
                name, objects.size(), morphisms.size(), composition.size());
    }

    private record ComposablePair(Morphism first, Morphism second) {}
}
