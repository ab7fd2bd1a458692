package io.surfworks.arrowforge.category;

/**
 * A morphism of a finite category. Equality is by name and endpoints.
 *
 * @param name the morphism name
 * @param source the domain
 * @param target the codomain
 */
public record Morphism(String name, CategoryObject source, CategoryObject target) {

    public Morphism {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("morphism name must not be blank");
        }
        if (source == null || target == null) {
            throw new IllegalArgumentException("morphism '" + name + "' needs a source and target");
        }
    }

    /**
     * Returns true if this morphism goes from {@code from} to {@code to}.
     */
    public boolean connects(CategoryObject from, CategoryObject to) {
        return source.equals(from) && target.equals(to);
    }

    @Override
    public String toString() {
        return String.format("%s: %s → %s", name, source, target);
    }
}
