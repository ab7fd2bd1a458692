package io.surfworks.arrowforge.category;

import java.util.Collection;
import java.util.Optional;

/**
 * Read-only view of a finite category: what the commutativity verifier consumes.
 *
 * <p>Collections are expected to iterate in a stable order so that shape
 * enumeration is deterministic.
 */
public interface CategoryView {

    /**
     * Returns the category's name, used in reports.
     */
    String name();

    Collection<CategoryObject> objects();

    Collection<Morphism> morphisms();

    /**
     * Looks up the composite {@code g ∘ f} (f first, then g).
     *
     * @return the composite, or empty if the pair does not compose or the
     *         composite is not known
     */
    Optional<Morphism> compose(Morphism f, Morphism g);

    /**
     * Returns the identity morphism of {@code object}, if the category has one.
     */
    Optional<Morphism> identity(CategoryObject object);

    /**
     * Returns true if {@code morphism} belongs to this category.
     */
    default boolean contains(Morphism morphism) {
        return morphisms().contains(morphism);
    }

    /**
     * Returns true if {@code morphism} is the identity of its source.
     */
    default boolean isIdentity(Morphism morphism) {
        return identity(morphism.source()).map(morphism::equals).orElse(false);
    }
}
