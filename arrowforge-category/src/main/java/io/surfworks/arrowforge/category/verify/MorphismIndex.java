package io.surfworks.arrowforge.category.verify;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import io.surfworks.arrowforge.category.CategoryObject;
import io.surfworks.arrowforge.category.CategoryView;
import io.surfworks.arrowforge.category.Morphism;

/**
 * Morphisms of a category indexed by (source, target), plus the non-identity
 * morphisms leaving each object.
 *
 * <p>Built once per enumeration or path search. Lists keep the category's
 * iteration order.
 */
final class MorphismIndex {

    private final Map<Endpoints, List<Morphism>> byEndpoints = new HashMap<>();
    private final Map<CategoryObject, List<Morphism>> nonIdentityBySource = new HashMap<>();

    private MorphismIndex() {}

    static MorphismIndex build(CategoryView category) {
        MorphismIndex index = new MorphismIndex();
        for (Morphism m : category.morphisms()) {
            index.byEndpoints.computeIfAbsent(new Endpoints(m.source(), m.target()), k -> new ArrayList<>()).add(m);
            if (!category.isIdentity(m)) {
                index.nonIdentityBySource.computeIfAbsent(m.source(), k -> new ArrayList<>()).add(m);
            }
        }
        return index;
    }

    List<Morphism> between(CategoryObject source, CategoryObject target) {
        return byEndpoints.getOrDefault(new Endpoints(source, target), List.of());
    }

    /**
     * Outgoing morphisms other than the identity, for path search.
     */
    List<Morphism> outgoingNonIdentity(CategoryObject source) {
        return nonIdentityBySource.getOrDefault(source, List.of());
    }

    private record Endpoints(CategoryObject source, CategoryObject target) {}
}
