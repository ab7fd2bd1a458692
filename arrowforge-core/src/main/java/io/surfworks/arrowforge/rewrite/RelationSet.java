package io.surfworks.arrowforge.rewrite;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Append-only, ordered registry of relations for one rewriting context.
 *
 * <p>Registration order decides which rewrite the engine tries first; it has no
 * effect on soundness. There is no removal: a presentation only grows within a
 * session. Names are unique, so a {@link RewriteStep} identifies exactly one
 * relation.
 *
 * <p>Example:
 * <pre>{@code
 * RelationSet<String> relations = new RelationSet<String>()
 *     .add("swap", List.of("a", "b"), List.of("b", "a"))
 *     .add("idem", List.of("e", "e"), List.of("e"));
 * }</pre>
 *
 * @param <S> the symbol type
 */
public final class RelationSet<S> {

    private static final Logger LOG = Logger.getLogger(RelationSet.class.getName());

    private final Map<String, Relation<S>> relations = new LinkedHashMap<>();

    public RelationSet() {}

    /**
     * Creates a registry holding the given relations, in order.
     */
    public RelationSet(List<Relation<S>> initial) {
        for (Relation<S> relation : initial) {
            add(relation);
        }
    }

    /**
     * Registers a relation.
     *
     * @param relation the relation to add
     * @return this registry for chaining
     * @throws MalformedRelationException if a relation with the same name is already registered
     */
    public RelationSet<S> add(Relation<S> relation) {
        if (relation == null) {
            throw new MalformedRelationException(null, "relation must not be null");
        }
        if (relations.containsKey(relation.name())) {
            throw new MalformedRelationException(relation.name(), "a relation with this name is already registered");
        }
        relations.put(relation.name(), relation);
        LOG.fine(() -> "Registered relation " + relation);
        return this;
    }

    /**
     * Builds and registers a relation.
     *
     * @throws MalformedRelationException if either side is empty or the name is taken
     */
    public RelationSet<S> add(String name, List<S> lhs, List<S> rhs) {
        return add(new Relation<>(name, lhs, rhs));
    }

    /**
     * Returns the relations in registration order.
     */
    public List<Relation<S>> relations() {
        return List.copyOf(relations.values());
    }

    /**
     * Returns the relation registered under {@code name}.
     */
    public Optional<Relation<S>> byName(String name) {
        return Optional.ofNullable(relations.get(name));
    }

    public int size() {
        return relations.size();
    }

    public boolean isEmpty() {
        return relations.isEmpty();
    }

    @Override
    public String toString() {
        return String.format("RelationSet[relations=%d]", relations.size());
    }
}
