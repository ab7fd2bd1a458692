package io.surfworks.arrowforge.ncat;

import java.util.List;
import java.util.Objects;

import io.surfworks.arrowforge.rewrite.MalformedRelationException;
import io.surfworks.arrowforge.rewrite.Relation;

/**
 * A relation between two sequences of generator indices at one dimension.
 *
 * @param dim the dimension whose generators the indices refer to
 * @param lhs the left-hand side, as generator indices
 * @param rhs the right-hand side, as generator indices
 * @param name the relation name recorded in certificates
 */
public record DimensionedRelation(int dim, List<Integer> lhs, List<Integer> rhs, String name) {

    public DimensionedRelation {
        if (name == null || name.isBlank()) {
            throw new MalformedRelationException(name, "name must not be blank");
        }
        if (lhs == null || lhs.isEmpty()) {
            throw new MalformedRelationException(name, "left-hand side must not be empty");
        }
        if (rhs == null || rhs.isEmpty()) {
            throw new MalformedRelationException(name, "right-hand side must not be empty");
        }
        if (lhs.stream().anyMatch(Objects::isNull) || rhs.stream().anyMatch(Objects::isNull)) {
            throw new MalformedRelationException(name, "sides must not contain null generator indices");
        }
        lhs = List.copyOf(lhs);
        rhs = List.copyOf(rhs);
    }

    /**
     * Returns the dimension-free relation used by the rewrite engine.
     */
    public Relation<Integer> toRelation() {
        return new Relation<>(name, lhs, rhs);
    }
}
