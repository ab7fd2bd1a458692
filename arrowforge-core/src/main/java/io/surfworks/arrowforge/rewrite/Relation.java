package io.surfworks.arrowforge.rewrite;

import java.util.List;

/**
 * A named, bidirectional rewrite rule between two non-empty symbol sequences.
 *
 * <p>Both {@code lhs → rhs} and {@code rhs → lhs} are valid single-step rewrites.
 *
 * @param name the relation name recorded in certificates
 * @param lhs the left-hand side
 * @param rhs the right-hand side
 * @param <S> the symbol type
 */
public record Relation<S>(String name, List<S> lhs, List<S> rhs) {

    public Relation {
        if (name == null || name.isBlank()) {
            throw new MalformedRelationException(name, "name must not be blank");
        }
        if (lhs == null || lhs.isEmpty()) {
            throw new MalformedRelationException(name, "left-hand side must not be empty");
        }
        if (rhs == null || rhs.isEmpty()) {
            throw new MalformedRelationException(name, "right-hand side must not be empty");
        }
        if (containsNull(lhs) || containsNull(rhs)) {
            throw new MalformedRelationException(name, "sides must not contain null symbols");
        }
        lhs = List.copyOf(lhs);
        rhs = List.copyOf(rhs);
    }

    /**
     * Creates a relation.
     */
    public static <S> Relation<S> of(String name, List<S> lhs, List<S> rhs) {
        return new Relation<>(name, lhs, rhs);
    }

    /**
     * Returns the subsequence matched when applying this relation in {@code direction}.
     */
    public List<S> pattern(Direction direction) {
        return direction == Direction.FORWARD ? lhs : rhs;
    }

    /**
     * Returns the subsequence substituted when applying this relation in {@code direction}.
     */
    public List<S> replacement(Direction direction) {
        return direction == Direction.FORWARD ? rhs : lhs;
    }

    private static boolean containsNull(List<?> symbols) {
        for (Object symbol : symbols) {
            if (symbol == null) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return String.format("%s: %s ↔ %s", name, lhs, rhs);
    }
}
