package io.surfworks.arrowforge.rewrite;

/**
 * One step of a certificate: a relation applied at an offset in a direction.
 *
 * @param relationName the name of the applied relation
 * @param offset the index at which the pattern was matched
 * @param direction which side of the relation was matched
 */
public record RewriteStep(String relationName, int offset, Direction direction) {

    public RewriteStep {
        if (relationName == null) {
            throw new IllegalArgumentException("relationName must not be null");
        }
        if (offset < 0) {
            throw new IllegalArgumentException("offset must be >= 0, got " + offset);
        }
        if (direction == null) {
            throw new IllegalArgumentException("direction must not be null");
        }
    }

    @Override
    public String toString() {
        return String.format("(%s, %d, %s)", relationName, offset, direction.arrow());
    }
}
