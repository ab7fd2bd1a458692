package io.surfworks.arrowforge.rewrite;

/**
 * Exception thrown when a relation is rejected at registration.
 *
 * <p>An empty side would match at every offset of every path, so relations
 * with an empty left- or right-hand side are never stored.
 */
public class MalformedRelationException extends RuntimeException {

    private final String relationName;

    public MalformedRelationException(String relationName, String message) {
        super(String.format("Malformed relation '%s': %s", relationName, message));
        this.relationName = relationName;
    }

    /**
     * Returns the name of the rejected relation (may be null if the name itself was missing).
     */
    public String getRelationName() {
        return relationName;
    }
}
