package io.surfworks.arrowforge.rewrite;

/**
 * Direction in which a bidirectional relation is applied.
 */
public enum Direction {

    /** Replace an occurrence of the left-hand side with the right-hand side. */
    FORWARD("→"),

    /** Replace an occurrence of the right-hand side with the left-hand side. */
    BACKWARD("←");

    private final String arrow;

    Direction(String arrow) {
        this.arrow = arrow;
    }

    /**
     * Returns the arrow used when rendering certificates.
     */
    public String arrow() {
        return arrow;
    }
}
