package io.surfworks.arrowforge.category.verify;

/**
 * Names of two paths compared by a proof.
 */
public record PathNamePair(String first, String second) {

    @Override
    public String toString() {
        return first + " ≟ " + second;
    }
}
