package io.surfworks.arrowforge.category;

/**
 * An object of a finite category. Equality is by name.
 *
 * @param name the object name
 */
public record CategoryObject(String name) {

    public CategoryObject {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("object name must not be blank");
        }
    }

    public static CategoryObject of(String name) {
        return new CategoryObject(name);
    }

    @Override
    public String toString() {
        return name;
    }
}
