package io.surfworks.arrowforge.category.verify;

/**
 * Exception thrown when exhaustive shape enumeration is requested on a category
 * larger than {@link VerifierConfig#maxEnumerationObjects()}.
 */
public class EnumerationLimitExceededException extends RuntimeException {

    private final String shape;
    private final int objectCount;
    private final int limit;

    public EnumerationLimitExceededException(String shape, int objectCount, int limit) {
        super(String.format("Refusing to enumerate %ss over %d objects (limit %d)", shape, objectCount, limit));
        this.shape = shape;
        this.objectCount = objectCount;
        this.limit = limit;
    }

    public String getShape() {
        return shape;
    }

    public int getObjectCount() {
        return objectCount;
    }

    public int getLimit() {
        return limit;
    }
}
