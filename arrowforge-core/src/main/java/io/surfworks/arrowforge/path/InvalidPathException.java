package io.surfworks.arrowforge.path;

/**
 * Exception thrown when a path cannot be constructed (empty, or containing null symbols).
 */
public class InvalidPathException extends RuntimeException {

    public InvalidPathException(String message) {
        super(message);
    }

    public InvalidPathException(String message, Throwable cause) {
        super(message, cause);
    }
}
