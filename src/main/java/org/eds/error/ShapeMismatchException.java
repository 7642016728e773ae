package org.eds.error;

/**
 * Thrown when a matrix or mask does not have the shape its consumer requires.
 */
public class ShapeMismatchException extends IllegalArgumentException {

    public ShapeMismatchException(String message) {
        super(message);
    }

    public ShapeMismatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
