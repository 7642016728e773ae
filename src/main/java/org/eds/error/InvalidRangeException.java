package org.eds.error;

/**
 * Thrown for a pinned value outside its allowed range, or an unknown constraint type name.
 */
public class InvalidRangeException extends IllegalArgumentException {

    public InvalidRangeException(String message) {
        super(message);
    }

    public InvalidRangeException(String message, Throwable cause) {
        super(message, cause);
    }
}
