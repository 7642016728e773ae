package org.eds.error;

/**
 * Thrown when a chemical identifier is neither a known atomic number nor a known symbol.
 */
public class InvalidElementException extends IllegalArgumentException {

    public InvalidElementException(String message) {
        super(message);
    }

    public InvalidElementException(String message, Throwable cause) {
        super(message, cause);
    }
}
