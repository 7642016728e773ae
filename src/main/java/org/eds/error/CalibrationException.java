package org.eds.error;

/**
 * Thrown when the energy axis cannot be used for line-shape evaluation (e.g. it starts at or below zero).
 */
public class CalibrationException extends IllegalStateException {

    public CalibrationException(String message) {
        super(message);
    }

    public CalibrationException(String message, Throwable cause) {
        super(message, cause);
    }
}
