package org.eds.error;

/**
 * Thrown when ground truth is requested from a dataset that carries none.
 */
public class NoGroundTruthException extends IllegalStateException {

    public NoGroundTruthException(String message) {
        super(message);
    }

    public NoGroundTruthException(String message, Throwable cause) {
        super(message, cause);
    }
}
