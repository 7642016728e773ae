package org.eds.error;

/**
 * Thrown when a physics parameter needed to build a dictionary is absent from the dataset metadata.
 */
public class MissingMetadataException extends IllegalStateException {

    public MissingMetadataException(String message) {
        super(message);
    }

    public MissingMetadataException(String message, Throwable cause) {
        super(message, cause);
    }
}
