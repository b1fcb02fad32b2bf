package org.transitmatters.stopevents.normalizer;

/**
 * Thrown when a whole source cannot be read, for example because the file is missing or is not valid CSV.
 */
public class SourceReadException extends Exception {
    public SourceReadException(String message) {
        super(message);
    }

    public SourceReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
