package com.parsely.backend.services.extraction;

/**
 * Thrown when extraction settings or confidence weights are outside their allowed ranges.
 */
public class InvalidExtractionConfigException extends IllegalArgumentException {

    public InvalidExtractionConfigException(String message) {
        super(message);
    }

    public InvalidExtractionConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
