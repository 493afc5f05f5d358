package com.example.cruisesync.infrastructure.parser;

/**
 * A payload that cannot be turned into a sailing. Subtypes tell the caller whether
 * retrying the same bytes could ever help.
 */
public class NormalizationException extends RuntimeException {

    public NormalizationException(String message) {
        super(message);
    }

    public NormalizationException(String message, Throwable cause) {
        super(message, cause);
    }
}
