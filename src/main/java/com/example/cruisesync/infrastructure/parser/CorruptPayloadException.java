package com.example.cruisesync.infrastructure.parser;

public class CorruptPayloadException extends NormalizationException {

    public CorruptPayloadException(String message) {
        super(message);
    }

    public CorruptPayloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
