package com.example.cruisesync.infrastructure.parser;

public class MissingIdentifierException extends NormalizationException {

    private final String field;

    public MissingIdentifierException(String field) {
        super("Payload has no " + field);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
