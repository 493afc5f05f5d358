package com.example.cruisesync.common.exception;

/**
 * A sailing row still violates a constraint after its dimension rows were re-upserted.
 */
public class SailingConstraintException extends RuntimeException {

    private final String sailingId;

    public SailingConstraintException(String sailingId, Throwable cause) {
        super("Constraint violation persisting sailing " + sailingId + ": " + rootMessage(cause), cause);
        this.sailingId = sailingId;
    }

    public String getSailingId() {
        return sailingId;
    }

    private static String rootMessage(Throwable cause) {
        Throwable current = cause;
        while (current != null && current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        return current == null ? "unknown" : current.getMessage();
    }
}
