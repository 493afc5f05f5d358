package com.example.cruisesync.domain.enumtype;

/**
 * Failure classes recorded per reference. {@code permanent} failures are not retried by
 * later scheduled crawls while the remote file is unchanged; {@code abortsRun} failures
 * stop the whole run at the current batch.
 */
public enum SyncErrorCode {
    CONNECTION(false, false),
    AUTH(false, true),
    CIRCUIT_OPEN(false, true),
    NOT_FOUND(false, false),
    CORRUPT_PAYLOAD(true, false),
    MISSING_IDENTIFIER(true, false),
    CONSTRAINT_VIOLATION(false, false),
    LOCK_LOST(false, true),
    UNKNOWN(false, false);

    private final boolean permanent;
    private final boolean abortsRun;

    SyncErrorCode(boolean permanent, boolean abortsRun) {
        this.permanent = permanent;
        this.abortsRun = abortsRun;
    }

    public boolean isPermanent() {
        return permanent;
    }

    public boolean abortsRun() {
        return abortsRun;
    }
}
