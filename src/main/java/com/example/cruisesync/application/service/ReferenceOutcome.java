package com.example.cruisesync.application.service;

import com.example.cruisesync.domain.enumtype.ReferenceState;
import com.example.cruisesync.domain.enumtype.SyncErrorCode;
import com.example.cruisesync.domain.model.SailingReference;
import com.example.cruisesync.domain.model.UpsertResult;

/**
 * Terminal result for one reference in one run.
 */
public final class ReferenceOutcome {

    private final SailingReference reference;
    private final ReferenceState state;
    private final ReferenceState failedAt;
    private final UpsertResult upsertResult;
    private final SyncErrorCode errorCode;
    private final String errorMessage;

    private ReferenceOutcome(SailingReference reference, ReferenceState state, ReferenceState failedAt,
                             UpsertResult upsertResult, SyncErrorCode errorCode, String errorMessage) {
        this.reference = reference;
        this.state = state;
        this.failedAt = failedAt;
        this.upsertResult = upsertResult;
        this.errorCode = errorCode;
        this.errorMessage = errorMessage;
    }

    public static ReferenceOutcome committed(SailingReference reference, UpsertResult upsertResult) {
        return new ReferenceOutcome(reference, ReferenceState.COMMITTED, null, upsertResult, null, null);
    }

    public static ReferenceOutcome failed(SailingReference reference, ReferenceState failedAt,
                                          SyncErrorCode errorCode, String errorMessage) {
        return new ReferenceOutcome(reference, ReferenceState.FAILED, failedAt, null, errorCode, errorMessage);
    }

    public SailingReference getReference() {
        return reference;
    }

    public ReferenceState getState() {
        return state;
    }

    /** Stage the reference was in when it failed; null for committed references. */
    public ReferenceState getFailedAt() {
        return failedAt;
    }

    public UpsertResult getUpsertResult() {
        return upsertResult;
    }

    public SyncErrorCode getErrorCode() {
        return errorCode;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public boolean isCommitted() {
        return state == ReferenceState.COMMITTED;
    }

    /** Failures that say nothing about this file, only about the remote endpoint. */
    public boolean abortsRun() {
        return errorCode != null && errorCode.abortsRun();
    }
}
