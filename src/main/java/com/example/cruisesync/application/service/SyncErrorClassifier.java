package com.example.cruisesync.application.service;

import com.example.cruisesync.common.exception.SailingConstraintException;
import com.example.cruisesync.domain.enumtype.SyncErrorCode;
import com.example.cruisesync.infrastructure.ftp.CircuitOpenException;
import com.example.cruisesync.infrastructure.ftp.RemoteAuthException;
import com.example.cruisesync.infrastructure.ftp.RemoteConnectionException;
import com.example.cruisesync.infrastructure.ftp.RemoteNotFoundException;
import com.example.cruisesync.infrastructure.parser.CorruptPayloadException;
import com.example.cruisesync.infrastructure.parser.MissingIdentifierException;
import com.example.cruisesync.infrastructure.parser.NormalizationException;
import org.springframework.dao.DataIntegrityViolationException;

public final class SyncErrorClassifier {

    private SyncErrorClassifier() {
    }

    public static SyncErrorCode classify(Throwable error) {
        if (error instanceof CircuitOpenException) {
            return SyncErrorCode.CIRCUIT_OPEN;
        }
        if (error instanceof RemoteAuthException) {
            return SyncErrorCode.AUTH;
        }
        if (error instanceof RemoteNotFoundException) {
            return SyncErrorCode.NOT_FOUND;
        }
        if (error instanceof RemoteConnectionException) {
            return SyncErrorCode.CONNECTION;
        }
        if (error instanceof MissingIdentifierException) {
            return SyncErrorCode.MISSING_IDENTIFIER;
        }
        if (error instanceof CorruptPayloadException || error instanceof NormalizationException) {
            return SyncErrorCode.CORRUPT_PAYLOAD;
        }
        if (error instanceof SailingConstraintException || error instanceof DataIntegrityViolationException) {
            return SyncErrorCode.CONSTRAINT_VIOLATION;
        }
        return SyncErrorCode.UNKNOWN;
    }
}
