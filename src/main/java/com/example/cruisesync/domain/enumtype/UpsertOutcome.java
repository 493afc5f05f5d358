package com.example.cruisesync.domain.enumtype;

public enum UpsertOutcome {
    INSERTED,
    UPDATED
}
