package com.example.cruisesync.domain.enumtype;

public enum CheckpointStatus {
    COMMITTED,
    FAILED,
    PERMANENT_FAILED
}
