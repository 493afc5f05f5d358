package com.example.cruisesync.domain.enumtype;

public enum TaskStatus {
    PENDING,
    RUNNING,
    SUCCESS,
    PARTIAL_SUCCESS,
    FAILED,
    CANCELED,
    INTERRUPTED;

    public boolean isActive() {
        return this == PENDING || this == RUNNING;
    }
}
