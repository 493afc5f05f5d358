package com.example.cruisesync.domain.enumtype;

public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
