package com.example.cruisesync.domain.enumtype;

/**
 * Lifecycle of one sailing reference inside a run. COMMITTED and FAILED are terminal.
 */
public enum ReferenceState {
    DISCOVERED,
    FETCHING,
    NORMALIZING,
    PERSISTING,
    COMMITTED,
    FAILED;

    public boolean isTerminal() {
        return this == COMMITTED || this == FAILED;
    }
}
