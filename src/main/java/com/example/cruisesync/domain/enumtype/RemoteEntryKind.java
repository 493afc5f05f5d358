package com.example.cruisesync.domain.enumtype;

public enum RemoteEntryKind {
    FILE,
    DIRECTORY
}
