package com.example.cruisesync.infrastructure.ftp;

public class PoolExhaustedException extends RemoteConnectionException {

    public PoolExhaustedException(String message, String path) {
        super(message, path);
    }
}
