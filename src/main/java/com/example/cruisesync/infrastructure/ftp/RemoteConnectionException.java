package com.example.cruisesync.infrastructure.ftp;

/**
 * Transient transport failure: reset, timeout, protocol fault or no free session.
 */
public class RemoteConnectionException extends RemoteFileException {

    public RemoteConnectionException(String message, String path) {
        super(message, path);
    }

    public RemoteConnectionException(String message, String path, Throwable cause) {
        super(message, path, cause);
    }
}
