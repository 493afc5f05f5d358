package com.example.cruisesync.infrastructure.ftp;

/**
 * Base type for failures talking to the vendor file server.
 */
public class RemoteFileException extends RuntimeException {

    private final String path;

    public RemoteFileException(String message, String path) {
        super(message);
        this.path = path;
    }

    public RemoteFileException(String message, String path, Throwable cause) {
        super(message, cause);
        this.path = path;
    }

    public String getPath() {
        return path;
    }
}
