package com.example.cruisesync.infrastructure.ftp;

public class RemoteAuthException extends RemoteFileException {

    public RemoteAuthException(String message, String path) {
        super(message, path);
    }
}
