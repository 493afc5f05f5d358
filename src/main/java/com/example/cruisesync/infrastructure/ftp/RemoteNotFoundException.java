package com.example.cruisesync.infrastructure.ftp;

public class RemoteNotFoundException extends RemoteFileException {

    public RemoteNotFoundException(String path) {
        super("Remote path not found: " + path, path);
    }
}
