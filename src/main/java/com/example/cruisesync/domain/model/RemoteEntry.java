package com.example.cruisesync.domain.model;

import com.example.cruisesync.domain.enumtype.RemoteEntryKind;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RemoteEntry {

    private String name;

    private RemoteEntryKind kind;

    private long size;

    public static RemoteEntry file(String name, long size) {
        return new RemoteEntry(name, RemoteEntryKind.FILE, size);
    }

    public static RemoteEntry directory(String name) {
        return new RemoteEntry(name, RemoteEntryKind.DIRECTORY, 0L);
    }

    public boolean isDirectory() {
        return kind == RemoteEntryKind.DIRECTORY;
    }
}
