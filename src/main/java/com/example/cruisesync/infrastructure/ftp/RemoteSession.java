package com.example.cruisesync.infrastructure.ftp;

import com.example.cruisesync.domain.model.RemoteEntry;
import java.io.Closeable;
import java.io.IOException;
import java.util.List;

/**
 * One persistent, logged-in connection to the file server. Not thread-safe; the pool
 * hands each session to a single caller at a time.
 *
 * <p>{@link IOException} means the session is no longer usable and must be discarded.
 * {@link RemoteNotFoundException} and {@link RemoteAuthException} are answers from a
 * healthy server.
 */
public interface RemoteSession extends Closeable {

    List<RemoteEntry> list(String path) throws IOException;

    byte[] retrieve(String path) throws IOException;

    boolean isConnected();

    @Override
    void close();
}
