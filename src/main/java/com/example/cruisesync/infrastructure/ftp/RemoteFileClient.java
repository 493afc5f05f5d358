package com.example.cruisesync.infrastructure.ftp;

import com.example.cruisesync.domain.model.RemoteEntry;
import java.util.List;

/**
 * Access to the vendor's directory tree. Implementations are safe for concurrent use.
 *
 * <p>Failures surface as {@link RemoteNotFoundException}, {@link RemoteAuthException},
 * {@link CircuitOpenException} or, once retries are spent, {@link RemoteConnectionException}.
 */
public interface RemoteFileClient {

    List<RemoteEntry> listDirectory(String path);

    byte[] fetchFile(String path);

    String host();
}
