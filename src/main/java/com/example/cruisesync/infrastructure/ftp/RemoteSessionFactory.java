package com.example.cruisesync.infrastructure.ftp;

import java.io.IOException;

public interface RemoteSessionFactory {

    /** Open and authenticate a new session. */
    RemoteSession open() throws IOException;

    /** Logical endpoint the sessions connect to; also the circuit breaker key. */
    String host();
}
