package com.example.cruisesync.infrastructure.ftp;

import java.time.Duration;

/**
 * Raised without touching the network while the host's breaker is open.
 */
public class CircuitOpenException extends RemoteFileException {

    private final String host;
    private final Duration retryAfter;

    public CircuitOpenException(String host, String path, Duration retryAfter) {
        super("Circuit breaker OPEN for host " + host + ", retry in " + retryAfter.getSeconds() + "s", path);
        this.host = host;
        this.retryAfter = retryAfter;
    }

    public String getHost() {
        return host;
    }

    public Duration getRetryAfter() {
        return retryAfter;
    }
}
