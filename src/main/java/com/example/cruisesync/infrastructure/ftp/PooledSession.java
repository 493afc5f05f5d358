package com.example.cruisesync.infrastructure.ftp;

import java.time.Instant;

/**
 * A session plus the timestamps the pool needs for TTL and idle checks.
 */
public final class PooledSession {

    private final RemoteSession session;
    private final Instant createdAt;
    private Instant lastUsedAt;
    private boolean reused;

    PooledSession(RemoteSession session, Instant createdAt) {
        this.session = session;
        this.createdAt = createdAt;
        this.lastUsedAt = createdAt;
    }

    public RemoteSession session() {
        return session;
    }

    Instant createdAt() {
        return createdAt;
    }

    Instant lastUsedAt() {
        return lastUsedAt;
    }

    /** True once the session has been handed out again after a release. */
    boolean reused() {
        return reused;
    }

    void markReused() {
        this.reused = true;
    }

    void touch(Instant now) {
        this.lastUsedAt = now;
    }
}
