package com.example.cruisesync.infrastructure.ftp;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fixed-size pool of long-lived sessions. A permit is held for the whole time a caller
 * owns a session, so at most {@code maxSize} sessions are ever open or being opened.
 * Expired, idle-too-long and broken sessions are closed and replaced on the next acquire.
 */
public class RemoteSessionPool implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RemoteSessionPool.class);

    private final RemoteSessionFactory factory;
    private final int maxSize;
    private final Duration acquireTimeout;
    private final Duration sessionTtl;
    private final Duration idleTimeout;
    private final Clock clock;
    private final Semaphore permits;
    private final Deque<PooledSession> idle = new ArrayDeque<>();
    private final AtomicInteger openSessions = new AtomicInteger();
    private volatile boolean closed;

    public RemoteSessionPool(RemoteSessionFactory factory,
                             int maxSize,
                             Duration acquireTimeout,
                             Duration sessionTtl,
                             Duration idleTimeout,
                             Clock clock) {
        if (maxSize < 1) {
            throw new IllegalArgumentException("maxSize must be >= 1");
        }
        this.factory = factory;
        this.maxSize = maxSize;
        this.acquireTimeout = acquireTimeout;
        this.sessionTtl = sessionTtl;
        this.idleTimeout = idleTimeout;
        this.clock = clock;
        this.permits = new Semaphore(maxSize, true);
    }

    /**
     * Borrow a healthy session, opening a new one when no idle session qualifies.
     *
     * @throws PoolExhaustedException when no permit frees up within the acquire timeout
     * @throws IOException when a new session cannot be opened
     */
    public PooledSession acquire() throws IOException {
        if (closed) {
            throw new RemoteConnectionException("Session pool is closed", null);
        }
        boolean granted;
        try {
            granted = permits.tryAcquire(acquireTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RemoteConnectionException("Interrupted waiting for session", null, e);
        }
        if (!granted) {
            throw new PoolExhaustedException("No session available within "
                    + acquireTimeout.toMillis() + " ms for host " + factory.host(), null);
        }
        try {
            PooledSession candidate;
            while ((candidate = pollIdle()) != null) {
                if (isHealthy(candidate)) {
                    candidate.markReused();
                    candidate.touch(clock.instant());
                    return candidate;
                }
                discard(candidate, "expired");
            }
            RemoteSession session = factory.open();
            openSessions.incrementAndGet();
            return new PooledSession(session, clock.instant());
        } catch (IOException | RuntimeException e) {
            permits.release();
            throw e;
        }
    }

    /**
     * Return a session. Broken sessions are closed so the next acquire opens a fresh one.
     */
    public void release(PooledSession pooled, boolean broken) {
        try {
            if (broken || closed || !pooled.session().isConnected()) {
                discard(pooled, broken ? "broken" : "disconnected");
                return;
            }
            pooled.touch(clock.instant());
            synchronized (idle) {
                idle.addLast(pooled);
            }
        } finally {
            permits.release();
        }
    }

    /**
     * Close every idle session, e.g. after the server dropped authentication on one of them.
     * Sessions currently borrowed are left to their holders.
     */
    public int evictIdle(String reason) {
        List<PooledSession> drained;
        synchronized (idle) {
            drained = new ArrayList<>(idle);
            idle.clear();
        }
        for (PooledSession pooled : drained) {
            discard(pooled, reason);
        }
        return drained.size();
    }

    public int openCount() {
        return openSessions.get();
    }

    public int inUseCount() {
        return maxSize - permits.availablePermits();
    }

    public int maxSize() {
        return maxSize;
    }

    @Override
    public void close() {
        closed = true;
        evictIdle("shutdown");
    }

    private PooledSession pollIdle() {
        synchronized (idle) {
            return idle.pollFirst();
        }
    }

    private boolean isHealthy(PooledSession pooled) {
        Instant now = clock.instant();
        if (!pooled.session().isConnected()) {
            return false;
        }
        if (!pooled.createdAt().plus(sessionTtl).isAfter(now)) {
            return false;
        }
        return pooled.lastUsedAt().plus(idleTimeout).isAfter(now);
    }

    private void discard(PooledSession pooled, String reason) {
        openSessions.decrementAndGet();
        log.debug("FTP_SESSION_DISCARDED host={} reason={}", factory.host(), reason);
        pooled.session().close();
    }
}
