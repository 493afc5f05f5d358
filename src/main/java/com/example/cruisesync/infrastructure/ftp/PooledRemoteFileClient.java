package com.example.cruisesync.infrastructure.ftp;

import com.example.cruisesync.common.util.Sleeper;
import com.example.cruisesync.domain.model.RemoteEntry;
import java.io.IOException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Remote client backed by the session pool. Each call checks the host breaker, borrows a
 * session and retries transport faults on a fresh session with linear backoff.
 * A reused session that lost its login is replaced like a broken one; only a login
 * rejected on a freshly opened session surfaces as {@link RemoteAuthException}.
 */
public class PooledRemoteFileClient implements RemoteFileClient {

    private static final Logger log = LoggerFactory.getLogger(PooledRemoteFileClient.class);

    private final RemoteSessionPool pool;
    private final CircuitBreakerRegistry breakerRegistry;
    private final String host;
    private final int maxAttempts;
    private final long retryBackoffMs;
    private final Sleeper sleeper;

    public PooledRemoteFileClient(RemoteSessionPool pool,
                                  CircuitBreakerRegistry breakerRegistry,
                                  String host,
                                  int maxAttempts,
                                  long retryBackoffMs,
                                  Sleeper sleeper) {
        this.pool = pool;
        this.breakerRegistry = breakerRegistry;
        this.host = host;
        this.maxAttempts = Math.max(1, maxAttempts);
        this.retryBackoffMs = Math.max(0L, retryBackoffMs);
        this.sleeper = sleeper;
    }

    @Override
    public List<RemoteEntry> listDirectory(String path) {
        return execute("LIST", path, session -> session.list(path));
    }

    @Override
    public byte[] fetchFile(String path) {
        return execute("RETR", path, session -> session.retrieve(path));
    }

    @Override
    public String host() {
        return host;
    }

    private <T> T execute(String command, String path, SessionCall<T> call) {
        CircuitBreaker breaker = breakerRegistry.forHost(host);
        RemoteConnectionException lastError = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            CircuitBreaker.Permit permit = breaker.tryAcquire();
            if (permit == null) {
                throw new CircuitOpenException(host, path, breaker.remainingCoolDown());
            }
            PooledSession pooled;
            try {
                pooled = pool.acquire();
            } catch (PoolExhaustedException e) {
                breaker.release(permit);
                throw e;
            } catch (RemoteAuthException e) {
                breaker.release(permit);
                throw e;
            } catch (IOException e) {
                breaker.recordFailure(permit);
                lastError = new RemoteConnectionException("Cannot open session to " + host + ": " + e.getMessage(), path, e);
                log.warn("REMOTE_CONNECT_FAILED host={} path={} attempt={}/{} error={}",
                        host, path, attempt, maxAttempts, e.getMessage());
                backoff(attempt);
                continue;
            } catch (RuntimeException e) {
                breaker.release(permit);
                throw e;
            }

            boolean broken = false;
            try {
                T result = call.apply(pooled.session());
                breaker.recordSuccess(permit);
                return result;
            } catch (RemoteNotFoundException e) {
                breaker.recordSuccess(permit);
                throw e;
            } catch (RemoteAuthException e) {
                broken = true;
                breaker.release(permit);
                if (!pooled.reused()) {
                    throw e;
                }
                int evicted = pool.evictIdle("auth_lost");
                lastError = new RemoteConnectionException(command + " " + path
                        + " failed: session lost authentication", path, e);
                log.warn("REMOTE_SESSION_AUTH_LOST host={} command={} path={} attempt={}/{} evictedIdle={}",
                        host, command, path, attempt, maxAttempts, evicted);
                continue;
            } catch (IOException e) {
                broken = true;
                breaker.recordFailure(permit);
                lastError = new RemoteConnectionException(command + " " + path + " failed: " + e.getMessage(), path, e);
                log.warn("REMOTE_CALL_FAILED host={} command={} path={} attempt={}/{} error={}",
                        host, command, path, attempt, maxAttempts, e.getMessage());
            } catch (RuntimeException e) {
                broken = true;
                breaker.recordFailure(permit);
                throw new RemoteConnectionException(command + " " + path + " failed: " + e.getMessage(), path, e);
            } finally {
                pool.release(pooled, broken);
            }
            backoff(attempt);
        }
        throw lastError;
    }

    private void backoff(int attempt) {
        if (attempt >= maxAttempts || retryBackoffMs <= 0) {
            return;
        }
        try {
            sleeper.sleep(retryBackoffMs * attempt);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RemoteConnectionException("Interrupted during retry backoff", null, e);
        }
    }

    @FunctionalInterface
    private interface SessionCall<T> {
        T apply(RemoteSession session) throws IOException;
    }
}
