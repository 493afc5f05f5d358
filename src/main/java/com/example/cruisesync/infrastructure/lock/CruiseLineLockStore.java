package com.example.cruisesync.infrastructure.lock;

import com.example.cruisesync.domain.model.CruiseLineLock;
import java.time.Duration;
import java.util.Optional;

/**
 * At most one live lock per line id. Expired locks are taken over on acquisition.
 */
public interface CruiseLineLockStore {

    /**
     * @return the lock now held by {@code holderId}, or empty when someone else holds a live lock
     */
    Optional<CruiseLineLock> tryAcquire(int lineId, String holderId, Duration ttl);

    /**
     * Pushes the expiry of a live lock held by {@code holderId}. False when the lock expired
     * or changed hands.
     */
    boolean renew(int lineId, String holderId, Duration ttl);

    boolean release(int lineId, String holderId);

    /** The live lock on the line, if any. */
    Optional<CruiseLineLock> current(int lineId);

    int releaseExpired();
}
