package com.example.cruisesync.infrastructure.lock;

import com.example.cruisesync.domain.model.CruiseLineLock;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Single-process lock table. Only correct while one instance consumes webhooks.
 */
@Component
@ConditionalOnProperty(prefix = "app.sync", name = "lock-store", havingValue = "memory", matchIfMissing = true)
public class InMemoryCruiseLineLockStore implements CruiseLineLockStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryCruiseLineLockStore.class);

    private final Map<Integer, CruiseLineLock> locks = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryCruiseLineLockStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<CruiseLineLock> tryAcquire(int lineId, String holderId, Duration ttl) {
        Instant now = clock.instant();
        CruiseLineLock result = locks.compute(lineId, (key, existing) -> {
            if (existing != null && !existing.isExpired(now)) {
                return existing;
            }
            if (existing != null) {
                log.info("LINE_LOCK_TAKEOVER lineId={} expiredHolder={}", lineId, existing.getHolderId());
            }
            return new CruiseLineLock(lineId, CruiseLineLock.lockKeyFor(lineId), holderId, now, now.plus(ttl));
        });
        if (!result.isHeldBy(holderId)) {
            return Optional.empty();
        }
        return Optional.of(result);
    }

    @Override
    public boolean renew(int lineId, String holderId, Duration ttl) {
        Instant now = clock.instant();
        AtomicBoolean renewed = new AtomicBoolean(false);
        locks.computeIfPresent(lineId, (key, existing) -> {
            if (!existing.isHeldBy(holderId) || existing.isExpired(now)) {
                return existing;
            }
            renewed.set(true);
            return new CruiseLineLock(lineId, existing.getLockKey(), holderId, existing.getAcquiredAt(), now.plus(ttl));
        });
        return renewed.get();
    }

    @Override
    public boolean release(int lineId, String holderId) {
        CruiseLineLock existing = locks.get(lineId);
        return existing != null && existing.isHeldBy(holderId) && locks.remove(lineId, existing);
    }

    @Override
    public Optional<CruiseLineLock> current(int lineId) {
        CruiseLineLock existing = locks.get(lineId);
        if (existing == null || existing.isExpired(clock.instant())) {
            return Optional.empty();
        }
        return Optional.of(existing);
    }

    @Override
    public int releaseExpired() {
        Instant now = clock.instant();
        int before = locks.size();
        locks.values().removeIf(lock -> lock.isExpired(now));
        return before - locks.size();
    }
}
