package com.example.cruisesync.infrastructure.lock;

import com.example.cruisesync.domain.model.CruiseLineLock;
import com.example.cruisesync.infrastructure.persistence.entity.CruiseLineLockEntity;
import com.example.cruisesync.infrastructure.persistence.mapper.CruiseLineLockMapper;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Optional;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Lock table shared by every instance through {@code cruise_line_lock}. Timestamps are
 * written in UTC from the injected clock, never from the database's NOW().
 */
@Component
@ConditionalOnProperty(prefix = "app.sync", name = "lock-store", havingValue = "database")
public class MybatisCruiseLineLockStore implements CruiseLineLockStore {

    private final CruiseLineLockMapper cruiseLineLockMapper;
    private final Clock clock;

    public MybatisCruiseLineLockStore(CruiseLineLockMapper cruiseLineLockMapper, Clock clock) {
        this.cruiseLineLockMapper = cruiseLineLockMapper;
        this.clock = clock;
    }

    @Override
    public Optional<CruiseLineLock> tryAcquire(int lineId, String holderId, Duration ttl) {
        Instant now = clock.instant();
        cruiseLineLockMapper.insertOrTakeOver(lineId, CruiseLineLock.lockKeyFor(lineId), holderId,
                toUtc(now), toUtc(now.plus(ttl)));
        CruiseLineLockEntity row = cruiseLineLockMapper.selectByLineId(lineId);
        if (row == null || !holderId.equals(row.getHolderId())) {
            return Optional.empty();
        }
        return Optional.of(toModel(row));
    }

    @Override
    public boolean renew(int lineId, String holderId, Duration ttl) {
        Instant now = clock.instant();
        return cruiseLineLockMapper.renew(lineId, holderId, toUtc(now), toUtc(now.plus(ttl))) > 0;
    }

    @Override
    public boolean release(int lineId, String holderId) {
        return cruiseLineLockMapper.release(lineId, holderId) > 0;
    }

    @Override
    public Optional<CruiseLineLock> current(int lineId) {
        CruiseLineLockEntity row = cruiseLineLockMapper.selectByLineId(lineId);
        if (row == null) {
            return Optional.empty();
        }
        CruiseLineLock lock = toModel(row);
        return lock.isExpired(clock.instant()) ? Optional.empty() : Optional.of(lock);
    }

    @Override
    public int releaseExpired() {
        return cruiseLineLockMapper.deleteExpired(toUtc(clock.instant()));
    }

    private static LocalDateTime toUtc(Instant instant) {
        return LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
    }

    private static CruiseLineLock toModel(CruiseLineLockEntity row) {
        return new CruiseLineLock(row.getLineId(), row.getLockKey(), row.getHolderId(),
                row.getAcquiredAt().toInstant(ZoneOffset.UTC), row.getExpiresAt().toInstant(ZoneOffset.UTC));
    }
}
