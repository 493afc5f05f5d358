package com.example.cruisesync.infrastructure.lock;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.cruisesync.domain.model.CruiseLineLock;
import com.example.cruisesync.infrastructure.persistence.entity.CruiseLineLockEntity;
import com.example.cruisesync.infrastructure.persistence.mapper.CruiseLineLockMapper;
import com.example.cruisesync.support.MutableClock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MybatisCruiseLineLockStoreTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2025, 3, 15, 10, 0);

    private CruiseLineLockMapper mapper;
    private MybatisCruiseLineLockStore store;

    @BeforeEach
    void setUp() {
        mapper = mock(CruiseLineLockMapper.class);
        store = new MybatisCruiseLineLockStore(mapper, new MutableClock(Instant.parse("2025-03-15T10:00:00Z")));
    }

    @Test
    void acquireShouldWriteUtcTimesAndConfirmHolder() {
        when(mapper.selectByLineId(22)).thenReturn(row("a", NOW.plusMinutes(30)));

        Optional<CruiseLineLock> lock = store.tryAcquire(22, "a", Duration.ofMinutes(30));

        assertTrue(lock.isPresent());
        verify(mapper).insertOrTakeOver(22, "webhook-sync-22", "a", NOW, NOW.plusMinutes(30));
    }

    @Test
    void acquireShouldFailWhenRowBelongsToSomeoneElse() {
        when(mapper.selectByLineId(22)).thenReturn(row("other", NOW.plusMinutes(10)));

        assertFalse(store.tryAcquire(22, "a", Duration.ofMinutes(30)).isPresent());
    }

    @Test
    void expiredRowShouldNotCountAsCurrent() {
        when(mapper.selectByLineId(22)).thenReturn(row("a", NOW.minusSeconds(1)));

        assertFalse(store.current(22).isPresent());
    }

    @Test
    void renewShouldReportWhetherTheRowWasUpdated() {
        when(mapper.renew(eq(22), anyString(), any(LocalDateTime.class), any(LocalDateTime.class))).thenReturn(1, 0);

        assertTrue(store.renew(22, "a", Duration.ofMinutes(30)));
        assertFalse(store.renew(22, "a", Duration.ofMinutes(30)));
    }

    @Test
    void sweepShouldDeleteRowsExpiredByNow() {
        when(mapper.deleteExpired(NOW)).thenReturn(3);

        assertEquals(3, store.releaseExpired());
    }

    private CruiseLineLockEntity row(String holder, LocalDateTime expiresAt) {
        CruiseLineLockEntity entity = new CruiseLineLockEntity();
        entity.setLineId(22);
        entity.setLockKey("webhook-sync-22");
        entity.setHolderId(holder);
        entity.setAcquiredAt(NOW.minusMinutes(1));
        entity.setExpiresAt(expiresAt);
        return entity;
    }
}
