package com.example.cruisesync.application.service;

import com.example.cruisesync.infrastructure.lock.CruiseLineLockStore;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;

/**
 * Line locks for a crawl across every line. At most one line is held at a time; the lock
 * moves when the batch line changes and is renewed while batches stay on the same line.
 * A line whose lock belongs to another run is reported busy.
 */
class CrawlLineLocks implements SyncRunContext.LineGate {

    private static final Logger log = LoggerFactory.getLogger(CrawlLineLocks.class);

    private final CruiseLineLockStore lockStore;
    private final ApplicationEventPublisher eventPublisher;
    private final String holderId;
    private final Duration ttl;

    private Integer heldLine;

    CrawlLineLocks(CruiseLineLockStore lockStore, ApplicationEventPublisher eventPublisher,
                   String holderId, Duration ttl) {
        this.lockStore = lockStore;
        this.eventPublisher = eventPublisher;
        this.holderId = holderId;
        this.ttl = ttl;
    }

    @Override
    public boolean enter(int lineId) {
        if (heldLine != null && heldLine == lineId) {
            if (lockStore.renew(lineId, holderId, ttl)) {
                return true;
            }
            log.warn("SYNC_LINE_LOCK_LOST holder={} lineId={}", holderId, lineId);
            heldLine = null;
        } else {
            releaseHeld();
        }
        if (lockStore.tryAcquire(lineId, holderId, ttl).isPresent()) {
            heldLine = lineId;
            log.debug("SYNC_LINE_LOCK_ACQUIRED holder={} lineId={}", holderId, lineId);
            return true;
        }
        log.info("SYNC_LINE_BUSY holder={} lineId={}", holderId, lineId);
        return false;
    }

    Integer heldLine() {
        return heldLine;
    }

    void releaseHeld() {
        if (heldLine == null) {
            return;
        }
        int lineId = heldLine;
        heldLine = null;
        lockStore.release(lineId, holderId);
        eventPublisher.publishEvent(new LineLockReleasedEvent(lineId, holderId));
    }
}
