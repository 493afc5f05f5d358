package com.example.cruisesync.application.job;

import com.example.cruisesync.infrastructure.lock.CruiseLineLockStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Service
public class LockSweepJob {

    private static final Logger log = LoggerFactory.getLogger(LockSweepJob.class);

    private final CruiseLineLockStore lockStore;

    public LockSweepJob(CruiseLineLockStore lockStore) {
        this.lockStore = lockStore;
    }

    @Scheduled(cron = "${app.sync.lock-sweep-cron:0 */5 * * * ?}")
    public void run() {
        try {
            int released = lockStore.releaseExpired();
            if (released > 0) {
                log.info("LINE_LOCK_SWEEP released={}", released);
            }
        } catch (Exception e) {
            log.warn("Line lock sweep failed", e);
        }
    }
}
