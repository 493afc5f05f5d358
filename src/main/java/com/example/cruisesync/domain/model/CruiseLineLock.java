package com.example.cruisesync.domain.model;

import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Time-boxed exclusive claim on one cruise line. A lock whose expiry has passed no longer
 * excludes anyone even if its row still exists.
 */
@Data
@AllArgsConstructor
public class CruiseLineLock {

    private int lineId;

    private String lockKey;

    private String holderId;

    private Instant acquiredAt;

    private Instant expiresAt;

    public static String lockKeyFor(int lineId) {
        return "webhook-sync-" + lineId;
    }

    public boolean isExpired(Instant now) {
        return !expiresAt.isAfter(now);
    }

    public boolean isHeldBy(String candidate) {
        return holderId != null && holderId.equals(candidate);
    }
}
