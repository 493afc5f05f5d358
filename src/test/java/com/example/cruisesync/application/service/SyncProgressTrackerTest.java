package com.example.cruisesync.application.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

import com.example.cruisesync.support.MutableClock;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SyncProgressTrackerTest {

    private MutableClock clock;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-03-15T10:00:00Z"));
    }

    @Test
    void formatElapsedShouldPickTheLargestUnit() {
        assertEquals("450ms", SyncProgressTracker.formatElapsed(450));
        assertEquals("42s", SyncProgressTracker.formatElapsed(42_000));
        assertEquals("3m5s", SyncProgressTracker.formatElapsed(185_000));
        assertEquals("2h0m1s", SyncProgressTracker.formatElapsed(7_201_000));
    }

    @Test
    void countersShouldTrackEveryOutcome() {
        SyncProgressTracker tracker = new SyncProgressTracker(1L, clock, 30, 0);

        tracker.onDiscovered();
        tracker.onDiscovered();
        tracker.onDiscovered();
        tracker.onDiscovered();
        tracker.onSkipped();
        tracker.onInserted("/a.json", false);
        tracker.onUpdated("/b.json", true);
        tracker.onFailed("/c.json");
        tracker.onBatchCompleted(3, false);
        tracker.logFinal();

        assertEquals(4, tracker.getDiscovered());
        assertEquals(3, tracker.getProcessed());
        assertEquals(1, tracker.getInserted());
        assertEquals(1, tracker.getUpdated());
        assertEquals(1, tracker.getFailed());
        assertEquals(1, tracker.getSkipped());
        assertEquals(1, tracker.getPriceChanged());
        assertEquals(1, tracker.getBatches());
        assertEquals("/c.json", tracker.getLastSyncedPath());
    }

    @Test
    void etaShouldBeUnknownWithoutExpectedTotal() {
        SyncProgressTracker tracker = new SyncProgressTracker(1L, clock, 30, 0);
        clock.advance(Duration.ofSeconds(2));
        tracker.onInserted("/a.json", false);
        tracker.onBatchCompleted(1, false);

        assertEquals("N/A", tracker.formatEta());
    }

    @Test
    void etaShouldFollowMeasuredRate() {
        SyncProgressTracker tracker = new SyncProgressTracker(1L, clock, 30, 20);
        clock.advance(Duration.ofSeconds(10));
        for (int i = 0; i < 10; i++) {
            tracker.onInserted("/" + i + ".json", false);
        }
        tracker.onBatchCompleted(10, false);

        assertEquals(1.0, tracker.smoothedFilesPerSecond(), 0.0001);
        assertEquals("10s", tracker.formatEta());
        assertNotEquals(0, tracker.getElapsedMs());
    }
}
