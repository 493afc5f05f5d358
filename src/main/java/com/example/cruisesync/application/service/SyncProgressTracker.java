package com.example.cruisesync.application.service;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-run counters plus rate and smoothed ETA reporting. ETA is only known when the
 * run has an expected total (bounded webhook jobs); full crawls are discovered lazily.
 */
public class SyncProgressTracker {

    private static final Logger log = LoggerFactory.getLogger(SyncProgressTracker.class);

    private static final int RATE_WINDOW_SIZE = 10;

    private final Long taskId;
    private final Clock clock;
    private final long startTimeMs;
    private final int logIntervalSec;
    private final int expectedTotal;

    private int discovered;
    private int processed;
    private int inserted;
    private int updated;
    private int failed;
    private int skipped;
    private int priceChanged;
    private int batches;
    private String lastSyncedPath;

    private long lastLogTimeMs;
    private long lastSampleTimeMs;
    private int lastSampleProcessed;
    private final Deque<Double> rateWindow = new ArrayDeque<>();

    public SyncProgressTracker(Long taskId, Clock clock, int logIntervalSec, int expectedTotal) {
        this.taskId = taskId;
        this.clock = clock;
        this.startTimeMs = clock.millis();
        this.lastLogTimeMs = startTimeMs;
        this.lastSampleTimeMs = startTimeMs;
        this.logIntervalSec = logIntervalSec > 0 ? logIntervalSec : 30;
        this.expectedTotal = Math.max(0, expectedTotal);
    }

    public void onDiscovered() {
        discovered++;
    }

    public void onSkipped() {
        skipped++;
    }

    public void onInserted(String path, boolean priceChanged) {
        processed++;
        inserted++;
        lastSyncedPath = path;
        if (priceChanged) {
            this.priceChanged++;
        }
    }

    public void onUpdated(String path, boolean priceChanged) {
        processed++;
        updated++;
        lastSyncedPath = path;
        if (priceChanged) {
            this.priceChanged++;
        }
    }

    public void onFailed(String path) {
        processed++;
        failed++;
        lastSyncedPath = path;
    }

    /**
     * Called once per finished batch. Logs when the interval elapsed or {@code force} is set.
     */
    public void onBatchCompleted(int batchSize, boolean force) {
        batches++;
        recordRateSample();
        long now = clock.millis();
        if (force || now - lastLogTimeMs >= logIntervalSec * 1000L) {
            logProgress(batchSize, now);
        }
    }

    /** End-of-run line; does not count as a batch. */
    public void logFinal() {
        logProgress(0, clock.millis());
    }

    private void logProgress(int batchSize, long now) {
        lastLogTimeMs = now;
        log.info("SYNC_PROGRESS taskId={} batch={} batchSize={} discovered={} processed={} inserted={} "
                        + "updated={} failed={} skipped={} priceChanged={} rate={} ETA={} elapsed={}",
                taskId, batches, batchSize, discovered, processed, inserted, updated, failed, skipped,
                priceChanged, formatRate(), formatEta(), formatElapsed(now - startTimeMs));
    }

    private void recordRateSample() {
        long now = clock.millis();
        long deltaMs = now - lastSampleTimeMs;
        int deltaFiles = processed - lastSampleProcessed;
        if (deltaMs > 0 && deltaFiles > 0) {
            rateWindow.addLast(deltaFiles * 1000.0 / deltaMs);
            while (rateWindow.size() > RATE_WINDOW_SIZE) {
                rateWindow.removeFirst();
            }
        }
        lastSampleTimeMs = now;
        lastSampleProcessed = processed;
    }

    /** Exponentially weighted, recent batches count more. */
    double smoothedFilesPerSecond() {
        double weighted = 0;
        double weightSum = 0;
        int i = 0;
        for (Double sample : rateWindow) {
            double weight = Math.pow(0.7, rateWindow.size() - 1 - i);
            weighted += sample * weight;
            weightSum += weight;
            i++;
        }
        return weightSum <= 0 ? 0 : weighted / weightSum;
    }

    String formatEta() {
        int done = processed + skipped;
        if (expectedTotal <= 0 || done >= expectedTotal) {
            return "N/A";
        }
        double speed = smoothedFilesPerSecond();
        if (speed <= 0) {
            return "N/A";
        }
        long etaMs = (long) ((expectedTotal - done) / speed * 1000);
        return formatElapsed(etaMs);
    }

    private String formatRate() {
        return String.format(Locale.ROOT, "%.1f files/s", smoothedFilesPerSecond());
    }

    static String formatElapsed(long elapsedMs) {
        if (elapsedMs < 1000) {
            return elapsedMs + "ms";
        }
        long seconds = elapsedMs / 1000;
        long minutes = seconds / 60;
        long remainSeconds = seconds % 60;
        if (minutes <= 0) {
            return seconds + "s";
        }
        long hours = minutes / 60;
        long remainMinutes = minutes % 60;
        if (hours <= 0) {
            return minutes + "m" + remainSeconds + "s";
        }
        return hours + "h" + remainMinutes + "m" + remainSeconds + "s";
    }

    public int getDiscovered() { return discovered; }
    public int getProcessed() { return processed; }
    public int getInserted() { return inserted; }
    public int getUpdated() { return updated; }
    public int getFailed() { return failed; }
    public int getSkipped() { return skipped; }
    public int getPriceChanged() { return priceChanged; }
    public int getBatches() { return batches; }
    public String getLastSyncedPath() { return lastSyncedPath; }
    public long getElapsedMs() { return clock.millis() - startTimeMs; }
}
