package com.example.cruisesync.application.service;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.function.BooleanSupplier;

/**
 * What one processor invocation needs besides the references themselves.
 */
public class SyncRunContext {

    private final Long taskId;
    private final Set<String> completedPathMd5s;
    private final Map<String, Long> permanentFailures;
    private final BooleanSupplier cancelled;
    private final BatchListener batchListener;
    private final LineGate lineGate;
    private final int expectedTotal;

    public SyncRunContext(Long taskId,
                          Set<String> completedPathMd5s,
                          Map<String, Long> permanentFailures,
                          BooleanSupplier cancelled,
                          BatchListener batchListener,
                          int expectedTotal) {
        this(taskId, completedPathMd5s, permanentFailures, cancelled, batchListener, LineGate.OPEN, expectedTotal);
    }

    public SyncRunContext(Long taskId,
                          Set<String> completedPathMd5s,
                          Map<String, Long> permanentFailures,
                          BooleanSupplier cancelled,
                          BatchListener batchListener,
                          LineGate lineGate,
                          int expectedTotal) {
        this.taskId = taskId;
        this.completedPathMd5s = completedPathMd5s == null ? Collections.emptySet() : completedPathMd5s;
        this.permanentFailures = permanentFailures == null ? Collections.emptyMap() : permanentFailures;
        this.cancelled = cancelled == null ? () -> false : cancelled;
        this.batchListener = batchListener == null ? BatchListener.NOOP : batchListener;
        this.lineGate = lineGate == null ? LineGate.OPEN : lineGate;
        this.expectedTotal = expectedTotal;
    }

    public Long getTaskId() {
        return taskId;
    }

    /** Path md5s this task, or the task it resumes, already finished. */
    public Set<String> getCompletedPathMd5s() {
        return completedPathMd5s;
    }

    /** Path md5 to file size for references that failed permanently. */
    public Map<String, Long> getPermanentFailures() {
        return permanentFailures;
    }

    public boolean isCancelled() {
        return cancelled.getAsBoolean();
    }

    public BatchListener getBatchListener() {
        return batchListener;
    }

    public LineGate getLineGate() {
        return lineGate;
    }

    public int getExpectedTotal() {
        return expectedTotal;
    }

    /**
     * Hook after every flushed batch. Returning false stops the run, e.g. when the line
     * lock could not be renewed.
     */
    @FunctionalInterface
    public interface BatchListener {

        BatchListener NOOP = batchNo -> true;

        boolean afterBatch(int batchNo);
    }

    /**
     * Asked before every batch with the line all of its references belong to. Returning false
     * skips the batch without checkpointing it.
     */
    @FunctionalInterface
    public interface LineGate {

        LineGate OPEN = lineId -> true;

        boolean enter(int lineId);
    }
}
