package com.example.cruisesync.application.service;

import com.example.cruisesync.common.config.AppSyncProperties;
import com.example.cruisesync.domain.enumtype.CheckpointStatus;
import com.example.cruisesync.domain.enumtype.ReferenceState;
import com.example.cruisesync.domain.enumtype.SyncErrorCode;
import com.example.cruisesync.domain.enumtype.UpsertOutcome;
import com.example.cruisesync.domain.model.NormalizedSailing;
import com.example.cruisesync.domain.model.SailingReference;
import com.example.cruisesync.domain.model.UpsertResult;
import com.example.cruisesync.infrastructure.ftp.CircuitOpenException;
import com.example.cruisesync.infrastructure.ftp.RemoteAuthException;
import com.example.cruisesync.infrastructure.ftp.RemoteFileClient;
import com.example.cruisesync.infrastructure.parser.SailingPayloadNormalizer;
import com.example.cruisesync.infrastructure.persistence.entity.PermanentFailureEntity;
import com.example.cruisesync.infrastructure.persistence.entity.SyncCheckpointEntity;
import com.example.cruisesync.infrastructure.persistence.entity.SyncTaskEntity;
import com.example.cruisesync.infrastructure.persistence.mapper.PermanentFailureMapper;
import com.example.cruisesync.infrastructure.persistence.mapper.SyncCheckpointMapper;
import com.example.cruisesync.infrastructure.persistence.mapper.SyncTaskMapper;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Pulls references in fixed-size batches, runs fetch, normalize and persist for each one on
 * the file worker pool, then flushes the checkpoint and progress once the whole batch is
 * done. A reference is checkpointed only after it reached a terminal state, so a crash
 * mid-batch re-processes exactly the references that never finished.
 */
@Service
public class SailingSyncProcessor {

    private static final Logger log = LoggerFactory.getLogger(SailingSyncProcessor.class);

    private static final int MAX_ERROR_MESSAGE = 500;

    private final RemoteFileClient remoteFileClient;
    private final SailingPayloadNormalizer normalizer;
    private final SailingPersistenceService persistenceService;
    private final SyncCheckpointMapper checkpointMapper;
    private final PermanentFailureMapper permanentFailureMapper;
    private final SyncTaskMapper syncTaskMapper;
    private final ExecutorService fileWorkerExecutor;
    private final AppSyncProperties syncProperties;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    public SailingSyncProcessor(RemoteFileClient remoteFileClient,
                                SailingPayloadNormalizer normalizer,
                                SailingPersistenceService persistenceService,
                                SyncCheckpointMapper checkpointMapper,
                                PermanentFailureMapper permanentFailureMapper,
                                SyncTaskMapper syncTaskMapper,
                                @Qualifier("fileWorkerExecutor") ExecutorService fileWorkerExecutor,
                                AppSyncProperties syncProperties,
                                Clock clock,
                                ObjectProvider<MeterRegistry> meterRegistryProvider) {
        this.remoteFileClient = remoteFileClient;
        this.normalizer = normalizer;
        this.persistenceService = persistenceService;
        this.checkpointMapper = checkpointMapper;
        this.permanentFailureMapper = permanentFailureMapper;
        this.syncTaskMapper = syncTaskMapper;
        this.fileWorkerExecutor = fileWorkerExecutor;
        this.syncProperties = syncProperties;
        this.clock = clock;
        this.meterRegistry = meterRegistryProvider.getIfAvailable();
    }

    public SyncRunResult process(SyncRunContext context, Iterator<SailingReference> references) {
        Long taskId = context.getTaskId();
        int batchSize = Math.max(1, syncProperties.getBatchSize());
        SyncProgressTracker tracker = new SyncProgressTracker(taskId, clock,
                syncProperties.getProgressLogIntervalSec(), context.getExpectedTotal());
        Map<SyncErrorCode, Integer> failuresByCode = new EnumMap<>(SyncErrorCode.class);
        SyncRunResult result = new SyncRunResult();
        YearMonth latestMonth = null;
        BatchSource source = new BatchSource(references);

        while (true) {
            if (context.isCancelled()) {
                result.setCancelled(true);
                log.info("SYNC_RUN_CANCELED taskId={} batches={}", taskId, tracker.getBatches());
                break;
            }
            List<SailingReference> batch;
            try {
                batch = nextBatch(source, batchSize, context, tracker, result);
            } catch (RemoteAuthException | CircuitOpenException e) {
                abort(result, SyncErrorClassifier.classify(e), e.getMessage(), taskId);
                break;
            }
            if (batch.isEmpty()) {
                result.setExhausted(true);
                break;
            }
            int lineId = batch.get(0).getLineId();
            if (!context.getLineGate().enter(lineId)) {
                result.setLineBusySkipped(result.getLineBusySkipped() + batch.size());
                batch.forEach(reference -> tracker.onSkipped());
                log.info("SYNC_LINE_BUSY_SKIPPED taskId={} lineId={} count={}", taskId, lineId, batch.size());
                continue;
            }

            List<ReferenceOutcome> outcomes = runBatch(batch, taskId);
            List<SyncCheckpointEntity> checkpoints = new ArrayList<>(outcomes.size());
            ReferenceOutcome abortOutcome = null;
            for (ReferenceOutcome outcome : outcomes) {
                SailingReference reference = outcome.getReference();
                if (latestMonth == null || reference.yearMonth().isAfter(latestMonth)) {
                    latestMonth = reference.yearMonth();
                }
                if (outcome.isCommitted()) {
                    recordCommitted(outcome, context, tracker, checkpoints, taskId);
                } else if (outcome.abortsRun()) {
                    if (abortOutcome == null) {
                        abortOutcome = outcome;
                    }
                } else {
                    recordFailed(outcome, tracker, checkpoints, failuresByCode, taskId);
                }
            }
            if (!checkpoints.isEmpty()) {
                checkpointMapper.batchUpsert(checkpoints);
            }
            String lastCompletedMonth = abortOutcome == null && latestMonth != null
                    ? latestMonth.minusMonths(1).toString()
                    : null;
            updateProgress(taskId, tracker, lastCompletedMonth);
            tracker.onBatchCompleted(batch.size(), false);

            if (abortOutcome != null) {
                abort(result, abortOutcome.getErrorCode(), abortOutcome.getErrorMessage(), taskId);
                break;
            }
            if (!context.getBatchListener().afterBatch(tracker.getBatches())) {
                abort(result, SyncErrorCode.LOCK_LOST, "batch listener stopped the run", taskId);
                break;
            }
        }

        tracker.logFinal();
        result.setDiscovered(tracker.getDiscovered());
        result.setProcessed(tracker.getProcessed());
        result.setInserted(tracker.getInserted());
        result.setUpdated(tracker.getUpdated());
        result.setFailed(tracker.getFailed());
        result.setSkipped(tracker.getSkipped());
        result.setPriceChanged(tracker.getPriceChanged());
        result.setBatches(tracker.getBatches());
        result.setFailuresByCode(failuresByCode);
        return result;
    }

    /**
     * Runs one reference through its state machine. Never throws; every failure becomes a
     * {@link ReferenceOutcome} carrying the stage it happened in.
     */
    ReferenceOutcome processReference(SailingReference reference, Long taskId) {
        ReferenceState state = ReferenceState.DISCOVERED;
        try {
            state = ReferenceState.FETCHING;
            byte[] raw = remoteFileClient.fetchFile(reference.getRemotePath());
            state = ReferenceState.NORMALIZING;
            NormalizedSailing sailing = normalizer.normalize(raw, reference);
            state = ReferenceState.PERSISTING;
            UpsertResult upsertResult = persistenceService.upsert(sailing, taskId);
            return ReferenceOutcome.committed(reference, upsertResult);
        } catch (RuntimeException e) {
            SyncErrorCode code = SyncErrorClassifier.classify(e);
            if (code == SyncErrorCode.UNKNOWN) {
                log.error("SYNC_FILE_FAILED taskId={} path={} stage={} code={}",
                        taskId, reference.getRemotePath(), state, code, e);
            } else {
                log.warn("SYNC_FILE_FAILED taskId={} path={} stage={} code={} error={}",
                        taskId, reference.getRemotePath(), state, code, e.getMessage());
            }
            return ReferenceOutcome.failed(reference, state, code, truncate(e.getMessage()));
        }
    }

    /** A batch never spans two lines, so one line lock covers all of it. */
    private List<SailingReference> nextBatch(BatchSource references, int batchSize,
                                             SyncRunContext context, SyncProgressTracker tracker,
                                             SyncRunResult result) {
        List<SailingReference> batch = new ArrayList<>(batchSize);
        while (batch.size() < batchSize && references.hasNext()) {
            if (!batch.isEmpty() && references.peek().getLineId() != batch.get(0).getLineId()) {
                break;
            }
            SailingReference reference = references.next();
            tracker.onDiscovered();
            String md5 = reference.pathMd5();
            if (context.getCompletedPathMd5s().contains(md5)) {
                tracker.onSkipped();
                continue;
            }
            Long failedSize = context.getPermanentFailures().get(md5);
            if (failedSize != null && failedSize == reference.getSize()) {
                log.debug("SYNC_SKIP_PERMANENT_FAILURE path={}", reference.getRemotePath());
                result.getRetainedSailingIds().add(reference.getSailingId());
                tracker.onSkipped();
                continue;
            }
            batch.add(reference);
        }
        return batch;
    }

    private List<ReferenceOutcome> runBatch(List<SailingReference> batch, Long taskId) {
        List<Future<ReferenceOutcome>> futures = new ArrayList<>(batch.size());
        for (SailingReference reference : batch) {
            futures.add(fileWorkerExecutor.submit(() -> processReference(reference, taskId)));
        }
        List<ReferenceOutcome> outcomes = new ArrayList<>(batch.size());
        for (int i = 0; i < futures.size(); i++) {
            try {
                outcomes.add(futures.get(i).get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.forEach(future -> future.cancel(true));
                throw new IllegalStateException("Interrupted while waiting for batch of task " + taskId, e);
            } catch (ExecutionException e) {
                SailingReference reference = batch.get(i);
                log.error("SYNC_FILE_WORKER_ERROR taskId={} path={}", taskId, reference.getRemotePath(), e.getCause());
                outcomes.add(ReferenceOutcome.failed(reference, ReferenceState.DISCOVERED, SyncErrorCode.UNKNOWN,
                        truncate(String.valueOf(e.getCause()))));
            }
        }
        return outcomes;
    }

    private void recordCommitted(ReferenceOutcome outcome, SyncRunContext context, SyncProgressTracker tracker,
                                 List<SyncCheckpointEntity> checkpoints, Long taskId) {
        SailingReference reference = outcome.getReference();
        UpsertResult upsertResult = outcome.getUpsertResult();
        if (upsertResult.getOutcome() == UpsertOutcome.INSERTED) {
            tracker.onInserted(reference.getRemotePath(), false);
        } else {
            tracker.onUpdated(reference.getRemotePath(), upsertResult.pricesChanged());
        }
        checkpoints.add(checkpoint(taskId, reference, CheckpointStatus.COMMITTED, null, null));
        String md5 = reference.pathMd5();
        if (context.getPermanentFailures().containsKey(md5)) {
            permanentFailureMapper.deleteByPathMd5(md5);
        }
        recordCounter("cruise.sync.file", "outcome", upsertResult.getOutcome().name().toLowerCase(Locale.ROOT));
    }

    private void recordFailed(ReferenceOutcome outcome, SyncProgressTracker tracker,
                              List<SyncCheckpointEntity> checkpoints, Map<SyncErrorCode, Integer> failuresByCode,
                              Long taskId) {
        SailingReference reference = outcome.getReference();
        SyncErrorCode code = outcome.getErrorCode();
        tracker.onFailed(reference.getRemotePath());
        failuresByCode.merge(code, 1, Integer::sum);
        CheckpointStatus status = code.isPermanent() ? CheckpointStatus.PERMANENT_FAILED : CheckpointStatus.FAILED;
        checkpoints.add(checkpoint(taskId, reference, status, code, outcome.getErrorMessage()));
        if (code.isPermanent()) {
            PermanentFailureEntity failure = new PermanentFailureEntity();
            failure.setPathMd5(reference.pathMd5());
            failure.setRemotePath(reference.getRemotePath());
            failure.setFileSize(reference.getSize());
            failure.setErrorCode(code.name());
            failure.setErrorMessage(outcome.getErrorMessage());
            failure.setFailedAt(LocalDateTime.now(clock));
            permanentFailureMapper.upsert(failure);
        }
        recordCounter("cruise.sync.file", "outcome", "failed", "code", code.name());
    }

    private SyncCheckpointEntity checkpoint(Long taskId, SailingReference reference, CheckpointStatus status,
                                            SyncErrorCode code, String message) {
        SyncCheckpointEntity entity = new SyncCheckpointEntity();
        entity.setTaskId(taskId);
        entity.setPathMd5(reference.pathMd5());
        entity.setRemotePath(reference.getRemotePath());
        entity.setLineId(reference.getLineId());
        entity.setStatus(status.name());
        entity.setErrorCode(code == null ? null : code.name());
        entity.setErrorMessage(message);
        return entity;
    }

    private void updateProgress(Long taskId, SyncProgressTracker tracker, String lastCompletedMonth) {
        SyncTaskEntity progress = new SyncTaskEntity();
        progress.setId(taskId);
        progress.setDiscoveredCount(tracker.getDiscovered());
        progress.setProcessedCount(tracker.getProcessed());
        progress.setInsertedCount(tracker.getInserted());
        progress.setUpdatedCount(tracker.getUpdated());
        progress.setFailedCount(tracker.getFailed());
        progress.setSkippedCount(tracker.getSkipped());
        progress.setPriceChangedCount(tracker.getPriceChanged());
        progress.setLastSyncedPath(tracker.getLastSyncedPath());
        progress.setLastCompletedMonth(lastCompletedMonth);
        syncTaskMapper.updateProgress(progress);
    }

    private void abort(SyncRunResult result, SyncErrorCode code, String message, Long taskId) {
        result.setAbortCode(code);
        result.setAbortMessage(truncate(message));
        log.warn("SYNC_RUN_ABORTED taskId={} code={} error={}", taskId, code, message);
    }

    private String truncate(String value) {
        if (value == null || value.length() <= MAX_ERROR_MESSAGE) {
            return value;
        }
        return value.substring(0, MAX_ERROR_MESSAGE);
    }

    private void recordCounter(String name, String... tags) {
        if (meterRegistry == null) {
            return;
        }
        try {
            meterRegistry.counter(name, tags).increment();
        } catch (Exception ex) {
            log.debug("Sync metric counter failed, name={}", name, ex);
        }
    }

    private static final class BatchSource {

        private final Iterator<SailingReference> delegate;
        private SailingReference lookahead;

        private BatchSource(Iterator<SailingReference> delegate) {
            this.delegate = delegate;
        }

        boolean hasNext() {
            return lookahead != null || delegate.hasNext();
        }

        SailingReference peek() {
            if (lookahead == null) {
                lookahead = delegate.next();
            }
            return lookahead;
        }

        SailingReference next() {
            SailingReference reference = peek();
            lookahead = null;
            return reference;
        }
    }
}
