package com.example.cruisesync.application.service;

import com.example.cruisesync.api.request.CreateSyncTaskRequest;
import com.example.cruisesync.api.response.CreateSyncTaskResponse;
import com.example.cruisesync.api.response.SyncTaskDetailResponse;
import com.example.cruisesync.common.config.AppSyncProperties;
import com.example.cruisesync.common.exception.BusinessException;
import com.example.cruisesync.domain.enumtype.TaskStatus;
import com.example.cruisesync.domain.enumtype.TaskType;
import com.example.cruisesync.infrastructure.catalog.CatalogWalk;
import com.example.cruisesync.infrastructure.catalog.SailingCatalogWalker;
import com.example.cruisesync.infrastructure.lock.CruiseLineLockStore;
import com.example.cruisesync.infrastructure.persistence.entity.PermanentFailureEntity;
import com.example.cruisesync.infrastructure.persistence.entity.SyncTaskEntity;
import com.example.cruisesync.infrastructure.persistence.mapper.CruiseMapper;
import com.example.cruisesync.infrastructure.persistence.mapper.PermanentFailureMapper;
import com.example.cruisesync.infrastructure.persistence.mapper.SyncCheckpointMapper;
import com.example.cruisesync.infrastructure.persistence.mapper.SyncTaskMapper;
import java.time.Clock;
import java.time.Duration;
import java.time.YearMonth;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

@Service
public class SyncTaskService {

    private static final Logger log = LoggerFactory.getLogger(SyncTaskService.class);

    private static final int CLAIM_CHUNK_SIZE = 500;

    private final SyncTaskMapper syncTaskMapper;
    private final SyncCheckpointMapper syncCheckpointMapper;
    private final PermanentFailureMapper permanentFailureMapper;
    private final CruiseMapper cruiseMapper;
    private final SailingCatalogWalker catalogWalker;
    private final SailingSyncProcessor syncProcessor;
    private final CruiseLineLockStore lockStore;
    private final AppSyncProperties syncProperties;
    private final ExecutorService syncTaskExecutor;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public SyncTaskService(SyncTaskMapper syncTaskMapper,
                           SyncCheckpointMapper syncCheckpointMapper,
                           PermanentFailureMapper permanentFailureMapper,
                           CruiseMapper cruiseMapper,
                           SailingCatalogWalker catalogWalker,
                           SailingSyncProcessor syncProcessor,
                           CruiseLineLockStore lockStore,
                           AppSyncProperties syncProperties,
                           @Qualifier("syncTaskExecutor") ExecutorService syncTaskExecutor,
                           ApplicationEventPublisher eventPublisher,
                           Clock clock) {
        this.syncTaskMapper = syncTaskMapper;
        this.syncCheckpointMapper = syncCheckpointMapper;
        this.permanentFailureMapper = permanentFailureMapper;
        this.cruiseMapper = cruiseMapper;
        this.catalogWalker = catalogWalker;
        this.syncProcessor = syncProcessor;
        this.lockStore = lockStore;
        this.syncProperties = syncProperties;
        this.syncTaskExecutor = syncTaskExecutor;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    public CreateSyncTaskResponse createCrawlTask(CreateSyncTaskRequest request) {
        TaskType taskType = request.getTaskType();
        if (taskType == TaskType.WEBHOOK_LINE_SYNC) {
            throw BusinessException.badRequest("WEBHOOK_LINE_SYNC tasks are started by webhooks only");
        }
        if (taskType == TaskType.LINE_CRAWL && request.getLineId() == null) {
            throw BusinessException.badRequest("lineId is required for LINE_CRAWL");
        }
        Integer lineId = taskType == TaskType.LINE_CRAWL ? request.getLineId() : null;
        YearMonth current = YearMonth.now(clock);
        YearMonth start = parseMonth(request.getStartMonth(), syncProperties.resolveCrawlStart(current));
        YearMonth end = parseMonth(request.getEndMonth(), current.plusMonths(syncProperties.getCrawlMonthsAhead()));
        if (start.isAfter(end)) {
            throw BusinessException.badRequest("startMonth must not be after endMonth");
        }
        if (taskType == TaskType.FULL_CRAWL && isFullCrawlActive()) {
            throw BusinessException.conflict("A full crawl is already active");
        }
        if (lineId != null && lockStore.current(lineId).isPresent()) {
            throw BusinessException.conflict("Line " + lineId + " is being synchronized");
        }

        Long resumeFrom = request.getResumeFromTaskId();
        if (resumeFrom != null) {
            SyncTaskEntity previous = syncTaskMapper.selectById(resumeFrom);
            if (previous == null) {
                throw BusinessException.notFound("Task to resume does not exist");
            }
            if (TaskStatus.valueOf(previous.getStatus()).isActive()) {
                throw BusinessException.conflict("Task to resume is still active");
            }
        }

        SyncTaskEntity entity = newTask(taskType, lineId, start, end, resumeFrom);
        syncTaskMapper.insert(entity);
        log.info("SYNC_TASK_CREATED taskId={} type={} lineId={} range={}..{} resumeFrom={}",
                entity.getId(), taskType, lineId, start, end, resumeFrom);
        if (resumeFrom != null) {
            adoptCheckpoint(resumeFrom, entity.getId());
        }
        RunPlan plan = new RunPlan(taskType, lineId, start, end, resumeFrom != null, Integer.MAX_VALUE,
                "task-" + entity.getId());
        submit(entity.getId(), plan);
        return new CreateSyncTaskResponse(entity.getId(), TaskStatus.PENDING.name());
    }

    /**
     * Runs a scoped resync of one line on the calling thread. The caller already holds the
     * line lock as {@code holderId}; each flushed batch renews it, and a failed renewal stops
     * the run.
     */
    public SyncRunResult runWebhookSync(int lineId, String holderId) {
        YearMonth start = YearMonth.now(clock);
        YearMonth end = start.plusMonths(syncProperties.getWebhookMonthsAhead());
        SyncTaskEntity entity = newTask(TaskType.WEBHOOK_LINE_SYNC, lineId, start, end, null);
        syncTaskMapper.insert(entity);
        log.info("SYNC_TASK_CREATED taskId={} type={} lineId={} range={}..{} holder={}",
                entity.getId(), TaskType.WEBHOOK_LINE_SYNC, lineId, start, end, holderId);
        RunPlan plan = new RunPlan(TaskType.WEBHOOK_LINE_SYNC, lineId, start, end, false,
                syncProperties.getMaxFilesPerWebhookJob(), holderId);
        return executeTask(entity.getId(), plan, true);
    }

    public SyncTaskDetailResponse getTask(Long taskId) {
        SyncTaskEntity entity = syncTaskMapper.selectById(taskId);
        if (entity == null) {
            return null;
        }
        return toDetailResponse(entity);
    }

    public boolean cancelTask(Long taskId) {
        SyncTaskEntity entity = syncTaskMapper.selectById(taskId);
        if (entity == null) {
            return false;
        }
        int affected = syncTaskMapper.cancel(taskId);
        if (affected > 0) {
            log.info("SYNC_TASK_CANCELED taskId={} fromStatus={}", taskId, entity.getStatus());
        } else {
            log.info("SYNC_TASK_CANCEL_IGNORED taskId={} currentStatus={}", taskId, entity.getStatus());
        }
        return true;
    }

    public boolean isFullCrawlActive() {
        return syncTaskMapper.countActiveByType(TaskType.FULL_CRAWL.name()) > 0;
    }

    /**
     * Tasks still PENDING or RUNNING at startup belonged to a process that died. They are
     * marked INTERRUPTED; crawls get a successor task that adopts their checkpoint.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void resumeInterruptedTasks() {
        List<SyncTaskEntity> stale = new ArrayList<>(syncTaskMapper.selectByStatus(TaskStatus.RUNNING.name()));
        stale.addAll(syncTaskMapper.selectByStatus(TaskStatus.PENDING.name()));
        if (stale.isEmpty()) {
            return;
        }
        for (SyncTaskEntity task : stale) {
            if (syncTaskMapper.markInterrupted(task.getId()) == 0) {
                continue;
            }
            log.warn("SYNC_TASK_INTERRUPTED taskId={} type={} lastSyncedPath={} lastCompletedMonth={}",
                    task.getId(), task.getTaskType(), task.getLastSyncedPath(), task.getLastCompletedMonth());
            TaskType type = TaskType.valueOf(task.getTaskType());
            if (!syncProperties.isResumeInterruptedOnStartup() || type == TaskType.WEBHOOK_LINE_SYNC) {
                continue;
            }
            CreateSyncTaskRequest request = new CreateSyncTaskRequest();
            request.setTaskType(type);
            request.setLineId(task.getLineId());
            request.setStartMonth(resumeStartMonth(task));
            request.setEndMonth(task.getRangeEnd());
            request.setResumeFromTaskId(task.getId());
            try {
                CreateSyncTaskResponse resumed = createCrawlTask(request);
                log.info("SYNC_TASK_RESUMED fromTaskId={} taskId={}", task.getId(), resumed.getTaskId());
            } catch (BusinessException e) {
                log.warn("SYNC_TASK_RESUME_SKIPPED fromTaskId={} code={} msg={}", task.getId(), e.getCode(), e.getMessage());
            }
        }
    }

    private void submit(Long taskId, RunPlan plan) {
        try {
            syncTaskExecutor.submit(() -> executeTask(taskId, plan, false));
        } catch (RejectedExecutionException e) {
            syncTaskMapper.markFailedBeforeRunning(taskId, "task scheduling failed: " + truncate(e.getMessage(), 400));
            throw new BusinessException("TASK_EXECUTOR_REJECTED", "Task executor is busy, retry later");
        }
    }

    SyncRunResult executeTask(Long taskId, RunPlan plan, boolean lockHeldByCaller) {
        if (syncTaskMapper.markRunning(taskId) == 0) {
            log.info("SYNC_TASK_START_SKIPPED taskId={} currentStatus={}", taskId, syncTaskMapper.selectStatusById(taskId));
            return null;
        }
        log.info("SYNC_TASK_RUNNING taskId={} type={} lineId={}", taskId, plan.taskType, plan.lineId);
        Duration lockTtl = Duration.ofMillis(syncProperties.getLockTtlMs());
        boolean lockAcquiredHere = false;
        CrawlLineLocks crawlLocks = null;
        try {
            if (plan.lineId != null && !lockHeldByCaller) {
                if (!lockStore.tryAcquire(plan.lineId, plan.holderId, lockTtl).isPresent()) {
                    syncTaskMapper.markFinished(taskId, TaskStatus.FAILED.name(), 0, "line lock is held by another run");
                    log.warn("SYNC_TASK_LOCK_BUSY taskId={} lineId={}", taskId, plan.lineId);
                    return null;
                }
                lockAcquiredHere = true;
            }
            Set<String> completed = syncCheckpointMapper.selectDonePathMd5s(taskId);
            SyncRunContext.BatchListener listener = SyncRunContext.BatchListener.NOOP;
            SyncRunContext.LineGate lineGate = SyncRunContext.LineGate.OPEN;
            if (plan.lineId == null) {
                crawlLocks = new CrawlLineLocks(lockStore, eventPublisher, plan.holderId, lockTtl);
                lineGate = crawlLocks;
            } else {
                listener = batchNo -> renewLock(taskId, plan, lockTtl);
            }
            CatalogWalk walk = catalogWalker.walk(plan.start, plan.end, plan.lineId, plan.maxReferences);
            SyncRunContext context = new SyncRunContext(taskId, completed, loadPermanentFailures(),
                    () -> isCanceled(taskId), listener, lineGate, 0);

            SyncRunResult result = syncProcessor.process(context, walk);
            if (crawlLocks != null) {
                crawlLocks.releaseHeld();
            }

            int deactivated = 0;
            if (canDeactivate(plan, result, walk)) {
                claimRetained(taskId, result.getRetainedSailingIds());
                deactivated = cruiseMapper.deactivateUnlisted(taskId, plan.lineId,
                        plan.start.atDay(1), plan.end.plusMonths(1).atDay(1));
                log.info("SYNC_DEACTIVATED taskId={} lineId={} count={}", taskId, plan.lineId, deactivated);
            }
            finish(taskId, result, deactivated, walk);
            return result;
        } catch (Exception e) {
            log.error("Sync task failed, taskId={}", taskId, e);
            if (!isCanceled(taskId)) {
                syncTaskMapper.markFinished(taskId, TaskStatus.FAILED.name(), 0, truncate(String.valueOf(e.getMessage()), 1000));
            }
            return null;
        } finally {
            if (crawlLocks != null) {
                crawlLocks.releaseHeld();
            }
            if (lockAcquiredHere) {
                lockStore.release(plan.lineId, plan.holderId);
                eventPublisher.publishEvent(new LineLockReleasedEvent(plan.lineId, plan.holderId));
            }
        }
    }

    private void finish(Long taskId, SyncRunResult result, int deactivated, CatalogWalk walk) {
        TaskStatus finalStatus = result.finalStatus();
        String summary = result.errorSummary();
        if (walk.getListingFailures() > 0) {
            String listing = "listing failures " + walk.getListingFailures();
            summary = summary == null ? listing : summary + "; " + listing;
        }
        if (finalStatus == TaskStatus.CANCELED) {
            log.info("SYNC_TASK_RESULT taskId={} status={} processed={}", taskId, finalStatus, result.getProcessed());
            return;
        }
        int rows = syncTaskMapper.markFinished(taskId, finalStatus.name(), deactivated, truncate(summary, 1000));
        if (rows == 0) {
            log.warn("SYNC_TASK_FINISH_REJECTED taskId={} expectStatus=RUNNING currentStatus={}",
                    taskId, syncTaskMapper.selectStatusById(taskId));
            return;
        }
        log.info("SYNC_TASK_RESULT taskId={} status={} discovered={} processed={} inserted={} updated={} failed={} "
                        + "skipped={} priceChanged={} deactivated={} truncated={}",
                taskId, finalStatus, result.getDiscovered(), result.getProcessed(), result.getInserted(),
                result.getUpdated(), result.getFailed(), result.getSkipped(), result.getPriceChanged(),
                deactivated, walk.isTruncated());
        if (finalStatus == TaskStatus.SUCCESS) {
            syncCheckpointMapper.deleteByTaskId(taskId);
        }
    }

    /**
     * Only a complete, uninterrupted walk of the whole range proves a sailing is gone. A file
     * that failed was still listed, so any failure keeps its sailing active.
     */
    private boolean canDeactivate(RunPlan plan, SyncRunResult result, CatalogWalk walk) {
        if (plan.taskType == TaskType.WEBHOOK_LINE_SYNC || plan.resumed) {
            return false;
        }
        return result.isExhausted()
                && !result.isCancelled()
                && result.getAbortCode() == null
                && result.getFailed() == 0
                && result.getLineBusySkipped() == 0
                && !walk.isTruncated()
                && walk.getListingFailures() == 0;
    }

    private void claimRetained(Long taskId, List<String> sailingIds) {
        for (int from = 0; from < sailingIds.size(); from += CLAIM_CHUNK_SIZE) {
            List<String> chunk = sailingIds.subList(from, Math.min(sailingIds.size(), from + CLAIM_CHUNK_SIZE));
            cruiseMapper.claimForTask(taskId, new ArrayList<>(chunk));
        }
    }

    private boolean renewLock(Long taskId, RunPlan plan, Duration ttl) {
        if (lockStore.renew(plan.lineId, plan.holderId, ttl)) {
            return true;
        }
        log.warn("SYNC_TASK_LOCK_LOST taskId={} lineId={} holder={}", taskId, plan.lineId, plan.holderId);
        return false;
    }

    private void adoptCheckpoint(Long fromTaskId, Long toTaskId) {
        int moved = syncCheckpointMapper.reassignTask(fromTaskId, toTaskId);
        log.info("SYNC_TASK_RESUME fromTaskId={} taskId={} checkpointRefs={}", fromTaskId, toTaskId, moved);
    }

    private Map<String, Long> loadPermanentFailures() {
        Map<String, Long> failures = new HashMap<>();
        for (PermanentFailureEntity failure : permanentFailureMapper.selectAll()) {
            failures.put(failure.getPathMd5(), failure.getFileSize());
        }
        return failures;
    }

    private boolean isCanceled(Long taskId) {
        return TaskStatus.CANCELED.name().equals(syncTaskMapper.selectStatusById(taskId));
    }

    private String resumeStartMonth(SyncTaskEntity task) {
        if (task.getLastCompletedMonth() == null) {
            return task.getRangeStart();
        }
        YearMonth next = YearMonth.parse(task.getLastCompletedMonth()).plusMonths(1);
        YearMonth start = YearMonth.parse(task.getRangeStart());
        return (next.isAfter(start) ? next : start).toString();
    }

    private SyncTaskEntity newTask(TaskType taskType, Integer lineId, YearMonth start, YearMonth end, Long resumeFrom) {
        SyncTaskEntity entity = new SyncTaskEntity();
        entity.setTaskType(taskType.name());
        entity.setStatus(TaskStatus.PENDING.name());
        entity.setLineId(lineId);
        entity.setRangeStart(start.toString());
        entity.setRangeEnd(end.toString());
        entity.setResumeFromTaskId(resumeFrom);
        return entity;
    }

    private static YearMonth parseMonth(String value, YearMonth fallback) {
        if (value == null || value.trim().isEmpty()) {
            return fallback;
        }
        try {
            return YearMonth.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw BusinessException.badRequest("Invalid month: " + value);
        }
    }

    private String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength);
    }

    private SyncTaskDetailResponse toDetailResponse(SyncTaskEntity entity) {
        return new SyncTaskDetailResponse(
                entity.getId(),
                entity.getTaskType(),
                entity.getStatus(),
                entity.getLineId(),
                entity.getRangeStart(),
                entity.getRangeEnd(),
                entity.getResumeFromTaskId(),
                entity.getStartTime(),
                entity.getEndTime(),
                nullSafeInt(entity.getDiscoveredCount()),
                nullSafeInt(entity.getProcessedCount()),
                nullSafeInt(entity.getInsertedCount()),
                nullSafeInt(entity.getUpdatedCount()),
                nullSafeInt(entity.getFailedCount()),
                nullSafeInt(entity.getSkippedCount()),
                nullSafeInt(entity.getPriceChangedCount()),
                nullSafeInt(entity.getDeactivatedCount()),
                entity.getLastSyncedPath(),
                entity.getLastCompletedMonth(),
                entity.getErrorSummary()
        );
    }

    private int nullSafeInt(Integer value) {
        return value == null ? 0 : value;
    }

    static final class RunPlan {

        final TaskType taskType;
        final Integer lineId;
        final YearMonth start;
        final YearMonth end;
        final boolean resumed;
        final int maxReferences;
        /** Lock holder: of the one line for line-scoped runs, of the line being crawled for full crawls. */
        final String holderId;

        RunPlan(TaskType taskType, Integer lineId, YearMonth start, YearMonth end, boolean resumed,
                int maxReferences, String holderId) {
            this.taskType = taskType;
            this.lineId = lineId;
            this.start = start;
            this.end = end;
            this.resumed = resumed;
            this.maxReferences = maxReferences;
            this.holderId = holderId;
        }
    }
}
