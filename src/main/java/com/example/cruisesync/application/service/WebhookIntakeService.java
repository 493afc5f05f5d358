package com.example.cruisesync.application.service;

import com.example.cruisesync.api.request.TraveltekWebhookRequest;
import com.example.cruisesync.common.config.AppSyncProperties;
import com.example.cruisesync.common.config.AppWebhookProperties;
import com.example.cruisesync.infrastructure.lock.CruiseLineLockStore;
import com.example.cruisesync.infrastructure.persistence.entity.WebhookEventEntity;
import com.example.cruisesync.infrastructure.persistence.mapper.CruiseMapper;
import com.example.cruisesync.infrastructure.persistence.mapper.WebhookEventMapper;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Turns "line pricing changed" notifications into at most one running resync per line.
 * The line is flagged for a price refresh right away; events arriving while a run holds
 * the line lock set a pending flag. A webhook holder loops until the flag stays clear;
 * flags left by a crawl holder are picked up when the crawl releases the line.
 */
@Service
public class WebhookIntakeService {

    private static final Logger log = LoggerFactory.getLogger(WebhookIntakeService.class);

    private final AppWebhookProperties webhookProperties;
    private final AppSyncProperties syncProperties;
    private final CruiseMapper cruiseMapper;
    private final WebhookEventMapper webhookEventMapper;
    private final CruiseLineLockStore lockStore;
    private final SyncTaskService syncTaskService;
    private final ExecutorService syncTaskExecutor;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    private final Set<Integer> pendingLines = ConcurrentHashMap.newKeySet();
    private final String instanceId = UUID.randomUUID().toString().substring(0, 8);

    public WebhookIntakeService(AppWebhookProperties webhookProperties,
                                AppSyncProperties syncProperties,
                                CruiseMapper cruiseMapper,
                                WebhookEventMapper webhookEventMapper,
                                CruiseLineLockStore lockStore,
                                SyncTaskService syncTaskService,
                                @Qualifier("syncTaskExecutor") ExecutorService syncTaskExecutor,
                                Clock clock,
                                ObjectProvider<MeterRegistry> meterRegistryProvider) {
        this.webhookProperties = webhookProperties;
        this.syncProperties = syncProperties;
        this.cruiseMapper = cruiseMapper;
        this.webhookEventMapper = webhookEventMapper;
        this.lockStore = lockStore;
        this.syncTaskService = syncTaskService;
        this.syncTaskExecutor = syncTaskExecutor;
        this.clock = clock;
        this.meterRegistry = meterRegistryProvider.getIfAvailable();
    }

    public WebhookOutcome onWebhook(TraveltekWebhookRequest request) {
        if (request == null || !webhookProperties.accepts(request.getEventType())) {
            String eventType = request == null ? null : request.getEventType();
            log.info("WEBHOOK_REJECTED eventType={} reason=unsupported_event", eventType);
            recordCounter("rejected");
            return WebhookOutcome.rejected("unsupported event type");
        }
        Integer lineId = request.getLineId();
        if (lineId == null || lineId <= 0) {
            log.info("WEBHOOK_REJECTED eventType={} reason=missing_line_id", request.getEventType());
            recordCounter("rejected");
            return WebhookOutcome.rejected("missing line id");
        }
        String webhookId = trimToNull(request.getWebhookId());
        boolean recorded = false;
        try {
            if (webhookId != null) {
                if (!recordEvent(webhookId, request, lineId)) {
                    log.info("WEBHOOK_DUPLICATE webhookId={} lineId={}", webhookId, lineId);
                    recordCounter("duplicate");
                    return WebhookOutcome.accepted(WebhookOutcome.REASON_DUPLICATE, 0);
                }
                recorded = true;
            }
            int marked = cruiseMapper.markNeedsPriceUpdateByLine(lineId, YearMonth.now(clock).atDay(1));
            WebhookOutcome outcome = dispatch(lineId);
            if (recorded) {
                saveOutcome(webhookId, outcome, marked);
            }
            log.info("WEBHOOK_ACCEPTED webhookId={} eventType={} lineId={} marked={} accepted={} reason={}",
                    webhookId, request.getEventType(), lineId, marked, outcome.isAccepted(), outcome.getReason());
            recordCounter(outcome.getReason());
            return new WebhookOutcome(outcome.isAccepted(), outcome.getReason(), marked);
        } catch (RuntimeException e) {
            log.error("WEBHOOK_INTAKE_FAILED webhookId={} lineId={} msg={}", webhookId, lineId, e.getMessage(), e);
            if (recorded) {
                forgetEvent(webhookId);
            }
            recordCounter("failed");
            return WebhookOutcome.rejected(WebhookOutcome.REASON_INTAKE_FAILED);
        }
    }

    /**
     * A crawl that held the line may have merged events; start their run now that it is free.
     */
    @EventListener
    public void onLineLockReleased(LineLockReleasedEvent event) {
        int lineId = event.getLineId();
        if (!pendingLines.contains(lineId)) {
            return;
        }
        try {
            WebhookOutcome outcome = dispatch(lineId);
            log.info("WEBHOOK_PENDING_DISPATCHED lineId={} releasedBy={} reason={}",
                    lineId, event.getHolderId(), outcome.getReason());
        } catch (RuntimeException e) {
            log.error("WEBHOOK_PENDING_DISPATCH_FAILED lineId={} releasedBy={}", lineId, event.getHolderId(), e);
        }
    }

    public boolean hasPendingEvent(int lineId) {
        return pendingLines.contains(lineId);
    }

    private WebhookOutcome dispatch(int lineId) {
        pendingLines.add(lineId);
        String holderId = "webhook-" + instanceId + "-" + UUID.randomUUID().toString().substring(0, 8);
        if (!lockStore.tryAcquire(lineId, holderId, lockTtl()).isPresent()) {
            log.info("WEBHOOK_MERGED lineId={}", lineId);
            return WebhookOutcome.accepted(WebhookOutcome.REASON_MERGED, 0);
        }
        try {
            syncTaskExecutor.submit(() -> drain(lineId, holderId));
        } catch (RejectedExecutionException e) {
            lockStore.release(lineId, holderId);
            log.warn("WEBHOOK_EXECUTOR_REJECTED lineId={} msg={}", lineId, e.getMessage());
            return WebhookOutcome.rejected("executor busy, line flagged for next crawl");
        }
        return WebhookOutcome.accepted(WebhookOutcome.REASON_STARTED, 0);
    }

    /**
     * Runs resyncs for the line while events keep arriving. The flag is re-checked after the
     * lock is released because an event can lose the race against the release.
     */
    void drain(int lineId, String holderId) {
        boolean again;
        do {
            try {
                do {
                    pendingLines.remove(lineId);
                    SyncRunResult result = syncTaskService.runWebhookSync(lineId, holderId);
                    if (result != null && result.getAbortCode() != null) {
                        log.warn("WEBHOOK_SYNC_ABORTED lineId={} code={}", lineId, result.getAbortCode());
                        break;
                    }
                } while (pendingLines.contains(lineId));
            } catch (RuntimeException e) {
                log.error("Webhook line sync failed, lineId={}", lineId, e);
            } finally {
                lockStore.release(lineId, holderId);
            }
            again = pendingLines.contains(lineId) && lockStore.tryAcquire(lineId, holderId, lockTtl()).isPresent();
        } while (again);
        log.info("WEBHOOK_LINE_IDLE lineId={}", lineId);
    }

    private boolean recordEvent(String webhookId, TraveltekWebhookRequest request, int lineId) {
        WebhookEventEntity entity = new WebhookEventEntity();
        entity.setWebhookId(webhookId);
        entity.setEventType(request.getEventType());
        entity.setLineId(lineId);
        entity.setEventTimestamp(request.getTimestamp());
        entity.setStatus("RECEIVED");
        entity.setReceivedAt(LocalDateTime.now(clock));
        return webhookEventMapper.insertIgnore(entity) > 0;
    }

    /** Once the line is flagged and dispatched, a failed status update must not fail the event. */
    private void saveOutcome(String webhookId, WebhookOutcome outcome, int marked) {
        try {
            webhookEventMapper.updateOutcome(webhookId, outcome.isAccepted() ? "ACCEPTED" : "REJECTED",
                    outcome.getReason(), marked);
        } catch (RuntimeException e) {
            log.warn("WEBHOOK_OUTCOME_NOT_SAVED webhookId={} reason={} msg={}",
                    webhookId, outcome.getReason(), e.getMessage());
        }
    }

    /** Drops the dedup row so a vendor retry of the same event is processed again. */
    private void forgetEvent(String webhookId) {
        try {
            webhookEventMapper.deleteReceived(webhookId);
        } catch (RuntimeException e) {
            log.error("WEBHOOK_EVENT_NOT_FORGOTTEN webhookId={} msg={}", webhookId, e.getMessage(), e);
        }
    }

    private Duration lockTtl() {
        return Duration.ofMillis(syncProperties.getLockTtlMs());
    }

    private static String trimToNull(String value) {
        if (value == null || value.trim().isEmpty()) {
            return null;
        }
        return value.trim();
    }

    private void recordCounter(String result) {
        if (meterRegistry == null) {
            return;
        }
        try {
            meterRegistry.counter("cruise.webhook.events", "result", result).increment();
        } catch (Exception ex) {
            log.debug("Webhook metric counter failed, result={}", result, ex);
        }
    }
}
