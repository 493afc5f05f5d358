package com.example.cruisesync.application.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.cruisesync.common.config.AppSyncProperties;
import com.example.cruisesync.domain.enumtype.CheckpointStatus;
import com.example.cruisesync.domain.enumtype.ReferenceState;
import com.example.cruisesync.domain.enumtype.SyncErrorCode;
import com.example.cruisesync.domain.enumtype.TaskStatus;
import com.example.cruisesync.domain.model.CabinPrices;
import com.example.cruisesync.domain.model.NormalizedSailing;
import com.example.cruisesync.domain.model.PriceDelta;
import com.example.cruisesync.domain.model.SailingReference;
import com.example.cruisesync.domain.model.UpsertResult;
import com.example.cruisesync.infrastructure.ftp.CircuitOpenException;
import com.example.cruisesync.infrastructure.ftp.RemoteAuthException;
import com.example.cruisesync.infrastructure.ftp.RemoteConnectionException;
import com.example.cruisesync.infrastructure.ftp.RemoteFileClient;
import com.example.cruisesync.infrastructure.parser.CorruptPayloadException;
import com.example.cruisesync.infrastructure.parser.SailingPayloadNormalizer;
import com.example.cruisesync.infrastructure.persistence.entity.PermanentFailureEntity;
import com.example.cruisesync.infrastructure.persistence.entity.SyncCheckpointEntity;
import com.example.cruisesync.infrastructure.persistence.entity.SyncTaskEntity;
import com.example.cruisesync.infrastructure.persistence.mapper.PermanentFailureMapper;
import com.example.cruisesync.infrastructure.persistence.mapper.SyncCheckpointMapper;
import com.example.cruisesync.infrastructure.persistence.mapper.SyncTaskMapper;
import com.example.cruisesync.support.MeterRegistryProviders;
import com.example.cruisesync.support.MutableClock;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;

class SailingSyncProcessorTest {

    private static final String ROOT = "/cruisedata";

    private RemoteFileClient remoteFileClient;
    private SailingPayloadNormalizer normalizer;
    private SailingPersistenceService persistenceService;
    private SyncCheckpointMapper checkpointMapper;
    private PermanentFailureMapper permanentFailureMapper;
    private SyncTaskMapper syncTaskMapper;
    private ExecutorService workers;
    private AppSyncProperties properties;
    private SimpleMeterRegistry meterRegistry;
    private SailingSyncProcessor processor;

    private final List<SyncCheckpointEntity> checkpoints = new CopyOnWriteArrayList<>();
    private final List<SyncTaskEntity> progress = new CopyOnWriteArrayList<>();
    private final List<Integer> flushSizes = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        remoteFileClient = mock(RemoteFileClient.class);
        normalizer = mock(SailingPayloadNormalizer.class);
        persistenceService = mock(SailingPersistenceService.class);
        checkpointMapper = mock(SyncCheckpointMapper.class);
        permanentFailureMapper = mock(PermanentFailureMapper.class);
        syncTaskMapper = mock(SyncTaskMapper.class);
        workers = Executors.newFixedThreadPool(2);
        properties = new AppSyncProperties();
        properties.setBatchSize(2);
        meterRegistry = new SimpleMeterRegistry();
        ObjectProvider<MeterRegistry> provider = MeterRegistryProviders.of(meterRegistry);

        when(checkpointMapper.batchUpsert(anyList())).thenAnswer(invocation -> {
            List<SyncCheckpointEntity> items = invocation.getArgument(0);
            flushSizes.add(items.size());
            checkpoints.addAll(items);
            return items.size();
        });
        when(syncTaskMapper.updateProgress(any(SyncTaskEntity.class))).thenAnswer(invocation -> {
            progress.add(invocation.getArgument(0));
            return 1;
        });
        when(remoteFileClient.fetchFile(anyString()))
                .thenAnswer(invocation -> ("{}" + invocation.getArgument(0)).getBytes(StandardCharsets.UTF_8));
        when(normalizer.normalize(any(byte[].class), any(SailingReference.class)))
                .thenAnswer(invocation -> sailingFor(invocation.getArgument(1)));
        when(persistenceService.upsert(any(NormalizedSailing.class), anyLong())).thenReturn(UpsertResult.inserted());

        processor = new SailingSyncProcessor(remoteFileClient, normalizer, persistenceService, checkpointMapper,
                permanentFailureMapper, syncTaskMapper, workers, properties,
                new MutableClock(Instant.parse("2025-03-15T10:00:00Z")), provider);
    }

    @AfterEach
    void tearDown() {
        workers.shutdownNow();
    }

    @Test
    void referencesShouldBeProcessedAndCheckpointedPerBatch() {
        List<SailingReference> refs = Arrays.asList(ref(2025, 4, "1"), ref(2025, 4, "2"), ref(2025, 5, "3"));

        SyncRunResult result = processor.process(context(null, null), refs.iterator());

        assertTrue(result.isExhausted());
        assertEquals(3, result.getDiscovered());
        assertEquals(3, result.getInserted());
        assertEquals(2, result.getBatches());
        assertEquals(TaskStatus.SUCCESS, result.finalStatus());
        assertEquals(Arrays.asList(2, 1), flushSizes);
        assertTrue(checkpoints.stream().allMatch(c -> CheckpointStatus.COMMITTED.name().equals(c.getStatus())));
        assertEquals(2, progress.size());
        assertEquals("2025-03", progress.get(0).getLastCompletedMonth());
        assertEquals("2025-04", progress.get(1).getLastCompletedMonth());
        assertEquals(3.0, meterRegistry.counter("cruise.sync.file", "outcome", "inserted").count());
    }

    @Test
    void updatedSailingWithNewPricesShouldCountPriceChange() {
        PriceDelta delta = new PriceDelta("2",
                CabinPrices.of(new BigDecimal("100"), null, null, null),
                CabinPrices.of(new BigDecimal("90"), null, null, null));
        when(persistenceService.upsert(any(NormalizedSailing.class), anyLong())).thenReturn(UpsertResult.updated(delta));

        SyncRunResult result = processor.process(context(null, null),
                Collections.singletonList(ref(2025, 4, "2")).iterator());

        assertEquals(1, result.getUpdated());
        assertEquals(1, result.getPriceChanged());
    }

    @Test
    void perFileFailureShouldNotStopTheRun() {
        SailingReference bad = ref(2025, 4, "2");
        when(remoteFileClient.fetchFile(bad.getRemotePath()))
                .thenThrow(new RemoteConnectionException("timed out", bad.getRemotePath()));

        SyncRunResult result = processor.process(context(null, null),
                Arrays.asList(ref(2025, 4, "1"), bad, ref(2025, 4, "3")).iterator());

        assertEquals(TaskStatus.PARTIAL_SUCCESS, result.finalStatus());
        assertEquals(2, result.getInserted());
        assertEquals(1, result.getFailed());
        assertEquals(Integer.valueOf(1), result.getFailuresByCode().get(SyncErrorCode.CONNECTION));
        SyncCheckpointEntity failed = checkpointFor(bad);
        assertEquals(CheckpointStatus.FAILED.name(), failed.getStatus());
        assertEquals(SyncErrorCode.CONNECTION.name(), failed.getErrorCode());
        verify(permanentFailureMapper, never()).upsert(any(PermanentFailureEntity.class));
    }

    @Test
    void corruptPayloadShouldBeRecordedAsPermanentFailure() {
        SailingReference bad = ref(2025, 4, "2");
        when(normalizer.normalize(any(byte[].class), eq(bad))).thenThrow(new CorruptPayloadException("not json"));

        processor.process(context(null, null), Collections.singletonList(bad).iterator());

        assertEquals(CheckpointStatus.PERMANENT_FAILED.name(), checkpointFor(bad).getStatus());
        verify(permanentFailureMapper).upsert(argThat(entity ->
                bad.pathMd5().equals(entity.getPathMd5())
                        && entity.getFileSize() == bad.getSize()
                        && SyncErrorCode.CORRUPT_PAYLOAD.name().equals(entity.getErrorCode())));
    }

    @Test
    void completedReferencesShouldBeSkippedOnResume() {
        SailingReference done = ref(2025, 4, "1");
        SailingReference todo = ref(2025, 4, "2");

        SyncRunResult result = processor.process(
                context(new HashSet<>(Collections.singletonList(done.pathMd5())), null),
                Arrays.asList(done, todo).iterator());

        assertEquals(2, result.getDiscovered());
        assertEquals(1, result.getSkipped());
        assertEquals(1, result.getInserted());
        verify(remoteFileClient, never()).fetchFile(done.getRemotePath());
    }

    @Test
    void permanentFailureShouldBeSkippedUntilFileSizeChanges() {
        SailingReference unchanged = ref(2025, 4, "1");
        SailingReference changed = new SailingReference(2025, 4, 22, 180, "2",
                ref(2025, 4, "2").getRemotePath(), 4096L);
        Map<String, Long> permanent = new HashMap<>();
        permanent.put(unchanged.pathMd5(), unchanged.getSize());
        permanent.put(changed.pathMd5(), 1024L);

        SyncRunResult result = processor.process(context(null, permanent), Arrays.asList(unchanged, changed).iterator());

        assertEquals(1, result.getSkipped());
        assertEquals(1, result.getInserted());
        assertEquals(Collections.singletonList("1"), result.getRetainedSailingIds());
        verify(remoteFileClient, never()).fetchFile(unchanged.getRemotePath());
        verify(permanentFailureMapper).deleteByPathMd5(changed.pathMd5());
    }

    @Test
    void authFailureShouldAbortAtTheCurrentBatch() {
        properties.setBatchSize(1);
        SailingReference denied = ref(2025, 4, "2");
        SailingReference untouched = ref(2025, 4, "3");
        when(remoteFileClient.fetchFile(denied.getRemotePath()))
                .thenThrow(new RemoteAuthException("530 Login incorrect", denied.getRemotePath()));

        SyncRunResult result = processor.process(context(null, null),
                Arrays.asList(ref(2025, 4, "1"), denied, untouched).iterator());

        assertEquals(SyncErrorCode.AUTH, result.getAbortCode());
        assertEquals(TaskStatus.FAILED, result.finalStatus());
        assertFalse(result.isExhausted());
        verify(remoteFileClient, never()).fetchFile(untouched.getRemotePath());
        assertEquals(1, checkpoints.size());
        assertNull(progress.get(progress.size() - 1).getLastCompletedMonth());
    }

    @Test
    void cancellationShouldStopAtBatchBoundary() {
        AtomicBoolean cancelled = new AtomicBoolean(false);
        SyncRunContext context = new SyncRunContext(5L, null, null, cancelled::get, batchNo -> {
            cancelled.set(true);
            return true;
        }, 0);

        SyncRunResult result = processor.process(context,
                Arrays.asList(ref(2025, 4, "1"), ref(2025, 4, "2"), ref(2025, 4, "3")).iterator());

        assertTrue(result.isCancelled());
        assertEquals(TaskStatus.CANCELED, result.finalStatus());
        assertEquals(2, result.getProcessed());
        assertEquals(1, result.getBatches());
    }

    @Test
    void circuitOpenWhileListingShouldAbortTheRun() {
        SailingReference first = ref(2025, 4, "1");
        Iterator<SailingReference> references = new Iterator<SailingReference>() {
            private boolean served;

            @Override
            public boolean hasNext() {
                if (served) {
                    throw new CircuitOpenException("ftp.traveltek.net", "/cruisedata/2025/05", Duration.ofSeconds(30));
                }
                return true;
            }

            @Override
            public SailingReference next() {
                if (served) {
                    throw new NoSuchElementException();
                }
                served = true;
                return first;
            }
        };

        SyncRunResult result = processor.process(context(null, null), references);

        assertEquals(SyncErrorCode.CIRCUIT_OPEN, result.getAbortCode());
        verify(remoteFileClient, never()).fetchFile(first.getRemotePath());
    }

    @Test
    void listenerRefusalShouldAbortWithLockLost() {
        properties.setBatchSize(1);
        SyncRunContext context = new SyncRunContext(5L, null, null, null, batchNo -> false, 0);

        SyncRunResult result = processor.process(context,
                Arrays.asList(ref(2025, 4, "1"), ref(2025, 4, "2")).iterator());

        assertEquals(SyncErrorCode.LOCK_LOST, result.getAbortCode());
        assertEquals(1, result.getProcessed());
        verify(checkpointMapper, times(1)).batchUpsert(anyList());
    }

    @Test
    void batchShouldEndWhereTheLineChanges() {
        List<Integer> enteredLines = new ArrayList<>();
        SyncRunContext context = new SyncRunContext(5L, null, null, null, null, lineId -> {
            enteredLines.add(lineId);
            return true;
        }, 0);
        List<SailingReference> refs = Arrays.asList(ref(2025, 4, "1"), lineRef(45, "2"), lineRef(45, "3"));

        SyncRunResult result = processor.process(context, refs.iterator());

        assertEquals(3, result.getInserted());
        assertEquals(Arrays.asList(1, 2), flushSizes);
        assertEquals(Arrays.asList(22, 45), enteredLines);
    }

    @Test
    void batchOfBusyLineShouldBeSkippedWithoutCheckpoint() {
        SyncRunContext context = new SyncRunContext(5L, null, null, null, null, lineId -> lineId != 45, 0);
        SailingReference busy = lineRef(45, "2");
        List<SailingReference> refs = Arrays.asList(ref(2025, 4, "1"), busy, ref(2025, 5, "3"));

        SyncRunResult result = processor.process(context, refs.iterator());

        assertTrue(result.isExhausted());
        assertEquals(2, result.getInserted());
        assertEquals(1, result.getLineBusySkipped());
        assertEquals(1, result.getSkipped());
        assertEquals(TaskStatus.PARTIAL_SUCCESS, result.finalStatus());
        verify(remoteFileClient, never()).fetchFile(busy.getRemotePath());
        assertTrue(checkpoints.stream().noneMatch(c -> busy.pathMd5().equals(c.getPathMd5())));
    }

    @Test
    void processReferenceShouldReportTheFailingStage() {
        SailingReference reference = ref(2025, 4, "1");
        when(persistenceService.upsert(any(NormalizedSailing.class), anyLong()))
                .thenThrow(new IllegalStateException("boom"));

        ReferenceOutcome outcome = processor.processReference(reference, 5L);

        assertFalse(outcome.isCommitted());
        assertEquals(ReferenceState.PERSISTING, outcome.getFailedAt());
        assertEquals(SyncErrorCode.UNKNOWN, outcome.getErrorCode());
        assertEquals("boom", outcome.getErrorMessage());
    }

    private SyncRunContext context(Set<String> completed, Map<String, Long> permanent) {
        return new SyncRunContext(5L, completed, permanent, null, null, 0);
    }

    private SyncCheckpointEntity checkpointFor(SailingReference reference) {
        List<SyncCheckpointEntity> matches = new ArrayList<>();
        for (SyncCheckpointEntity checkpoint : checkpoints) {
            if (reference.pathMd5().equals(checkpoint.getPathMd5())) {
                matches.add(checkpoint);
            }
        }
        assertEquals(1, matches.size());
        return matches.get(0);
    }

    private static SailingReference ref(int year, int month, String sailingId) {
        return SailingReference.of(ROOT, YearMonth.of(year, month), 22, 180, sailingId, 2048L);
    }

    private static SailingReference lineRef(int lineId, String sailingId) {
        return SailingReference.of(ROOT, YearMonth.of(2025, 4), lineId, 300, sailingId, 2048L);
    }

    private static NormalizedSailing sailingFor(SailingReference reference) {
        NormalizedSailing sailing = new NormalizedSailing();
        sailing.setSailingId(reference.getSailingId());
        sailing.setCruiseId("c" + reference.getSailingId());
        sailing.setLineId(reference.getLineId());
        sailing.setShipId(reference.getShipId());
        return sailing;
    }
}
