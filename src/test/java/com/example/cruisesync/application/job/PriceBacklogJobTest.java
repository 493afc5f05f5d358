package com.example.cruisesync.application.job;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.example.cruisesync.infrastructure.persistence.mapper.CruiseMapper;
import com.example.cruisesync.support.MeterRegistryProviders;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;

class PriceBacklogJobTest {

    private CruiseMapper cruiseMapper;
    private SimpleMeterRegistry meterRegistry;
    private PriceBacklogJob job;

    @BeforeEach
    void setUp() {
        cruiseMapper = mock(CruiseMapper.class);
        meterRegistry = new SimpleMeterRegistry();
        ObjectProvider<MeterRegistry> provider = MeterRegistryProviders.of(meterRegistry);
        job = new PriceBacklogJob(cruiseMapper, provider);
    }

    @Test
    void runShouldPublishBacklogGauge() {
        when(cruiseMapper.countNeedingPriceUpdate()).thenReturn(42L);

        job.run();

        assertEquals(42L, job.lastBacklog());
        assertEquals(42.0, meterRegistry.get("cruise.sync.price.backlog").gauge().value());
    }

    @Test
    void failedCountShouldKeepPreviousValue() {
        when(cruiseMapper.countNeedingPriceUpdate()).thenReturn(7L).thenThrow(new IllegalStateException("db down"));

        job.run();
        job.run();

        assertEquals(7L, job.lastBacklog());
    }
}
