package com.example.cruisesync.application.job;

import com.example.cruisesync.infrastructure.persistence.mapper.CruiseMapper;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Publishes how many active sailings still wait for a price refresh. A count that keeps
 * growing means webhooks are flagging lines faster than runs clear them.
 */
@Service
public class PriceBacklogJob {

    private static final Logger log = LoggerFactory.getLogger(PriceBacklogJob.class);

    private final CruiseMapper cruiseMapper;
    private final AtomicLong backlog = new AtomicLong();

    public PriceBacklogJob(CruiseMapper cruiseMapper, ObjectProvider<MeterRegistry> meterRegistryProvider) {
        this.cruiseMapper = cruiseMapper;
        MeterRegistry meterRegistry = meterRegistryProvider.getIfAvailable();
        if (meterRegistry != null) {
            Gauge.builder("cruise.sync.price.backlog", backlog, AtomicLong::get)
                    .description("Active sailings flagged needs_price_update")
                    .register(meterRegistry);
        }
    }

    @Scheduled(cron = "${app.sync.backlog-report-cron:0 */10 * * * ?}")
    public void run() {
        try {
            long count = cruiseMapper.countNeedingPriceUpdate();
            backlog.set(count);
            log.info("PRICE_UPDATE_BACKLOG count={}", count);
        } catch (Exception e) {
            log.warn("Price backlog report failed", e);
        }
    }

    public long lastBacklog() {
        return backlog.get();
    }
}
