package com.example.cruisesync.common.config;

import java.math.BigDecimal;
import java.time.YearMonth;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.sync")
public class AppSyncProperties {

    /**
     * References per batch. Also the cap on concurrent in-flight fetches.
     */
    private int batchSize = 25;

    private int fileWorkerThreadCount = 4;

    private int taskThreadCount = 4;

    /**
     * First month of the full crawl, formatted yyyy-MM. Empty means the current month.
     */
    private String crawlStartMonth;

    private int crawlMonthsAhead = 24;

    private boolean crawlEnabled = true;

    private String crawlCron = "0 0 2 * * ?";

    private int webhookMonthsAhead = 6;

    private int maxFilesPerWebhookJob = 500;

    private long lockTtlMs = 1800000L;

    private String lockStore = "memory";

    private String lockSweepCron = "0 */5 * * * ?";

    /**
     * Divisors applied to every extracted price of a cruise line, keyed by line id.
     * Line 329 publishes prices in thousandths.
     */
    private Map<Integer, BigDecimal> linePriceDivisors = defaultDivisors();

    private int progressLogIntervalSec = 30;

    private boolean resumeInterruptedOnStartup = true;

    private String backlogReportCron = "0 */10 * * * ?";

    public YearMonth resolveCrawlStart(YearMonth current) {
        if (crawlStartMonth == null || crawlStartMonth.trim().isEmpty()) {
            return current;
        }
        return YearMonth.parse(crawlStartMonth.trim());
    }

    private static Map<Integer, BigDecimal> defaultDivisors() {
        Map<Integer, BigDecimal> divisors = new LinkedHashMap<>();
        divisors.put(329, new BigDecimal("1000"));
        return divisors;
    }
}
