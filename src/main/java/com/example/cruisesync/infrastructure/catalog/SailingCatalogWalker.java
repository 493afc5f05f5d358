package com.example.cruisesync.infrastructure.catalog;

import com.example.cruisesync.common.config.AppFtpProperties;
import com.example.cruisesync.infrastructure.ftp.RemoteFileClient;
import java.time.YearMonth;
import org.springframework.stereotype.Component;

/**
 * Stateless factory for catalog walks. Resuming a walk is the caller's job: it skips
 * references it has already checkpointed.
 */
@Component
public class SailingCatalogWalker {

    private final RemoteFileClient remoteFileClient;
    private final AppFtpProperties ftpProperties;

    public SailingCatalogWalker(RemoteFileClient remoteFileClient, AppFtpProperties ftpProperties) {
        this.remoteFileClient = remoteFileClient;
        this.ftpProperties = ftpProperties;
    }

    /**
     * @param start      first month, inclusive
     * @param end        last month, inclusive
     * @param lineFilter only this cruise line when non-null
     */
    public CatalogWalk walk(YearMonth start, YearMonth end, Integer lineFilter) {
        return walk(start, end, lineFilter, 0);
    }

    /**
     * Same as {@link #walk(YearMonth, YearMonth, Integer)} but stops after
     * {@code maxReferences} references; zero or less means unbounded.
     */
    public CatalogWalk walk(YearMonth start, YearMonth end, Integer lineFilter, int maxReferences) {
        if (start.isAfter(end)) {
            throw new IllegalArgumentException("start " + start + " is after end " + end);
        }
        return new CatalogWalk(remoteFileClient, ftpProperties.getRootPath(), start, end, lineFilter, maxReferences);
    }
}
