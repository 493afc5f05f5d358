package com.example.cruisesync.application.job;

import com.example.cruisesync.api.request.CreateSyncTaskRequest;
import com.example.cruisesync.application.service.SyncTaskService;
import com.example.cruisesync.common.config.AppSyncProperties;
import com.example.cruisesync.common.exception.BusinessException;
import com.example.cruisesync.domain.enumtype.TaskType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Service
public class ScheduledCrawlJob {

    private static final Logger log = LoggerFactory.getLogger(ScheduledCrawlJob.class);

    private final AppSyncProperties appSyncProperties;
    private final SyncTaskService syncTaskService;

    public ScheduledCrawlJob(AppSyncProperties appSyncProperties, SyncTaskService syncTaskService) {
        this.appSyncProperties = appSyncProperties;
        this.syncTaskService = syncTaskService;
    }

    @Scheduled(cron = "${app.sync.crawl-cron:0 0 2 * * ?}")
    public void run() {
        if (!appSyncProperties.isCrawlEnabled()) {
            log.debug("Scheduled crawl skipped: disabled");
            return;
        }
        if (syncTaskService.isFullCrawlActive()) {
            log.info("Scheduled crawl skipped due to active full crawl");
            return;
        }
        CreateSyncTaskRequest request = new CreateSyncTaskRequest();
        request.setTaskType(TaskType.FULL_CRAWL);
        try {
            syncTaskService.createCrawlTask(request);
            log.info("Scheduled crawl task created, cron={}", appSyncProperties.getCrawlCron());
        } catch (BusinessException e) {
            if (e.isConflict()) {
                log.info("Scheduled crawl skipped due to active full crawl");
            } else {
                log.warn("Scheduled crawl task create failed, code={}, msg={}", e.getCode(), e.getMessage());
            }
        } catch (Exception e) {
            log.warn("Scheduled crawl task create failed unexpectedly", e);
        }
    }
}
