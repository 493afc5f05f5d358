package com.example.cruisesync.infrastructure.persistence.entity;

import java.time.LocalDateTime;
import lombok.Data;

@Data
public class SyncTaskEntity {

    private Long id;

    private String taskType;

    private String status;

    private Integer lineId;

    /** First month of the walk, yyyy-MM. */
    private String rangeStart;

    private String rangeEnd;

    private Long resumeFromTaskId;

    private LocalDateTime startTime;

    private LocalDateTime endTime;

    private Integer discoveredCount;

    private Integer processedCount;

    private Integer insertedCount;

    private Integer updatedCount;

    private Integer failedCount;

    private Integer skippedCount;

    private Integer priceChangedCount;

    private Integer deactivatedCount;

    private String lastSyncedPath;

    private String lastCompletedMonth;

    private String errorSummary;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
