package com.example.cruisesync.api.response;

import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SyncTaskDetailResponse {

    private Long taskId;
    private String taskType;
    private String status;
    private Integer lineId;
    private String rangeStart;
    private String rangeEnd;
    private Long resumeFromTaskId;
    private LocalDateTime startTime;
    private LocalDateTime endTime;
    private int discoveredCount;
    private int processedCount;
    private int insertedCount;
    private int updatedCount;
    private int failedCount;
    private int skippedCount;
    private int priceChangedCount;
    private int deactivatedCount;
    private String lastSyncedPath;
    private String lastCompletedMonth;
    private String errorSummary;
}
