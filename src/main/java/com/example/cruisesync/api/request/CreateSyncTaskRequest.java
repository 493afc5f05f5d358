package com.example.cruisesync.api.request;

import com.example.cruisesync.domain.enumtype.TaskType;
import javax.validation.constraints.NotNull;
import javax.validation.constraints.Pattern;
import javax.validation.constraints.Positive;
import lombok.Data;

@Data
public class CreateSyncTaskRequest {

    @NotNull
    private TaskType taskType;

    /** Required for LINE_CRAWL. */
    @Positive
    private Integer lineId;

    @Pattern(regexp = "\\d{4}-\\d{2}", message = "startMonth must be yyyy-MM")
    private String startMonth;

    @Pattern(regexp = "\\d{4}-\\d{2}", message = "endMonth must be yyyy-MM")
    private String endMonth;

    private Long resumeFromTaskId;
}
