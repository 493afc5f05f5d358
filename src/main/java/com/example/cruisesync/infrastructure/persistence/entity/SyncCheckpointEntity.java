package com.example.cruisesync.infrastructure.persistence.entity;

import java.time.LocalDateTime;
import lombok.Data;

@Data
public class SyncCheckpointEntity {

    private Long id;

    private Long taskId;

    private String pathMd5;

    private String remotePath;

    private Integer lineId;

    private String status;

    private String errorCode;

    private String errorMessage;

    private LocalDateTime createdAt;
}
