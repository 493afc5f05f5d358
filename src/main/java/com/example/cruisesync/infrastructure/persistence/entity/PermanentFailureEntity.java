package com.example.cruisesync.infrastructure.persistence.entity;

import java.time.LocalDateTime;
import lombok.Data;

@Data
public class PermanentFailureEntity {

    private String pathMd5;

    private String remotePath;

    private Long fileSize;

    private String errorCode;

    private String errorMessage;

    private LocalDateTime failedAt;
}
