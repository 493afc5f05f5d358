package com.example.cruisesync.infrastructure.persistence.entity;

import java.time.LocalDateTime;
import lombok.Data;

@Data
public class CruiseLineLockEntity {

    private Integer lineId;

    private String lockKey;

    private String holderId;

    private LocalDateTime acquiredAt;

    private LocalDateTime expiresAt;
}
