package com.example.cruisesync.infrastructure.persistence.entity;

import java.time.LocalDateTime;
import lombok.Data;

@Data
public class WebhookEventEntity {

    private Long id;

    private String webhookId;

    private String eventType;

    private Integer lineId;

    private String eventTimestamp;

    private String status;

    private String reason;

    private Integer markedCount;

    private LocalDateTime receivedAt;
}
