package com.example.cruisesync.infrastructure.persistence.entity;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import lombok.Data;

@Data
public class CruiseEntity {

    /** Vendor per-sailing code. */
    private String id;

    private String cruiseId;

    private Integer cruiseLineId;

    private Integer shipId;

    private String name;

    private String voyageCode;

    private LocalDate sailingDate;

    private Integer nights;

    private Integer embarkPortId;

    private Integer disembarkPortId;

    private String portIds;

    private String regionIds;

    private BigDecimal interiorPrice;

    private BigDecimal oceanviewPrice;

    private BigDecimal balconyPrice;

    private BigDecimal suitePrice;

    private BigDecimal cheapestPrice;

    private String currency;

    private Boolean needsPriceUpdate;

    private Boolean isActive;

    private String rawData;

    private Long lastSyncTaskId;

    private LocalDateTime lastSyncedAt;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
