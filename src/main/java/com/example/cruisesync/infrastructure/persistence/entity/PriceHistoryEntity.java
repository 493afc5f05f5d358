package com.example.cruisesync.infrastructure.persistence.entity;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Data;

@Data
public class PriceHistoryEntity {

    private Long id;

    private String cruiseId;

    private BigDecimal interiorPrice;

    private BigDecimal oceanviewPrice;

    private BigDecimal balconyPrice;

    private BigDecimal suitePrice;

    private BigDecimal cheapestPrice;

    private String currency;

    private Long syncTaskId;

    private LocalDateTime snapshotDate;
}
