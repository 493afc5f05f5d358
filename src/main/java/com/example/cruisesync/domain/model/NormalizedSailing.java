package com.example.cruisesync.domain.model;

import com.example.cruisesync.domain.enumtype.CabinClass;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Data;

/**
 * Canonical sailing produced from one vendor payload.
 */
@Data
public class NormalizedSailing {

    /** Per-sailing code, the primary key of the cruises table. */
    private String sailingId;

    /** Reusable cruise definition id shared by all sail dates of the same itinerary. */
    private String cruiseId;

    private Integer lineId;

    private String lineName;

    private Integer shipId;

    private String shipName;

    private String name;

    private String voyageCode;

    private LocalDate sailingDate;

    private Integer nights;

    private Integer embarkPortId;

    private Integer disembarkPortId;

    private List<Integer> portIds = new ArrayList<>();

    private List<Integer> regionIds = new ArrayList<>();

    private Map<Integer, String> portNames = new LinkedHashMap<>();

    private Map<Integer, String> regionNames = new LinkedHashMap<>();

    private CabinPrices prices = CabinPrices.empty();

    private String currency;

    private String rawData;

    public BigDecimal price(CabinClass cabinClass) {
        return prices.get(cabinClass);
    }

    public BigDecimal getCheapestPrice() {
        return prices.cheapest();
    }
}
