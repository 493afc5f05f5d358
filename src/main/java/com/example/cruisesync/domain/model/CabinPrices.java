package com.example.cruisesync.domain.model;

import com.example.cruisesync.domain.enumtype.CabinClass;
import java.math.BigDecimal;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Canonical price per cabin class. A class is either priced with a non-negative amount
 * or absent; absence is never represented as zero.
 */
public final class CabinPrices {

    private static final CabinPrices EMPTY = new CabinPrices(new EnumMap<>(CabinClass.class));

    private final Map<CabinClass, BigDecimal> prices;

    private CabinPrices(EnumMap<CabinClass, BigDecimal> prices) {
        this.prices = Collections.unmodifiableMap(prices);
    }

    public static CabinPrices empty() {
        return EMPTY;
    }

    public static CabinPrices of(Map<CabinClass, BigDecimal> source) {
        EnumMap<CabinClass, BigDecimal> copy = new EnumMap<>(CabinClass.class);
        for (Map.Entry<CabinClass, BigDecimal> entry : source.entrySet()) {
            if (entry.getValue() != null) {
                if (entry.getValue().signum() < 0) {
                    throw new IllegalArgumentException("Negative price for " + entry.getKey());
                }
                copy.put(entry.getKey(), entry.getValue());
            }
        }
        return new CabinPrices(copy);
    }

    public static CabinPrices of(BigDecimal interior, BigDecimal oceanview, BigDecimal balcony, BigDecimal suite) {
        EnumMap<CabinClass, BigDecimal> map = new EnumMap<>(CabinClass.class);
        map.put(CabinClass.INTERIOR, interior);
        map.put(CabinClass.OCEANVIEW, oceanview);
        map.put(CabinClass.BALCONY, balcony);
        map.put(CabinClass.SUITE, suite);
        return of(map);
    }

    public BigDecimal get(CabinClass cabinClass) {
        return prices.get(cabinClass);
    }

    public boolean isEmpty() {
        return prices.isEmpty();
    }

    /** Minimum of the present prices, or null when none is present. */
    public BigDecimal cheapest() {
        BigDecimal min = null;
        for (BigDecimal price : prices.values()) {
            if (min == null || price.compareTo(min) < 0) {
                min = price;
            }
        }
        return min;
    }

    public Map<CabinClass, BigDecimal> asMap() {
        return prices;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CabinPrices)) {
            return false;
        }
        CabinPrices other = (CabinPrices) o;
        if (!prices.keySet().equals(other.prices.keySet())) {
            return false;
        }
        for (Map.Entry<CabinClass, BigDecimal> entry : prices.entrySet()) {
            if (entry.getValue().compareTo(other.prices.get(entry.getKey())) != 0) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int hash = 1;
        for (Map.Entry<CabinClass, BigDecimal> entry : prices.entrySet()) {
            hash = 31 * hash + Objects.hash(entry.getKey(), entry.getValue().stripTrailingZeros());
        }
        return hash;
    }

    @Override
    public String toString() {
        return prices.toString();
    }
}
