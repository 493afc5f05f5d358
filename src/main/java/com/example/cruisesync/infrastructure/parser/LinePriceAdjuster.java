package com.example.cruisesync.infrastructure.parser;

import com.example.cruisesync.domain.enumtype.CabinClass;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.EnumMap;
import java.util.Map;

/**
 * Per-line unit correction followed by rounding to currency scale.
 */
public class LinePriceAdjuster {

    private static final int CURRENCY_SCALE = 2;

    private final Map<Integer, BigDecimal> divisors;

    public LinePriceAdjuster(Map<Integer, BigDecimal> divisors) {
        this.divisors = divisors;
    }

    public Map<CabinClass, BigDecimal> adjust(Integer lineId, Map<CabinClass, BigDecimal> prices) {
        BigDecimal divisor = lineId == null ? null : divisors.get(lineId);
        Map<CabinClass, BigDecimal> adjusted = new EnumMap<>(CabinClass.class);
        for (Map.Entry<CabinClass, BigDecimal> entry : prices.entrySet()) {
            BigDecimal value = entry.getValue();
            if (divisor != null && divisor.signum() > 0) {
                value = value.divide(divisor, CURRENCY_SCALE, RoundingMode.HALF_UP);
            } else {
                value = value.setScale(CURRENCY_SCALE, RoundingMode.HALF_UP);
            }
            if (value.signum() > 0) {
                adjusted.put(entry.getKey(), value);
            }
        }
        return adjusted;
    }
}
