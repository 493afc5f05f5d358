package com.example.cruisesync.domain.model;

import com.example.cruisesync.domain.enumtype.CabinClass;
import java.math.BigDecimal;
import java.util.EnumSet;
import java.util.Set;

/**
 * Difference between the snapshot taken before an update and the prices written by it.
 */
public final class PriceDelta {

    private final String sailingId;
    private final CabinPrices previous;
    private final CabinPrices current;

    public PriceDelta(String sailingId, CabinPrices previous, CabinPrices current) {
        this.sailingId = sailingId;
        this.previous = previous;
        this.current = current;
    }

    public String getSailingId() {
        return sailingId;
    }

    public CabinPrices getPrevious() {
        return previous;
    }

    public CabinPrices getCurrent() {
        return current;
    }

    public Set<CabinClass> changedClasses() {
        Set<CabinClass> changed = EnumSet.noneOf(CabinClass.class);
        for (CabinClass cabinClass : CabinClass.values()) {
            BigDecimal before = previous.get(cabinClass);
            BigDecimal after = current.get(cabinClass);
            if (before == null && after == null) {
                continue;
            }
            if (before == null || after == null || before.compareTo(after) != 0) {
                changed.add(cabinClass);
            }
        }
        return changed;
    }

    public boolean hasChanges() {
        return !changedClasses().isEmpty();
    }
}
