package com.example.cruisesync.domain.model;

import com.example.cruisesync.domain.enumtype.UpsertOutcome;
import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class UpsertResult {

    private UpsertOutcome outcome;

    /** Null on insert; there is no previous price to compare with. */
    private PriceDelta delta;

    public static UpsertResult inserted() {
        return new UpsertResult(UpsertOutcome.INSERTED, null);
    }

    public static UpsertResult updated(PriceDelta delta) {
        return new UpsertResult(UpsertOutcome.UPDATED, delta);
    }

    public boolean pricesChanged() {
        return delta != null && delta.hasChanges();
    }
}
