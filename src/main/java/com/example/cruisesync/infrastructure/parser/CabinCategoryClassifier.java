package com.example.cruisesync.infrastructure.parser;

import com.example.cruisesync.domain.enumtype.CabinClass;
import java.util.Locale;
import java.util.Optional;

/**
 * Maps the vendor's free-text cabin category onto a canonical class by substring match.
 * Checked in order interior, oceanview, balcony, suite; the first hit wins.
 */
public final class CabinCategoryClassifier {

    private CabinCategoryClassifier() {
    }

    public static Optional<CabinClass> classify(String category) {
        if (category == null) {
            return Optional.empty();
        }
        String text = category.toLowerCase(Locale.ROOT);
        if (text.contains("interior") || text.contains("inside")) {
            return Optional.of(CabinClass.INTERIOR);
        }
        if (text.contains("ocean") || text.contains("outside")) {
            return Optional.of(CabinClass.OCEANVIEW);
        }
        if (text.contains("balcony")) {
            return Optional.of(CabinClass.BALCONY);
        }
        if (text.contains("suite")) {
            return Optional.of(CabinClass.SUITE);
        }
        return Optional.empty();
    }
}
