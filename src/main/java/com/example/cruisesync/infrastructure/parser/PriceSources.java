package com.example.cruisesync.infrastructure.parser;

import com.example.cruisesync.domain.enumtype.CabinClass;
import com.fasterxml.jackson.databind.JsonNode;
import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Price sources in the order they are consulted. Earlier sources win per cabin class.
 */
public final class PriceSources {

    private static final String[] VENDOR_SLOTS = {"inside", "outside", "balcony", "suite"};

    private static final String[] CATEGORY_FIELDS = {"cabintype", "cabincategory", "category", "cabin_type", "type"};

    private PriceSources() {
    }

    public static List<PriceSource> defaultOrder() {
        return Collections.unmodifiableList(Arrays.asList(
                topLevelCheapest(),
                nestedSlots("cheapest.combined"),
                nestedSlots("cheapest.prices"),
                cabinEntries()));
    }

    /** {@code cheapestinside}, {@code cheapestoutside}, ... at the document root. */
    public static PriceSource topLevelCheapest() {
        return payload -> {
            Map<CabinClass, BigDecimal> found = new EnumMap<>(CabinClass.class);
            CabinClass[] classes = CabinClass.values();
            for (int i = 0; i < VENDOR_SLOTS.length; i++) {
                putIfPresent(found, classes[i], JsonFields.price(JsonFields.at(payload, "cheapest" + VENDOR_SLOTS[i])));
            }
            return found;
        };
    }

    /** An object holding {@code inside/outside/balcony/suite} slots at the given path. */
    public static PriceSource nestedSlots(String dottedPath) {
        return payload -> {
            Map<CabinClass, BigDecimal> found = new EnumMap<>(CabinClass.class);
            JsonNode holder = JsonFields.at(payload, dottedPath);
            if (holder == null || !holder.isObject()) {
                return found;
            }
            CabinClass[] classes = CabinClass.values();
            for (int i = 0; i < VENDOR_SLOTS.length; i++) {
                putIfPresent(found, classes[i], JsonFields.price(holder.get(VENDOR_SLOTS[i])));
            }
            return found;
        };
    }

    /**
     * Individual cabin price entries, classified by their category text, minimum per class.
     * Reads the flat {@code pricing} array and the {@code prices} tree, whose leaves sit at
     * {@code rateCode -> cabinCode} or {@code rateCode -> cabinCode -> occupancy}.
     */
    public static PriceSource cabinEntries() {
        return payload -> {
            Map<CabinClass, BigDecimal> minimum = new EnumMap<>(CabinClass.class);
            JsonNode flat = JsonFields.at(payload, "pricing");
            if (flat != null && flat.isArray()) {
                for (JsonNode entry : flat) {
                    acceptEntry(minimum, entry);
                }
            }
            JsonNode tree = JsonFields.at(payload, "prices");
            if (tree != null && tree.isObject()) {
                Iterator<JsonNode> rateCodes = tree.elements();
                while (rateCodes.hasNext()) {
                    JsonNode cabins = rateCodes.next();
                    if (cabins == null || !cabins.isObject()) {
                        continue;
                    }
                    Iterator<JsonNode> cabinNodes = cabins.elements();
                    while (cabinNodes.hasNext()) {
                        JsonNode cabin = cabinNodes.next();
                        if (isLeaf(cabin)) {
                            acceptEntry(minimum, cabin);
                        } else if (cabin != null && cabin.isObject()) {
                            cabin.elements().forEachRemaining(occupancy -> acceptEntry(minimum, occupancy));
                        }
                    }
                }
            }
            return minimum;
        };
    }

    private static boolean isLeaf(JsonNode node) {
        return node != null && node.isObject()
                && (node.has("price") || node.has("adultprice") || categoryOf(node) != null);
    }

    private static void acceptEntry(Map<CabinClass, BigDecimal> minimum, JsonNode entry) {
        if (entry == null || !entry.isObject()) {
            return;
        }
        Optional<CabinClass> cabinClass = CabinCategoryClassifier.classify(categoryOf(entry));
        BigDecimal price = JsonFields.price(entry);
        if (!cabinClass.isPresent() || price == null) {
            return;
        }
        minimum.merge(cabinClass.get(), price, (a, b) -> a.compareTo(b) <= 0 ? a : b);
    }

    private static String categoryOf(JsonNode entry) {
        return JsonFields.firstText(entry, CATEGORY_FIELDS);
    }

    private static void putIfPresent(Map<CabinClass, BigDecimal> target, CabinClass cabinClass, BigDecimal price) {
        if (price != null) {
            target.put(cabinClass, price);
        }
    }
}
