package com.example.cruisesync.infrastructure.parser;

import com.example.cruisesync.domain.enumtype.CabinClass;
import com.fasterxml.jackson.databind.JsonNode;
import java.math.BigDecimal;
import java.util.Map;

/**
 * One place in the payload where cabin prices may be found. Returns only the classes it
 * found a valid price for; an empty map means the source does not apply.
 */
@FunctionalInterface
public interface PriceSource {

    Map<CabinClass, BigDecimal> extract(JsonNode payload);
}
