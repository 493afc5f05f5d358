package com.example.cruisesync.infrastructure.parser;

import com.example.cruisesync.common.config.AppSyncProperties;
import com.example.cruisesync.domain.enumtype.CabinClass;
import com.example.cruisesync.domain.model.CabinPrices;
import com.example.cruisesync.domain.model.NormalizedSailing;
import com.example.cruisesync.domain.model.SailingReference;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

@Component
public class TraveltekPayloadNormalizer implements SailingPayloadNormalizer {

    private static final String DEFAULT_CURRENCY = "USD";

    private final ObjectMapper objectMapper;
    private final PayloadDecoder decoder;
    private final List<PriceSource> priceSources;
    private final LinePriceAdjuster priceAdjuster;

    @Autowired
    public TraveltekPayloadNormalizer(ObjectMapper objectMapper, AppSyncProperties syncProperties) {
        this(objectMapper, PriceSources.defaultOrder(), new LinePriceAdjuster(syncProperties.getLinePriceDivisors()));
    }

    TraveltekPayloadNormalizer(ObjectMapper objectMapper, List<PriceSource> priceSources, LinePriceAdjuster priceAdjuster) {
        this.objectMapper = objectMapper;
        this.decoder = new PayloadDecoder(objectMapper);
        this.priceSources = priceSources;
        this.priceAdjuster = priceAdjuster;
    }

    @Override
    public NormalizedSailing normalize(byte[] raw) {
        return normalize(raw, null);
    }

    @Override
    public NormalizedSailing normalize(byte[] raw, SailingReference reference) {
        JsonNode payload = decoder.decode(raw);

        NormalizedSailing sailing = new NormalizedSailing();
        sailing.setSailingId(requireId(payload, "codetocruiseid"));
        sailing.setCruiseId(requireId(payload, "cruiseid"));

        Integer lineId = JsonFields.firstInt(payload, "lineid", "cruiselineid");
        if (lineId == null && reference != null) {
            lineId = reference.getLineId();
        }
        Integer shipId = JsonFields.firstInt(payload, "shipid");
        if (shipId == null && reference != null) {
            shipId = reference.getShipId();
        }
        sailing.setLineId(lineId);
        sailing.setShipId(shipId);

        sailing.setPrices(CabinPrices.of(priceAdjuster.adjust(lineId, extractPrices(payload))));
        sailing.setCurrency(firstNonEmpty(JsonFields.firstText(payload, "currency"), DEFAULT_CURRENCY));

        applyMetadata(sailing, payload);
        sailing.setRawData(toJson(payload));
        return sailing;
    }

    /**
     * Consults every source in order; a class keeps the first price found for it.
     */
    Map<CabinClass, BigDecimal> extractPrices(JsonNode payload) {
        Map<CabinClass, BigDecimal> prices = new EnumMap<>(CabinClass.class);
        for (PriceSource source : priceSources) {
            if (prices.size() == CabinClass.values().length) {
                break;
            }
            for (Map.Entry<CabinClass, BigDecimal> entry : source.extract(payload).entrySet()) {
                prices.putIfAbsent(entry.getKey(), entry.getValue());
            }
        }
        return prices;
    }

    private void applyMetadata(NormalizedSailing sailing, JsonNode payload) {
        Integer lineId = sailing.getLineId();
        Integer shipId = sailing.getShipId();
        sailing.setLineName(firstNonEmpty(
                JsonFields.firstText(payload, "linecontent.enginename", "linecontent.name",
                        "linecontent.shortname", "linename"),
                lineId == null ? null : "Line " + lineId));
        sailing.setShipName(firstNonEmpty(
                JsonFields.firstText(payload, "shipcontent.enginename", "shipcontent.nicename",
                        "shipcontent.name", "shipname"),
                shipId == null ? null : "Ship " + shipId));
        sailing.setName(firstNonEmpty(
                JsonFields.firstText(payload, "name", "title", "cruisename"),
                "Cruise " + sailing.getCruiseId()));
        sailing.setVoyageCode(JsonFields.firstText(payload, "voyagecode"));
        sailing.setSailingDate(parseDate(JsonFields.firstText(payload, "saildate", "startdate")));
        sailing.setNights(JsonFields.firstInt(payload, "nights", "sailnights"));
        sailing.setEmbarkPortId(JsonFields.firstInt(payload, "startportid", "embarkportid"));
        sailing.setDisembarkPortId(JsonFields.firstInt(payload, "endportid", "disembarkportid"));
        sailing.setPortIds(idList(JsonFields.at(payload, "portids")));
        sailing.setRegionIds(idList(JsonFields.at(payload, "regionids")));
        sailing.setPortNames(nameMap(JsonFields.at(payload, "ports")));
        sailing.setRegionNames(nameMap(JsonFields.at(payload, "regions")));
    }

    private String requireId(JsonNode payload, String field) {
        String value = JsonFields.firstText(payload, field);
        if (value == null) {
            throw new MissingIdentifierException(field);
        }
        return value;
    }

    private LocalDate parseDate(String text) {
        if (text == null) {
            return null;
        }
        String datePart = text.length() > 10 ? text.substring(0, 10) : text;
        try {
            return LocalDate.parse(datePart);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    /** Accepts a JSON array or a comma separated string. */
    private List<Integer> idList(JsonNode node) {
        List<Integer> ids = new ArrayList<>();
        if (node == null) {
            return ids;
        }
        if (node.isArray()) {
            for (JsonNode item : node) {
                Integer id = JsonFields.toInt(item);
                if (id != null && !ids.contains(id)) {
                    ids.add(id);
                }
            }
            return ids;
        }
        if (node.isValueNode()) {
            for (String part : node.asText().split(",")) {
                Integer id = parseIntOrNull(part);
                if (id != null && !ids.contains(id)) {
                    ids.add(id);
                }
            }
        }
        return ids;
    }

    /** Accepts {@code {"12":"Miami"}} or {@code [{"id":12,"name":"Miami"}]}. */
    private Map<Integer, String> nameMap(JsonNode node) {
        Map<Integer, String> names = new LinkedHashMap<>();
        if (node == null) {
            return names;
        }
        if (node.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                Integer id = parseIntOrNull(field.getKey());
                String name = field.getValue().isObject()
                        ? JsonFields.firstText(field.getValue(), "name")
                        : textOrNull(field.getValue());
                if (id != null && name != null) {
                    names.put(id, name);
                }
            }
        } else if (node.isArray()) {
            for (JsonNode item : node) {
                Integer id = JsonFields.firstInt(item, "id");
                String name = JsonFields.firstText(item, "name");
                if (id != null && name != null) {
                    names.put(id, name);
                }
            }
        }
        return names;
    }

    private Integer parseIntOrNull(String text) {
        try {
            return Integer.valueOf(text.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private String textOrNull(JsonNode node) {
        if (node == null || !node.isValueNode()) {
            return null;
        }
        String text = node.asText().trim();
        return text.isEmpty() ? null : text;
    }

    private String toJson(JsonNode payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new CorruptPayloadException("Cannot serialize decoded payload", e);
        }
    }

    private static String firstNonEmpty(String... candidates) {
        for (String candidate : candidates) {
            if (candidate != null && !candidate.trim().isEmpty()) {
                return candidate.trim();
            }
        }
        return null;
    }
}
