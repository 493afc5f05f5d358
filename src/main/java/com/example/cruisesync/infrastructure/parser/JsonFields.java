package com.example.cruisesync.infrastructure.parser;

import com.fasterxml.jackson.databind.JsonNode;
import java.math.BigDecimal;

/**
 * Null-tolerant accessors over the vendor's loosely typed fields.
 */
final class JsonFields {

    private JsonFields() {
    }

    /** Dotted path lookup, e.g. {@code "cheapest.combined.inside"}. */
    static JsonNode at(JsonNode root, String dottedPath) {
        JsonNode current = root;
        for (String segment : dottedPath.split("\\.")) {
            if (current == null || !current.isObject()) {
                return null;
            }
            current = current.get(segment);
        }
        return current == null || current.isNull() || current.isMissingNode() ? null : current;
    }

    /** First non-blank text among the paths. */
    static String firstText(JsonNode root, String... dottedPaths) {
        for (String path : dottedPaths) {
            JsonNode node = at(root, path);
            if (node != null && node.isValueNode()) {
                String text = node.asText().trim();
                if (!text.isEmpty()) {
                    return text;
                }
            }
        }
        return null;
    }

    static Integer firstInt(JsonNode root, String... dottedPaths) {
        for (String path : dottedPaths) {
            Integer value = toInt(at(root, path));
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    static Integer toInt(JsonNode node) {
        if (node == null || !node.isValueNode()) {
            return null;
        }
        if (node.isIntegralNumber()) {
            return node.intValue();
        }
        String text = node.asText().trim();
        if (text.isEmpty()) {
            return null;
        }
        try {
            return Integer.valueOf(text);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Reads a price from a number, a formatted string ("$1,234.50") or an object carrying
     * {@code price}/{@code adultprice}. Zero, negative and unparsable values are absent.
     */
    static BigDecimal price(JsonNode node) {
        if (node == null) {
            return null;
        }
        if (node.isObject()) {
            BigDecimal nested = price(node.get("price"));
            return nested != null ? nested : price(node.get("adultprice"));
        }
        BigDecimal value;
        if (node.isNumber()) {
            if (node.isDouble() || node.isFloat()) {
                double d = node.doubleValue();
                if (Double.isNaN(d) || Double.isInfinite(d)) {
                    return null;
                }
            }
            value = node.decimalValue();
        } else if (node.isTextual()) {
            String cleaned = node.textValue().replaceAll("[^0-9.\\-]", "");
            if (cleaned.isEmpty()) {
                return null;
            }
            try {
                value = new BigDecimal(cleaned);
            } catch (NumberFormatException e) {
                return null;
            }
        } else {
            return null;
        }
        return value.signum() > 0 ? value : null;
    }
}
