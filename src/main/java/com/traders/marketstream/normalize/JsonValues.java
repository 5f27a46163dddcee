package com.traders.marketstream.normalize;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Lenient readers over loosely typed wire JSON. Missing, null and unparsable values all read as {@code null}.
 */
public final class JsonValues {

    private JsonValues() {
    }

    public static JsonNode field(JsonNode node, String key) {
        if (node == null || !node.isObject()) {
            return null;
        }
        JsonNode value = node.get(key);
        return value == null || value.isNull() || value.isMissingNode() ? null : value;
    }

    public static boolean isRecord(JsonNode node) {
        return node != null && node.isObject();
    }

    public static JsonNode record(JsonNode node, String key) {
        JsonNode value = field(node, key);
        return isRecord(value) ? value : null;
    }

    public static Double number(JsonNode node) {
        if (node == null) {
            return null;
        }
        if (node.isNumber()) {
            double value = node.asDouble();
            return Double.isFinite(value) ? value : null;
        }
        if (node.isTextual()) {
            String trimmed = node.asText().trim();
            if (trimmed.isEmpty()) {
                return null;
            }
            try {
                double value = Double.parseDouble(trimmed);
                return Double.isFinite(value) ? value : null;
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    public static Double firstNumber(JsonNode node, String... keys) {
        for (String key : keys) {
            Double value = number(field(node, key));
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    public static String text(JsonNode node) {
        if (node == null || !node.isTextual()) {
            return null;
        }
        String trimmed = node.asText().trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    /** Like {@link #text(JsonNode)} but also accepts numbers, for identifiers sent either way. */
    public static String scalarText(JsonNode node) {
        if (node != null && node.isNumber()) {
            return node.asText();
        }
        return text(node);
    }

    public static String firstText(JsonNode node, String... keys) {
        for (String key : keys) {
            String value = text(field(node, key));
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    public static Long wholeNumber(Double value) {
        return value == null ? null : Math.round(value);
    }

    public static double round6(double value) {
        return Math.round(value * 1_000_000d) / 1_000_000d;
    }
}
