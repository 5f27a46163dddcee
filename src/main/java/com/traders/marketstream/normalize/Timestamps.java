package com.traders.marketstream.normalize;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.regex.Pattern;

/**
 * Parses the timestamp shapes seen on the wire into UTC instants. {@code ...Z} and {@code ...+00:00}
 * yield the same instant. A date-time without an offset is read as UTC.
 */
public final class Timestamps {
    private static final Pattern DATE_ONLY = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");
    private static final Pattern DIGITS = Pattern.compile("^\\d+$");
    private static final long EPOCH_MILLIS_THRESHOLD = 100_000_000_000L;

    private Timestamps() {
    }

    public static Instant toUtc(JsonNode node) {
        if (node == null) {
            return null;
        }
        if (node.isNumber()) {
            return fromEpoch(node.asLong());
        }
        return parse(JsonValues.text(node));
    }

    public static Instant parse(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        if (DIGITS.matcher(trimmed).matches()) {
            try {
                return fromEpoch(Long.parseLong(trimmed));
            } catch (NumberFormatException e) {
                return null;
            }
        }
        if (DATE_ONLY.matcher(trimmed).matches()) {
            return parseDate(trimmed);
        }
        String candidate = trimmed.replaceFirst("^(\\d{4}-\\d{2}-\\d{2}) ", "$1T");
        Instant withOffset = parseWithOffset(candidate);
        return withOffset != null ? withOffset : parseLocal(candidate);
    }

    private static Instant parseDate(String candidate) {
        try {
            return LocalDate.parse(candidate).atStartOfDay().toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static Instant parseWithOffset(String candidate) {
        try {
            return OffsetDateTime.parse(candidate).toInstant();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static Instant parseLocal(String candidate) {
        try {
            return LocalDateTime.parse(candidate).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static Instant fromEpoch(long value) {
        return value >= EPOCH_MILLIS_THRESHOLD ? Instant.ofEpochMilli(value) : Instant.ofEpochSecond(value);
    }
}
