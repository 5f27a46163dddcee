package com.traders.marketstream.normalize;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Topic names on the wire are {@code base-SYMBOL}, e.g. {@code market.ticker-ES}.
 */
public final class MarketTopics {
    public static final List<String> DOM_BASES = List.of("market.dom", "market.depth");
    public static final List<String> DEFAULT_BASES = List.of("market.dom", "market.depth", "market.ticker", "market.bar");

    private static final List<String> KNOWN_BASES = List.of(
            "market.dom", "market.depth", "market.ticker", "market.bar", "market.kline",
            "dom", "depth", "ticker", "bars", "bar", "kline");

    public enum Route {
        DEPTH,
        TICKER,
        BAR
    }

    public record Topic(String base, String symbol) {
    }

    private MarketTopics() {
    }

    public static List<String> topicsFor(String symbol, boolean domCapable) {
        List<String> topics = new ArrayList<>();
        for (String base : DEFAULT_BASES) {
            if (!domCapable && DOM_BASES.contains(base)) {
                continue;
            }
            topics.add(base + "-" + symbol);
        }
        return topics;
    }

    /**
     * Splits a topic into base and symbol. Known bases are matched case-insensitively; anything else
     * splits at the first hyphen. The symbol is {@code null} when the topic has no suffix.
     */
    public static Topic parse(String topic) {
        if (topic == null || topic.isBlank()) {
            return null;
        }
        String trimmed = topic.trim();
        String lower = trimmed.toLowerCase(Locale.ROOT);
        for (String base : KNOWN_BASES) {
            if (lower.equals(base)) {
                return new Topic(base, null);
            }
            if (lower.startsWith(base + "-")) {
                String symbol = trimmed.substring(base.length() + 1).trim();
                return new Topic(base, symbol.isEmpty() ? null : symbol);
            }
        }
        int hyphen = trimmed.indexOf('-');
        if (hyphen <= 0) {
            return new Topic(lower, null);
        }
        String symbol = trimmed.substring(hyphen + 1).trim();
        return new Topic(lower.substring(0, hyphen), symbol.isEmpty() ? null : symbol);
    }

    public static Route route(String base) {
        if (base == null) {
            return null;
        }
        String lower = base.toLowerCase(Locale.ROOT);
        if (lower.contains("depth") || lower.contains("dom")) {
            return Route.DEPTH;
        }
        if (lower.contains("ticker")) {
            return Route.TICKER;
        }
        return switch (lower) {
            case "bar", "bars", "kline", "market.bar", "market.kline" -> Route.BAR;
            default -> null;
        };
    }
}
