package com.traders.marketstream.normalize;

import com.fasterxml.jackson.databind.JsonNode;
import com.traders.marketstream.domain.Bar;
import com.traders.marketstream.domain.DepthLevel;
import com.traders.marketstream.domain.DepthSnapshot;
import com.traders.marketstream.domain.KlineSnapshot;
import com.traders.marketstream.domain.TickerSnapshot;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.traders.marketstream.normalize.JsonValues.field;
import static com.traders.marketstream.normalize.JsonValues.firstNumber;
import static com.traders.marketstream.normalize.JsonValues.firstText;
import static com.traders.marketstream.normalize.JsonValues.number;
import static com.traders.marketstream.normalize.JsonValues.round6;

/**
 * Stateless mapping of depth, ticker and bar wire payloads into canonical snapshots.
 */
public final class MarketNormalizer {
    public static final int MAX_DEPTH_LEVELS = 5;
    private static final double PRICE_EPSILON = 1e-6;

    /** Symbol, timeframe and window to fall back on when a bar payload omits them. */
    public record BarContext(String symbol, String timeframe, long intervalSeconds, long durationSeconds) {
    }

    /** Either a history snapshot or a single live bar, with the resolved context. */
    public record BarEvent(String symbol, String timeframe, long intervalSeconds, long durationSeconds,
                           KlineSnapshot snapshot, Bar bar) {
    }

    private MarketNormalizer() {
    }

    public static DepthSnapshot normalizeDepth(JsonNode payload, String targetSymbol, Instant now) {
        if (!JsonValues.isRecord(payload)) {
            return null;
        }
        String payloadSymbol = firstText(payload, "symbol");
        if (!SymbolRoots.compatible(targetSymbol, payloadSymbol)) {
            return null;
        }
        List<DepthLevel> bids = levels(field(payload, "bids"));
        List<DepthLevel> asks = levels(field(payload, "asks"));

        DepthLevel bestBid = bestLevel(payload, "best_bid", "bestBid",
                firstNumber(payload, "best_bid_price", "bestBidPrice"),
                firstNumber(payload, "best_bid_size", "bestBidSize"));
        DepthLevel bestAsk = bestLevel(payload, "best_ask", "bestAsk",
                firstNumber(payload, "best_ask_price", "bestAskPrice"),
                firstNumber(payload, "best_ask_size", "bestAskSize"));
        addIfAbsent(bids, bestBid);
        addIfAbsent(asks, bestAsk);

        bids.sort(Comparator.comparingDouble(DepthLevel::price).reversed());
        asks.sort(Comparator.comparingDouble(DepthLevel::price));
        List<DepthLevel> topBids = bids.subList(0, Math.min(MAX_DEPTH_LEVELS, bids.size()));
        List<DepthLevel> topAsks = asks.subList(0, Math.min(MAX_DEPTH_LEVELS, asks.size()));

        Double totalBidSize = firstNumber(payload, "total_bid_size", "totalBidSize");
        if (totalBidSize == null && bestBid != null) {
            totalBidSize = bestBid.size();
        }
        Double totalAskSize = firstNumber(payload, "total_ask_size", "totalAskSize");
        if (totalAskSize == null && bestAsk != null) {
            totalAskSize = bestAsk.size();
        }
        if (topBids.isEmpty() && topAsks.isEmpty() && totalBidSize == null && totalAskSize == null) {
            return null;
        }

        DepthLevel topBid = topBids.isEmpty() ? null : topBids.get(0);
        DepthLevel topAsk = topAsks.isEmpty() ? null : topAsks.get(0);
        Double midPrice = firstNumber(payload, "mid_price", "midPrice");
        Double spread = firstNumber(payload, "spread");
        if (midPrice == null && topBid != null && topAsk != null) {
            midPrice = round6((topBid.price() + topAsk.price()) / 2);
        }
        if (spread == null && topBid != null && topAsk != null) {
            spread = round6(Math.abs(topAsk.price() - topBid.price()));
        }

        return DepthSnapshot.builder()
                .symbol(payloadSymbol != null ? payloadSymbol : targetSymbol)
                .bids(topBids)
                .asks(topAsks)
                .midPrice(midPrice)
                .spread(spread)
                .totalBidSize(totalBidSize)
                .totalAskSize(totalAskSize)
                .updatedAt(updatedAt(payload, now))
                .build();
    }

    public static TickerSnapshot normalizeTicker(JsonNode payload, String targetSymbol, Instant now) {
        if (!JsonValues.isRecord(payload)) {
            return null;
        }
        String payloadSymbol = firstText(payload, "symbol");
        if (!SymbolRoots.compatible(targetSymbol, payloadSymbol)) {
            return null;
        }
        Double bid = nonNegative(firstNumber(payload, "bid", "bid_price", "bidPrice"));
        Double ask = nonNegative(firstNumber(payload, "ask", "ask_price", "askPrice"));
        Double last = nonNegative(firstNumber(payload,
                "last", "last_price", "lastPrice", "trade_price", "price", "mark", "mark_price", "markPrice"));
        Double close = nonNegative(firstNumber(payload, "close", "close_price", "closePrice"));

        Double change = last != null && close != null ? last - close : null;
        Double changePercent = change != null && close != 0 ? change / close * 100 : null;
        Double midPrice = firstNumber(payload, "mid_price", "midPrice", "mid");
        if (midPrice == null && bid != null && ask != null) {
            midPrice = round6((bid + ask) / 2);
        }
        Double spread = firstNumber(payload, "spread", "bid_ask_spread", "bidAskSpread");
        if (spread == null && bid != null && ask != null) {
            spread = Math.abs(ask - bid);
        }

        return TickerSnapshot.builder()
                .symbol(payloadSymbol != null ? payloadSymbol : targetSymbol)
                .bid(bid)
                .ask(ask)
                .last(last)
                .close(close)
                .midPrice(nonNegative(midPrice))
                .spread(spread)
                .change(change)
                .changePercent(changePercent)
                .lastSize(firstNumber(payload, "last_size", "lastSize"))
                .updatedAt(updatedAt(payload, now))
                .build();
    }

    public static BarEvent normalizeBarEvent(JsonNode payload, BarContext context) {
        if (!JsonValues.isRecord(payload)) {
            return null;
        }
        JsonNode metadata = JsonValues.record(payload, "metadata");
        String symbol = firstText(payload, "symbol");
        if (symbol == null) {
            symbol = context.symbol();
        }
        String timeframe = firstText(payload, "timeframe");
        if (timeframe == null) {
            timeframe = firstText(metadata, "timeframe");
        }
        if (timeframe == null) {
            timeframe = context.timeframe();
        }
        long interval = firstLong(context.intervalSeconds(),
                firstNumber(payload, "interval_seconds", "intervalSeconds"),
                firstNumber(metadata, "interval_seconds", "intervalSeconds"));
        long duration = firstLong(context.durationSeconds(),
                firstNumber(payload, "duration_seconds", "durationSeconds", "duration"),
                firstNumber(metadata, "duration_seconds", "durationSeconds"));

        JsonNode barsNode = field(payload, "bars");
        if (barsNode != null && barsNode.isArray() && !barsNode.isEmpty()) {
            List<Bar> bars = new ArrayList<>();
            barsNode.forEach(item -> {
                Bar bar = mapBar(item);
                if (bar != null) {
                    bars.add(bar);
                }
            });
            List<Bar> deduped = dedupeBars(bars);
            if (!deduped.isEmpty()) {
                KlineSnapshot snapshot = KlineSnapshot.builder()
                        .symbol(symbol == null ? "" : symbol)
                        .timeframe(timeframe == null ? "" : timeframe)
                        .intervalSeconds(interval)
                        .durationSeconds(duration)
                        .bars(deduped)
                        .end(deduped.get(deduped.size() - 1).timestamp())
                        .build();
                return new BarEvent(symbol, timeframe, interval, duration, snapshot, null);
            }
        }

        Bar single = mapBar(field(payload, "bar"));
        if (single == null) {
            single = mapBar(payload);
        }
        return single == null ? null : new BarEvent(symbol, timeframe, interval, duration, null, single);
    }

    /**
     * Maps one bar. A bar without a parsable timestamp is dropped; missing prices fall back to the open.
     */
    public static Bar mapBar(JsonNode node) {
        if (!JsonValues.isRecord(node)) {
            return null;
        }
        Instant timestamp = Timestamps.toUtc(firstPresent(node, "timestamp", "time", "t", "start"));
        if (timestamp == null) {
            return null;
        }
        double open = orDefault(number(field(node, "open")), 0d);
        double high = orDefault(number(field(node, "high")), open);
        double low = orDefault(number(field(node, "low")), open);
        double close = orDefault(number(field(node, "close")), open);
        return new Bar(timestamp, open, high, low, close, number(field(node, "volume")));
    }

    /**
     * Collapses bars sharing a timestamp, keeping the last one seen, and sorts ascending.
     */
    public static List<Bar> dedupeBars(Collection<Bar> bars) {
        Map<Instant, Bar> merged = new LinkedHashMap<>();
        for (Bar bar : bars) {
            if (bar != null && bar.timestamp() != null) {
                merged.put(bar.timestamp(), bar);
            }
        }
        List<Bar> result = new ArrayList<>(merged.values());
        result.sort(Comparator.comparing(Bar::timestamp));
        return result;
    }

    private static List<DepthLevel> levels(JsonNode node) {
        List<DepthLevel> result = new ArrayList<>();
        if (node == null || !node.isArray()) {
            return result;
        }
        for (JsonNode level : node) {
            Double price;
            Double size;
            if (level.isArray() && level.size() >= 2) {
                price = number(level.get(0));
                size = number(level.get(1));
            } else {
                price = number(field(level, "price"));
                size = number(field(level, "size"));
            }
            if (price != null && size != null) {
                result.add(new DepthLevel(price, size));
            }
        }
        return result;
    }

    private static DepthLevel bestLevel(JsonNode payload, String snakeKey, String camelKey,
                                        Double fallbackPrice, Double fallbackSize) {
        JsonNode level = JsonValues.record(payload, snakeKey);
        if (level == null) {
            level = JsonValues.record(payload, camelKey);
        }
        Double price = fallbackPrice;
        Double size = fallbackSize;
        if (level != null) {
            price = orDefault(number(field(level, "price")), fallbackPrice);
            size = orDefault(number(field(level, "size")), fallbackSize);
        }
        return price == null || size == null ? null : new DepthLevel(price, size);
    }

    private static void addIfAbsent(List<DepthLevel> levels, DepthLevel candidate) {
        if (candidate == null) {
            return;
        }
        boolean exists = levels.stream().anyMatch(level -> Math.abs(level.price() - candidate.price()) < PRICE_EPSILON);
        if (!exists) {
            levels.add(0, candidate);
        }
    }

    private static Instant updatedAt(JsonNode payload, Instant now) {
        Instant parsed = Timestamps.toUtc(firstPresent(payload, "timestamp", "updated_at", "updatedAt"));
        return parsed != null ? parsed : now;
    }

    private static JsonNode firstPresent(JsonNode node, String... keys) {
        for (String key : keys) {
            JsonNode value = field(node, key);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static long firstLong(long fallback, Double... candidates) {
        for (Double candidate : candidates) {
            if (candidate != null) {
                return Math.round(candidate);
            }
        }
        return fallback;
    }

    private static Double nonNegative(Double value) {
        return value == null || value < 0 ? null : value;
    }

    private static <T> T orDefault(T value, T fallback) {
        return value != null ? value : fallback;
    }
}
