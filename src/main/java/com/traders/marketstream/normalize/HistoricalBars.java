package com.traders.marketstream.normalize;

import com.fasterxml.jackson.databind.JsonNode;
import com.traders.marketstream.domain.Bar;
import com.traders.marketstream.domain.KlineSnapshot;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static com.traders.marketstream.normalize.JsonValues.field;
import static com.traders.marketstream.normalize.JsonValues.firstNumber;
import static com.traders.marketstream.normalize.JsonValues.firstText;
import static com.traders.marketstream.normalize.JsonValues.isRecord;
import static com.traders.marketstream.normalize.JsonValues.number;

/**
 * Extracts a bar history from the loosely shaped history payloads embedded in subscribe ACKs:
 * a bare array, a record holding arrays or single bars, or a record that is itself a bar.
 */
public final class HistoricalBars {
    private static final String[] ARRAY_KEYS = {"historical_bars", "historicalBars", "bars", "items"};
    private static final String[] SINGLE_KEYS = {"bar", "latest_bar", "latestBar", "snapshot"};
    private static final String[] PRICE_KEYS = {"open", "close", "high", "low"};

    /**
     * Symbol, timeframe and window of a history. Symbol and timeframe are only filled while unset;
     * interval and duration take the last value seen.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Context {
        private String symbol;
        private String timeframe;
        private Long intervalSeconds;
        private Long durationSeconds;

        public Context copy() {
            return new Context(symbol, timeframe, intervalSeconds, durationSeconds);
        }

        public void applyFrom(JsonNode record) {
            if (!isRecord(record)) {
                return;
            }
            String symbolCandidate = firstText(record, "symbol");
            if (symbolCandidate != null && symbol == null) {
                symbol = symbolCandidate;
            }
            String timeframeCandidate = firstText(record, "timeframe", "time_frame");
            if (timeframeCandidate != null && timeframe == null) {
                timeframe = timeframeCandidate;
            }
            Long interval = JsonValues.wholeNumber(firstNumber(record, "interval_seconds", "intervalSeconds"));
            if (interval != null) {
                intervalSeconds = interval;
            }
            Long duration = JsonValues.wholeNumber(
                    firstNumber(record, "duration_seconds", "durationSeconds", "duration"));
            if (duration != null) {
                durationSeconds = duration;
            }
        }

        /**
         * Fills whatever the payload left open from the subscription and the timeframe's window.
         */
        public void fillDefaults(String defaultSymbol, String defaultTimeframe, Long requestedDuration) {
            if (symbol == null) {
                symbol = defaultSymbol;
            }
            if (timeframe == null) {
                timeframe = defaultTimeframe;
            }
            AggregationWindow window = AggregationWindow.resolve(timeframe);
            if (intervalSeconds == null || intervalSeconds == 0) {
                intervalSeconds = window.intervalSeconds();
            }
            if (durationSeconds == null || durationSeconds == 0) {
                durationSeconds = requestedDuration != null ? requestedDuration : window.durationSeconds();
            }
        }
    }

    private HistoricalBars() {
    }

    /**
     * @return the deduplicated, ascending history, or {@code null} when the payload holds no usable bar
     */
    public static KlineSnapshot collect(JsonNode data, Context base) {
        if (data == null) {
            return null;
        }
        Context context = base.copy();
        List<JsonNode> candidates = new ArrayList<>();
        if (data.isArray()) {
            data.forEach(candidates::add);
        } else if (data.isObject()) {
            enqueueFromRecord(data, context, candidates);
        } else {
            return null;
        }

        List<Bar> bars = new ArrayList<>();
        for (JsonNode candidate : candidates) {
            Bar bar = mapHistoricalBar(candidate);
            if (bar != null) {
                bars.add(bar);
            }
        }
        List<Bar> ordered = MarketNormalizer.dedupeBars(bars);
        if (ordered.isEmpty()) {
            return null;
        }
        return KlineSnapshot.builder()
                .symbol(context.getSymbol() == null ? "" : context.getSymbol())
                .timeframe(context.getTimeframe() == null ? "" : context.getTimeframe())
                .intervalSeconds(context.getIntervalSeconds())
                .durationSeconds(context.getDurationSeconds())
                .bars(ordered)
                .end(ordered.get(ordered.size() - 1).timestamp())
                .build();
    }

    /**
     * Open falls back to close, then 0. High and low are widened to cover open and close.
     */
    public static Bar mapHistoricalBar(JsonNode node) {
        if (!isRecord(node)) {
            return null;
        }
        Instant timestamp = Timestamps.toUtc(field(node, "timestamp"));
        if (timestamp == null) {
            return null;
        }
        Double closeValue = number(field(node, "close"));
        double open = firstNonNull(number(field(node, "open")), closeValue, 0d);
        double close = closeValue != null ? closeValue : open;
        double high = firstNonNull(number(field(node, "high")), open, open);
        double low = firstNonNull(number(field(node, "low")), open, open);
        return new Bar(
                timestamp,
                open,
                Math.max(high, Math.max(open, close)),
                Math.min(low, Math.min(open, close)),
                close,
                number(field(node, "volume")));
    }

    private static void enqueueFromRecord(JsonNode record, Context context, List<JsonNode> candidates) {
        context.applyFrom(record);
        boolean foundContainer = false;
        for (String key : ARRAY_KEYS) {
            JsonNode array = field(record, key);
            if (array != null && array.isArray()) {
                array.forEach(candidates::add);
                foundContainer = true;
            }
        }
        for (String key : SINGLE_KEYS) {
            JsonNode single = field(record, key);
            if (isRecord(single)) {
                candidates.add(single);
                foundContainer = true;
            }
        }
        if (!foundContainer && looksLikeBar(record)) {
            candidates.add(record);
        }
        JsonNode metadata = JsonValues.record(record, "metadata");
        if (metadata != null) {
            context.applyFrom(metadata);
            JsonNode bars = field(metadata, "bars");
            if (bars != null && bars.isArray()) {
                bars.forEach(candidates::add);
            }
            JsonNode bar = field(metadata, "bar");
            if (isRecord(bar)) {
                candidates.add(bar);
            }
        }
    }

    private static boolean looksLikeBar(JsonNode record) {
        JsonNode timestamp = record.get("timestamp");
        if (timestamp == null || !timestamp.isTextual()) {
            return false;
        }
        for (String key : PRICE_KEYS) {
            if (record.has(key)) {
                return true;
            }
        }
        return false;
    }

    private static double firstNonNull(Double first, Double second, double fallback) {
        if (first != null) {
            return first;
        }
        return second != null ? second : fallback;
    }
}
