package com.traders.marketstream.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.traders.marketstream.domain.KlineSnapshot;
import com.traders.marketstream.normalize.HistoricalBars;
import lombok.extern.slf4j.Slf4j;

import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Applies the snapshot a server may embed in a subscribe ACK so consumers start from a full picture
 * instead of waiting for the first live event of every kind.
 */
@Slf4j
class AckSnapshotIngestor {
    static final List<String> DEPTH_KEYS = List.of(
            "market.dom", "market.depth", "depth", "dom", "depthSnapshot", "latest_dom", "latestDom");
    static final List<String> TICKER_KEYS = List.of(
            "market.ticker", "ticker", "tickerSnapshot", "latest_ticker", "latestTicker");
    static final List<String> HISTORY_KEYS = List.of("historical_bars", "historicalBars");
    static final List<String> BAR_KEYS = List.of("market.bar", "bar", "barSnapshot", "latestBar", "latest_bar");
    static final List<String> KLINE_KEYS = List.of("kline", "klineSnapshot", "market.kline");
    static final List<String> AVAILABILITY_KEYS = List.of("availability", "marketAvailability", "market.availability");
    private static final List<String> CONTEXT_KEYS = List.of("metadata", "context");

    /**
     * What the ingestor forwards to. Implemented by the client, which owns normalization and
     * listener delivery.
     */
    interface Target {
        void applyDepth(JsonNode value);

        void applyTicker(JsonNode value);

        void applyBar(JsonNode value);

        void applyHistory(KlineSnapshot snapshot);

        void clearHistory();

        void applyAvailability(JsonNode value);

        String symbol();

        String timeframe();

        Long requestedDuration();
    }

    record Result(boolean depthApplied, boolean tickerApplied, boolean barApplied, boolean historyApplied) {
        static final Result NONE = new Result(false, false, false, false);
    }

    private final Target target;

    AckSnapshotIngestor(Target target) {
        this.target = target;
    }

    Result ingest(JsonNode snapshot) {
        if (snapshot == null || !snapshot.isObject()) {
            return Result.NONE;
        }
        HistoricalBars.Context context = historyContext(snapshot);
        boolean depthApplied = false;
        boolean tickerApplied = false;
        boolean barApplied = false;
        boolean historyApplied = false;

        JsonNode depth = pick(snapshot, DEPTH_KEYS);
        if (depth != null) {
            log.debug("Applying depth snapshot from subscribe ACK");
            target.applyDepth(depth);
            depthApplied = true;
        }
        JsonNode ticker = pick(snapshot, TICKER_KEYS);
        if (ticker != null) {
            log.debug("Applying ticker snapshot from subscribe ACK");
            target.applyTicker(ticker);
            tickerApplied = true;
        }
        JsonNode history = pick(snapshot, HISTORY_KEYS);
        if (history != null) {
            historyApplied = applyHistory(history, context);
        }
        JsonNode bar = pick(snapshot, BAR_KEYS);
        if (bar != null) {
            if (!historyApplied) {
                log.debug("Seeding bar history from the latest bar of a subscribe ACK");
                historyApplied = applyHistory(bar, context);
            }
            target.applyBar(bar);
            barApplied = true;
        }
        JsonNode kline = pick(snapshot, KLINE_KEYS);
        if (kline != null) {
            if (kline.isNull()) {
                target.clearHistory();
            } else if (applyHistory(kline, context)) {
                historyApplied = true;
            } else {
                log.debug("Kline snapshot in subscribe ACK held no usable bars");
            }
        }
        JsonNode availability = pick(snapshot, AVAILABILITY_KEYS);
        if (availability != null) {
            target.applyAvailability(availability);
        }
        return new Result(depthApplied, tickerApplied, barApplied, historyApplied);
    }

    /**
     * Looks up the first alias present. Each alias matches exactly, then case-insensitively, then as
     * a prefix followed by one of {@code - : . _}, e.g. {@code market.ticker-ES}.
     *
     * @return the value (possibly a JSON null), or {@code null} when no alias is present
     */
    static JsonNode pick(JsonNode snapshot, List<String> keys) {
        for (String key : keys) {
            if (snapshot.has(key)) {
                return snapshot.get(key);
            }
            String normalizedKey = key.trim().toLowerCase(Locale.ROOT);
            Iterator<Map.Entry<String, JsonNode>> fields = snapshot.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> entry = fields.next();
                String candidate = entry.getKey().trim().toLowerCase(Locale.ROOT);
                if (candidate.isEmpty()) {
                    continue;
                }
                if (candidate.equals(normalizedKey) || isQualified(candidate, normalizedKey)) {
                    return entry.getValue();
                }
            }
        }
        return null;
    }

    private static boolean isQualified(String candidate, String key) {
        if (candidate.length() <= key.length() || !candidate.startsWith(key)) {
            return false;
        }
        char separator = candidate.charAt(key.length());
        return separator == '-' || separator == ':' || separator == '.' || separator == '_';
    }

    private boolean applyHistory(JsonNode value, HistoricalBars.Context context) {
        KlineSnapshot snapshot = HistoricalBars.collect(value, context);
        if (snapshot == null) {
            return false;
        }
        log.debug("Applying {} historical bars for {} from subscribe ACK", snapshot.bars().size(), snapshot.symbol());
        target.applyHistory(snapshot);
        return true;
    }

    private HistoricalBars.Context historyContext(JsonNode snapshot) {
        HistoricalBars.Context context = new HistoricalBars.Context();
        context.applyFrom(snapshot);
        JsonNode nested = pick(snapshot, CONTEXT_KEYS);
        if (nested != null && nested.isObject()) {
            context.applyFrom(nested);
        }
        context.fillDefaults(target.symbol(), target.timeframe(), target.requestedDuration());
        return context;
    }
}
