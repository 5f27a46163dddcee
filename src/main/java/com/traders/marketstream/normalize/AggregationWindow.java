package com.traders.marketstream.normalize;

import java.util.Locale;
import java.util.Map;

/**
 * Bar interval and history window per chart timeframe. Unknown timeframes use the 5m window.
 */
public record AggregationWindow(long intervalSeconds, long durationSeconds) {

    public static final AggregationWindow DEFAULT = new AggregationWindow(300, 21_600);

    private static final Map<String, AggregationWindow> WINDOWS = Map.of(
            "1m", new AggregationWindow(60, 3_600),
            "5m", DEFAULT,
            "15m", new AggregationWindow(900, 86_400),
            "1h", new AggregationWindow(3_600, 604_800),
            "4h", new AggregationWindow(14_400, 2_592_000),
            "1d", new AggregationWindow(86_400, 15_552_000)
    );

    public static AggregationWindow resolve(String timeframe) {
        if (timeframe == null) {
            return DEFAULT;
        }
        return WINDOWS.getOrDefault(timeframe.trim().toLowerCase(Locale.ROOT), DEFAULT);
    }
}
