// com.traders.marketstream.domain.KlineSnapshot
package com.traders.marketstream.domain;

import lombok.Builder;

import java.time.Instant;
import java.util.List;

/**
 * A bar history for one symbol and timeframe. Bars are unique by timestamp and sorted ascending.
 */
@Builder(toBuilder = true)
public record KlineSnapshot(
        String symbol,
        String timeframe,
        Long intervalSeconds,
        Long durationSeconds,
        List<Bar> bars,
        Instant end
) {
    public KlineSnapshot {
        bars = bars == null ? List.of() : List.copyOf(bars);
    }
}
