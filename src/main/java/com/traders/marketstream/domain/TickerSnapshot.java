// com.traders.marketstream.domain.TickerSnapshot
package com.traders.marketstream.domain;

import lombok.Builder;

import java.time.Instant;

@Builder(toBuilder = true)
public record TickerSnapshot(
        String symbol,
        Double bid,
        Double ask,
        Double last,
        Double close,
        Double midPrice,
        Double spread,
        Double change,
        Double changePercent,
        Double lastSize,
        Instant updatedAt
) {
}
