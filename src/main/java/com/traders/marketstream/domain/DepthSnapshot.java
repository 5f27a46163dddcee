// com.traders.marketstream.domain.DepthSnapshot
package com.traders.marketstream.domain;

import lombok.Builder;

import java.time.Instant;
import java.util.List;

/**
 * Top of book: bids by price descending, asks ascending, at most five levels a side.
 */
@Builder(toBuilder = true)
public record DepthSnapshot(
        String symbol,
        List<DepthLevel> bids,
        List<DepthLevel> asks,
        Double midPrice,
        Double spread,
        Double totalBidSize,
        Double totalAskSize,
        Instant updatedAt
) {
    public DepthSnapshot {
        bids = bids == null ? List.of() : List.copyOf(bids);
        asks = asks == null ? List.of() : List.copyOf(asks);
    }

    public DepthLevel bestBid() {
        return bids.isEmpty() ? null : bids.get(0);
    }

    public DepthLevel bestAsk() {
        return asks.isEmpty() ? null : asks.get(0);
    }
}
