package com.traders.marketstream.domain;

import java.time.Instant;
import java.util.List;

/**
 * The symbol, timeframe and ordered topic set of one subscribe request.
 */
public record SubscriptionDescriptor(String symbol, String timeframe, List<String> topics, Instant requestedAt) {
    public SubscriptionDescriptor {
        topics = topics == null ? List.of() : List.copyOf(topics);
    }
}
