package com.traders.marketstream.domain;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

public record SubscriptionReady(
        String subscriptionId,
        String symbol,
        String timeframe,
        List<String> topics,
        JsonNode capabilities
) {
    public SubscriptionReady {
        topics = topics == null ? List.of() : List.copyOf(topics);
    }
}
