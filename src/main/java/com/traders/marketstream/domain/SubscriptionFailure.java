package com.traders.marketstream.domain;

import java.util.List;

public record SubscriptionFailure(String symbol, String timeframe, List<String> topics, String error) {
    public SubscriptionFailure {
        topics = topics == null ? List.of() : List.copyOf(topics);
    }
}
