package com.traders.marketstream.client;

import com.traders.marketstream.domain.ConnectionState;

import java.time.Instant;
import java.util.List;

/**
 * Point-in-time view of a client, read on its event loop.
 */
public record ClientStatus(
        boolean started,
        ConnectionState state,
        String symbol,
        String timeframe,
        List<String> topics,
        String subscriptionId,
        boolean confirmed,
        int reconnectAttempt,
        Instant lastActivityAt
) {
    public ClientStatus {
        topics = topics == null ? List.of() : List.copyOf(topics);
    }
}
