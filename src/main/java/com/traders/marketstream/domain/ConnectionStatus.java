package com.traders.marketstream.domain;

import java.time.Instant;

public record ConnectionStatus(ConnectionState state, String reason, Instant at) {

    public static ConnectionStatus of(ConnectionState state, Instant at) {
        return new ConnectionStatus(state, null, at);
    }
}
