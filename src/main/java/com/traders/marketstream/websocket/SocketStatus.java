package com.traders.marketstream.websocket;

import java.time.Instant;

public record SocketStatus(
        String name,
        boolean open,
        boolean connecting,
        int subscribers,
        long reconnectDelayMs,
        int earlyFailures,
        String breakerState,
        Instant lastOpenedAt,
        Instant lastMessageAt,
        Instant lastPingAt
) {
}
