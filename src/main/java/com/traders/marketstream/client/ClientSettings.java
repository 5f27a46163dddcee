package com.traders.marketstream.client;

import java.time.Duration;

/**
 * Timing of the client's own reconnect backoff and application heartbeat.
 */
public record ClientSettings(
        Duration reconnectBase,
        Duration reconnectMax,
        Duration heartbeatCheckInterval,
        Duration heartbeatTimeout
) {
    public static final ClientSettings DEFAULTS = new ClientSettings(null, null, null, null);

    public ClientSettings {
        if (reconnectBase == null) reconnectBase = Duration.ofSeconds(1);
        if (reconnectMax == null) reconnectMax = Duration.ofSeconds(30);
        if (heartbeatCheckInterval == null) heartbeatCheckInterval = Duration.ofSeconds(10);
        if (heartbeatTimeout == null) heartbeatTimeout = Duration.ofSeconds(40);
    }

    /**
     * {@code min(max, base * 2^(attempt - 1))} for attempts starting at 1.
     */
    public Duration reconnectDelay(int attempt) {
        int exponent = Math.max(0, Math.min(attempt - 1, 30));
        Duration delay = reconnectBase.multipliedBy(1L << exponent);
        return delay.compareTo(reconnectMax) > 0 ? reconnectMax : delay;
    }
}
