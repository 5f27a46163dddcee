package com.traders.marketstream.websocket;

import java.time.Duration;

public record HubSettings(
        String baseUrl,
        String defaultPath,
        Duration reconnectBase,
        Duration reconnectMax,
        Duration failureCooldown,
        int maxEarlyFailures,
        Duration pingInterval
) {
    public static final String DEFAULT_PATH = "/ws/events";

    public HubSettings {
        if (baseUrl == null) baseUrl = "ws://localhost:8080";
        if (defaultPath == null) defaultPath = DEFAULT_PATH;
        if (reconnectBase == null) reconnectBase = Duration.ofSeconds(5);
        if (reconnectMax == null) reconnectMax = Duration.ofSeconds(60);
        if (failureCooldown == null) failureCooldown = Duration.ofSeconds(60);
        if (maxEarlyFailures <= 0) maxEarlyFailures = 3;
        if (pingInterval == null) pingInterval = Duration.ofSeconds(30);
    }

    public static HubSettings defaults(String baseUrl) {
        return new HubSettings(baseUrl, null, null, null, null, 0, null);
    }
}
