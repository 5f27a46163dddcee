package com.traders.marketstream.config;

import com.traders.marketstream.client.ClientSettings;
import com.traders.marketstream.websocket.HubSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "market.stream")
public record MarketStreamProperties(
    String baseUrl,
    String path,
    Duration hubReconnectBase,
    Duration hubReconnectMax,
    Duration failureCooldown,
    int maxEarlyFailures,
    Duration pingInterval,
    Duration clientReconnectBase,
    Duration clientReconnectMax,
    Duration heartbeatCheckInterval,
    Duration heartbeatTimeout
) {
    public MarketStreamProperties {
        if (baseUrl == null) baseUrl = "ws://localhost:8080";
        if (path == null) path = HubSettings.DEFAULT_PATH;
        if (hubReconnectBase == null) hubReconnectBase = Duration.ofSeconds(5);
        if (hubReconnectMax == null) hubReconnectMax = Duration.ofSeconds(60);
        if (failureCooldown == null) failureCooldown = Duration.ofSeconds(60);
        if (maxEarlyFailures <= 0) maxEarlyFailures = 3;
        if (pingInterval == null) pingInterval = Duration.ofSeconds(30);
        if (clientReconnectBase == null) clientReconnectBase = Duration.ofSeconds(1);
        if (clientReconnectMax == null) clientReconnectMax = Duration.ofSeconds(30);
        if (heartbeatCheckInterval == null) heartbeatCheckInterval = Duration.ofSeconds(10);
        if (heartbeatTimeout == null) heartbeatTimeout = Duration.ofSeconds(40);
    }

    public HubSettings hubSettings() {
        return new HubSettings(baseUrl, path, hubReconnectBase, hubReconnectMax, failureCooldown,
                maxEarlyFailures, pingInterval);
    }

    public ClientSettings clientSettings() {
        return new ClientSettings(clientReconnectBase, clientReconnectMax, heartbeatCheckInterval, heartbeatTimeout);
    }
}
