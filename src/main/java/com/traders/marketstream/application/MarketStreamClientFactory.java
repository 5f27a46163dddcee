package com.traders.marketstream.application;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.traders.marketstream.backfill.BackfillProgressClient;
import com.traders.marketstream.backfill.BackfillProgressListener;
import com.traders.marketstream.client.ClientSettings;
import com.traders.marketstream.client.ClientStatus;
import com.traders.marketstream.client.MarketClientOptions;
import com.traders.marketstream.client.MarketRealtimeClient;
import com.traders.marketstream.telemetry.MarketTelemetry;
import com.traders.marketstream.websocket.WebSocketHub;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;

/**
 * Entry point for hosts: creates clients wired to the shared hub and keeps track of them so
 * management operations can reach every live client.
 */
@Slf4j
public class MarketStreamClientFactory {
    @Getter
    private final WebSocketHub hub;
    private final MarketTelemetry telemetry;
    private final ObjectMapper objectMapper;
    private final ClientSettings clientSettings;
    private final List<MarketRealtimeClient> clients = new CopyOnWriteArrayList<>();

    public MarketStreamClientFactory(WebSocketHub hub, MarketTelemetry telemetry, ObjectMapper objectMapper,
                                     ClientSettings clientSettings) {
        this.hub = hub;
        this.telemetry = telemetry;
        this.objectMapper = objectMapper;
        this.clientSettings = clientSettings;
    }

    /**
     * Creates an unstarted client. Call {@link MarketRealtimeClient#connect()} to start it and
     * {@link #release(MarketRealtimeClient)} when done.
     */
    public MarketRealtimeClient create(MarketClientOptions options) {
        MarketRealtimeClient client = new MarketRealtimeClient(hub, telemetry, objectMapper, options, clientSettings);
        clients.add(client);
        log.debug("Created market data client, {} registered", clients.size());
        return client;
    }

    public void release(MarketRealtimeClient client) {
        if (clients.remove(client)) {
            client.disconnect();
        }
    }

    /**
     * Subscribes to progress of one backfill job. The returned client is already started.
     */
    public BackfillProgressClient watchBackfill(String jobId, Supplier<String> tokenProvider,
                                                BackfillProgressListener listener) {
        BackfillProgressClient client = new BackfillProgressClient(hub, objectMapper, jobId, tokenProvider, listener);
        client.start();
        return client;
    }

    /** Forces every registered client to drop its socket and reconnect. */
    public int reconnectAll() {
        clients.forEach(client -> client.connect(true));
        log.info("Forced reconnect of {} market data client(s)", clients.size());
        return clients.size();
    }

    public List<CompletableFuture<ClientStatus>> clientStatuses() {
        return clients.stream().map(MarketRealtimeClient::status).toList();
    }

    public int clientCount() {
        return clients.size();
    }
}
