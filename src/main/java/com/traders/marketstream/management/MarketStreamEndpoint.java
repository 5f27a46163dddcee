package com.traders.marketstream.management;

import com.traders.marketstream.application.MarketStreamClientFactory;
import com.traders.marketstream.client.ClientStatus;
import com.traders.marketstream.websocket.SocketStatus;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import org.springframework.boot.actuate.endpoint.annotation.Endpoint;
import org.springframework.boot.actuate.endpoint.annotation.ReadOperation;
import org.springframework.boot.actuate.endpoint.annotation.WriteOperation;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

@Component
@Endpoint(id = "marketstream")
public class MarketStreamEndpoint {

    private final MarketStreamClientFactory clientFactory;
    private final MeterRegistry meterRegistry;

    private final AtomicInteger socketCountGauge = new AtomicInteger(0);
    private final AtomicInteger openSocketCountGauge = new AtomicInteger(0);
    private final AtomicInteger clientCountGauge = new AtomicInteger(0);

    public MarketStreamEndpoint(MarketStreamClientFactory clientFactory, MeterRegistry meterRegistry) {
        this.clientFactory = clientFactory;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void initMetrics() {
        meterRegistry.gauge("market.stream.sockets", socketCountGauge);
        meterRegistry.gauge("market.stream.sockets.open", openSocketCountGauge);
        meterRegistry.gauge("market.stream.clients", clientCountGauge);
    }

    @ReadOperation
    public StreamStatus getStreamStatus() {
        List<SocketStatus> sockets = clientFactory.getHub().getLoop()
                .submit(clientFactory.getHub()::status)
                .join();
        List<ClientStatus> clients = clientFactory.clientStatuses().stream()
                .map(CompletableFuture::join)
                .toList();

        socketCountGauge.set(sockets.size());
        openSocketCountGauge.set((int) sockets.stream().filter(SocketStatus::open).count());
        clientCountGauge.set(clients.size());

        return new StreamStatus(sockets.size(), sockets, clients);
    }

    @WriteOperation
    public ReconnectResult reconnect() {
        int clients = clientFactory.reconnectAll();
        return new ReconnectResult(clients);
    }

    @Data
    public static class StreamStatus {
        private final int totalSockets;
        private final List<SocketStatus> sockets;
        private final List<ClientStatus> clients;
    }

    @Data
    public static class ReconnectResult {
        private final int reconnectedClients;
    }
}
