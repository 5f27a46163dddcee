package com.traders.marketstream.telemetry;

import com.traders.marketstream.domain.ConnectionState;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MarketTelemetryTest {

    private static final Instant AT = Instant.parse("2024-01-01T00:00:00Z");

    @Test
    @DisplayName("Every sink receives every event until it unsubscribes")
    void fanOut() {
        MarketTelemetry telemetry = new MarketTelemetry();
        List<MarketMetricEvent> first = new ArrayList<>();
        List<MarketMetricEvent> second = new ArrayList<>();
        Runnable unsubscribeFirst = telemetry.subscribe(first::add);
        telemetry.subscribe(second::add);

        MarketMetricEvent opened = new MarketMetricEvent.SocketOpened(AT, 0, Duration.ofMillis(120));
        telemetry.emit(opened);
        unsubscribeFirst.run();
        telemetry.emit(new MarketMetricEvent.SocketError(AT, "reset by peer"));

        assertEquals(List.of(opened), first);
        assertEquals(2, second.size());
        assertEquals(1, telemetry.sinkCount());
    }

    @Test
    @DisplayName("A failing sink does not stop delivery to the others")
    void failingSinkIsSkipped() {
        MarketTelemetry telemetry = new MarketTelemetry();
        List<MarketMetricEvent> received = new ArrayList<>();
        telemetry.subscribe(event -> {
            throw new IllegalStateException("sink down");
        });
        telemetry.subscribe(received::add);

        assertDoesNotThrow(() -> telemetry.emit(new MarketMetricEvent.SocketClosed(AT, "manual", null)));
        assertEquals(1, received.size());
    }

    @Test
    @DisplayName("The Micrometer sink counts events by type")
    void micrometerSinkCounts() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        MarketTelemetry telemetry = new MarketTelemetry();
        telemetry.subscribe(new MicrometerTelemetrySink(registry));

        telemetry.emit(new MarketMetricEvent.ConnectionStatusChanged(AT, ConnectionState.CONNECTING, null));
        telemetry.emit(new MarketMetricEvent.ConnectionStatusChanged(AT, ConnectionState.CONNECTED, null));
        telemetry.emit(new MarketMetricEvent.ReconnectScheduled(AT, "socket-close", 1, Duration.ofSeconds(1)));

        assertEquals(2.0, registry.get(MicrometerTelemetrySink.METRIC_NAME)
                .tag("type", "market.realtime.connection_status").counter().count());
        assertEquals(1.0, registry.get(MicrometerTelemetrySink.METRIC_NAME)
                .tag("type", "market.realtime.reconnect_scheduled").counter().count());
    }
}
