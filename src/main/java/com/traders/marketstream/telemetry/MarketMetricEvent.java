package com.traders.marketstream.telemetry;

import com.traders.marketstream.domain.ConnectionState;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

public sealed interface MarketMetricEvent {

    String type();

    Instant at();

    record ConnectionStatusChanged(Instant at, ConnectionState state, String reason) implements MarketMetricEvent {
        public String type() {
            return "market.realtime.connection_status";
        }
    }

    record SubscribeRequested(Instant at, String symbol, String timeframe, List<String> topics) implements MarketMetricEvent {
        public String type() {
            return "market.realtime.subscribe.requested";
        }
    }

    record SubscribeAcknowledged(Instant at, String subscriptionId, String symbol, String timeframe,
                                 List<String> topics, Duration latency) implements MarketMetricEvent {
        public String type() {
            return "market.realtime.subscribe.ack";
        }
    }

    record SubscribeFailed(Instant at, String symbol, String timeframe, List<String> topics,
                           String error) implements MarketMetricEvent {
        public String type() {
            return "market.realtime.subscribe.failed";
        }
    }

    record ReconnectScheduled(Instant at, String reason, int attempt, Duration delay) implements MarketMetricEvent {
        public String type() {
            return "market.realtime.reconnect_scheduled";
        }
    }

    record HeartbeatTimeout(Instant at, Duration inactivity, String symbol, String timeframe,
                            List<String> topics) implements MarketMetricEvent {
        public String type() {
            return "market.realtime.heartbeat_timeout";
        }
    }

    record SocketOpened(Instant at, int attempt, Duration latency) implements MarketMetricEvent {
        public String type() {
            return "market.realtime.socket.opened";
        }
    }

    record SocketClosed(Instant at, String reason, Integer code) implements MarketMetricEvent {
        public String type() {
            return "market.realtime.socket.closed";
        }
    }

    record SocketError(Instant at, String message) implements MarketMetricEvent {
        public String type() {
            return "market.realtime.socket.error";
        }
    }
}
