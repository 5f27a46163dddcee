package com.traders.marketstream.telemetry;

@FunctionalInterface
public interface TelemetrySink {
    void record(MarketMetricEvent event);
}
