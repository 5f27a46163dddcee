package com.traders.marketstream.telemetry;

import io.micrometer.core.instrument.MeterRegistry;

public class MicrometerTelemetrySink implements TelemetrySink {
    static final String METRIC_NAME = "market.stream.events";

    private final MeterRegistry meterRegistry;

    public MicrometerTelemetrySink(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @Override
    public void record(MarketMetricEvent event) {
        meterRegistry.counter(METRIC_NAME, "type", event.type()).increment();
    }
}
