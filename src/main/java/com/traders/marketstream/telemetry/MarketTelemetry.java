package com.traders.marketstream.telemetry;

import com.traders.marketstream.util.Subject;
import lombok.extern.slf4j.Slf4j;

/**
 * Fire-and-forget fan-out of client metric events. A failing sink is logged and skipped.
 */
@Slf4j
public class MarketTelemetry {
    private final Subject<MarketMetricEvent> events = new Subject<>();

    /**
     * @return a handle that unregisters the sink
     */
    public Runnable subscribe(TelemetrySink sink) {
        return events.subscribe(sink::record);
    }

    public void emit(MarketMetricEvent event) {
        log.debug("{} {}", event.type(), event);
        events.notifyObservers(event);
    }

    public int sinkCount() {
        return events.observerCount();
    }
}
