package com.traders.marketstream.normalize;

import com.traders.marketstream.domain.Bar;
import com.traders.marketstream.domain.KlineSnapshot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static com.traders.marketstream.normalize.MarketNormalizerTest.json;
import static org.junit.jupiter.api.Assertions.*;

class HistoricalBarsTest {

    private static HistoricalBars.Context defaults() {
        HistoricalBars.Context context = new HistoricalBars.Context();
        context.fillDefaults("ES", "1m", null);
        return context;
    }

    @Test
    @DisplayName("Context defaults come from the timeframe window unless a duration was requested")
    void contextDefaults() {
        HistoricalBars.Context context = new HistoricalBars.Context();
        context.fillDefaults("ES", "1h", null);
        assertEquals(3600L, context.getIntervalSeconds());
        assertEquals(604_800L, context.getDurationSeconds());

        HistoricalBars.Context requested = new HistoricalBars.Context();
        requested.fillDefaults("ES", "1h", 7200L);
        assertEquals(7200L, requested.getDurationSeconds());
    }

    @Test
    @DisplayName("Payload metadata overrides the window but not an already known symbol")
    void contextFromPayload() {
        HistoricalBars.Context context = new HistoricalBars.Context("NQ", null, null, null);
        context.applyFrom(json("{'symbol':'ES','time_frame':'15m','duration':'1800'}"));

        assertEquals("NQ", context.getSymbol());
        assertEquals("15m", context.getTimeframe());
        assertEquals(1800L, context.getDurationSeconds());
    }

    @Test
    @DisplayName("Collects arrays and single bars of a record, including its metadata")
    void collectsFromRecord() {
        KlineSnapshot snapshot = HistoricalBars.collect(json("{'symbol':'NQ','timeframe':'5m','interval_seconds':300,"
                + "'bars':[{'timestamp':'2024-05-01T14:05:00Z','close':3}],"
                + "'latest_bar':{'timestamp':'2024-05-01T14:10:00Z','open':3,'close':4},"
                + "'metadata':{'bar':{'timestamp':'2024-05-01T14:00:00Z','open':1,'close':2}}}"),
                new HistoricalBars.Context());

        assertEquals("NQ", snapshot.symbol());
        assertEquals("5m", snapshot.timeframe());
        assertEquals(300L, snapshot.intervalSeconds());
        assertEquals(3, snapshot.bars().size());
        assertEquals(Instant.parse("2024-05-01T14:00:00Z"), snapshot.bars().get(0).timestamp());
        assertEquals(Instant.parse("2024-05-01T14:10:00Z"), snapshot.end());
    }

    @Test
    @DisplayName("A record that is itself a bar is collected")
    void recordIsBar() {
        KlineSnapshot snapshot = HistoricalBars.collect(
                json("{'timestamp':'2024-05-01T14:00:00Z','open':10,'close':12,'high':11,'low':9}"), defaults());

        assertEquals("ES", snapshot.symbol());
        assertEquals(new Bar(Instant.parse("2024-05-01T14:00:00Z"), 10, 12, 9, 12, null), snapshot.bars().get(0));
    }

    @Test
    @DisplayName("Open falls back to close")
    void openFallsBackToClose() {
        Bar bar = HistoricalBars.mapHistoricalBar(json("{'timestamp':'2024-05-01T14:00:00Z','close':10}"));
        assertEquals(new Bar(Instant.parse("2024-05-01T14:00:00Z"), 10, 10, 10, 10, null), bar);
    }

    @Test
    @DisplayName("Nothing usable yields null")
    void nothingUsable() {
        assertNull(HistoricalBars.collect(json("{'status':'empty'}"), defaults()));
        assertNull(HistoricalBars.collect(json("[]"), defaults()));
        assertNull(HistoricalBars.collect(json("'text'"), defaults()));
        assertNull(HistoricalBars.collect(null, defaults()));
    }
}
