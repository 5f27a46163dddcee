package com.traders.marketstream.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.traders.marketstream.domain.KlineSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static com.traders.marketstream.client.DomCapabilityResolverTest.json;
import static org.junit.jupiter.api.Assertions.*;

class AckSnapshotIngestorTest {

    private RecordingTarget target;
    private AckSnapshotIngestor ingestor;

    @BeforeEach
    void setUp() {
        target = new RecordingTarget();
        ingestor = new AckSnapshotIngestor(target);
    }

    @Nested
    @DisplayName("Alias lookup")
    class Pick {

        @Test
        @DisplayName("Matches exactly, then ignoring case, then as a qualified prefix")
        void aliases() {
            JsonNode snapshot = json("{'Ticker':{'last':1},'latest_dom:ES':{'bids':[]},'kline':null}");

            assertEquals(1, AckSnapshotIngestor.pick(snapshot, AckSnapshotIngestor.TICKER_KEYS).get("last").asInt());
            assertTrue(AckSnapshotIngestor.pick(snapshot, AckSnapshotIngestor.DEPTH_KEYS).has("bids"));
            assertTrue(AckSnapshotIngestor.pick(snapshot, AckSnapshotIngestor.KLINE_KEYS).isNull());
            assertNull(AckSnapshotIngestor.pick(snapshot, AckSnapshotIngestor.BAR_KEYS));
        }

        @Test
        @DisplayName("A longer word sharing the prefix is not an alias")
        void unrelatedPrefix() {
            assertNull(AckSnapshotIngestor.pick(json("{'barometer':1,'tickers':[]}"), AckSnapshotIngestor.BAR_KEYS));
            assertNull(AckSnapshotIngestor.pick(json("{'tickers':[]}"), AckSnapshotIngestor.TICKER_KEYS));
        }
    }

    @Nested
    @DisplayName("Ingestion")
    class Ingest {

        @Test
        @DisplayName("Depth, ticker and availability are forwarded")
        void forwardsSections() {
            AckSnapshotIngestor.Result result = ingestor.ingest(json("{'market.depth-ES':{'bids':[[1,1]]},"
                    + "'market.ticker-ES':{'last':5000},'availability':{'status':'closed'}}"));

            assertTrue(result.depthApplied());
            assertTrue(result.tickerApplied());
            assertFalse(result.barApplied());
            assertFalse(result.historyApplied());
            assertEquals(List.of("depth", "ticker", "availability"), target.calls);
        }

        @Test
        @DisplayName("A lone latest bar also seeds the history")
        void barSeedsHistory() {
            AckSnapshotIngestor.Result result = ingestor.ingest(
                    json("{'market.bar-ES':{'timestamp':'2024-05-01T14:00:00Z','open':1,'close':2}}"));

            assertTrue(result.barApplied());
            assertTrue(result.historyApplied());
            assertEquals(List.of("history", "bar"), target.calls);
            KlineSnapshot history = target.histories.get(0);
            assertEquals("ES", history.symbol());
            assertEquals(60L, history.intervalSeconds());
            assertEquals(Instant.parse("2024-05-01T14:00:00Z"), history.end());
        }

        @Test
        @DisplayName("An explicit history takes precedence over the latest bar")
        void historyBeforeBar() {
            ingestor.ingest(json("{'historical_bars':[{'timestamp':'2024-05-01T14:00:00Z','close':2},"
                    + "{'timestamp':'2024-05-01T14:01:00Z','close':3}],"
                    + "'bar':{'timestamp':'2024-05-01T14:01:00Z','close':3}}"));

            assertEquals(List.of("history", "bar"), target.calls);
            assertEquals(2, target.histories.get(0).bars().size());
        }

        @Test
        @DisplayName("Context metadata overrides the subscription defaults")
        void contextMetadata() {
            ingestor.ingest(json("{'metadata':{'symbol':'NQ','timeframe':'5m'},"
                    + "'historical_bars':[{'timestamp':'2024-05-01T14:00:00Z','close':2}]}"));

            KlineSnapshot history = target.histories.get(0);
            assertEquals("NQ", history.symbol());
            assertEquals("5m", history.timeframe());
            assertEquals(300L, history.intervalSeconds());
            assertEquals(21_600L, history.durationSeconds());
        }

        @Test
        @DisplayName("An explicit null kline clears the history")
        void nullKlineClears() {
            AckSnapshotIngestor.Result result = ingestor.ingest(json("{'kline':null}"));

            assertEquals(AckSnapshotIngestor.Result.NONE, result);
            assertEquals(List.of("clear"), target.calls);
        }

        @Test
        @DisplayName("Non-record snapshots are ignored")
        void nonRecord() {
            assertEquals(AckSnapshotIngestor.Result.NONE, ingestor.ingest(null));
            assertEquals(AckSnapshotIngestor.Result.NONE, ingestor.ingest(json("[]")));
            assertTrue(target.calls.isEmpty());
        }
    }

    private static class RecordingTarget implements AckSnapshotIngestor.Target {
        final List<String> calls = new ArrayList<>();
        final List<KlineSnapshot> histories = new ArrayList<>();

        @Override
        public void applyDepth(JsonNode value) {
            calls.add("depth");
        }

        @Override
        public void applyTicker(JsonNode value) {
            calls.add("ticker");
        }

        @Override
        public void applyBar(JsonNode value) {
            calls.add("bar");
        }

        @Override
        public void applyHistory(KlineSnapshot snapshot) {
            calls.add("history");
            histories.add(snapshot);
        }

        @Override
        public void clearHistory() {
            calls.add("clear");
        }

        @Override
        public void applyAvailability(JsonNode value) {
            calls.add("availability");
        }

        @Override
        public String symbol() {
            return "ES";
        }

        @Override
        public String timeframe() {
            return "1m";
        }

        @Override
        public Long requestedDuration() {
            return null;
        }
    }
}
