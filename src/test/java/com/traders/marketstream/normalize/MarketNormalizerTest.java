package com.traders.marketstream.normalize;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.traders.marketstream.domain.Bar;
import com.traders.marketstream.domain.DepthLevel;
import com.traders.marketstream.domain.DepthSnapshot;
import com.traders.marketstream.domain.TickerSnapshot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MarketNormalizerTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Instant NOW = Instant.parse("2024-05-01T14:30:00Z");

    static JsonNode json(String singleQuoted) {
        try {
            return MAPPER.readTree(singleQuoted.replace('\'', '"'));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(e);
        }
    }

    @Nested
    @DisplayName("Depth")
    class Depth {

        @Test
        @DisplayName("Builds a book from best bid and ask records with textual numbers")
        void bestLevels() {
            DepthSnapshot depth = MarketNormalizer.normalizeDepth(json("{'symbol':'MNQ',"
                    + "'best_bid':{'price':'17500.25','size':'3'},'best_ask':{'price':17500.75,'size':4},"
                    + "'total_bid_size':'18','total_ask_size':'21'}"), "MNQM4", NOW);

            assertNotNull(depth);
            assertEquals("MNQ", depth.symbol());
            assertEquals(List.of(new DepthLevel(17500.25, 3)), depth.bids());
            assertEquals(List.of(new DepthLevel(17500.75, 4)), depth.asks());
            assertEquals(17500.5, depth.midPrice());
            assertEquals(0.5, depth.spread());
            assertEquals(18.0, depth.totalBidSize());
            assertEquals(21.0, depth.totalAskSize());
            assertEquals(NOW, depth.updatedAt());
        }

        @Test
        @DisplayName("A payload for another root is rejected")
        void otherRootRejected() {
            assertNull(MarketNormalizer.normalizeDepth(
                    json("{'symbol':'CL','bids':[[80.1,1]],'asks':[[80.2,1]]}"), "MNQM4", NOW));
        }

        @Test
        @DisplayName("Levels are sorted best first and capped at five a side")
        void sortsAndCaps() {
            DepthSnapshot depth = MarketNormalizer.normalizeDepth(json("{'bids':["
                    + "[99,1],[101,1],[100,1],[97,1],[98,1],[96,1],[102,1]],"
                    + "'asks':[{'price':105,'size':2},{'price':103,'size':2}],"
                    + "'timestamp':'2024-05-01T14:29:59Z'}"), "ES", NOW);

            assertEquals("ES", depth.symbol());
            assertEquals(List.of(102.0, 101.0, 100.0, 99.0, 98.0),
                    depth.bids().stream().map(DepthLevel::price).toList());
            assertEquals(103.0, depth.bestAsk().price());
            assertEquals(Instant.parse("2024-05-01T14:29:59Z"), depth.updatedAt());
        }

        @Test
        @DisplayName("A best level already in the list is not duplicated")
        void bestLevelNotDuplicated() {
            DepthSnapshot depth = MarketNormalizer.normalizeDepth(json("{'bids':[[100,5],[99,1]],"
                    + "'best_bid_price':100,'best_bid_size':5}"), null, NOW);

            assertEquals(2, depth.bids().size());
            assertNull(depth.midPrice());
        }

        @Test
        @DisplayName("An empty payload yields nothing")
        void emptyPayload() {
            assertNull(MarketNormalizer.normalizeDepth(json("{'symbol':'ES'}"), "ES", NOW));
            assertNull(MarketNormalizer.normalizeDepth(json("[]"), "ES", NOW));
        }
    }

    @Nested
    @DisplayName("Ticker")
    class Ticker {

        @Test
        @DisplayName("Derives mid, spread and change")
        void derivedFields() {
            TickerSnapshot ticker = MarketNormalizer.normalizeTicker(json("{'symbol':'NQ',"
                    + "'bid':17500.25,'ask':17500.75,'last':17520,'close':17500,'last_size':2}"), "NQ", NOW);

            assertEquals(17500.5, ticker.midPrice());
            assertEquals(0.5, ticker.spread());
            assertEquals(20.0, ticker.change());
            assertEquals(0.1142857, ticker.changePercent().doubleValue(), 1e-6);
            assertEquals(2.0, ticker.lastSize());
        }

        @Test
        @DisplayName("Negative prices are discarded and aliases are honoured")
        void aliasesAndNegatives() {
            TickerSnapshot ticker = MarketNormalizer.normalizeTicker(
                    json("{'bid_price':-1,'askPrice':10.5,'mark_price':10.25}"), "CL", NOW);

            assertEquals("CL", ticker.symbol());
            assertNull(ticker.bid());
            assertEquals(10.5, ticker.ask());
            assertEquals(10.25, ticker.last());
            assertNull(ticker.change());
        }
    }

    @Nested
    @DisplayName("Bars")
    class Bars {

        private final MarketNormalizer.BarContext context = new MarketNormalizer.BarContext("ES", "1m", 60, 3600);

        @Test
        @DisplayName("A bars array becomes a deduplicated ascending snapshot")
        void barsArray() {
            MarketNormalizer.BarEvent event = MarketNormalizer.normalizeBarEvent(json("{'timeframe':'5m',"
                    + "'metadata':{'interval_seconds':300},'bars':["
                    + "{'timestamp':'2024-05-01T14:05:00Z','open':2,'close':3},"
                    + "{'timestamp':'2024-05-01T14:00:00Z','open':1,'close':2},"
                    + "{'timestamp':'2024-05-01T14:05:00Z','open':2,'close':4}]}"), context);

            assertNull(event.bar());
            assertEquals("5m", event.timeframe());
            assertEquals(300, event.intervalSeconds());
            assertEquals(3600, event.durationSeconds());
            assertEquals("ES", event.snapshot().symbol());
            assertEquals(2, event.snapshot().bars().size());
            assertEquals(4.0, event.snapshot().bars().get(1).close());
            assertEquals(Instant.parse("2024-05-01T14:05:00Z"), event.snapshot().end());
        }

        @Test
        @DisplayName("A single bar falls back to the context")
        void singleBar() {
            MarketNormalizer.BarEvent event = MarketNormalizer.normalizeBarEvent(
                    json("{'time':1714572000,'open':10,'close':11}"), context);

            assertNull(event.snapshot());
            assertEquals("ES", event.symbol());
            assertEquals("1m", event.timeframe());
            assertEquals(new Bar(Instant.parse("2024-05-01T14:00:00Z"), 10, 10, 10, 11, null), event.bar());
        }

        @Test
        @DisplayName("Bars without a timestamp are dropped")
        void missingTimestamp() {
            assertNull(MarketNormalizer.mapBar(json("{'open':1,'close':2}")));
            assertNull(MarketNormalizer.normalizeBarEvent(json("{'bar':{'open':1}}"), context));
        }

        @Test
        @DisplayName("A bar with an impossible date is dropped and the rest of the array survives")
        void impossibleDateInBars() {
            MarketNormalizer.BarEvent event = MarketNormalizer.normalizeBarEvent(json("{'bars':["
                    + "{'timestamp':'2024-02-30','open':1},"
                    + "{'timestamp':'2024-03-01T00:00:00Z','open':2}]}"), context);

            assertNull(event.bar());
            assertEquals(1, event.snapshot().bars().size());
            assertEquals(2.0, event.snapshot().bars().get(0).open());
            assertEquals(Instant.parse("2024-03-01T00:00:00Z"), event.snapshot().end());
        }
    }
}
