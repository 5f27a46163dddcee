package com.traders.marketstream.normalize;

import com.traders.marketstream.domain.SymbolInfo;
import com.traders.marketstream.normalize.PriceNormalizer.TickOptions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PriceNormalizerTest {

    private static TickOptions reference(double value) {
        return TickOptions.NONE.withReference(value);
    }

    @Nested
    @DisplayName("Tick snapping")
    class Snapping {

        @Test
        @DisplayName("Snaps to the default tick of the root symbol")
        void snapsToDefaultTick() {
            assertEquals(5000.0, PriceNormalizer.normalizePriceByTick(5000.1, "ES", TickOptions.NONE));
            assertEquals(5000.25, PriceNormalizer.normalizePriceByTick(5000.2, "ESM4", TickOptions.NONE));
            assertEquals(2045.3, PriceNormalizer.normalizePriceByTick(2045.27, "M2KZ5", TickOptions.NONE));
        }

        @Test
        @DisplayName("Explicit tick size from metadata wins over the default table")
        void explicitTickSize() {
            SymbolInfo info = SymbolInfo.builder().symbol("ES").tickSize(1.0).build();
            assertEquals(5000.0, PriceNormalizer.normalizePriceByTick(5000.4, "ES", TickOptions.of(info, null)));
        }

        @Test
        @DisplayName("Unknown symbols pass through untouched")
        void unknownSymbolUnchanged() {
            assertEquals(123.4567, PriceNormalizer.normalizePriceByTick(123.4567, "XYZ", reference(50)));
        }

        @Test
        @DisplayName("Null and non-finite input yield null")
        void nonFiniteIsNull() {
            assertNull(PriceNormalizer.normalizePriceByTick(null, "ES", TickOptions.NONE));
            assertNull(PriceNormalizer.normalizePriceByTick(Double.NaN, "ES", TickOptions.NONE));
            assertNull(PriceNormalizer.normalizePriceByTick(Double.POSITIVE_INFINITY, "ES", TickOptions.NONE));
        }
    }

    @Nested
    @DisplayName("Reference scaling")
    class ReferenceScaling {

        @Test
        @DisplayName("A price far above the reference is never scaled down")
        void neverShrinks() {
            assertEquals(49848.0, PriceNormalizer.normalizePriceByTick(49848.0, "MNQ", reference(24574)));
            assertEquals(4250.25, PriceNormalizer.normalizePriceByTick(4250.25, "ES", reference(21.25125)));
        }

        @Test
        @DisplayName("A price close to the reference is kept")
        void nearbyPriceKept() {
            assertEquals(24924.0, PriceNormalizer.normalizePriceByTick(24924.0, "MNQ", reference(24574)));
        }

        @Test
        @DisplayName("A price off by the tick times contract multiplier is scaled up")
        void scalesUpByMultiplier() {
            assertEquals(4250.25, PriceNormalizer.normalizePriceByTick(21.25125, "ES", reference(4250.25)));
        }

        @Test
        @DisplayName("The sign of the price is preserved")
        void keepsSign() {
            assertEquals(-5.0, PriceNormalizer.normalizePriceByTick(-5.0, "ES", reference(-5.1)));
        }
    }

    @Test
    @DisplayName("Tick value falls back to one for unknown roots")
    void tickValueFallback() {
        assertEquals(50.0, PriceNormalizer.tickValue("ESH5"));
        assertEquals(1.0, PriceNormalizer.tickValue("AAPL"));
    }
}
