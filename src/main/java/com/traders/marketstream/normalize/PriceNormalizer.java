package com.traders.marketstream.normalize;

import com.traders.marketstream.domain.SymbolInfo;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Snaps prices to the instrument's tick grid. When a reference price is known, a value that is off by
 * the tick multiplier or the contract multiplier is scaled up to the reference's magnitude. Scaling down
 * is opt-in: a finite price is never shrunk just because the reference disagrees with it.
 */
public final class PriceNormalizer {
    private static final double MAX_CANDIDATE_RATIO = 200d;
    private static final double IMPROVEMENT_FACTOR = 0.4d;

    static final Map<String, Double> INDEX_TICK_VALUES = Map.ofEntries(
            Map.entry("ES", 50d), Map.entry("MES", 5d), Map.entry("NQ", 20d), Map.entry("MNQ", 2d),
            Map.entry("YM", 5d), Map.entry("MYM", 0.5d), Map.entry("RTY", 5d), Map.entry("M2K", 5d),
            Map.entry("NKD", 5d), Map.entry("NIY", 5d), Map.entry("DAX", 25d), Map.entry("FDAX", 25d),
            Map.entry("FDXM", 5d), Map.entry("FESX", 10d), Map.entry("IF", 300d), Map.entry("IH", 300d),
            Map.entry("IC", 200d), Map.entry("IM", 200d), Map.entry("BTC", 5d), Map.entry("MBT", 0.1d),
            Map.entry("ETH", 50d), Map.entry("MET", 0.1d));

    static final Map<String, Double> DEFAULT_TICK_SIZES = Map.ofEntries(
            Map.entry("ES", 0.25d), Map.entry("MES", 0.25d), Map.entry("NQ", 0.25d), Map.entry("MNQ", 0.25d),
            Map.entry("YM", 1d), Map.entry("MYM", 1d), Map.entry("RTY", 0.1d), Map.entry("M2K", 0.1d),
            Map.entry("NKD", 5d), Map.entry("NIY", 5d), Map.entry("DAX", 0.5d), Map.entry("FDAX", 0.5d),
            Map.entry("FDXM", 0.5d), Map.entry("FESX", 0.5d), Map.entry("IF", 0.2d), Map.entry("IH", 0.2d),
            Map.entry("IC", 0.2d), Map.entry("IM", 0.2d), Map.entry("BTC", 5d), Map.entry("MBT", 5d),
            Map.entry("ETH", 0.5d), Map.entry("MET", 0.5d));

    public record TickOptions(Double tickSize, Double tickValue, Double reference, boolean allowDownscale) {
        public static final TickOptions NONE = new TickOptions(null, null, null, false);

        public static TickOptions of(SymbolInfo info, Double reference) {
            if (info == null) {
                return new TickOptions(null, null, reference, false);
            }
            return new TickOptions(info.tickSize(), info.tickValue(), reference, false);
        }

        public TickOptions withReference(Double newReference) {
            return new TickOptions(tickSize, tickValue, newReference, allowDownscale);
        }
    }

    private PriceNormalizer() {
    }

    public static Double resolveTickSize(String symbol, Double explicit) {
        if (explicit != null && explicit > 0) {
            return explicit;
        }
        return DEFAULT_TICK_SIZES.get(SymbolRoots.root(symbol));
    }

    public static double tickValue(String symbol) {
        return INDEX_TICK_VALUES.getOrDefault(SymbolRoots.root(symbol), 1d);
    }

    public static Double normalizePriceByTick(Double value, String symbol, TickOptions options) {
        if (value == null || !Double.isFinite(value)) {
            return null;
        }
        TickOptions effective = options == null ? TickOptions.NONE : options;
        Double tickSize = resolveTickSize(symbol, effective.tickSize());
        if (tickSize == null || tickSize <= 0) {
            return value;
        }
        double tickValue = effective.tickValue() != null ? effective.tickValue() : tickValue(symbol);
        Double reference = effective.reference();

        double normalized = value;
        if (reference != null && Double.isFinite(reference) && reference != 0) {
            double sign = value >= 0 ? 1 : -1;
            normalized = sign * closestToReference(
                    Math.abs(value), Math.abs(reference), tickSize, tickValue, effective.allowDownscale());
        }

        double snapped = Math.round(normalized / tickSize) * tickSize;
        return Double.isFinite(snapped) ? JsonValues.round6(snapped) : normalized;
    }

    private static double closestToReference(double absolute, double reference, double tickSize,
                                             double tickValue, boolean allowDownscale) {
        Set<Double> candidates = new LinkedHashSet<>();
        candidates.add(absolute);
        Double primary = factor(tickSize > 1 ? tickSize : 1 / tickSize);
        Double secondary = factor(tickValue);
        register(candidates, absolute, primary, allowDownscale);
        register(candidates, absolute, secondary, allowDownscale);
        if (primary != null && secondary != null) {
            register(candidates, absolute, factor(primary * secondary), allowDownscale);
        }

        double best = absolute;
        double bestError = Math.abs(absolute - reference);
        for (double candidate : candidates) {
            double error = Math.abs(candidate - reference);
            if (error < bestError * IMPROVEMENT_FACTOR) {
                best = candidate;
                bestError = error;
            }
        }
        return best;
    }

    private static Double factor(double value) {
        if (!Double.isFinite(value)) {
            return null;
        }
        double magnitude = Math.abs(value);
        return magnitude > 1 ? magnitude : null;
    }

    private static void register(Set<Double> candidates, double absolute, Double factor, boolean allowDownscale) {
        if (factor == null) {
            return;
        }
        consider(candidates, absolute, absolute * factor);
        if (allowDownscale) {
            consider(candidates, absolute, absolute / factor);
        }
    }

    private static void consider(Set<Double> candidates, double absolute, double candidate) {
        if (!Double.isFinite(candidate) || candidate == 0) {
            return;
        }
        if (candidate > absolute * MAX_CANDIDATE_RATIO || candidate < absolute / MAX_CANDIDATE_RATIO) {
            return;
        }
        candidates.add(candidate);
    }
}
