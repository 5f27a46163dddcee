package com.traders.marketstream.client;

import com.traders.marketstream.domain.MarketDataListener;
import com.traders.marketstream.domain.SymbolInfo;
import lombok.Builder;

import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Host-supplied inputs of one {@link MarketRealtimeClient}. Providers are polled on the client's
 * event loop whenever the client needs the current value, so they should be cheap.
 *
 * @param tokenProvider          bearer token appended to the socket URL; blank means not signed in
 * @param symbolProvider         the currently selected symbol
 * @param timeframeProvider      the currently selected timeframe, e.g. {@code 5m}
 * @param durationProvider       requested history length in seconds, {@code null} for the timeframe default
 * @param symbolMetadataProvider instrument metadata lookup, may return {@code null}
 * @param listener               receives every consumer-facing callback
 * @param path                   socket path, {@code null} for the hub default
 */
@Builder
public record MarketClientOptions(
        Supplier<String> tokenProvider,
        Supplier<String> symbolProvider,
        Supplier<String> timeframeProvider,
        Supplier<Long> durationProvider,
        Function<String, SymbolInfo> symbolMetadataProvider,
        MarketDataListener listener,
        String path
) {
    public MarketClientOptions {
        if (tokenProvider == null) tokenProvider = () -> null;
        if (symbolProvider == null) symbolProvider = () -> null;
        if (timeframeProvider == null) timeframeProvider = () -> null;
        if (durationProvider == null) durationProvider = () -> null;
        if (symbolMetadataProvider == null) symbolMetadataProvider = symbol -> null;
        if (listener == null) listener = MarketDataListener.NO_OP;
    }
}
