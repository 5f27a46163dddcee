// com.traders.marketstream.domain.MarketDataListener
package com.traders.marketstream.domain;

import com.fasterxml.jackson.databind.JsonNode;
import com.traders.marketstream.exception.AuthenticationFailureException;

/**
 * Consumer-facing callbacks of a market data client. All methods run on the client's event loop
 * and default to no-ops.
 */
public interface MarketDataListener {

    default void onConnectionStatus(ConnectionStatus status) {
    }

    default void onSubscriptionPending(SubscriptionDescriptor descriptor) {
    }

    default void onSubscriptionReady(SubscriptionReady ready) {
    }

    default void onSubscriptionFailed(SubscriptionFailure failure) {
    }

    /** Local subscription state was cleared (disconnect or acknowledged unsubscribe). */
    default void onSubscriptionReset() {
    }

    default void onDepth(DepthSnapshot depth) {
    }

    default void onTicker(TickerSnapshot ticker) {
    }

    default void onBar(BarUpdate update) {
    }

    /**
     * @param snapshot the new history, or {@code null} when the server cleared it
     */
    default void onKline(String symbol, KlineSnapshot snapshot) {
    }

    default void onAvailability(String symbol, JsonNode availability) {
    }

    default void onMarkPrice(String symbol, double price) {
    }

    default void onSymbolMismatch(String observed, String expected) {
    }

    default void onAuthenticationFailure(AuthenticationFailureException failure) {
    }

    MarketDataListener NO_OP = new MarketDataListener() {
    };
}
