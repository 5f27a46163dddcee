package com.traders.marketstream.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.traders.marketstream.domain.ConnectionState;
import com.traders.marketstream.util.ScheduledTask;
import com.traders.marketstream.websocket.HubSubscription;

import java.time.Instant;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Mutable state of one client. Only ever touched from the client's event loop.
 */
final class ClientState {
    boolean started;
    ConnectionState connectionState;
    HubSubscription handle;
    ScheduledTask reconnectTask;
    ScheduledTask heartbeatTask;
    int reconnectAttempt;
    Instant connectionOpenedAt;
    Instant lastActivityAt;

    String lastRequestedSymbol;
    String lastRequestedTimeframe;
    String lastSubscribedSymbol;
    String lastSubscribedTimeframe;
    List<String> lastSubscribedTopics = List.of();
    Instant subscriptionRequestedAt;
    String subscriptionId;
    boolean confirmed;

    final Map<String, JsonNode> capabilitiesBySymbol = new HashMap<>();
    final Set<String> mismatchWarnings = new HashSet<>();

    JsonNode capabilitiesFor(String symbol) {
        return symbol == null ? null : capabilitiesBySymbol.get(symbol.toUpperCase(Locale.ROOT));
    }

    void cacheCapabilities(String symbol, JsonNode capabilities) {
        if (symbol == null) {
            return;
        }
        String key = symbol.toUpperCase(Locale.ROOT);
        if (capabilities == null) {
            capabilitiesBySymbol.remove(key);
        } else {
            capabilitiesBySymbol.put(key, capabilities);
        }
    }

    void clearSubscription() {
        lastRequestedSymbol = null;
        lastRequestedTimeframe = null;
        lastSubscribedSymbol = null;
        lastSubscribedTimeframe = null;
        lastSubscribedTopics = List.of();
        subscriptionRequestedAt = null;
        subscriptionId = null;
        confirmed = false;
        capabilitiesBySymbol.clear();
        mismatchWarnings.clear();
    }
}
