package com.traders.marketstream.websocket;

import java.net.URI;

/**
 * Opens physical WebSocket connections.
 */
public interface WebSocketTransport {

    /**
     * Starts connecting to {@code uri}. Outcome is reported through {@code listener}.
     *
     * @throws com.traders.marketstream.exception.TransientTransportException when the attempt cannot even be started
     */
    TransportConnection open(URI uri, TransportListener listener);
}
