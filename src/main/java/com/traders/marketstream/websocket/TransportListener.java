package com.traders.marketstream.websocket;

/**
 * Callbacks of one physical connection. May be invoked from any thread.
 */
public interface TransportListener {

    void onOpen();

    void onMessage(String text);

    void onError(Throwable error);

    /** Called exactly once per connection, also when the handshake never completed. */
    void onClose(CloseReason reason);
}
