package com.traders.marketstream.websocket;

/**
 * A subscriber's view of a shared socket. The socket itself is never exposed.
 */
public interface HubSubscription {

    /**
     * @return false when the socket is not open or the handle was disposed
     */
    boolean send(String text);

    boolean isOpen();

    /** Idempotent. The last disposal closes the socket. */
    void dispose();
}
