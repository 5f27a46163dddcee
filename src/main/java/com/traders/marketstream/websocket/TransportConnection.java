package com.traders.marketstream.websocket;

public interface TransportConnection {

    boolean isOpen();

    /**
     * @return false when the frame could not be written
     */
    boolean send(String text);

    /**
     * Closes the connection. A connection still in its handshake is closed as soon as it opens.
     */
    void close();
}
