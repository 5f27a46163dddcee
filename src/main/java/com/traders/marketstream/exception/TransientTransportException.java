package com.traders.marketstream.exception;

/**
 * A socket error or a close that is not authentication-terminal. Retried with backoff.
 */
public class TransientTransportException extends MarketStreamException {

    public TransientTransportException(String message) {
        super(message);
    }

    public TransientTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
