package com.traders.marketstream.exception;

public class MarketStreamException extends RuntimeException {

    public MarketStreamException(String message) {
        super(message);
    }

    public MarketStreamException(String message, Throwable cause) {
        super(message, cause);
    }
}
