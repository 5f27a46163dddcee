package com.traders.marketstream.exception;

public class MalformedMessageException extends MarketStreamException {

    public MalformedMessageException(String message) {
        super(message);
    }

    public MalformedMessageException(String message, Throwable cause) {
        super(message, cause);
    }
}
