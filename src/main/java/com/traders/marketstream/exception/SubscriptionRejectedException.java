package com.traders.marketstream.exception;

public class SubscriptionRejectedException extends MarketStreamException {

    public SubscriptionRejectedException(String message) {
        super(message);
    }
}
