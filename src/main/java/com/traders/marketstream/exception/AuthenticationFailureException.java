package com.traders.marketstream.exception;

import lombok.Getter;

/**
 * The server closed the socket because the token was rejected. Never retried.
 */
@Getter
public class AuthenticationFailureException extends MarketStreamException {
    private final int closeCode;

    public AuthenticationFailureException(int closeCode, String reason) {
        super("Authentication failed (code %d): %s".formatted(closeCode, reason == null ? "" : reason));
        this.closeCode = closeCode;
    }
}
