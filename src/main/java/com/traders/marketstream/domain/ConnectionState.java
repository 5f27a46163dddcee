// com.traders.marketstream.domain.ConnectionState
package com.traders.marketstream.domain;

public enum ConnectionState {
    CONNECTING,
    CONNECTED,
    RECONNECTING,
    FAILED
}
