package com.traders.marketstream.websocket;

import lombok.Builder;

import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Callbacks and token source of one hub subscriber. Missing callbacks default to no-ops.
 */
@Builder
public record SubscriberHandlers(
        Supplier<String> tokenProvider,
        Runnable onOpen,
        Consumer<String> onMessage,
        Consumer<Throwable> onError,
        Consumer<CloseReason> onClose
) {
    public SubscriberHandlers {
        if (tokenProvider == null) tokenProvider = () -> null;
        if (onOpen == null) onOpen = () -> { };
        if (onMessage == null) onMessage = text -> { };
        if (onError == null) onError = error -> { };
        if (onClose == null) onClose = reason -> { };
    }
}
