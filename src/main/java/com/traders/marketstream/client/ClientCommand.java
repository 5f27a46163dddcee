package com.traders.marketstream.client;

/**
 * Public client operations, posted to the event loop and applied in submission order.
 */
sealed interface ClientCommand permits ClientCommand.Connect, ClientCommand.Disconnect, ClientCommand.RefreshSubscription {

    record Connect(boolean force) implements ClientCommand {
    }

    record Disconnect() implements ClientCommand {
    }

    record RefreshSubscription() implements ClientCommand {
    }
}
