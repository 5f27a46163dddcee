// com.traders.marketstream.websocket.WebSocketHub
package com.traders.marketstream.websocket;

import com.traders.marketstream.util.EventLoop;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Registry of shared sockets keyed by connection name. Every subscriber registered under a name
 * shares one physical connection; the connection is closed when the last subscriber disposes.
 * <p>
 * Not thread-safe: all calls must be made on {@link #getLoop()}.
 */
@Slf4j
public class WebSocketHub {
    private final WebSocketTransport transport;
    @Getter
    private final EventLoop loop;
    @Getter
    private final HubSettings settings;
    private final Map<String, ManagedWebSocket> sockets = new LinkedHashMap<>();

    public WebSocketHub(WebSocketTransport transport, EventLoop loop, HubSettings settings) {
        this.transport = transport;
        this.loop = loop;
        this.settings = settings;
    }

    public HubSubscription subscribe(String name, SubscriberHandlers handlers) {
        return subscribe(name, settings.defaultPath(), handlers);
    }

    /**
     * @param path used only when this call creates the connection for {@code name};
     *             {@code null} selects the default path
     */
    public HubSubscription subscribe(String name, String path, SubscriberHandlers handlers) {
        ManagedWebSocket socket = sockets.get(name);
        if (socket == null) {
            if (path == null || path.isBlank()) {
                path = settings.defaultPath();
            }
            socket = new ManagedWebSocket(name, path, transport, loop, settings, this::release);
            sockets.put(name, socket);
            log.debug("Created websocket '{}' for path {}", name, path);
        }
        return socket.subscribe(handlers);
    }

    public boolean isOpen(String name) {
        ManagedWebSocket socket = sockets.get(name);
        return socket != null && socket.isOpen();
    }

    public List<SocketStatus> status() {
        return sockets.values().stream().map(ManagedWebSocket::status).toList();
    }

    private void release(ManagedWebSocket socket) {
        if (sockets.remove(socket.getName(), socket)) {
            log.debug("Released websocket '{}'", socket.getName());
        }
    }
}
