// com.traders.marketstream.infrastructure.spring.SpringWebSocketTransport
package com.traders.marketstream.infrastructure.spring;

import com.traders.marketstream.websocket.TransportConnection;
import com.traders.marketstream.websocket.TransportListener;
import com.traders.marketstream.websocket.WebSocketTransport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.client.WebSocketClient;

import java.net.URI;

/**
 * {@link WebSocketTransport} on top of a Spring {@link WebSocketClient}, usually the JSR-356
 * backed {@link org.springframework.web.socket.client.standard.StandardWebSocketClient}.
 */
@Slf4j
public class SpringWebSocketTransport implements WebSocketTransport {
    private final WebSocketClient client;

    public SpringWebSocketTransport(WebSocketClient client) {
        this.client = client;
    }

    @Override
    public TransportConnection open(URI uri, TransportListener listener) {
        MarketWebSocketHandler handler = new MarketWebSocketHandler(listener);
        client.execute(handler, new WebSocketHttpHeaders(), uri)
                .whenComplete((session, error) -> {
                    if (error != null) {
                        handler.handshakeFailed(error);
                    }
                });
        return handler;
    }
}
