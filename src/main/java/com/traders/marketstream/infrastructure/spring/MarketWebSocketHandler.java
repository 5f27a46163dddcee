// com.traders.marketstream.infrastructure.spring.MarketWebSocketHandler
package com.traders.marketstream.infrastructure.spring;

import com.traders.marketstream.util.SocketUrls;
import com.traders.marketstream.websocket.CloseReason;
import com.traders.marketstream.websocket.TransportConnection;
import com.traders.marketstream.websocket.TransportListener;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PongMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.AbstractWebSocketHandler;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Bridges one Spring WebSocket session to a {@link TransportListener} and doubles as the
 * connection handle returned to the hub.
 */
@Slf4j
public class MarketWebSocketHandler extends AbstractWebSocketHandler implements TransportConnection {
    private final TransportListener listener;
    private final AtomicBoolean closed = new AtomicBoolean();
    private volatile boolean closeRequested;
    @Getter
    private volatile WebSocketSession session;

    public MarketWebSocketHandler(TransportListener listener) {
        this.listener = listener;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        this.session = session;
        if (closeRequested) {
            log.debug("Closing session {} that was abandoned during its handshake", session.getId());
            closeQuietly(session);
            return;
        }
        log.info("WebSocket connection established for session: {}", session.getId());
        listener.onOpen();
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        listener.onMessage(message.getPayload());
    }

    @Override
    protected void handlePongMessage(WebSocketSession session, PongMessage message) {
        log.debug("Received pong on session {}", session.getId());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.error("WebSocket error: {}", exception.getMessage(), exception);
        listener.onError(exception);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        log.info("WebSocket connection closed: {}", status);
        this.session = null;
        fireClose(new CloseReason(status.getCode(), status.getReason()));
    }

    void handshakeFailed(Throwable cause) {
        log.warn("WebSocket handshake failed: {}", SocketUrls.redact(cause.getMessage()));
        listener.onError(cause);
        fireClose(CloseReason.abnormal(SocketUrls.redact(cause.getMessage())));
    }

    @Override
    public boolean isOpen() {
        WebSocketSession current = session;
        return current != null && current.isOpen();
    }

    @Override
    public boolean send(String text) {
        WebSocketSession current = session;
        if (current == null || !current.isOpen()) {
            return false;
        }
        try {
            current.sendMessage(new TextMessage(text));
            return true;
        } catch (IOException | IllegalStateException e) {
            log.warn("Failed to send frame on session {}: {}", current.getId(), e.getMessage());
            return false;
        }
    }

    @Override
    public void close() {
        closeRequested = true;
        WebSocketSession current = session;
        if (current != null) {
            closeQuietly(current);
        }
    }

    private void fireClose(CloseReason reason) {
        if (closed.compareAndSet(false, true)) {
            listener.onClose(reason);
        }
    }

    private void closeQuietly(WebSocketSession target) {
        try {
            target.close(CloseStatus.NORMAL);
        } catch (IOException e) {
            log.warn("Failed to close session {}: {}", target.getId(), e.getMessage());
        }
    }
}
