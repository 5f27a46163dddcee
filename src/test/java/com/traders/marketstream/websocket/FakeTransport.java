package com.traders.marketstream.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.traders.marketstream.exception.TransientTransportException;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;

/**
 * In-memory transport. Tests drive each connection's lifecycle by hand.
 */
public class FakeTransport implements WebSocketTransport {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final List<FakeConnection> connections = new ArrayList<>();
    private int failuresToThrow;
    private int attempts;

    @Override
    public TransportConnection open(URI uri, TransportListener listener) {
        attempts++;
        if (failuresToThrow > 0) {
            failuresToThrow--;
            throw new TransientTransportException("handshake could not start");
        }
        FakeConnection connection = new FakeConnection(uri, listener);
        connections.add(connection);
        return connection;
    }

    public void failNextOpens(int count) {
        failuresToThrow = count;
    }

    public int attempts() {
        return attempts;
    }

    public List<FakeConnection> connections() {
        return connections;
    }

    public FakeConnection last() {
        return connections.get(connections.size() - 1);
    }

    public static class FakeConnection implements TransportConnection {
        private final URI uri;
        private final TransportListener listener;
        private final List<String> sent = new ArrayList<>();
        private boolean open;
        private boolean closed;

        FakeConnection(URI uri, TransportListener listener) {
            this.uri = uri;
            this.listener = listener;
        }

        public URI uri() {
            return uri;
        }

        public void simulateOpen() {
            open = true;
            listener.onOpen();
        }

        public void simulateMessage(String text) {
            listener.onMessage(text);
        }

        public void simulateError(Throwable error) {
            listener.onError(error);
        }

        public void simulateClose(int code, String reason) {
            open = false;
            listener.onClose(new CloseReason(code, reason));
        }

        public boolean isClosed() {
            return closed;
        }

        public List<String> sent() {
            return sent;
        }

        /** Sent frames whose {@code action} field equals {@code action}, parsed. */
        public List<JsonNode> framesWithAction(String action) {
            List<JsonNode> frames = new ArrayList<>();
            for (String text : sent) {
                JsonNode frame = parse(text);
                if (action.equals(frame.path("action").asText())) {
                    frames.add(frame);
                }
            }
            return frames;
        }

        @Override
        public boolean isOpen() {
            return open && !closed;
        }

        @Override
        public boolean send(String text) {
            if (!isOpen()) {
                return false;
            }
            sent.add(text);
            return true;
        }

        @Override
        public void close() {
            closed = true;
            open = false;
        }

        private static JsonNode parse(String text) {
            try {
                return MAPPER.readTree(text);
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("sent frame is not JSON: " + text, e);
            }
        }
    }
}
