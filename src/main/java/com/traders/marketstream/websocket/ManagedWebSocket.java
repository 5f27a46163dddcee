// com.traders.marketstream.websocket.ManagedWebSocket
package com.traders.marketstream.websocket;

import com.google.gson.JsonObject;
import com.traders.marketstream.exception.TransientTransportException;
import com.traders.marketstream.util.EventLoop;
import com.traders.marketstream.util.ScheduledTask;
import com.traders.marketstream.util.SocketUrls;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * One physical socket shared by every subscriber registered under the same connection name.
 * Confined to the hub's event loop.
 */
@Slf4j
class ManagedWebSocket {
    private static final String PING_FRAME = createPingFrame();

    @Getter
    private final String name;
    private final String path;
    private final WebSocketTransport transport;
    private final EventLoop loop;
    private final HubSettings settings;
    private final Consumer<ManagedWebSocket> onEmpty;
    private final CircuitBreaker earlyFailureBreaker;

    private final Map<Long, SubscriberHandlers> subscribers = new LinkedHashMap<>();
    private long nextSubscriberId = 1;

    private TransportConnection connection;
    private ConnectionListener listener;
    private boolean open;
    private boolean hadSuccessfulOpen;
    private boolean shouldReconnect = true;
    private String lastResolvedToken;
    private Duration reconnectDelay;
    private ScheduledTask reconnectTask;
    private ScheduledTask cooldownTask;
    private ScheduledTask heartbeatTask;
    private Instant lastOpenedAt;
    private Instant lastMessageAt;
    private Instant lastPingAt;

    ManagedWebSocket(String name, String path, WebSocketTransport transport, EventLoop loop,
                     HubSettings settings, Consumer<ManagedWebSocket> onEmpty) {
        this.name = name;
        this.path = path;
        this.transport = transport;
        this.loop = loop;
        this.settings = settings;
        this.onEmpty = onEmpty;
        this.reconnectDelay = settings.reconnectBase();
        this.earlyFailureBreaker = CircuitBreaker.of("websocket-" + name, CircuitBreakerConfig.custom()
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(settings.maxEarlyFailures())
                .minimumNumberOfCalls(settings.maxEarlyFailures())
                .failureRateThreshold(100)
                .waitDurationInOpenState(settings.failureCooldown())
                .automaticTransitionFromOpenToHalfOpenEnabled(false)
                .recordExceptions(TransientTransportException.class)
                .build());
        this.earlyFailureBreaker.getEventPublisher().onStateTransition(event ->
                log.info("Websocket '{}' failure breaker {}", name, event.getStateTransition()));
    }

    HubSubscription subscribe(SubscriberHandlers handlers) {
        long id = nextSubscriberId++;
        subscribers.put(id, handlers);
        log.debug("Registered subscriber {} on websocket '{}'", id, name);
        ensureConnection();
        if (open) {
            // late joiners get their open callback on a later loop turn, never inside subscribe()
            loop.execute(() -> {
                SubscriberHandlers subscriber = subscribers.get(id);
                if (subscriber != null && open) {
                    invoke(id, "open", () -> subscriber.onOpen().run());
                }
            });
        }
        return new Subscription(id);
    }

    SocketStatus status() {
        return new SocketStatus(
                name,
                open,
                connection != null && !open,
                subscribers.size(),
                reconnectDelay.toMillis(),
                earlyFailureBreaker.getMetrics().getNumberOfFailedCalls(),
                earlyFailureBreaker.getState().name(),
                lastOpenedAt,
                lastMessageAt,
                lastPingAt);
    }

    boolean isOpen() {
        return open;
    }

    private void ensureConnection() {
        if (connection != null) {
            return;
        }
        openSocket();
    }

    private void openSocket() {
        if (connection != null) {
            return;
        }
        String token = resolveToken();
        if (token == null) {
            log.info("No token available for websocket '{}', deferring connection", name);
            scheduleReconnect();
            return;
        }
        if (!token.equals(lastResolvedToken)) {
            resetFailureState();
            lastResolvedToken = token;
        }
        if (!shouldReconnect || inCooldown()) {
            scheduleReconnect();
            return;
        }

        ConnectionListener attemptListener = new ConnectionListener();
        URI uri;
        try {
            uri = SocketUrls.withToken(settings.baseUrl(), path, token);
            log.info("Opening websocket '{}' at {}", name, SocketUrls.redact(uri));
            connection = transport.open(uri, attemptListener);
        } catch (RuntimeException e) {
            attemptListener.detach();
            log.warn("Websocket '{}' could not start connecting: {}", name, SocketUrls.redact(e.getMessage()));
            recordEarlyFailure(new TransientTransportException("connection attempt failed to start", e));
            scheduleReconnect();
            growReconnectDelay();
            return;
        }
        listener = attemptListener;
        hadSuccessfulOpen = false;
    }

    private String resolveToken() {
        for (SubscriberHandlers subscriber : subscribers.values()) {
            String token = subscriber.tokenProvider().get();
            if (token != null && !token.isBlank()) {
                return token;
            }
        }
        return null;
    }

    private void handleOpen() {
        open = true;
        hadSuccessfulOpen = true;
        lastOpenedAt = loop.now();
        reconnectDelay = settings.reconnectBase();
        clearCooldown();
        earlyFailureBreaker.onSuccess(0, TimeUnit.MILLISECONDS);
        log.info("Websocket '{}' open with {} subscriber(s)", name, subscribers.size());
        forEachSubscriber("open", subscriber -> subscriber.onOpen().run());
        if (open && connection != null) {
            startHeartbeat();
        }
    }

    private void handleMessage(String text) {
        lastMessageAt = loop.now();
        forEachSubscriber("message", subscriber -> subscriber.onMessage().accept(text));
    }

    private void handleError(Throwable error) {
        log.warn("Websocket '{}' transport error: {}", name, error.getMessage());
        forEachSubscriber("error", subscriber -> subscriber.onError().accept(error));
    }

    private void handleClose(CloseReason reason) {
        boolean closedBeforeOpen = !hadSuccessfulOpen;
        detachListener();
        connection = null;
        open = false;
        stopHeartbeat();

        boolean fatal = reason.isAuthenticationFailure();
        if (fatal) {
            log.warn("Websocket '{}' closed with authentication failure (code {}), not reconnecting",
                    name, reason.code());
            shouldReconnect = false;
            cancelReconnect();
            clearCooldown();
            earlyFailureBreaker.reset();
            reconnectDelay = settings.reconnectBase();
        } else {
            log.info("Websocket '{}' closed (code {}, reason '{}')", name, reason.code(), reason.reason());
        }

        forEachSubscriber("close", subscriber -> subscriber.onClose().accept(reason));

        if (subscribers.isEmpty() || fatal) {
            return;
        }
        if (closedBeforeOpen) {
            recordEarlyFailure(new TransientTransportException(
                    "closed before open with code %d".formatted(reason.code())));
            scheduleReconnect();
            growReconnectDelay();
        } else {
            reconnectDelay = settings.reconnectBase();
            scheduleReconnect();
        }
    }

    private void recordEarlyFailure(TransientTransportException failure) {
        earlyFailureBreaker.onError(0, TimeUnit.MILLISECONDS, failure);
        if (earlyFailureBreaker.getState() == CircuitBreaker.State.OPEN) {
            beginCooldown();
        }
    }

    private void growReconnectDelay() {
        Duration doubled = reconnectDelay.multipliedBy(2);
        reconnectDelay = doubled.compareTo(settings.reconnectMax()) > 0 ? settings.reconnectMax() : doubled;
    }

    private void scheduleReconnect() {
        if (!shouldReconnect || inCooldown() || reconnectTask != null) {
            return;
        }
        Duration delay = reconnectDelay;
        log.info("Reconnecting websocket '{}' in {} ms", name, delay.toMillis());
        reconnectTask = loop.schedule(() -> {
            reconnectTask = null;
            if (!subscribers.isEmpty() && connection == null) {
                openSocket();
            }
        }, delay);
    }

    private void cancelReconnect() {
        if (reconnectTask != null) {
            reconnectTask.cancel();
            reconnectTask = null;
        }
    }

    private boolean inCooldown() {
        return cooldownTask != null;
    }

    private void beginCooldown() {
        if (cooldownTask != null) {
            return;
        }
        cancelReconnect();
        log.warn("Websocket '{}' failed to open {} times in a row, pausing reconnects for {} s",
                name, settings.maxEarlyFailures(), settings.failureCooldown().toSeconds());
        cooldownTask = loop.schedule(this::endCooldown, settings.failureCooldown());
    }

    private void endCooldown() {
        cooldownTask = null;
        earlyFailureBreaker.transitionToClosedState();
        reconnectDelay = settings.reconnectBase();
        shouldReconnect = true;
        if (!subscribers.isEmpty() && connection == null) {
            ensureConnection();
        }
    }

    private void clearCooldown() {
        if (cooldownTask != null) {
            cooldownTask.cancel();
            cooldownTask = null;
        }
        if (earlyFailureBreaker.getState() != CircuitBreaker.State.CLOSED) {
            earlyFailureBreaker.transitionToClosedState();
        }
    }

    private void resetFailureState() {
        clearCooldown();
        earlyFailureBreaker.reset();
        reconnectDelay = settings.reconnectBase();
        hadSuccessfulOpen = false;
        shouldReconnect = true;
    }

    private void startHeartbeat() {
        stopHeartbeat();
        sendPing();
        heartbeatTask = loop.scheduleAtFixedRate(this::sendPing, settings.pingInterval(), settings.pingInterval());
    }

    private void stopHeartbeat() {
        if (heartbeatTask != null) {
            heartbeatTask.cancel();
            heartbeatTask = null;
        }
    }

    private void sendPing() {
        if (!open) {
            return;
        }
        if (send(PING_FRAME)) {
            lastPingAt = loop.now();
            log.debug("Sent heartbeat ping on websocket '{}'", name);
        } else {
            log.debug("Heartbeat ping on websocket '{}' was not written", name);
        }
    }

    private boolean send(String text) {
        if (!open || connection == null) {
            return false;
        }
        return connection.send(text);
    }

    private void teardown() {
        log.info("Last subscriber left websocket '{}', closing", name);
        stopHeartbeat();
        cancelReconnect();
        clearCooldown();
        earlyFailureBreaker.reset();
        shouldReconnect = true;
        reconnectDelay = settings.reconnectBase();
        TransportConnection current = connection;
        detachListener();
        connection = null;
        open = false;
        if (current != null) {
            current.close();
        }
        onEmpty.accept(this);
    }

    private void detachListener() {
        if (listener != null) {
            listener.detach();
            listener = null;
        }
    }

    private void forEachSubscriber(String callback, Consumer<SubscriberHandlers> action) {
        List<Map.Entry<Long, SubscriberHandlers>> snapshot = new ArrayList<>(subscribers.entrySet());
        for (Map.Entry<Long, SubscriberHandlers> entry : snapshot) {
            if (subscribers.containsKey(entry.getKey())) {
                invoke(entry.getKey(), callback, () -> action.accept(entry.getValue()));
            }
        }
    }

    private void invoke(long subscriberId, String callback, Runnable action) {
        try {
            action.run();
        } catch (RuntimeException e) {
            log.warn("Subscriber {} of websocket '{}' failed in {} callback: {}",
                    subscriberId, name, callback, e.getMessage(), e);
        }
    }

    private static String createPingFrame() {
        JsonObject ping = new JsonObject();
        ping.addProperty("action", "ping");
        return ping.toString();
    }

    private final class Subscription implements HubSubscription {
        private final long id;

        private Subscription(long id) {
            this.id = id;
        }

        @Override
        public boolean send(String text) {
            return subscribers.containsKey(id) && ManagedWebSocket.this.send(text);
        }

        @Override
        public boolean isOpen() {
            return subscribers.containsKey(id) && open;
        }

        @Override
        public void dispose() {
            if (subscribers.remove(id) == null) {
                return;
            }
            log.debug("Subscriber {} left websocket '{}'", id, name);
            if (subscribers.isEmpty()) {
                teardown();
            }
        }
    }

    /**
     * Relays transport callbacks onto the loop. Once detached, late callbacks of an abandoned
     * connection are dropped.
     */
    private final class ConnectionListener implements TransportListener {
        private volatile boolean detached;

        void detach() {
            detached = true;
        }

        @Override
        public void onOpen() {
            post(ManagedWebSocket.this::handleOpen);
        }

        @Override
        public void onMessage(String text) {
            post(() -> handleMessage(text));
        }

        @Override
        public void onError(Throwable error) {
            post(() -> handleError(error));
        }

        @Override
        public void onClose(CloseReason reason) {
            post(() -> handleClose(reason));
        }

        private void post(Runnable task) {
            if (detached) {
                return;
            }
            loop.execute(() -> {
                if (!detached) {
                    task.run();
                }
            });
        }
    }
}
