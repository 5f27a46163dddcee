package com.traders.marketstream.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.traders.marketstream.domain.Bar;
import com.traders.marketstream.domain.BarUpdate;
import com.traders.marketstream.domain.ConnectionState;
import com.traders.marketstream.domain.ConnectionStatus;
import com.traders.marketstream.domain.DepthLevel;
import com.traders.marketstream.domain.DepthSnapshot;
import com.traders.marketstream.domain.KlineSnapshot;
import com.traders.marketstream.domain.MarketDataListener;
import com.traders.marketstream.domain.SubscriptionDescriptor;
import com.traders.marketstream.domain.SubscriptionFailure;
import com.traders.marketstream.domain.SubscriptionReady;
import com.traders.marketstream.domain.SymbolInfo;
import com.traders.marketstream.domain.TickerSnapshot;
import com.traders.marketstream.exception.AuthenticationFailureException;
import com.traders.marketstream.exception.MalformedMessageException;
import com.traders.marketstream.exception.SubscriptionRejectedException;
import com.traders.marketstream.normalize.AggregationWindow;
import com.traders.marketstream.normalize.JsonValues;
import com.traders.marketstream.normalize.MarketNormalizer;
import com.traders.marketstream.normalize.MarketTopics;
import com.traders.marketstream.normalize.PriceNormalizer;
import com.traders.marketstream.normalize.PriceNormalizer.TickOptions;
import com.traders.marketstream.normalize.SymbolRoots;
import com.traders.marketstream.telemetry.MarketMetricEvent;
import com.traders.marketstream.telemetry.MarketTelemetry;
import com.traders.marketstream.util.EventLoop;
import com.traders.marketstream.websocket.CloseReason;
import com.traders.marketstream.websocket.HubSubscription;
import com.traders.marketstream.websocket.SubscriberHandlers;
import com.traders.marketstream.websocket.WebSocketHub;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

import static com.traders.marketstream.normalize.JsonValues.field;
import static com.traders.marketstream.normalize.JsonValues.firstText;
import static com.traders.marketstream.normalize.JsonValues.round6;

/**
 * Keeps one market data subscription alive over a shared hub socket.
 * <p>
 * The client follows whatever the symbol and timeframe providers currently return: every socket open
 * resubscribes, {@link #refreshSubscription()} swaps topics when the selection changed, and an
 * application-level heartbeat forces a reconnect when the server goes quiet. Inbound events are
 * checked against the selected symbol, normalized and handed to the {@link MarketDataListener}.
 * <p>
 * Public methods may be called from any thread; they are queued onto the event loop. Every listener
 * callback runs on that loop.
 */
@Slf4j
public class MarketRealtimeClient implements AckSnapshotIngestor.Target {
    static final String DEFAULT_CONNECTION_NAME = "ws";
    static final String MISSING_TOKEN = "missing token";
    static final String AUTHENTICATION_FAILED = "authentication failed";

    private final WebSocketHub hub;
    private final EventLoop loop;
    private final MarketTelemetry telemetry;
    private final ObjectMapper objectMapper;
    private final MarketClientOptions options;
    private final ClientSettings settings;
    private final DomCapabilityResolver domCapabilities;
    private final AckSnapshotIngestor snapshotIngestor;
    private final ClientState state = new ClientState();

    public MarketRealtimeClient(WebSocketHub hub, MarketTelemetry telemetry, ObjectMapper objectMapper,
                                MarketClientOptions options, ClientSettings settings) {
        this.hub = hub;
        this.loop = hub.getLoop();
        this.telemetry = telemetry;
        this.objectMapper = objectMapper;
        this.options = options;
        this.settings = settings == null ? ClientSettings.DEFAULTS : settings;
        this.domCapabilities = new DomCapabilityResolver();
        this.snapshotIngestor = new AckSnapshotIngestor(this);
        this.state.lastActivityAt = loop.now();
    }

    public void connect() {
        connect(false);
    }

    /**
     * Starts the client. Idempotent unless {@code force}, which drops the current socket and opens a new one.
     */
    public void connect(boolean force) {
        submit(new ClientCommand.Connect(force));
    }

    public void disconnect() {
        submit(new ClientCommand.Disconnect());
    }

    /**
     * Re-reads the symbol and timeframe providers and resubscribes if either changed since the last request.
     */
    public void refreshSubscription() {
        submit(new ClientCommand.RefreshSubscription());
    }

    public CompletableFuture<ClientStatus> status() {
        return loop.submit(this::currentStatus);
    }

    private void submit(ClientCommand command) {
        loop.execute(() -> dispatch(command));
    }

    void dispatch(ClientCommand command) {
        if (command instanceof ClientCommand.Connect connect) {
            handleConnect(connect.force());
        } else if (command instanceof ClientCommand.Disconnect) {
            handleDisconnect();
        } else if (command instanceof ClientCommand.RefreshSubscription) {
            subscribeToTopics(false);
        }
    }

    ClientStatus currentStatus() {
        return new ClientStatus(
                state.started,
                state.connectionState,
                state.lastSubscribedSymbol,
                state.lastSubscribedTimeframe,
                state.lastSubscribedTopics,
                state.subscriptionId,
                state.confirmed,
                state.reconnectAttempt,
                state.lastActivityAt);
    }

    private void handleConnect(boolean force) {
        if (state.started && !force) {
            return;
        }
        log.info("Starting market data client (force={})", force);
        state.started = true;
        if (force) {
            stopHeartbeat();
            disposeHandle();
        }
        cancelReconnect();
        state.reconnectAttempt = 0;
        openSocket();
    }

    private void handleDisconnect() {
        log.info("Stopping market data client");
        state.started = false;
        stopHeartbeat();
        cancelReconnect();
        state.reconnectAttempt = 0;
        disposeHandle();
        state.clearSubscription();
        telemetry.emit(new MarketMetricEvent.SocketClosed(loop.now(), "manual", null));
        notifyListener(MarketDataListener::onSubscriptionReset);
    }

    private void openSocket() {
        String token = trimToNull(options.tokenProvider().get());
        if (token == null) {
            log.warn("No market data token available, client stays offline");
            notifyListener(MarketDataListener::onSubscriptionReset);
            updateStatus(ConnectionState.FAILED, MISSING_TOKEN);
            state.started = false;
            return;
        }
        String symbol = currentSymbol();
        String connectionName = symbol != null ? symbol : DEFAULT_CONNECTION_NAME;
        disposeHandle();
        cancelReconnect();
        updateStatus(ConnectionState.CONNECTING, null);
        state.connectionOpenedAt = loop.now();
        state.handle = hub.subscribe(connectionName, options.path(), SubscriberHandlers.builder()
                .tokenProvider(options.tokenProvider())
                .onOpen(this::handleSocketOpen)
                .onMessage(this::handleMessage)
                .onError(this::handleSocketError)
                .onClose(this::handleSocketClose)
                .build());
    }

    private void handleSocketOpen() {
        Instant now = loop.now();
        touch();
        startHeartbeat();
        cancelReconnect();
        int attempt = state.reconnectAttempt;
        Duration latency = state.connectionOpenedAt == null ? null : Duration.between(state.connectionOpenedAt, now);
        state.reconnectAttempt = 0;
        updateStatus(ConnectionState.CONNECTED, null);
        telemetry.emit(new MarketMetricEvent.SocketOpened(now, attempt, latency));
        subscribeToTopics(true);
    }

    private void handleSocketError(Throwable error) {
        String message = error == null || error.getMessage() == null ? "socket error" : error.getMessage();
        log.warn("Market data socket error: {}", message);
        stopHeartbeat();
        telemetry.emit(new MarketMetricEvent.SocketError(loop.now(), message));
        scheduleReconnect("socket-error");
    }

    private void handleSocketClose(CloseReason reason) {
        stopHeartbeat();
        boolean authenticationFailure = reason.isAuthenticationFailure();
        telemetry.emit(new MarketMetricEvent.SocketClosed(loop.now(),
                authenticationFailure ? "authentication-failure" : "socket-close", reason.code()));
        if (authenticationFailure) {
            handleAuthenticationFailure(reason);
            return;
        }
        scheduleReconnect("socket-close");
    }

    private void handleAuthenticationFailure(CloseReason reason) {
        log.warn("Market data socket rejected the token (code {}), client stopped", reason.code());
        cancelReconnect();
        disposeHandle();
        state.started = false;
        updateStatus(ConnectionState.FAILED, AUTHENTICATION_FAILED);
        AuthenticationFailureException failure = new AuthenticationFailureException(reason.code(), reason.reason());
        notifyListener(listener -> listener.onAuthenticationFailure(failure));
    }

    private void scheduleReconnect(String reason) {
        if (!state.started || state.reconnectTask != null) {
            return;
        }
        state.reconnectAttempt++;
        int attempt = state.reconnectAttempt;
        Duration delay = settings.reconnectDelay(attempt);
        log.info("Reconnecting market data client in {} ms (attempt {}, {})", delay.toMillis(), attempt, reason);
        telemetry.emit(new MarketMetricEvent.ReconnectScheduled(loop.now(), reason, attempt, delay));
        stopHeartbeat();
        disposeHandle();
        updateStatus(ConnectionState.RECONNECTING, null);
        state.reconnectTask = loop.schedule(() -> {
            state.reconnectTask = null;
            if (state.started) {
                openSocket();
            }
        }, delay);
    }

    private void cancelReconnect() {
        if (state.reconnectTask != null) {
            state.reconnectTask.cancel();
            state.reconnectTask = null;
        }
    }

    private void startHeartbeat() {
        if (state.heartbeatTask != null) {
            return;
        }
        state.heartbeatTask = loop.scheduleAtFixedRate(this::checkHeartbeat,
                settings.heartbeatCheckInterval(), settings.heartbeatCheckInterval());
    }

    private void stopHeartbeat() {
        if (state.heartbeatTask != null) {
            state.heartbeatTask.cancel();
            state.heartbeatTask = null;
        }
    }

    /**
     * Forces a reconnect when nothing arrived for longer than the heartbeat timeout.
     */
    void checkHeartbeat() {
        if (!state.started) {
            return;
        }
        Instant now = loop.now();
        Duration inactivity = Duration.between(state.lastActivityAt, now);
        if (inactivity.compareTo(settings.heartbeatTimeout()) < 0) {
            return;
        }
        String symbol = state.lastSubscribedSymbol != null ? state.lastSubscribedSymbol : currentSymbol();
        if (symbol == null) {
            touch();
            return;
        }
        String timeframe = state.lastSubscribedTimeframe != null ? state.lastSubscribedTimeframe : currentTimeframe();
        List<String> topics = state.lastSubscribedTopics.isEmpty() ? topicsFor(symbol) : state.lastSubscribedTopics;
        log.warn("No market data for {} s on {}, reconnecting", inactivity.toSeconds(), symbol);
        telemetry.emit(new MarketMetricEvent.HeartbeatTimeout(now, inactivity, symbol, timeframe, topics));
        touch();
        scheduleReconnect("heartbeat-timeout");
    }

    private void touch() {
        state.lastActivityAt = loop.now();
    }

    private void disposeHandle() {
        if (state.handle != null) {
            HubSubscription handle = state.handle;
            state.handle = null;
            handle.dispose();
        }
    }

    private void updateStatus(ConnectionState connectionState, String reason) {
        state.connectionState = connectionState;
        ConnectionStatus status = new ConnectionStatus(connectionState, reason, loop.now());
        telemetry.emit(new MarketMetricEvent.ConnectionStatusChanged(status.at(), connectionState, reason));
        notifyListener(listener -> listener.onConnectionStatus(status));
    }

    // inbound frames

    private void handleMessage(String raw) {
        touch();
        JsonNode envelope;
        try {
            envelope = readEnvelope(raw);
        } catch (MalformedMessageException e) {
            log.warn("Dropping market data frame: {}", e.getMessage());
            return;
        }
        String type = JsonValues.text(field(envelope, "type"));
        if ("event".equals(type)) {
            handleEvent(envelope);
        } else if ("ack".equals(type)) {
            handleAck(envelope);
        } else {
            log.debug("Ignoring market data frame of type {}", type);
        }
    }

    private JsonNode readEnvelope(String raw) {
        JsonNode envelope;
        try {
            envelope = objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new MalformedMessageException("unparsable JSON frame", e);
        }
        if (envelope == null || !envelope.isObject()) {
            throw new MalformedMessageException("frame is not a JSON object");
        }
        return envelope;
    }

    private void handleAck(JsonNode ack) {
        String action = JsonValues.text(field(ack, "action"));
        if ("subscribe".equals(action)) {
            handleSubscribeAck(ack);
        } else if ("unsubscribe".equals(action)) {
            handleUnsubscribeAck(ack);
        } else {
            log.debug("Ignoring ACK for action {}", action);
        }
    }

    private void handleUnsubscribeAck(JsonNode ack) {
        Set<String> acked = new HashSet<>(SubscriptionAcks.topics(ack));
        if (!acked.equals(new HashSet<>(state.lastSubscribedTopics))) {
            log.debug("Unsubscribe ACK for superseded topics {}", acked);
            return;
        }
        log.info("Unsubscribed from {}", acked);
        state.subscriptionId = null;
        state.confirmed = false;
        notifyListener(MarketDataListener::onSubscriptionReset);
    }

    private void handleSubscribeAck(JsonNode ack) {
        List<String> ackTopics = SubscriptionAcks.distinct(SubscriptionAcks.topics(ack));
        String ackSymbol = firstText(ack, "symbol");
        String ackTimeframe = firstText(ack, "timeframe");
        try {
            SubscriptionAcks.requireAccepted(ack);
        } catch (SubscriptionRejectedException e) {
            failSubscription(ackSymbol, ackTimeframe, ackTopics, e);
            return;
        }
        Instant now = loop.now();
        String subscriptionId = SubscriptionAcks.subscriptionId(ack);
        JsonNode capabilities = SubscriptionAcks.capabilities(ack);

        String symbol = ackSymbol != null ? ackSymbol : state.lastSubscribedSymbol;
        String timeframe = ackTimeframe != null ? ackTimeframe : state.lastSubscribedTimeframe;
        if (ackSymbol != null) {
            state.lastSubscribedSymbol = ackSymbol;
        }
        if (ackTimeframe != null) {
            state.lastSubscribedTimeframe = ackTimeframe;
        }
        String topicSymbol = symbol != null ? symbol : currentSymbol();
        List<String> topics = !ackTopics.isEmpty() || topicSymbol == null ? ackTopics : topicsFor(topicSymbol);
        Duration latency = state.subscriptionRequestedAt == null
                ? null : Duration.between(state.subscriptionRequestedAt, now);

        state.subscriptionRequestedAt = null;
        state.lastSubscribedTopics = List.copyOf(topics);
        state.subscriptionId = subscriptionId;
        state.confirmed = true;
        state.cacheCapabilities(topicSymbol, capabilities);
        state.mismatchWarnings.clear();

        log.info("Market data subscription {} ready for {} {} on {}", subscriptionId, symbol, timeframe, topics);
        telemetry.emit(new MarketMetricEvent.SubscribeAcknowledged(now, subscriptionId, symbol, timeframe, topics, latency));
        SubscriptionReady ready = new SubscriptionReady(subscriptionId, symbol, timeframe, topics, capabilities);
        notifyListener(listener -> listener.onSubscriptionReady(ready));

        AckSnapshotIngestor.Result applied = snapshotIngestor.ingest(SubscriptionAcks.snapshot(ack));
        if (expectsDepth(topics, capabilities) && !applied.depthApplied()) {
            log.warn("Subscribe ACK for {} carried no depth snapshot", symbol);
        }
        if (expectsBars(topics) && !applied.historyApplied() && !applied.barApplied()) {
            log.warn("Subscribe ACK for {} carried no bar snapshot", symbol);
        }
    }

    private void failSubscription(String symbol, String timeframe, List<String> topics,
                                  SubscriptionRejectedException rejection) {
        String error = rejection.getMessage();
        String failedSymbol = symbol != null ? symbol : state.lastSubscribedSymbol;
        String failedTimeframe = timeframe != null ? timeframe : state.lastSubscribedTimeframe;
        List<String> failedTopics = topics.isEmpty() ? state.lastSubscribedTopics : topics;
        log.warn("Market data subscription for {} rejected: {}", failedSymbol, error);
        SubscriptionFailure failure = new SubscriptionFailure(failedSymbol, failedTimeframe, failedTopics, error);
        notifyListener(listener -> listener.onSubscriptionFailed(failure));
        updateStatus(ConnectionState.FAILED, error);
        stopHeartbeat();
        cancelReconnect();
        disposeHandle();
        state.started = false;
        state.clearSubscription();
        telemetry.emit(new MarketMetricEvent.SubscribeFailed(loop.now(), failedSymbol, failedTimeframe, failedTopics, error));
    }

    private boolean expectsDepth(List<String> topics, JsonNode capabilities) {
        for (String topic : topics) {
            MarketTopics.Topic parsed = MarketTopics.parse(topic);
            if (parsed != null && MarketTopics.DOM_BASES.contains(parsed.base())) {
                return true;
            }
        }
        return Boolean.TRUE.equals(DomCapabilityResolver.findCapabilityFlag(capabilities));
    }

    private boolean expectsBars(List<String> topics) {
        for (String topic : topics) {
            MarketTopics.Topic parsed = MarketTopics.parse(topic);
            if (parsed != null && MarketTopics.route(parsed.base()) == MarketTopics.Route.BAR) {
                return true;
            }
        }
        return false;
    }

    private void handleEvent(JsonNode envelope) {
        String eventName = firstText(envelope, "event", "topic", "channel");
        if (eventName == null) {
            log.debug("Ignoring event frame without a topic");
            return;
        }
        JsonNode payload = field(envelope, "payload");
        if (payload == null) {
            payload = field(envelope, "data");
        }
        MarketTopics.Topic topic = MarketTopics.parse(eventName);
        String topicSymbol = topic.symbol();
        String payloadSymbol = payloadSymbol(payload);
        String selected = currentSymbol();
        String expected = selected != null ? selected : state.lastSubscribedSymbol;

        if (SymbolRoots.isMismatch(topicSymbol, payloadSymbol, expected)) {
            reportMismatch(eventName, topicSymbol, payloadSymbol, expected);
            return;
        }
        MarketTopics.Route route = MarketTopics.route(topic.base());
        if (route == null) {
            log.debug("Ignoring event {} with unknown topic", eventName);
            return;
        }
        switch (route) {
            case DEPTH -> applyDepth(payload);
            case TICKER -> applyTicker(payload);
            case BAR -> applyBar(payload);
        }
    }

    private static String payloadSymbol(JsonNode payload) {
        String direct = firstText(payload, "symbol");
        if (direct != null) {
            return direct;
        }
        String nested = firstText(JsonValues.record(payload, "payload"), "symbol");
        return nested != null ? nested : firstText(JsonValues.record(payload, "data"), "symbol");
    }

    private void reportMismatch(String eventName, String topicSymbol, String payloadSymbol, String expected) {
        Set<String> observedSymbols = new LinkedHashSet<>();
        if (topicSymbol != null) {
            observedSymbols.add(topicSymbol);
        }
        if (payloadSymbol != null) {
            observedSymbols.add(payloadSymbol);
        }
        String observed = String.join(" / ", observedSymbols);
        if (!state.mismatchWarnings.add(observed + "->" + expected)) {
            log.debug("Dropped {} for {} (subscribed to {})", eventName, observed, expected);
            return;
        }
        log.warn("Dropping {}: data for {} does not match subscription {}", eventName, observed, expected);
        notifyListener(listener -> listener.onSymbolMismatch(observed, expected));
    }

    // AckSnapshotIngestor.Target, also used for live events

    @Override
    public void applyDepth(JsonNode value) {
        String target = currentSymbol();
        DepthSnapshot depth = MarketNormalizer.normalizeDepth(value, target, loop.now());
        if (depth == null) {
            log.debug("Depth payload held nothing usable");
            return;
        }
        if (target != null && depth.symbol() != null && !SymbolRoots.compatible(target, depth.symbol())) {
            log.debug("Depth for {} ignored while subscribed to {}", depth.symbol(), target);
            return;
        }
        String symbol = canonicalSymbol(depth.symbol(), target);
        SymbolInfo metadata = metadata(symbol);
        Double reference = depth.midPrice();
        DepthSnapshot corrected = depth.toBuilder()
                .symbol(symbol)
                .bids(correctLevels(depth.bids(), symbol, metadata, reference))
                .asks(correctLevels(depth.asks(), symbol, metadata, reference))
                .build();
        notifyListener(listener -> listener.onDepth(corrected));
        Double mark = depthMarkPrice(corrected, metadata);
        if (symbol != null && mark != null) {
            notifyListener(listener -> listener.onMarkPrice(symbol, mark));
        }
    }

    @Override
    public void applyTicker(JsonNode value) {
        String target = currentSymbol();
        TickerSnapshot ticker = MarketNormalizer.normalizeTicker(value, target, loop.now());
        if (ticker == null) {
            log.debug("Ticker payload held nothing usable");
            return;
        }
        TickerSnapshot corrected = correctTicker(ticker, target);
        notifyListener(listener -> listener.onTicker(corrected));
        Double mark = tickerMarkPrice(corrected);
        if (corrected.symbol() != null && mark != null) {
            notifyListener(listener -> listener.onMarkPrice(corrected.symbol(), mark));
        }
    }

    @Override
    public void applyBar(JsonNode value) {
        String symbol = currentSymbol();
        String timeframe = currentTimeframe();
        AggregationWindow window = AggregationWindow.resolve(timeframe);
        Long requested = requestedDuration();
        MarketNormalizer.BarEvent event = MarketNormalizer.normalizeBarEvent(value, new MarketNormalizer.BarContext(
                symbol, timeframe, window.intervalSeconds(), requested != null ? requested : window.durationSeconds()));
        if (event == null) {
            log.debug("Bar payload held nothing usable");
            return;
        }
        String resolvedSymbol = canonicalSymbol(event.symbol(), symbol);
        String resolvedTimeframe = event.timeframe() != null ? event.timeframe() : timeframe;
        if (event.snapshot() != null) {
            applyHistory(event.snapshot().toBuilder().symbol(resolvedSymbol == null ? "" : resolvedSymbol).build());
        }
        if (event.bar() != null) {
            BarUpdate update = new BarUpdate(resolvedSymbol, resolvedTimeframe,
                    event.intervalSeconds(), event.durationSeconds(), correctBar(event.bar(), resolvedSymbol));
            notifyListener(listener -> listener.onBar(update));
        }
    }

    @Override
    public void applyHistory(KlineSnapshot snapshot) {
        String symbol = snapshot.symbol();
        List<Bar> bars = new ArrayList<>(snapshot.bars().size());
        for (Bar bar : snapshot.bars()) {
            bars.add(correctBar(bar, symbol));
        }
        KlineSnapshot corrected = snapshot.toBuilder().bars(bars).build();
        notifyListener(listener -> listener.onKline(symbol, corrected));
    }

    @Override
    public void clearHistory() {
        String symbol = currentSymbol();
        notifyListener(listener -> listener.onKline(symbol, null));
    }

    @Override
    public void applyAvailability(JsonNode value) {
        String symbol = currentSymbol();
        notifyListener(listener -> listener.onAvailability(symbol, value));
    }

    @Override
    public String symbol() {
        return currentSymbol();
    }

    @Override
    public String timeframe() {
        return currentTimeframe();
    }

    @Override
    public Long requestedDuration() {
        return options.durationProvider().get();
    }

    // price correction

    private List<DepthLevel> correctLevels(List<DepthLevel> levels, String symbol, SymbolInfo metadata, Double reference) {
        List<DepthLevel> corrected = new ArrayList<>(levels.size());
        for (DepthLevel level : levels) {
            Double price = PriceNormalizer.normalizePriceByTick(level.price(), symbol, TickOptions.of(metadata, reference));
            corrected.add(new DepthLevel(price != null ? price : level.price(), level.size()));
        }
        return corrected;
    }

    private Double depthMarkPrice(DepthSnapshot depth, SymbolInfo metadata) {
        Double mid = depth.midPrice();
        if (mid != null) {
            return price(mid, depth.symbol(), metadata, mid);
        }
        DepthLevel bestBid = depth.bestBid();
        DepthLevel bestAsk = depth.bestAsk();
        Double candidate = null;
        if (bestBid != null && bestAsk != null) {
            candidate = round6((bestBid.price() + bestAsk.price()) / 2);
        } else if (bestBid != null) {
            candidate = bestBid.price();
        } else if (bestAsk != null) {
            candidate = bestAsk.price();
        }
        return candidate == null ? null : price(candidate, depth.symbol(), metadata, candidate);
    }

    /**
     * Relabels to the selected symbol when the roots agree, tick-corrects every price and recomputes
     * the derived fields from the corrected values.
     */
    private TickerSnapshot correctTicker(TickerSnapshot ticker, String target) {
        String symbol = ticker.symbol() != null ? ticker.symbol() : target;
        if (target != null && SymbolRoots.sameRoot(target, symbol)) {
            symbol = target;
        }
        SymbolInfo metadata = metadata(symbol);
        Double last = price(ticker.last(), symbol, metadata, ticker.close());
        Double close = price(ticker.close(), symbol, metadata, last != null ? last : ticker.last());
        Double reference = last != null ? last : close;
        Double bid = price(ticker.bid(), symbol, metadata, reference);
        Double ask = price(ticker.ask(), symbol, metadata, reference);
        Double mid = price(ticker.midPrice(), symbol, metadata, reference);
        Double spread = ticker.spread();
        if (bid != null && ask != null) {
            mid = round6((bid + ask) / 2);
            spread = round6(Math.abs(ask - bid));
        }
        Double change = ticker.change();
        Double changePercent = ticker.changePercent();
        if (last != null && close != null) {
            change = round6(last - close);
            changePercent = Math.abs(close) > 1e-6 ? round6(change / close * 100) : null;
        }
        return ticker.toBuilder()
                .symbol(symbol)
                .last(last)
                .close(close)
                .bid(bid)
                .ask(ask)
                .midPrice(mid)
                .spread(spread)
                .change(change)
                .changePercent(changePercent)
                .build();
    }

    private Double tickerMarkPrice(TickerSnapshot ticker) {
        Double candidate = ticker.last();
        if (candidate == null) {
            candidate = ticker.midPrice();
        }
        if (candidate == null) {
            candidate = ticker.close();
        }
        if (candidate == null && ticker.bid() != null && ticker.ask() != null) {
            candidate = round6((ticker.bid() + ticker.ask()) / 2);
        }
        if (candidate == null) {
            return null;
        }
        Double reference = ticker.close() != null ? ticker.close() : ticker.midPrice();
        return price(candidate, ticker.symbol(), metadata(ticker.symbol()), reference != null ? reference : candidate);
    }

    private Bar correctBar(Bar bar, String symbol) {
        SymbolInfo metadata = metadata(symbol);
        double reference = bar.close();
        return new Bar(
                bar.timestamp(),
                price(bar.open(), symbol, metadata, reference),
                price(bar.high(), symbol, metadata, reference),
                price(bar.low(), symbol, metadata, reference),
                price(bar.close(), symbol, metadata, reference),
                bar.volume());
    }

    private Double price(Double value, String symbol, SymbolInfo metadata, Double reference) {
        if (value == null) {
            return null;
        }
        Double normalized = PriceNormalizer.normalizePriceByTick(value, symbol, TickOptions.of(metadata, reference));
        return normalized != null ? normalized : value;
    }

    // outbound frames

    private void subscribeToTopics(boolean force) {
        HubSubscription handle = state.handle;
        if (handle == null || !handle.isOpen()) {
            log.debug("Market data socket not open, subscription deferred");
            return;
        }
        String symbol = currentSymbol();
        if (symbol == null) {
            log.debug("No symbol selected, nothing to subscribe");
            return;
        }
        String timeframe = currentTimeframe();
        List<String> topics = topicsFor(symbol);
        boolean unsubscribePrevious = state.lastSubscribedSymbol != null
                && (!symbol.equals(state.lastSubscribedSymbol)
                || !Objects.equals(timeframe, state.lastSubscribedTimeframe));
        if (!force && symbol.equals(state.lastRequestedSymbol) && Objects.equals(timeframe, state.lastRequestedTimeframe)) {
            log.debug("Subscription for {} {} already requested", symbol, timeframe);
            return;
        }
        if (unsubscribePrevious && !state.lastSubscribedTopics.isEmpty()) {
            unsubscribe(handle, state.lastSubscribedTopics);
        }

        ObjectNode frame = objectMapper.createObjectNode();
        frame.put("action", "subscribe");
        frame.set("topics", topicArray(topics));
        frame.put("symbol", symbol);
        if (timeframe != null) {
            frame.put("timeframe", timeframe);
        }
        if (!handle.send(frame.toString())) {
            log.warn("Could not send subscription request for {}", symbol);
            return;
        }
        Instant now = loop.now();
        state.lastRequestedSymbol = symbol;
        state.lastRequestedTimeframe = timeframe;
        state.lastSubscribedSymbol = symbol;
        state.lastSubscribedTimeframe = timeframe;
        state.lastSubscribedTopics = List.copyOf(topics);
        state.subscriptionRequestedAt = now;
        state.confirmed = false;
        log.info("Requested market data subscription for {} {} on {}", symbol, timeframe, topics);
        SubscriptionDescriptor pending = new SubscriptionDescriptor(symbol, timeframe, topics, now);
        notifyListener(listener -> listener.onSubscriptionPending(pending));
        telemetry.emit(new MarketMetricEvent.SubscribeRequested(now, symbol, timeframe, topics));
    }

    private void unsubscribe(HubSubscription handle, List<String> topics) {
        ObjectNode frame = objectMapper.createObjectNode();
        frame.put("action", "unsubscribe");
        frame.set("topics", topicArray(topics));
        if (handle.send(frame.toString())) {
            log.info("Unsubscribing from {}", topics);
        } else {
            log.warn("Could not send unsubscribe for {}", topics);
        }
    }

    private ArrayNode topicArray(List<String> topics) {
        ArrayNode array = objectMapper.createArrayNode();
        topics.forEach(array::add);
        return array;
    }

    List<String> topicsFor(String symbol) {
        boolean domCapable = domCapabilities.isDomCapable(metadata(symbol), state.capabilitiesFor(symbol));
        return MarketTopics.topicsFor(symbol, domCapable);
    }

    // providers

    private String currentSymbol() {
        return trimToNull(options.symbolProvider().get());
    }

    private String currentTimeframe() {
        return trimToNull(options.timeframeProvider().get());
    }

    private SymbolInfo metadata(String symbol) {
        if (symbol == null) {
            return null;
        }
        try {
            return options.symbolMetadataProvider().apply(symbol);
        } catch (RuntimeException e) {
            log.warn("Symbol metadata lookup failed for {}: {}", symbol, e.getMessage());
            return null;
        }
    }

    private static String canonicalSymbol(String observed, String target) {
        if (target != null && (observed == null || SymbolRoots.sameRoot(observed, target))) {
            return target;
        }
        return observed != null ? observed : target;
    }

    private void notifyListener(Consumer<MarketDataListener> callback) {
        try {
            callback.accept(options.listener());
        } catch (RuntimeException e) {
            log.warn("Market data listener failed: {}", e.getMessage(), e);
        }
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
