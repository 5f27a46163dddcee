package com.traders.marketstream.backfill;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.traders.marketstream.util.EventLoop;
import com.traders.marketstream.websocket.CloseReason;
import com.traders.marketstream.websocket.HubSubscription;
import com.traders.marketstream.websocket.SubscriberHandlers;
import com.traders.marketstream.websocket.WebSocketHub;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.function.Supplier;

/**
 * Follows the progress of one historical backfill job over the shared {@value #CONNECTION_NAME} socket.
 * Confined to the hub's event loop; {@link #start()} and {@link #dispose()} may be called from any thread.
 */
@Slf4j
public class BackfillProgressClient {
    public static final String CONNECTION_NAME = "market-data-backfill";

    @Getter
    private final String jobId;
    @Getter
    private final String topic;
    private final WebSocketHub hub;
    private final EventLoop loop;
    private final ObjectMapper objectMapper;
    private final Supplier<String> tokenProvider;
    private final BackfillProgressListener listener;

    private HubSubscription handle;
    private boolean subscribed;
    private boolean disposed;
    private boolean completed;

    public BackfillProgressClient(WebSocketHub hub, ObjectMapper objectMapper, String jobId,
                                  Supplier<String> tokenProvider, BackfillProgressListener listener) {
        this.hub = hub;
        this.loop = hub.getLoop();
        this.objectMapper = objectMapper;
        this.jobId = jobId;
        this.topic = BackfillProgressParser.TOPIC_PREFIX + jobId;
        this.tokenProvider = tokenProvider;
        this.listener = listener;
    }

    public void start() {
        loop.execute(this::subscribe);
    }

    public void dispose() {
        loop.execute(this::release);
    }

    private void subscribe() {
        if (handle != null || disposed) {
            return;
        }
        log.info("Watching backfill job {}", jobId);
        handle = hub.subscribe(CONNECTION_NAME, SubscriberHandlers.builder()
                .tokenProvider(tokenProvider)
                .onOpen(this::handleOpen)
                .onMessage(this::handleMessage)
                .onError(this::handleError)
                .onClose(this::handleClose)
                .build());
    }

    private void release() {
        if (disposed) {
            return;
        }
        disposed = true;
        if (handle == null) {
            return;
        }
        if (subscribed) {
            if (!handle.send(frame("unsubscribe"))) {
                log.warn("Could not unsubscribe from {}", topic);
            }
            subscribed = false;
        }
        handle.dispose();
        handle = null;
        log.info("Stopped watching backfill job {}", jobId);
    }

    private void handleOpen() {
        subscribed = false;
        if (handle.send(frame("subscribe"))) {
            subscribed = true;
        } else {
            log.warn("Could not subscribe to {}", topic);
        }
    }

    private void handleMessage(String raw) {
        JsonNode envelope;
        try {
            envelope = objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            log.warn("Dropping unparsable backfill progress frame: {}", e.getOriginalMessage());
            return;
        }
        BackfillProgress progress = BackfillProgressParser.parse(envelope);
        if (progress == null || !jobId.equals(progress.jobId())) {
            return;
        }
        listener.onProgress(progress);
        if (progress.executed()) {
            complete();
        }
    }

    private void handleError(Throwable error) {
        log.warn("Backfill progress channel error for job {}: {}", jobId, error.getMessage());
        listener.onError(error);
    }

    private void handleClose(CloseReason reason) {
        subscribed = false;
        if (!disposed) {
            log.info("Backfill progress channel closed (code {}) while watching job {}", reason.code(), jobId);
            complete();
        }
    }

    private void complete() {
        if (completed) {
            return;
        }
        completed = true;
        listener.onComplete();
    }

    private String frame(String action) {
        ObjectNode frame = objectMapper.createObjectNode();
        frame.put("action", action);
        frame.putArray("topics").add(topic);
        return frame.toString();
    }
}
