package com.traders.marketstream.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.traders.marketstream.exception.SubscriptionRejectedException;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

import static com.traders.marketstream.normalize.JsonValues.field;
import static com.traders.marketstream.normalize.JsonValues.firstText;
import static com.traders.marketstream.normalize.JsonValues.record;
import static com.traders.marketstream.normalize.JsonValues.text;

/**
 * Readers for subscribe and unsubscribe ACK frames. Servers disagree on where they put the
 * subscription id, capabilities and embedded snapshot, so every reader walks a fixed list of places.
 */
final class SubscriptionAcks {
    static final String DEFAULT_REJECTION = "market data subscription was rejected";

    private static final String[] ID_KEYS = {"subscriptionId", "subscription_id", "id"};
    private static final String[] ERROR_KEYS = {"message", "error", "detail"};

    private SubscriptionAcks() {
    }

    /**
     * Trimmed, non-blank string topics of the frame in wire order.
     */
    static List<String> topics(JsonNode ack) {
        List<String> topics = new ArrayList<>();
        JsonNode node = field(ack, "topics");
        if (node == null || !node.isArray()) {
            return topics;
        }
        for (JsonNode item : node) {
            String topic = text(item);
            if (topic != null) {
                topics.add(topic);
            }
        }
        return topics;
    }

    static List<String> distinct(List<String> topics) {
        return new ArrayList<>(new LinkedHashSet<>(topics));
    }

    static String subscriptionId(JsonNode ack) {
        String direct = firstText(ack, "subscriptionId", "subscription_id");
        if (direct != null) {
            return direct;
        }
        JsonNode metadata = record(ack, "metadata");
        String fromMetadata = idIn(metadata, true);
        if (fromMetadata != null) {
            return fromMetadata;
        }
        String fromSnapshots = idIn(record(ack, "snapshots"), true);
        if (fromSnapshots != null) {
            return fromSnapshots;
        }
        JsonNode payload = record(ack, "payload");
        String fromPayload = idIn(payload, false);
        if (fromPayload != null) {
            return fromPayload;
        }
        return idIn(record(payload, "snapshots"), true);
    }

    static JsonNode capabilities(JsonNode ack) {
        JsonNode snapshots = record(ack, "snapshots");
        JsonNode payload = record(ack, "payload");
        JsonNode payloadSnapshots = record(payload, "snapshots");
        JsonNode[] candidates = {
                record(ack, "capabilities"),
                record(record(ack, "metadata"), "capabilities"),
                record(snapshots, "capabilities"),
                record(record(snapshots, "subscription"), "capabilities"),
                record(payload, "capabilities"),
                record(payloadSnapshots, "capabilities"),
                record(record(payloadSnapshots, "subscription"), "capabilities")
        };
        for (JsonNode candidate : candidates) {
            if (candidate != null) {
                return candidate;
            }
        }
        return null;
    }

    /**
     * @return the server's rejection message, or {@code null} when the ACK accepts the subscription
     */
    static String error(JsonNode ack) {
        String direct = errorText(field(ack, "error"));
        if (direct != null) {
            return direct;
        }
        String nested = errorText(field(record(ack, "payload"), "error"));
        if (nested != null) {
            return nested;
        }
        JsonNode status = field(ack, "status");
        boolean failed = (status != null && "error".equals(status.asText()))
                || isFalse(field(ack, "ok"))
                || isFalse(field(ack, "success"));
        if (!failed) {
            return null;
        }
        String message = text(field(ack, "message"));
        return message != null ? message : DEFAULT_REJECTION;
    }

    /**
     * The snapshot record embedded in an ACK: {@code snapshot} or {@code snapshots}, the same keys
     * nested under {@code payload}, {@code payload.data} or {@code data}, or the first record of a
     * {@code snapshots} array.
     */
    static JsonNode snapshot(JsonNode ack) {
        JsonNode payload = record(ack, "payload");
        JsonNode payloadData = record(payload, "data");
        JsonNode data = record(ack, "data");
        List<JsonNode> candidates = new ArrayList<>(List.of(
                nullToMissing(field(ack, "snapshot")),
                nullToMissing(field(ack, "snapshots")),
                nullToMissing(field(payload, "snapshot")),
                nullToMissing(field(payload, "snapshots")),
                nullToMissing(field(payloadData, "snapshot")),
                nullToMissing(field(payloadData, "snapshots")),
                nullToMissing(field(data, "snapshot")),
                nullToMissing(field(data, "snapshots"))));
        JsonNode snapshots = field(ack, "snapshots");
        if (snapshots != null && snapshots.isArray()) {
            snapshots.forEach(candidates::add);
        }
        for (JsonNode candidate : candidates) {
            if (candidate.isObject()) {
                return candidate;
            }
        }
        return null;
    }

    static void requireAccepted(JsonNode ack) {
        String error = error(ack);
        if (error != null) {
            throw new SubscriptionRejectedException(error);
        }
    }

    private static String idIn(JsonNode container, boolean includeSubscription) {
        if (container == null) {
            return null;
        }
        String id = firstText(container, ID_KEYS);
        if (id != null || !includeSubscription) {
            return id;
        }
        return firstText(record(container, "subscription"), "id", "subscriptionId", "subscription_id");
    }

    private static String errorText(JsonNode value) {
        if (value == null) {
            return null;
        }
        if (value.isTextual()) {
            return text(value);
        }
        if (value.isObject()) {
            for (String key : ERROR_KEYS) {
                String nested = errorText(field(value, key));
                if (nested != null) {
                    return nested;
                }
            }
        }
        return null;
    }

    private static JsonNode nullToMissing(JsonNode node) {
        return node == null ? MissingNode.getInstance() : node;
    }

    private static boolean isFalse(JsonNode value) {
        return value != null && value.isBoolean() && !value.booleanValue();
    }
}
