package com.traders.marketstream.backfill;

import com.fasterxml.jackson.databind.JsonNode;
import com.traders.marketstream.normalize.JsonValues;

import java.util.Locale;
import java.util.Set;

import static com.traders.marketstream.normalize.JsonValues.field;
import static com.traders.marketstream.normalize.JsonValues.firstText;
import static com.traders.marketstream.normalize.JsonValues.record;

/**
 * Reads backfill progress events. Only {@code event} frames (or frames without a type) are considered;
 * ACKs, pongs and welcome frames yield {@code null}.
 */
final class BackfillProgressParser {
    static final String TOPIC_PREFIX = "market_data.backfill.";

    private static final String[] PROGRESS_CONTAINERS = {"progress", "metadata", "detail", "details"};
    private static final String[] COMPLETION_FLAGS = {"executed", "complete", "completed", "done", "finished"};
    private static final Set<String> COMPLETED_STATUSES = Set.of(
            "completed", "success", "succeeded", "finished", "done", "executed");
    private static final Set<String> RUNNING_STATUSES = Set.of("pending", "running", "queued", "processing", "started");

    private BackfillProgressParser() {
    }

    static BackfillProgress parse(JsonNode envelope) {
        if (!JsonValues.isRecord(envelope)) {
            return null;
        }
        String type = firstText(envelope, "type");
        if (type != null && !"event".equals(type.toLowerCase(Locale.ROOT))) {
            return null;
        }
        JsonNode payload = firstRecord(envelope, "payload", "data", "message", "detail");
        if (payload == null) {
            payload = envelope;
        }
        JsonNode job = record(payload, "job");
        if (job == null) {
            job = record(envelope, "job");
        }
        if (job == null) {
            job = payload;
        }

        String jobId = jobId(job, payload);
        boolean executed = jobId != null && executed(job, payload);
        if (jobId == null) {
            jobId = jobIdFromTopic(firstText(envelope, "event", "channel", "topic"));
        }
        if (jobId == null) {
            return null;
        }
        JsonNode progress = progressSource(job, payload);
        if (progress == null) {
            progress = job;
        }
        return new BackfillProgress(
                jobId,
                executed,
                percent(JsonValues.firstNumber(progress,
                        "percent", "percentage", "progress", "value", "completion", "progress_percent")),
                firstText(progress, "status", "state", "stage", "phase"),
                firstText(progress, "message", "description", "detail"),
                eta(JsonValues.firstNumber(progress, "etaSeconds", "eta_seconds", "remaining_seconds", "eta", "eta_secs")),
                job);
    }

    /**
     * Fractions in {@code [0, 1]} are read as ratios; everything is clamped to {@code [0, 100]}.
     */
    static Double percent(Double value) {
        if (value == null) {
            return null;
        }
        double scaled = value >= 0 && value <= 1 ? value * 100 : value;
        return Math.max(0, Math.min(100, scaled));
    }

    private static Long eta(Double value) {
        return value == null || value < 0 ? null : Math.round(value);
    }

    private static String jobId(JsonNode job, JsonNode fallback) {
        String id = firstScalar(job, "id", "job_id", "jobId", "task_id", "taskId");
        return id != null ? id : firstScalar(fallback, "job_id", "jobId", "id", "task_id", "taskId");
    }

    private static String jobIdFromTopic(String topic) {
        if (topic == null || !topic.startsWith(TOPIC_PREFIX)) {
            return null;
        }
        String suffix = topic.substring(TOPIC_PREFIX.length()).trim();
        return suffix.isEmpty() ? null : suffix;
    }

    private static boolean executed(JsonNode job, JsonNode fallback) {
        Boolean fromJob = completion(job);
        if (fromJob != null) {
            return fromJob;
        }
        Boolean fromFallback = completion(fallback);
        return Boolean.TRUE.equals(fromFallback);
    }

    private static Boolean completion(JsonNode record) {
        for (String key : COMPLETION_FLAGS) {
            Boolean flag = flag(field(record, key));
            if (flag != null) {
                return flag;
            }
        }
        String status = firstText(record, "status");
        if (status == null) {
            return null;
        }
        String normalized = status.toLowerCase(Locale.ROOT);
        if (COMPLETED_STATUSES.contains(normalized)) {
            return true;
        }
        return RUNNING_STATUSES.contains(normalized) ? Boolean.FALSE : null;
    }

    private static Boolean flag(JsonNode value) {
        if (value == null) {
            return null;
        }
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        if (value.isNumber()) {
            return value.asDouble() != 0;
        }
        String text = JsonValues.text(value);
        if (text == null) {
            return null;
        }
        return switch (text.toLowerCase(Locale.ROOT)) {
            case "true", "yes", "1" -> Boolean.TRUE;
            case "false", "no", "0" -> Boolean.FALSE;
            default -> null;
        };
    }

    private static JsonNode progressSource(JsonNode job, JsonNode fallback) {
        JsonNode fromJob = firstRecord(job, PROGRESS_CONTAINERS);
        return fromJob != null ? fromJob : firstRecord(fallback, PROGRESS_CONTAINERS);
    }

    private static JsonNode firstRecord(JsonNode node, String... keys) {
        for (String key : keys) {
            JsonNode value = record(node, key);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static String firstScalar(JsonNode node, String... keys) {
        for (String key : keys) {
            String value = JsonValues.scalarText(field(node, key));
            if (value != null) {
                return value;
            }
        }
        return null;
    }
}
