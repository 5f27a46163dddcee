package com.traders.marketstream.backfill;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One progress report of a historical backfill job.
 *
 * @param percent    0..100, {@code null} when the server sent none
 * @param etaSeconds whole seconds remaining, {@code null} when unknown
 * @param raw        the job record the report was read from
 */
public record BackfillProgress(
        String jobId,
        boolean executed,
        Double percent,
        String status,
        String message,
        Long etaSeconds,
        JsonNode raw
) {
}
