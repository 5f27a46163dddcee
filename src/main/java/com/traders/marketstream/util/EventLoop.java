package com.traders.marketstream.util;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Single-threaded cooperative scheduler. Every task submitted to a loop runs to completion
 * before the next one starts, so state touched only from loop tasks needs no locking.
 */
public interface EventLoop {

    void execute(Runnable task);

    ScheduledTask schedule(Runnable task, Duration delay);

    ScheduledTask scheduleAtFixedRate(Runnable task, Duration initialDelay, Duration period);

    Instant now();

    /**
     * Runs {@code supplier} on the loop and completes the returned future with its result.
     * Used by callers on foreign threads that need a consistent read of loop-owned state.
     */
    default <T> CompletableFuture<T> submit(Supplier<T> supplier) {
        return CompletableFuture.supplyAsync(supplier, this::execute);
    }
}
