package com.traders.marketstream.util;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.PriorityQueue;

/**
 * Deterministic {@link EventLoop} on a virtual clock. Nothing runs until the test calls
 * {@link #runPending()} or {@link #advance(Duration)}.
 */
public class ManualEventLoop implements EventLoop {
    public static final Instant START = Instant.parse("2024-01-01T00:00:00Z");

    private final PriorityQueue<Entry> queue = new PriorityQueue<>(
            Comparator.comparing(Entry::due).thenComparingLong(Entry::sequence));
    private Instant now = START;
    private long sequence;

    private record Entry(Instant due, long sequence, Runnable task, Duration period, Handle handle) {
    }

    private static final class Handle implements ScheduledTask {
        private boolean cancelled;

        @Override
        public void cancel() {
            cancelled = true;
        }
    }

    @Override
    public void execute(Runnable task) {
        enqueue(now, task, null, new Handle());
    }

    @Override
    public ScheduledTask schedule(Runnable task, Duration delay) {
        Handle handle = new Handle();
        enqueue(now.plus(delay), task, null, handle);
        return handle;
    }

    @Override
    public ScheduledTask scheduleAtFixedRate(Runnable task, Duration initialDelay, Duration period) {
        Handle handle = new Handle();
        enqueue(now.plus(initialDelay), task, period, handle);
        return handle;
    }

    @Override
    public Instant now() {
        return now;
    }

    /** Runs every task that is due at the current virtual time, including tasks they enqueue. */
    public void runPending() {
        runUntil(now);
    }

    /** Moves the clock forward, running each task at its due time. */
    public void advance(Duration duration) {
        runUntil(now.plus(duration));
    }

    public int pendingTasks() {
        return (int) queue.stream().filter(entry -> !entry.handle().cancelled).count();
    }

    private void runUntil(Instant target) {
        while (!queue.isEmpty() && !queue.peek().due().isAfter(target)) {
            Entry entry = queue.poll();
            if (entry.handle().cancelled) {
                continue;
            }
            if (entry.due().isAfter(now)) {
                now = entry.due();
            }
            if (entry.period() != null) {
                enqueue(entry.due().plus(entry.period()), entry.task(), entry.period(), entry.handle());
            }
            entry.task().run();
        }
        now = target;
    }

    private void enqueue(Instant due, Runnable task, Duration period, Handle handle) {
        queue.add(new Entry(due, sequence++, task, period, handle));
    }
}
