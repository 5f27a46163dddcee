package com.traders.marketstream.util;

@FunctionalInterface
public interface ScheduledTask {
    void cancel();
}
