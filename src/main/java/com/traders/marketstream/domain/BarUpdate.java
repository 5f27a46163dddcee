package com.traders.marketstream.domain;

public record BarUpdate(String symbol, String timeframe, Long intervalSeconds, Long durationSeconds, Bar bar) {
}
