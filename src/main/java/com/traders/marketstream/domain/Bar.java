// com.traders.marketstream.domain.Bar
package com.traders.marketstream.domain;

import java.time.Instant;

public record Bar(Instant timestamp, double open, double high, double low, double close, Double volume) {
}
