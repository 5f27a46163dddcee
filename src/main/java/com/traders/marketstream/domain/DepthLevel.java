package com.traders.marketstream.domain;

public record DepthLevel(double price, double size) {
}
