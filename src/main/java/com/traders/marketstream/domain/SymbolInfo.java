// com.traders.marketstream.domain.SymbolInfo
package com.traders.marketstream.domain;

import lombok.Builder;

/**
 * Optional instrument metadata. Any field may be null.
 */
@Builder
public record SymbolInfo(
        String symbol,
        String secType,
        String exchange,
        Boolean domCapable,
        Double tickSize,
        Double tickValue
) {
}
