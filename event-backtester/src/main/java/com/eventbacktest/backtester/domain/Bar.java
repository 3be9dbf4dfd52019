package com.eventbacktest.backtester.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A single OHLCV price bar.
 * Bars are produced by an external data source and are never mutated by the engine.
 */
@Value
@Builder
@Jacksonized
public class Bar {

    String symbol;
    String timeframe;
    Instant timestamp;
    BigDecimal open;
    BigDecimal high;
    BigDecimal low;
    BigDecimal close;
    long volume;

    /**
     * High minus low.
     */
    public BigDecimal getSpread() {
        return high.subtract(low);
    }

    /**
     * Close times volume, used for trailing liquidity estimates.
     */
    public BigDecimal getDollarVolume() {
        return close.multiply(BigDecimal.valueOf(volume));
    }
}
