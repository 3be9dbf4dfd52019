package com.eventbacktest.backtester.domain;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * An open position. Only {@link Portfolio} changes its state.
 */
@Getter
@Setter(AccessLevel.PACKAGE)
@Builder
@Jacksonized
@ToString
public class Position {

    private final String symbol;
    private final PositionSide side;
    private int quantity;
    private BigDecimal averageEntryPrice;
    private BigDecimal currentPrice;
    private final Instant entryTimestamp;
    private Instant lastUpdated;

    @Builder.Default
    private BigDecimal unrealizedPnl = BigDecimal.ZERO;

    @Builder.Default
    private BigDecimal totalCommission = BigDecimal.ZERO;

    /** Slippage cost paid on entry fills, in currency. */
    @Builder.Default
    private BigDecimal totalSlippage = BigDecimal.ZERO;

    /** Initial protective stop; null when the signal carried none. */
    private BigDecimal initialStop;

    /** Committed risk fixed at entry: |entry - initial stop| x quantity. */
    @Builder.Default
    private BigDecimal riskAmount = BigDecimal.ZERO;

    /** Best close seen since entry, highest for LONG and lowest for SHORT. */
    private BigDecimal extremePrice;

    /**
     * Value contributed to portfolio equity.
     * LONG: quantity x mark. SHORT: posted collateral plus unrealized P&L.
     */
    public BigDecimal getMarketValue() {
        BigDecimal qty = BigDecimal.valueOf(quantity);
        if (side == PositionSide.LONG) {
            return qty.multiply(currentPrice);
        }
        return qty.multiply(averageEntryPrice).add(unrealizedPnl);
    }
}
