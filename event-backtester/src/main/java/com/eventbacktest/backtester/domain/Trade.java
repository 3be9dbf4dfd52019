package com.eventbacktest.backtester.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A closed round trip.
 * grossPnl is the price move before commission and slippage; netPnl is what reached the account.
 */
@Value
@Builder
@Jacksonized
public class Trade {

    UUID tradeId;
    String symbol;
    PositionSide side;
    int quantity;
    BigDecimal entryPrice;
    Instant entryTimestamp;
    BigDecimal exitPrice;
    Instant exitTimestamp;
    BigDecimal grossPnl;
    BigDecimal netPnl;
    BigDecimal commission;
    BigDecimal slippage;
    BigDecimal initialRisk;
    BigDecimal rMultiple;
    BigDecimal grossRMultiple;
    ExitReason exitReason;

    public boolean isWinner() {
        return netPnl.signum() > 0;
    }

    public boolean isLoser() {
        return netPnl.signum() < 0;
    }
}
