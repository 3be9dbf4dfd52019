package com.eventbacktest.backtester.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * A candidate entry produced by a {@link SignalSource}.
 */
@Value
@Builder
public class TradeSignal {

    String symbol;
    PositionSide side;

    /** Optional upper bound on the quantity; null or non-positive means no hint. */
    Integer sizeHint;

    /** Price at which the idea is invalidated. Required for risk-based sizing. */
    BigDecimal initialStop;

    /** Free-form label of the producing pattern, e.g. "SPRING". */
    String patternType;
}
