package com.eventbacktest.backtester.domain;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Turns account equity and a stop distance into an order quantity.
 */
@FunctionalInterface
public interface PositionSizer {

    /**
     * @param equity         current account equity
     * @param riskPerTradePct fraction of equity to risk, e.g. 0.01
     * @param stopDistance   absolute price distance between entry and initial stop
     * @return whole-unit quantity, 0 to skip the trade
     */
    int size(BigDecimal equity, BigDecimal riskPerTradePct, BigDecimal stopDistance);

    /**
     * Whole units of {@code unitAmount} that fit in {@code amount}, saturating at {@link Integer#MAX_VALUE}.
     */
    static int floorQuantity(BigDecimal amount, BigDecimal unitAmount) {
        return amount.divide(unitAmount, 0, RoundingMode.FLOOR)
                .min(BigDecimal.valueOf(Integer.MAX_VALUE))
                .intValue();
    }
}
