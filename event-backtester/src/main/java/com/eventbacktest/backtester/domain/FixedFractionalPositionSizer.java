package com.eventbacktest.backtester.domain;

import java.math.BigDecimal;

/**
 * Risks a fixed fraction of equity per trade: quantity = floor(equity x risk% / stop distance).
 */
public class FixedFractionalPositionSizer implements PositionSizer {

    @Override
    public int size(BigDecimal equity, BigDecimal riskPerTradePct, BigDecimal stopDistance) {
        if (equity == null || stopDistance == null || riskPerTradePct == null) {
            return 0;
        }
        if (equity.signum() <= 0 || stopDistance.signum() <= 0 || riskPerTradePct.signum() <= 0) {
            return 0;
        }
        BigDecimal riskAmount = equity.multiply(riskPerTradePct);
        return PositionSizer.floorQuantity(riskAmount, stopDistance);
    }
}
