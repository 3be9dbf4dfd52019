package com.eventbacktest.backtester.execution;

import com.eventbacktest.backtester.domain.BacktestConfigurationException;

import java.math.BigDecimal;

/**
 * Linear per-unit commission. A zero rate models commission-free venues.
 */
public class CommissionCalculator {

    private final BigDecimal defaultRate;

    public CommissionCalculator(BigDecimal defaultRate) {
        if (defaultRate == null || defaultRate.signum() < 0) {
            throw new BacktestConfigurationException("commission rate must be >= 0, got " + defaultRate);
        }
        this.defaultRate = defaultRate;
    }

    public BigDecimal calculateCommission(int quantity) {
        return calculateCommission(quantity, defaultRate);
    }

    public BigDecimal calculateCommission(int quantity, BigDecimal ratePerUnit) {
        if (ratePerUnit.signum() < 0) {
            throw new IllegalArgumentException("commission rate must be >= 0, got " + ratePerUnit);
        }
        return ratePerUnit.multiply(BigDecimal.valueOf(quantity));
    }

    public BigDecimal getDefaultRate() {
        return defaultRate;
    }
}
