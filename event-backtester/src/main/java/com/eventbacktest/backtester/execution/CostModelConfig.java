package com.eventbacktest.backtester.execution;

import com.eventbacktest.backtester.domain.BacktestConfigurationException;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

/**
 * Slippage and commission parameters.
 * Rates are fractions of price (0.0002 = 0.02%); the liquidity threshold is a
 * trailing average dollar volume.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class CostModelConfig {

    @Builder.Default
    BigDecimal liquidRate = new BigDecimal("0.0002");

    @Builder.Default
    BigDecimal illiquidRate = new BigDecimal("0.0005");

    @Builder.Default
    BigDecimal liquidityThreshold = new BigDecimal("1000000");

    /** Order/bar volume ratio above which market impact applies. */
    @Builder.Default
    BigDecimal impactThreshold = new BigDecimal("0.10");

    /** Width of one market impact increment, as a fraction of bar volume. */
    @Builder.Default
    BigDecimal impactStep = new BigDecimal("0.10");

    @Builder.Default
    BigDecimal impactRate = new BigDecimal("0.0001");

    /** Added on top of the illiquid rate when a bar traded no volume. */
    @Builder.Default
    BigDecimal zeroVolumePenaltyRate = new BigDecimal("0.0005");

    @Builder.Default
    BigDecimal commissionPerShare = new BigDecimal("0.005");

    public static CostModelConfig defaults() {
        return CostModelConfig.builder().build();
    }

    /**
     * Commission-free, slippage-free execution.
     */
    public static CostModelConfig frictionless() {
        return CostModelConfig.builder()
                .liquidRate(BigDecimal.ZERO)
                .illiquidRate(BigDecimal.ZERO)
                .impactRate(BigDecimal.ZERO)
                .zeroVolumePenaltyRate(BigDecimal.ZERO)
                .commissionPerShare(BigDecimal.ZERO)
                .build();
    }

    public void validate() {
        requireNonNegative("liquidRate", liquidRate);
        requireNonNegative("illiquidRate", illiquidRate);
        requireNonNegative("liquidityThreshold", liquidityThreshold);
        requireNonNegative("impactRate", impactRate);
        requireNonNegative("zeroVolumePenaltyRate", zeroVolumePenaltyRate);
        requireNonNegative("commissionPerShare", commissionPerShare);
        requirePositive("impactThreshold", impactThreshold);
        requirePositive("impactStep", impactStep);
    }

    private static void requireNonNegative(String name, BigDecimal value) {
        if (value == null || value.signum() < 0) {
            throw new BacktestConfigurationException(name + " must be >= 0, got " + value);
        }
    }

    private static void requirePositive(String name, BigDecimal value) {
        if (value == null || value.signum() <= 0) {
            throw new BacktestConfigurationException(name + " must be > 0, got " + value);
        }
    }
}
