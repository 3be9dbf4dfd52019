package com.eventbacktest.backtester.domain;

import com.eventbacktest.backtester.execution.CostModelConfig;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Parameters of a single backtest run.
 * <p>
 * Fractions are expressed as decimals (0.02 = 2%). {@code maxPortfolioHeatPct} is a percentage
 * of equity, in the same unit as {@link Portfolio#portfolioHeat(BigDecimal)}.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class BacktestConfig {

    String symbol;

    @Builder.Default
    BigDecimal initialCapital = new BigDecimal("100000");

    @Builder.Default
    CostModelConfig costModel = CostModelConfig.defaults();

    @Builder.Default
    BigDecimal stopLossPct = new BigDecimal("0.02");

    @Builder.Default
    BigDecimal takeProfitPct = new BigDecimal("0.06");

    /** Null disables the trailing stop. */
    BigDecimal trailingStopPct;

    @Builder.Default
    BigDecimal riskPerTradePct = new BigDecimal("0.02");

    /** Largest share of equity a single new position may take. */
    @Builder.Default
    BigDecimal maxPositionPct = new BigDecimal("0.25");

    @Builder.Default
    BigDecimal maxPortfolioHeatPct = new BigDecimal("10");

    /** Bars averaged for the trailing dollar volume used by the slippage tiers. */
    @Builder.Default
    int volumeLookback = 20;

    @Builder.Default
    BigDecimal riskFreeRate = PerformanceMetrics.DEFAULT_RISK_FREE_RATE;

    @Builder.Default
    Duration maxRunDuration = Duration.ofMinutes(5);

    /** Notify at least every N bars; 0 means every 5% of the run. */
    @Builder.Default
    int progressEveryBars = 0;

    @Builder.Default
    Duration progressInterval = Duration.ofSeconds(10);

    /**
     * Reject the configuration before any bar is processed.
     *
     * @throws BacktestConfigurationException on the first invalid field
     */
    public void validate() {
        if (symbol == null || symbol.isBlank()) {
            throw new BacktestConfigurationException("symbol is required");
        }
        if (initialCapital == null || initialCapital.signum() <= 0) {
            throw new BacktestConfigurationException("initialCapital must be positive, got " + initialCapital);
        }
        if (costModel == null) {
            throw new BacktestConfigurationException("costModel is required");
        }
        costModel.validate();
        requireFraction("stopLossPct", stopLossPct);
        requireFraction("takeProfitPct", takeProfitPct);
        if (trailingStopPct != null) {
            requireFraction("trailingStopPct", trailingStopPct);
        }
        requireFraction("riskPerTradePct", riskPerTradePct);
        requireFraction("maxPositionPct", maxPositionPct);
        if (maxPortfolioHeatPct == null || maxPortfolioHeatPct.signum() <= 0
                || maxPortfolioHeatPct.compareTo(BigDecimal.valueOf(100)) > 0) {
            throw new BacktestConfigurationException("maxPortfolioHeatPct must be in (0, 100], got " + maxPortfolioHeatPct);
        }
        if (volumeLookback < 1) {
            throw new BacktestConfigurationException("volumeLookback must be at least 1, got " + volumeLookback);
        }
        if (riskFreeRate == null) {
            throw new BacktestConfigurationException("riskFreeRate is required");
        }
        if (maxRunDuration == null || maxRunDuration.isNegative() || maxRunDuration.isZero()) {
            throw new BacktestConfigurationException("maxRunDuration must be positive, got " + maxRunDuration);
        }
        if (progressEveryBars < 0) {
            throw new BacktestConfigurationException("progressEveryBars must not be negative, got " + progressEveryBars);
        }
        if (progressInterval == null || progressInterval.isNegative() || progressInterval.isZero()) {
            throw new BacktestConfigurationException("progressInterval must be positive, got " + progressInterval);
        }
    }

    private static void requireFraction(String name, BigDecimal value) {
        if (value == null || value.signum() <= 0 || value.compareTo(BigDecimal.ONE) > 0) {
            throw new BacktestConfigurationException(name + " must be in (0, 1], got " + value);
        }
    }
}
