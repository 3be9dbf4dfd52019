package com.eventbacktest.backtester.walkforward;

import com.eventbacktest.backtester.domain.BacktestConfig;
import com.eventbacktest.backtester.domain.BacktestConfigurationException;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Walk-forward test of one symbol over an inclusive date range.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class WalkForwardConfig {

    String symbol;
    LocalDate startDate;
    LocalDate endDate;

    @Builder.Default
    int trainMonths = 6;

    @Builder.Default
    int validateMonths = 3;

    @Builder.Default
    PrimaryMetric primaryMetric = PrimaryMetric.WIN_RATE;

    /** A window is degraded when validate / train on the primary metric falls below this. */
    @Builder.Default
    BigDecimal degradationThreshold = new BigDecimal("0.80");

    /** Template for each window's runs; the symbol is taken from this config. */
    @Builder.Default
    BacktestConfig backtestConfig = BacktestConfig.builder().build();

    public BacktestConfig windowBacktestConfig() {
        return backtestConfig.toBuilder().symbol(symbol).build();
    }

    /**
     * @throws BacktestConfigurationException on the first invalid field
     */
    public void validate() {
        if (symbol == null || symbol.isBlank()) {
            throw new BacktestConfigurationException("symbol is required");
        }
        if (trainMonths <= 0) {
            throw new BacktestConfigurationException("trainMonths must be greater than 0, got " + trainMonths);
        }
        if (validateMonths <= 0) {
            throw new BacktestConfigurationException("validateMonths must be greater than 0, got " + validateMonths);
        }
        if (startDate == null || endDate == null || !endDate.isAfter(startDate)) {
            throw new BacktestConfigurationException("endDate must be after startDate, got " + startDate + " to " + endDate);
        }
        if (primaryMetric == null) {
            throw new BacktestConfigurationException("primaryMetric is required");
        }
        if (degradationThreshold == null || degradationThreshold.signum() < 0) {
            throw new BacktestConfigurationException("degradationThreshold must not be negative, got " + degradationThreshold);
        }
        if (backtestConfig == null) {
            throw new BacktestConfigurationException("backtestConfig is required");
        }
        windowBacktestConfig().validate();
    }
}
