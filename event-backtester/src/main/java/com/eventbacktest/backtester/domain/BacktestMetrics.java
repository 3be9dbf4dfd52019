package com.eventbacktest.backtester.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

/**
 * Return, risk and trade-quality statistics of one run.
 * Always recomputed from the equity curve and trade list, never updated in place.
 */
@Value
@Builder
@Jacksonized
public class BacktestMetrics {

    int totalTrades;
    int winningTrades;
    int losingTrades;

    /** Fraction in [0, 1]. */
    BigDecimal winRate;
    BigDecimal averageRMultiple;

    /** Gross wins over gross losses. 0 when there are no losing trades. */
    BigDecimal profitFactor;
    BigDecimal totalReturnPct;

    /** Fraction, e.g. 0.15 for 15% a year. */
    BigDecimal cagr;
    BigDecimal sharpeRatio;

    /** Fraction of the running peak in [0, 1]. */
    BigDecimal maxDrawdown;
    int maxDrawdownDurationBars;

    public static BacktestMetrics empty() {
        return BacktestMetrics.builder()
                .winRate(BigDecimal.ZERO)
                .averageRMultiple(BigDecimal.ZERO)
                .profitFactor(BigDecimal.ZERO)
                .totalReturnPct(BigDecimal.ZERO)
                .cagr(BigDecimal.ZERO)
                .sharpeRatio(BigDecimal.ZERO)
                .maxDrawdown(BigDecimal.ZERO)
                .build();
    }
}
