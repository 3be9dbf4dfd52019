package com.eventbacktest.backtester.walkforward;

import com.eventbacktest.backtester.domain.BacktestMetrics;

import java.math.BigDecimal;
import java.util.function.Function;

/**
 * Metric compared between train and validate runs of a window.
 */
public enum PrimaryMetric {
    WIN_RATE(BacktestMetrics::getWinRate),
    AVG_R_MULTIPLE(BacktestMetrics::getAverageRMultiple),
    PROFIT_FACTOR(BacktestMetrics::getProfitFactor),
    SHARPE_RATIO(BacktestMetrics::getSharpeRatio);

    private final Function<BacktestMetrics, BigDecimal> extractor;

    PrimaryMetric(Function<BacktestMetrics, BigDecimal> extractor) {
        this.extractor = extractor;
    }

    public BigDecimal valueOf(BacktestMetrics metrics) {
        BigDecimal value = extractor.apply(metrics);
        return value == null ? BigDecimal.ZERO : value;
    }
}
