package com.eventbacktest.backtester.walkforward;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Flattened per-window figures reported by the suite.
 */
@Value
@Builder
@Jacksonized
public class WindowMetricsRow {

    int windowNumber;
    LocalDate trainStart;
    LocalDate trainEnd;
    LocalDate validateStart;
    LocalDate validateEnd;
    BigDecimal trainWinRate;
    BigDecimal validateWinRate;
    BigDecimal trainProfitFactor;
    BigDecimal validateProfitFactor;
    BigDecimal trainSharpe;
    BigDecimal validateSharpe;
    BigDecimal trainMaxDrawdown;
    BigDecimal validateMaxDrawdown;
    BigDecimal performanceRatio;
    boolean degradationDetected;

    static WindowMetricsRow of(WalkForwardWindow w) {
        return WindowMetricsRow.builder()
                .windowNumber(w.getWindowNumber())
                .trainStart(w.getTrainStart())
                .trainEnd(w.getTrainEnd())
                .validateStart(w.getValidateStart())
                .validateEnd(w.getValidateEnd())
                .trainWinRate(w.getTrainMetrics().getWinRate())
                .validateWinRate(w.getValidateMetrics().getWinRate())
                .trainProfitFactor(w.getTrainMetrics().getProfitFactor())
                .validateProfitFactor(w.getValidateMetrics().getProfitFactor())
                .trainSharpe(w.getTrainMetrics().getSharpeRatio())
                .validateSharpe(w.getValidateMetrics().getSharpeRatio())
                .trainMaxDrawdown(w.getTrainMetrics().getMaxDrawdown())
                .validateMaxDrawdown(w.getValidateMetrics().getMaxDrawdown())
                .performanceRatio(w.getPerformanceRatio())
                .degradationDetected(w.isDegradationDetected())
                .build();
    }
}
