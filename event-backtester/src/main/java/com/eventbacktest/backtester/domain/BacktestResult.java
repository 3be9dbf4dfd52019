package com.eventbacktest.backtester.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Outcome of one backtest run, handed to the caller as a structured record.
 * A cancelled or timed-out run still carries a consistent partial result.
 */
@Value
@Builder
@Jacksonized
public class BacktestResult {

    UUID runId;
    BacktestConfig config;
    String signalSourceName;

    List<Trade> trades;
    List<EquityCurvePoint> equityCurve;
    BacktestMetrics metrics;
    CostSummary costSummary;
    List<MonthlyReturn> monthlyReturns;

    /** Positions still open when the loop ended, marked at the last processed close. */
    List<Position> openPositions;

    BigDecimal finalValue;
    boolean cancelled;
    boolean timedOut;
    int barsProcessed;
    int rejectedBars;
    long executionTimeMs;

    public boolean hasTrades() {
        return trades != null && !trades.isEmpty();
    }
}
