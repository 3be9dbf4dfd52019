package com.eventbacktest.backtester.domain;

/**
 * Progress notification payload.
 */
public record BacktestProgress(int barsProcessed, int totalBars, int percentComplete) {

    public static BacktestProgress of(int barsProcessed, int totalBars) {
        int percent = totalBars == 0 ? 100 : (int) ((long) barsProcessed * 100 / totalBars);
        return new BacktestProgress(barsProcessed, totalBars, percent);
    }

    public boolean isComplete() {
        return barsProcessed >= totalBars;
    }
}
