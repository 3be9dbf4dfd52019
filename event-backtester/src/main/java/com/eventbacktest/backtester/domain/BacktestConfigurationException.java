package com.eventbacktest.backtester.domain;

/**
 * Raised when a backtest or walk-forward configuration is invalid.
 * Always thrown before any simulation work starts.
 */
public class BacktestConfigurationException extends IllegalArgumentException {

    public BacktestConfigurationException(String message) {
        super(message);
    }
}
