package com.eventbacktest.backtester.domain;

/**
 * Receives progress of a running backtest. Called from the bar loop thread.
 * Implementations that do real work should hand it off and return quickly.
 */
@FunctionalInterface
public interface ProgressNotifier {

    ProgressNotifier NO_OP = progress -> {
    };

    void onProgress(BacktestProgress progress);
}
