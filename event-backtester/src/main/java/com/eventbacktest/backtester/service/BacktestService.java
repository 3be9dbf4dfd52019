package com.eventbacktest.backtester.service;

import com.eventbacktest.backtester.domain.BacktestConfig;
import com.eventbacktest.backtester.domain.BacktestResult;
import com.eventbacktest.backtester.domain.Bar;
import com.eventbacktest.backtester.domain.SignalSource;
import com.eventbacktest.backtester.walkforward.WalkForwardConfig;
import com.eventbacktest.backtester.walkforward.WalkForwardResult;

import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Service interface for running backtests and walk-forward tests.
 */
public interface BacktestService {

    /**
     * Run a backtest synchronously.
     *
     * @param runId        identifier under which the run can be cancelled while in progress
     * @param config       run parameters, validated before any bar is processed
     * @param bars         bars for {@code config.symbol}, oldest first
     * @param signalSource a fresh signal source for this run
     * @return the result, partial if the run was cancelled or timed out
     */
    BacktestResult runBacktest(UUID runId, BacktestConfig config, List<Bar> bars, SignalSource signalSource);

    /**
     * Run a backtest with the configured defaults and a signal source created by name.
     */
    BacktestResult runBacktest(String symbol, List<Bar> bars, String signalSourceName, String parametersJson);

    /**
     * Request cancellation of a running backtest.
     *
     * @return false if no run with this id is in progress
     */
    boolean cancel(UUID runId);

    Set<UUID> getActiveRuns();

    WalkForwardResult runWalkForward(WalkForwardConfig config, List<Bar> bars, Supplier<SignalSource> signalSourceSupplier);
}
