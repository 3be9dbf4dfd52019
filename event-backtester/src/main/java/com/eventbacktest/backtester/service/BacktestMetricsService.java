package com.eventbacktest.backtester.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

/**
 * Service for tracking backtest execution metrics.
 */
@Service
@Slf4j
public class BacktestMetricsService {

    private final Counter runsCompletedCounter;
    private final Counter runsCancelledCounter;
    private final Counter barsRejectedCounter;
    private final Counter tradesClosedCounter;
    private final Counter windowsDegradedCounter;
    private final Counter regressionsCounter;
    private final Timer runTimer;

    public BacktestMetricsService(MeterRegistry meterRegistry) {
        this.runsCompletedCounter = Counter.builder("backtest.runs.completed")
                .description("Total number of backtest runs that processed every bar")
                .register(meterRegistry);

        this.runsCancelledCounter = Counter.builder("backtest.runs.cancelled")
                .description("Total number of backtest runs stopped early by cancellation or time budget")
                .register(meterRegistry);

        this.barsRejectedCounter = Counter.builder("backtest.bars.rejected")
                .description("Total number of bars skipped for data quality")
                .register(meterRegistry);

        this.tradesClosedCounter = Counter.builder("backtest.trades.closed")
                .description("Total number of round-trip trades closed")
                .register(meterRegistry);

        this.windowsDegradedCounter = Counter.builder("walkforward.windows.degraded")
                .description("Total number of walk-forward windows below the degradation threshold")
                .register(meterRegistry);

        this.regressionsCounter = Counter.builder("walkforward.regressions")
                .description("Total number of baseline metrics flagged as regressed")
                .register(meterRegistry);

        this.runTimer = Timer.builder("backtest.run.time")
                .description("Backtest run execution time")
                .register(meterRegistry);

        log.info("BacktestMetricsService initialized with Micrometer metrics");
    }

    /**
     * Record a finished run. Early-stopped runs count as cancelled, not completed.
     */
    public void recordRun(long executionTimeMs, boolean stoppedEarly, int tradesClosed, int rejectedBars) {
        if (stoppedEarly) {
            runsCancelledCounter.increment();
        } else {
            runsCompletedCounter.increment();
        }
        tradesClosedCounter.increment(tradesClosed);
        barsRejectedCounter.increment(rejectedBars);
        runTimer.record(executionTimeMs, TimeUnit.MILLISECONDS);
    }

    public void recordWindowsDegraded(int count) {
        windowsDegradedCounter.increment(count);
    }

    public void recordRegressions(int count) {
        regressionsCounter.increment(count);
    }

    /**
     * Get current metrics summary (for logging purposes).
     */
    public String getMetricsSummary() {
        return String.format("Metrics: Completed=%d, Cancelled=%d, Trades=%d, RejectedBars=%d, "
                        + "DegradedWindows=%d, Regressions=%d, AvgRunTime=%.2fs",
                (long) runsCompletedCounter.count(),
                (long) runsCancelledCounter.count(),
                (long) tradesClosedCounter.count(),
                (long) barsRejectedCounter.count(),
                (long) windowsDegradedCounter.count(),
                (long) regressionsCounter.count(),
                runTimer.mean(TimeUnit.SECONDS));
    }
}
