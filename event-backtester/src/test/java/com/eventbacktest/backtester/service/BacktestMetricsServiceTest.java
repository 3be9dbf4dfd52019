package com.eventbacktest.backtester.service;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class BacktestMetricsServiceTest {

    private SimpleMeterRegistry registry;
    private BacktestMetricsService metricsService;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metricsService = new BacktestMetricsService(registry);
    }

    @Test
    void testRecordRun_CompletedRun() {
        // Act
        metricsService.recordRun(1500, false, 3, 2);

        // Assert
        assertEquals(1.0, registry.get("backtest.runs.completed").counter().count());
        assertEquals(0.0, registry.get("backtest.runs.cancelled").counter().count());
        assertEquals(3.0, registry.get("backtest.trades.closed").counter().count());
        assertEquals(2.0, registry.get("backtest.bars.rejected").counter().count());
        assertEquals(1, registry.get("backtest.run.time").timer().count());
        assertEquals(1500.0, registry.get("backtest.run.time").timer().totalTime(TimeUnit.MILLISECONDS));
    }

    @Test
    void testRecordRun_StoppedEarlyCountsAsCancelled() {
        metricsService.recordRun(200, true, 0, 0);

        assertEquals(0.0, registry.get("backtest.runs.completed").counter().count());
        assertEquals(1.0, registry.get("backtest.runs.cancelled").counter().count());
    }

    @Test
    void testWalkForwardCounters() {
        metricsService.recordWindowsDegraded(2);
        metricsService.recordRegressions(1);
        metricsService.recordRegressions(0);

        assertEquals(2.0, registry.get("walkforward.windows.degraded").counter().count());
        assertEquals(1.0, registry.get("walkforward.regressions").counter().count());
    }

    @Test
    void testGetMetricsSummary() {
        metricsService.recordRun(1000, false, 4, 0);

        String summary = metricsService.getMetricsSummary();

        assertTrue(summary.contains("Completed=1"));
        assertTrue(summary.contains("Trades=4"));
        assertTrue(summary.contains("Cancelled=0"));
    }
}
