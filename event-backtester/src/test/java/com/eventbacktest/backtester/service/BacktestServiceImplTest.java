package com.eventbacktest.backtester.service;

import com.eventbacktest.backtester.domain.BacktestConfig;
import com.eventbacktest.backtester.domain.BacktestResult;
import com.eventbacktest.backtester.domain.Bar;
import com.eventbacktest.backtester.domain.FixedFractionalPositionSizer;
import com.eventbacktest.backtester.domain.MovingAverageCrossoverSignalSource;
import com.eventbacktest.backtester.domain.ProgressNotifier;
import com.eventbacktest.backtester.domain.SignalContext;
import com.eventbacktest.backtester.domain.SignalSource;
import com.eventbacktest.backtester.domain.TradeSignal;
import com.eventbacktest.backtester.walkforward.WalkForwardConfig;
import com.eventbacktest.backtester.walkforward.WalkForwardEngine;
import com.eventbacktest.backtester.walkforward.WalkForwardResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for BacktestServiceImpl focusing on run lifecycle and cancellation.
 */
@ExtendWith(MockitoExtension.class)
class BacktestServiceImplTest {

    @Mock
    private ProgressNotifier progressNotifier;

    @Mock
    private SignalSourceFactory signalSourceFactory;

    @Mock
    private WalkForwardEngine walkForwardEngine;

    @Mock
    private BacktestMetricsService metricsService;

    private BacktestServiceImpl backtestService;
    private List<Bar> bars;

    @BeforeEach
    void setUp() {
        backtestService = new BacktestServiceImpl(
                BacktestConfig.builder().build(),
                new FixedFractionalPositionSizer(),
                progressNotifier,
                signalSourceFactory,
                walkForwardEngine,
                metricsService);
        bars = new SyntheticBarGenerator().generate("AAPL", LocalDate.of(2024, 1, 1), LocalDate.of(2024, 3, 29));
    }

    @Test
    void testRunBacktest_RecordsMetricsAndReleasesRun() {
        // Arrange
        UUID runId = UUID.randomUUID();
        BacktestConfig config = BacktestConfig.builder().symbol("AAPL").build();

        // Act
        BacktestResult result = backtestService.runBacktest(runId, config, bars, new SilentSignalSource(context -> { }));

        // Assert
        assertEquals(runId, result.getRunId());
        assertFalse(result.hasTrades());
        assertFalse(result.isCancelled());
        assertEquals(bars.size(), result.getBarsProcessed());
        verify(metricsService).recordRun(anyLong(), eq(false), eq(0), eq(0));
        assertTrue(backtestService.getActiveRuns().isEmpty());
        assertNull(MDC.get("runId"));
    }

    @Test
    void testRunBacktest_ByNameUsesTemplate() {
        // Arrange
        when(signalSourceFactory.create("ma_crossover", "{\"shortPeriod\":5,\"longPeriod\":20}"))
                .thenReturn(new MovingAverageCrossoverSignalSource(5, 20));

        // Act
        BacktestResult result = backtestService.runBacktest("AAPL", bars, "ma_crossover",
                "{\"shortPeriod\":5,\"longPeriod\":20}");

        // Assert
        assertEquals("AAPL", result.getConfig().getSymbol());
        assertEquals(0, new BigDecimal("100000").compareTo(result.getConfig().getInitialCapital()));
        assertNotNull(result.getMetrics());
        verify(metricsService).recordRun(anyLong(), eq(false), anyInt(), eq(0));
    }

    @Test
    void testCancel_StopsRunInProgress() {
        // Arrange
        UUID runId = UUID.randomUUID();
        BacktestConfig config = BacktestConfig.builder().symbol("AAPL").build();
        SignalSource cancelling = new SilentSignalSource(context -> {
            if (context.barIndex() == 2) {
                assertTrue(backtestService.getActiveRuns().contains(runId));
                assertTrue(backtestService.cancel(runId));
            }
        });

        // Act
        BacktestResult result = backtestService.runBacktest(runId, config, bars, cancelling);

        // Assert
        assertTrue(result.isCancelled());
        assertEquals(3, result.getBarsProcessed());
        verify(metricsService).recordRun(anyLong(), eq(true), eq(0), eq(0));
    }

    @Test
    void testCancel_UnknownRunReturnsFalse() {
        assertFalse(backtestService.cancel(UUID.randomUUID()));
    }

    @Test
    void testRunWalkForward_RecordsDegradedWindows() {
        // Arrange
        WalkForwardConfig config = WalkForwardConfig.builder().symbol("AAPL").build();
        WalkForwardResult expected = WalkForwardResult.builder()
                .windows(List.of())
                .degradationWindows(List.of(2, 5))
                .statisticalSignificance(Map.of())
                .build();
        Supplier<SignalSource> supplier = () -> new MovingAverageCrossoverSignalSource(5, 20);
        when(walkForwardEngine.run(eq(config), eq(bars), any())).thenReturn(expected);

        // Act
        WalkForwardResult result = backtestService.runWalkForward(config, bars, supplier);

        // Assert
        assertSame(expected, result);
        verify(metricsService).recordWindowsDegraded(2);
        assertNull(MDC.get("symbol"));
    }

    /** Emits nothing; runs a hook on every bar. */
    private static final class SilentSignalSource implements SignalSource {

        private final Consumer<SignalContext> hook;

        SilentSignalSource(Consumer<SignalContext> hook) {
            this.hook = hook;
        }

        @Override
        public List<TradeSignal> generate(SignalContext context) {
            hook.accept(context);
            return List.of();
        }

        @Override
        public String getName() {
            return "Silent";
        }
    }
}
