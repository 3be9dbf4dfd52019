package com.eventbacktest.backtester.walkforward;

import com.eventbacktest.backtester.domain.Bar;
import com.eventbacktest.backtester.domain.BacktestConfigurationException;
import com.eventbacktest.backtester.domain.MovingAverageCrossoverSignalSource;
import com.eventbacktest.backtester.domain.SignalSource;
import com.eventbacktest.backtester.infrastructure.BaselineStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for WalkForwardSuite baseline comparison and orchestration.
 */
@ExtendWith(MockitoExtension.class)
class WalkForwardSuiteTest {

    private static final Supplier<SignalSource> SOURCE = () -> new MovingAverageCrossoverSignalSource(5, 20);

    @Mock
    private BaselineStore baselineStore;

    @Mock
    private WalkForwardEngine engine;

    @Test
    void testCompare_WinRateDropBeyondToleranceRegresses() {
        // Arrange
        SymbolSuiteResult current = symbolResult("AAPL", "0.50");
        BaselineRecord baseline = BaselineRecord.builder()
                .symbol("AAPL")
                .avgValidateWinRate(new BigDecimal("0.60"))
                .build();

        // Act
        List<BaselineComparison> comparisons = WalkForwardSuite.compare(current, baseline, new BigDecimal("10.0"));

        // Assert
        assertEquals(1, comparisons.size());
        BaselineComparison comparison = comparisons.get(0);
        assertEquals("avg_validate_win_rate", comparison.getMetricName());
        assertEquals(new BigDecimal("-16.6667"), comparison.getChangePct());
        assertTrue(comparison.isRegressed());
    }

    @Test
    void testCompare_DrawdownRegressesWhenItRises() {
        SymbolSuiteResult worse = SymbolSuiteResult.builder()
                .symbol("AAPL")
                .avgValidateMaxDrawdown(new BigDecimal("0.12"))
                .build();
        SymbolSuiteResult better = SymbolSuiteResult.builder()
                .symbol("AAPL")
                .avgValidateMaxDrawdown(new BigDecimal("0.09"))
                .build();
        BaselineRecord baseline = BaselineRecord.builder()
                .symbol("AAPL")
                .avgValidateMaxDrawdown(new BigDecimal("0.10"))
                .build();

        assertTrue(WalkForwardSuite.compare(worse, baseline, new BigDecimal("10")).get(0).isRegressed());
        assertFalse(WalkForwardSuite.compare(better, baseline, new BigDecimal("10")).get(0).isRegressed());
    }

    @Test
    void testChangePct_ZeroBaselineIsZero() {
        assertEquals(0, BigDecimal.ZERO.compareTo(WalkForwardSuite.changePct(BigDecimal.ZERO, new BigDecimal("0.4"))));
    }

    @Test
    void testMetricPolarity_Either() {
        assertTrue(MetricPolarity.EITHER.isRegression(new BigDecimal("-12"), new BigDecimal("10")));
        assertTrue(MetricPolarity.EITHER.isRegression(new BigDecimal("12"), new BigDecimal("10")));
        assertFalse(MetricPolarity.EITHER.isRegression(new BigDecimal("10"), new BigDecimal("10")));
    }

    @Test
    void testCompareToBaselines_MissingBaselineSkipped() {
        // Arrange
        when(baselineStore.load("AAPL")).thenReturn(Optional.of(BaselineRecord.builder()
                .symbol("AAPL")
                .avgValidateWinRate(new BigDecimal("0.50"))
                .build()));
        when(baselineStore.load("EURUSD")).thenReturn(Optional.empty());
        WalkForwardSuite suite = new WalkForwardSuite(suiteConfig(), engine, baselineStore, null);

        // Act
        List<BaselineComparison> comparisons = suite.compareToBaselines(
                List.of(symbolResult("AAPL", "0.52"), symbolResult("EURUSD", "0.40")));

        // Assert
        assertEquals(1, comparisons.size());
        assertEquals("AAPL", comparisons.get(0).getSymbol());
        assertFalse(comparisons.get(0).isRegressed());
    }

    @Test
    void testRun_RegressionFailsSuite() {
        // Arrange
        when(engine.run(any(), any(), any())).thenReturn(walkForwardResult("0.50"));
        when(baselineStore.load("AAPL")).thenReturn(Optional.of(BaselineRecord.builder()
                .symbol("AAPL")
                .avgValidateWinRate(new BigDecimal("0.60"))
                .build()));
        when(baselineStore.load("EURUSD")).thenReturn(Optional.empty());
        WalkForwardSuite suite = new WalkForwardSuite(suiteConfig(), engine, baselineStore, null);

        // Act
        WalkForwardSuiteResult result = suite.run(Map.of("AAPL", bars(), "EURUSD", bars()), SOURCE);

        // Assert
        assertFalse(result.isOverallPass());
        assertEquals(1, result.getRegressionCount());
        assertEquals("AAPL/avg_validate_win_rate: -16.7% (tolerance: 10.0%)", result.getRegressionDetails().get(0));
        assertEquals(2, result.getTotalSymbols());
        assertEquals(List.of("AAPL", "EURUSD"),
                result.getSymbolResults().stream().map(SymbolSuiteResult::getSymbol).toList());
    }

    @Test
    void testRun_ParallelSymbolsKeepConfigurationOrder() {
        // Arrange
        when(engine.run(any(), any(), any())).thenReturn(walkForwardResult("0.55"));
        when(baselineStore.load(any())).thenReturn(Optional.empty());
        ExecutorService executor = Executors.newFixedThreadPool(2);
        WalkForwardSuite suite = new WalkForwardSuite(suiteConfig(), engine, baselineStore, executor);

        try {
            // Act
            WalkForwardSuiteResult result = suite.run(Map.of("AAPL", bars(), "EURUSD", bars()), SOURCE);

            // Assert
            assertTrue(result.isOverallPass());
            assertEquals(List.of("AAPL", "EURUSD"),
                    result.getSymbolResults().stream().map(SymbolSuiteResult::getSymbol).toList());
            assertTrue(result.getBaselineComparisons().isEmpty());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void testRun_SymbolWithoutDataFailsAlone() {
        // Arrange
        when(engine.run(any(), any(), any())).thenReturn(walkForwardResult("0.55"));
        when(baselineStore.load("AAPL")).thenReturn(Optional.empty());
        WalkForwardSuite suite = new WalkForwardSuite(suiteConfig(), engine, baselineStore, null);

        // Act
        WalkForwardSuiteResult result = suite.run(Map.of("AAPL", bars()), SOURCE);

        // Assert
        SymbolSuiteResult eurusd = result.getSymbolResults().get(1);
        assertTrue(eurusd.isFailed());
        assertTrue(eurusd.getError().contains("EURUSD"));
        assertFalse(result.getSymbolResults().get(0).isFailed());
        verify(baselineStore, never()).load("EURUSD");
        verify(engine, times(1)).run(any(), any(), any());
    }

    @Test
    void testSaveBaselines_WritesSuccessfulSymbols() {
        // Arrange
        WalkForwardSuite suite = new WalkForwardSuite(suiteConfig(), engine, baselineStore, null);
        WalkForwardSuiteResult result = WalkForwardSuiteResult.builder()
                .suiteId("suite-1")
                .symbolResults(List.of(
                        symbolResult("AAPL", "0.55"),
                        SymbolSuiteResult.builder().symbol("EURUSD").error("No market data for EURUSD").build()))
                .build();

        // Act
        List<BaselineRecord> saved = suite.saveBaselines(result, "v2");

        // Assert
        ArgumentCaptor<BaselineRecord> captor = ArgumentCaptor.forClass(BaselineRecord.class);
        verify(baselineStore, times(1)).save(captor.capture());
        BaselineRecord record = captor.getValue();
        assertEquals(1, saved.size());
        assertEquals("AAPL", record.getSymbol());
        assertEquals("v2", record.getVersion());
        assertEquals("suite-1", record.getSuiteId());
        assertEquals(new BigDecimal("0.55"), record.getAvgValidateWinRate());
        assertEquals(BaselineRecord.DEFAULT_NOTES, record.getNotes());
    }

    @Test
    void testEmptySymbolList_Rejected() {
        WalkForwardSuiteConfig empty = WalkForwardSuiteConfig.builder().build();

        assertThrows(BacktestConfigurationException.class,
                () -> new WalkForwardSuite(empty, engine, baselineStore, null));
    }

    private static WalkForwardSuiteConfig suiteConfig() {
        return WalkForwardSuiteConfig.builder()
                .symbol(SymbolSuiteConfig.builder()
                        .symbol("AAPL")
                        .assetClass("us_stock")
                        .startDate(LocalDate.of(2020, 1, 1))
                        .endDate(LocalDate.of(2021, 12, 31))
                        .build())
                .symbol(SymbolSuiteConfig.builder()
                        .symbol("EURUSD")
                        .assetClass("forex")
                        .startDate(LocalDate.of(2020, 1, 1))
                        .endDate(LocalDate.of(2021, 12, 31))
                        .build())
                .regressionTolerancePct(new BigDecimal("10.0"))
                .build();
    }

    private static SymbolSuiteResult symbolResult(String symbol, String winRate) {
        return SymbolSuiteResult.builder()
                .symbol(symbol)
                .windowCount(6)
                .avgValidateWinRate(new BigDecimal(winRate))
                .build();
    }

    private static WalkForwardResult walkForwardResult(String winRate) {
        return WalkForwardResult.builder()
                .windows(List.of())
                .summary(WalkForwardSummary.builder()
                        .avgValidateWinRate(new BigDecimal(winRate))
                        .avgValidateAvgR(BigDecimal.ZERO)
                        .avgValidateProfitFactor(BigDecimal.ZERO)
                        .avgValidateSharpe(BigDecimal.ZERO)
                        .avgValidateMaxDrawdown(BigDecimal.ZERO)
                        .degradationPct(BigDecimal.ZERO)
                        .build())
                .stabilityScore(BigDecimal.ZERO)
                .degradationWindows(List.of())
                .statisticalSignificance(Map.of())
                .build();
    }

    private static List<Bar> bars() {
        return List.of(Bar.builder()
                .symbol("AAPL")
                .timeframe("1d")
                .timestamp(LocalDate.of(2020, 1, 2).atStartOfDay(ZoneOffset.UTC).toInstant())
                .open(BigDecimal.TEN)
                .high(BigDecimal.TEN)
                .low(BigDecimal.TEN)
                .close(BigDecimal.TEN)
                .volume(1_000L)
                .build());
    }
}
