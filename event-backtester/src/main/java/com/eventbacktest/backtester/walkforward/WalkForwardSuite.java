package com.eventbacktest.backtester.walkforward;

import com.eventbacktest.backtester.domain.Bar;
import com.eventbacktest.backtester.domain.SignalSource;
import com.eventbacktest.backtester.infrastructure.BaselineStore;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Multi-symbol walk-forward validation runner.
 * <p>
 * Symbols run in parallel on the supplied executor, each with its own state; results are
 * collected in configuration order. Averages are then compared against stored baselines and
 * any regression beyond the tolerance fails the suite. A symbol without a baseline is skipped.
 */
@Slf4j
public class WalkForwardSuite {

    private static final int CHANGE_SCALE = 4;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final WalkForwardSuiteConfig config;
    private final WalkForwardEngine engine;
    private final BaselineStore baselineStore;
    private final ExecutorService executor;

    /**
     * @param executor runs symbols in parallel; null runs them on the calling thread
     */
    public WalkForwardSuite(WalkForwardSuiteConfig config, WalkForwardEngine engine,
                            BaselineStore baselineStore, ExecutorService executor) {
        config.validate();
        this.config = config;
        this.engine = engine;
        this.baselineStore = baselineStore;
        this.executor = executor;
    }

    /**
     * Run every configured symbol and compare against baselines.
     *
     * @param barsBySymbol         full bar series per symbol
     * @param signalSourceSupplier fresh signal source per backtest run
     */
    public WalkForwardSuiteResult run(Map<String, List<Bar>> barsBySymbol, Supplier<SignalSource> signalSourceSupplier) {
        long suiteStart = System.currentTimeMillis();
        String suiteId = UUID.randomUUID().toString();

        MDC.put("suiteId", suiteId);
        try {
            log.info("Walk-forward suite started - Symbols: {}", config.getSymbols().stream()
                    .map(SymbolSuiteConfig::getSymbol).collect(Collectors.toList()));

            List<SymbolSuiteResult> symbolResults = runSymbols(suiteId, barsBySymbol, signalSourceSupplier);
            List<BaselineComparison> comparisons = compareToBaselines(symbolResults);

            List<String> regressionDetails = comparisons.stream()
                    .filter(BaselineComparison::isRegressed)
                    .map(WalkForwardSuite::describeRegression)
                    .collect(Collectors.toList());
            int totalWindows = symbolResults.stream().mapToInt(SymbolSuiteResult::getWindowCount).sum();
            long totalTime = System.currentTimeMillis() - suiteStart;

            WalkForwardSuiteResult result = WalkForwardSuiteResult.builder()
                    .suiteId(suiteId)
                    .symbolResults(symbolResults)
                    .baselineComparisons(comparisons)
                    .regressionDetails(regressionDetails)
                    .regressionCount(regressionDetails.size())
                    .overallPass(regressionDetails.isEmpty())
                    .totalSymbols(symbolResults.size())
                    .totalWindows(totalWindows)
                    .totalExecutionTimeMs(totalTime)
                    .build();

            log.info("Walk-forward suite completed - Pass: {}, Symbols: {}, Windows: {}, Regressions: {}, Time: {}ms",
                    result.isOverallPass(), result.getTotalSymbols(), totalWindows, result.getRegressionCount(), totalTime);
            regressionDetails.forEach(detail -> log.warn("Regression: {}", detail));
            return result;
        } finally {
            MDC.remove("suiteId");
        }
    }

    /**
     * Compare each successful symbol against its stored baseline.
     */
    public List<BaselineComparison> compareToBaselines(List<SymbolSuiteResult> symbolResults) {
        List<BaselineComparison> comparisons = new ArrayList<>();
        for (SymbolSuiteResult result : symbolResults) {
            if (result.isFailed()) {
                continue;
            }
            Optional<BaselineRecord> baseline = baselineStore.load(result.getSymbol());
            if (baseline.isEmpty()) {
                log.info("No walk-forward baseline for {}, skipping comparison", result.getSymbol());
                continue;
            }
            comparisons.addAll(compare(result, baseline.get(), config.getRegressionTolerancePct()));
        }
        return comparisons;
    }

    /**
     * Compare one symbol's averages against a baseline. Metrics the baseline lacks are skipped.
     */
    public static List<BaselineComparison> compare(SymbolSuiteResult result, BaselineRecord baseline,
                                                   BigDecimal tolerancePct) {
        List<BaselineComparison> comparisons = new ArrayList<>();
        for (SuiteMetric metric : SuiteMetric.values()) {
            BigDecimal baselineValue = metric.baselineValue(baseline);
            if (baselineValue == null) {
                continue;
            }
            BigDecimal currentValue = metric.currentValue(result);
            BigDecimal changePct = changePct(baselineValue, currentValue);
            comparisons.add(BaselineComparison.builder()
                    .symbol(result.getSymbol())
                    .metricName(metric.getMetricName())
                    .baselineValue(baselineValue)
                    .currentValue(currentValue)
                    .changePct(changePct)
                    .tolerancePct(tolerancePct)
                    .regressed(metric.getPolarity().isRegression(changePct, tolerancePct))
                    .build());
        }
        return comparisons;
    }

    /**
     * Store every successful symbol of the result as the new baseline.
     *
     * @return the records written
     */
    public List<BaselineRecord> saveBaselines(WalkForwardSuiteResult result, String version) {
        List<BaselineRecord> saved = new ArrayList<>();
        for (SymbolSuiteResult symbolResult : result.getSymbolResults()) {
            if (symbolResult.isFailed()) {
                continue;
            }
            BaselineRecord record = BaselineRecord.builder()
                    .symbol(symbolResult.getSymbol())
                    .assetClass(symbolResult.getAssetClass())
                    .suiteId(result.getSuiteId())
                    .version(version)
                    .windowCount(symbolResult.getWindowCount())
                    .avgValidateWinRate(symbolResult.getAvgValidateWinRate())
                    .avgValidateProfitFactor(symbolResult.getAvgValidateProfitFactor())
                    .avgValidateSharpe(symbolResult.getAvgValidateSharpe())
                    .avgValidateMaxDrawdown(symbolResult.getAvgValidateMaxDrawdown())
                    .stabilityScore(symbolResult.getStabilityScore())
                    .degradationCount(symbolResult.getDegradationCount())
                    .notes(BaselineRecord.DEFAULT_NOTES)
                    .build();
            baselineStore.save(record);
            saved.add(record);
            log.info("Saved walk-forward baseline {} for {}", version, symbolResult.getSymbol());
        }
        return saved;
    }

    static BigDecimal changePct(BigDecimal baselineValue, BigDecimal currentValue) {
        if (baselineValue.signum() == 0) {
            return BigDecimal.ZERO.setScale(CHANGE_SCALE);
        }
        return currentValue.subtract(baselineValue)
                .multiply(HUNDRED)
                .divide(baselineValue, CHANGE_SCALE, RoundingMode.HALF_UP);
    }

    private List<SymbolSuiteResult> runSymbols(String suiteId, Map<String, List<Bar>> barsBySymbol,
                                               Supplier<SignalSource> signalSourceSupplier) {
        if (executor == null) {
            return config.getSymbols().stream()
                    .map(symbol -> runSymbol(suiteId, symbol, barsBySymbol, signalSourceSupplier))
                    .collect(Collectors.toList());
        }

        List<Future<SymbolSuiteResult>> futures = new ArrayList<>();
        for (SymbolSuiteConfig symbolConfig : config.getSymbols()) {
            futures.add(executor.submit(() -> runSymbol(suiteId, symbolConfig, barsBySymbol, signalSourceSupplier)));
        }

        List<SymbolSuiteResult> results = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            SymbolSuiteConfig symbolConfig = config.getSymbols().get(i);
            try {
                results.add(futures.get(i).get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                results.add(failed(symbolConfig, "interrupted"));
            } catch (ExecutionException e) {
                log.error("Walk-forward task for {} failed: {}", symbolConfig.getSymbol(), e.getCause().getMessage(), e);
                results.add(failed(symbolConfig, String.valueOf(e.getCause().getMessage())));
            }
        }
        return results;
    }

    private SymbolSuiteResult runSymbol(String suiteId, SymbolSuiteConfig symbolConfig,
                                        Map<String, List<Bar>> barsBySymbol, Supplier<SignalSource> signalSourceSupplier) {
        String symbol = symbolConfig.getSymbol();
        MDC.put("suiteId", suiteId);
        MDC.put("symbol", symbol);
        long start = System.currentTimeMillis();
        try {
            log.info("Walk-forward symbol started - {}", symbol);
            List<Bar> bars = barsBySymbol.get(symbol);
            if (bars == null || bars.isEmpty()) {
                throw new IllegalStateException("No market data for " + symbol);
            }

            WalkForwardResult wf = engine.run(config.toWalkForwardConfig(symbolConfig), bars, signalSourceSupplier);
            WalkForwardSummary summary = wf.getSummary();

            return SymbolSuiteResult.builder()
                    .symbol(symbol)
                    .assetClass(symbolConfig.getAssetClass())
                    .windowCount(wf.getWindows().size())
                    .avgValidateWinRate(summary.getAvgValidateWinRate())
                    .avgValidateProfitFactor(summary.getAvgValidateProfitFactor())
                    .avgValidateSharpe(summary.getAvgValidateSharpe())
                    .avgValidateMaxDrawdown(summary.getAvgValidateMaxDrawdown())
                    .stabilityScore(wf.getStabilityScore())
                    .degradationCount(wf.getDegradationWindows().size())
                    .executionTimeMs(System.currentTimeMillis() - start)
                    .perWindowMetrics(wf.getWindows().stream().map(WindowMetricsRow::of).collect(Collectors.toList()))
                    .build();
        } catch (RuntimeException e) {
            log.error("Walk-forward symbol {} failed: {}", symbol, e.getMessage(), e);
            return failed(symbolConfig, e.getMessage());
        } finally {
            MDC.remove("symbol");
            if (executor != null) {
                MDC.remove("suiteId");
            }
        }
    }

    private static SymbolSuiteResult failed(SymbolSuiteConfig symbolConfig, String error) {
        return SymbolSuiteResult.builder()
                .symbol(symbolConfig.getSymbol())
                .assetClass(symbolConfig.getAssetClass())
                .error(error == null ? "unknown error" : error)
                .build();
    }

    private static String describeRegression(BaselineComparison c) {
        return String.format(Locale.ROOT, "%s/%s: %+.1f%% (tolerance: %s%%)", c.getSymbol(), c.getMetricName(),
                c.getChangePct().doubleValue(), c.getTolerancePct().toPlainString());
    }
}
