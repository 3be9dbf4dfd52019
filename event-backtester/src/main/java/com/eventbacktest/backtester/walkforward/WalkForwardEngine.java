package com.eventbacktest.backtester.walkforward;

import com.eventbacktest.backtester.domain.BacktestConfig;
import com.eventbacktest.backtester.domain.BacktestConfigurationException;
import com.eventbacktest.backtester.domain.BacktestEngine;
import com.eventbacktest.backtester.domain.BacktestMetrics;
import com.eventbacktest.backtester.domain.BacktestResult;
import com.eventbacktest.backtester.domain.Bar;
import com.eventbacktest.backtester.domain.PositionSizer;
import com.eventbacktest.backtester.domain.SignalSource;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.apache.commons.math3.stat.inference.TTest;
import org.slf4j.MDC;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Walk-forward validation: rolls train/validate windows over a bar series, backtests each
 * half independently and measures how much of the train performance survives out of sample.
 * <p>
 * Validate periods never overlap; windows advance by the validate length. A window whose
 * backtest fails is logged and skipped, the rest still run.
 */
@Slf4j
public class WalkForwardEngine {

    private static final int RATIO_SCALE = 4;

    private final PositionSizer positionSizer;

    public WalkForwardEngine(PositionSizer positionSizer) {
        this.positionSizer = positionSizer;
    }

    /**
     * Run the walk-forward test.
     *
     * @param bars                  the full series for the config's symbol, oldest first
     * @param signalSourceSupplier  called once per backtest run so no state leaks between runs
     * @throws BacktestConfigurationException if the config is invalid or the range fits no window
     */
    public WalkForwardResult run(WalkForwardConfig config, List<Bar> bars, Supplier<SignalSource> signalSourceSupplier) {
        long startTime = System.currentTimeMillis();
        UUID walkForwardId = UUID.randomUUID();
        config.validate();

        List<WindowPeriod> periods = generateWindows(config);
        if (periods.isEmpty()) {
            throw new BacktestConfigurationException("Date range too short for walk-forward test. Requires at least "
                    + (config.getTrainMonths() + config.getValidateMonths()) + " months.");
        }

        MDC.put("walkForwardId", walkForwardId.toString());
        try {
            log.info("Walk-forward test started - Symbol: {}, Train: {}m, Validate: {}m, Windows: {}",
                    config.getSymbol(), config.getTrainMonths(), config.getValidateMonths(), periods.size());

            BacktestConfig backtestConfig = config.windowBacktestConfig();
            List<WalkForwardWindow> windows = new ArrayList<>();
            long windowTimeTotal = 0;

            for (int i = 0; i < periods.size(); i++) {
                WindowPeriod period = periods.get(i);
                int windowNumber = i + 1;
                long windowStart = System.currentTimeMillis();
                try {
                    List<Bar> trainBars = slice(bars, period.trainStart(), period.trainEnd());
                    List<Bar> validateBars = slice(bars, period.validateStart(), period.validateEnd());
                    BacktestResult train = runBacktest(backtestConfig, trainBars, signalSourceSupplier);
                    BacktestResult validate = runBacktest(backtestConfig, validateBars, signalSourceSupplier);

                    BigDecimal ratio = calculatePerformanceRatio(train.getMetrics(), validate.getMetrics(),
                            config.getPrimaryMetric());
                    boolean degraded = detectDegradation(ratio, config.getDegradationThreshold());

                    windows.add(WalkForwardWindow.builder()
                            .windowNumber(windowNumber)
                            .trainStart(period.trainStart())
                            .trainEnd(period.trainEnd())
                            .validateStart(period.validateStart())
                            .validateEnd(period.validateEnd())
                            .trainMetrics(train.getMetrics())
                            .validateMetrics(validate.getMetrics())
                            .trainRunId(train.getRunId())
                            .validateRunId(validate.getRunId())
                            .trainBars(trainBars.size())
                            .validateBars(validateBars.size())
                            .performanceRatio(ratio)
                            .degradationDetected(degraded)
                            .build());

                    long elapsed = System.currentTimeMillis() - windowStart;
                    windowTimeTotal += elapsed;
                    log.info("Window {} completed - Train win rate: {}, Validate win rate: {}, Ratio: {}, Time: {}ms",
                            windowNumber, train.getMetrics().getWinRate(), validate.getMetrics().getWinRate(),
                            ratio, elapsed);
                    if (degraded) {
                        log.warn("Degradation detected in window {} - Ratio {} below threshold {}",
                                windowNumber, ratio, config.getDegradationThreshold());
                    }
                } catch (RuntimeException e) {
                    log.error("Window {} backtest failed: {}", windowNumber, e.getMessage(), e);
                }
            }

            List<Integer> degradationWindows = windows.stream()
                    .filter(WalkForwardWindow::isDegradationDetected)
                    .map(WalkForwardWindow::getWindowNumber)
                    .collect(Collectors.toList());
            BigDecimal stability = calculateStabilityScore(windows, config.getPrimaryMetric());
            long totalTime = System.currentTimeMillis() - startTime;

            log.info("Walk-forward test completed - Windows: {}, Degraded: {}, Stability: {}, Time: {}ms",
                    windows.size(), degradationWindows.size(), stability, totalTime);

            return WalkForwardResult.builder()
                    .walkForwardId(walkForwardId)
                    .config(config)
                    .windows(windows)
                    .summary(calculateSummary(windows))
                    .stabilityScore(stability)
                    .degradationWindows(degradationWindows)
                    .statisticalSignificance(calculateStatisticalSignificance(windows))
                    .totalExecutionTimeMs(totalTime)
                    .avgWindowExecutionTimeMs(windows.isEmpty() ? 0 : windowTimeTotal / windows.size())
                    .build();
        } finally {
            MDC.remove("walkForwardId");
        }
    }

    /**
     * Rolling windows: train ends the day before {@code trainStart + trainMonths}, validate
     * covers the next {@code validateMonths}. Stops once a validate period would pass the end date.
     */
    public static List<WindowPeriod> generateWindows(WalkForwardConfig config) {
        List<WindowPeriod> windows = new ArrayList<>();
        LocalDate trainStart = config.getStartDate();

        while (true) {
            LocalDate trainEnd = trainStart.plusMonths(config.getTrainMonths()).minusDays(1);
            LocalDate validateStart = trainEnd.plusDays(1);
            LocalDate validateEnd = validateStart.plusMonths(config.getValidateMonths()).minusDays(1);

            if (validateEnd.isAfter(config.getEndDate())) {
                break;
            }
            windows.add(new WindowPeriod(trainStart, trainEnd, validateStart, validateEnd));
            trainStart = trainStart.plusMonths(config.getValidateMonths());
        }
        return windows;
    }

    public static BigDecimal calculatePerformanceRatio(BacktestMetrics train, BacktestMetrics validate,
                                                       PrimaryMetric metric) {
        BigDecimal trainValue = metric.valueOf(train);
        if (trainValue.signum() == 0) {
            return BigDecimal.ZERO.setScale(RATIO_SCALE);
        }
        return metric.valueOf(validate).divide(trainValue, RATIO_SCALE, RoundingMode.HALF_UP);
    }

    public static boolean detectDegradation(BigDecimal performanceRatio, BigDecimal threshold) {
        return performanceRatio.compareTo(threshold) < 0;
    }

    /**
     * Sample standard deviation over mean of the validate primary metric.
     * 0 for fewer than two windows or a zero mean.
     */
    public static BigDecimal calculateStabilityScore(List<WalkForwardWindow> windows, PrimaryMetric metric) {
        BigDecimal zero = BigDecimal.ZERO.setScale(RATIO_SCALE);
        if (windows.size() < 2) {
            return zero;
        }
        DescriptiveStatistics stats = new DescriptiveStatistics();
        windows.forEach(w -> stats.addValue(metric.valueOf(w.getValidateMetrics()).doubleValue()));

        double mean = stats.getMean();
        if (mean == 0) {
            return zero;
        }
        double cv = stats.getStandardDeviation() / mean;
        if (Double.isNaN(cv) || Double.isInfinite(cv)) {
            return zero;
        }
        return BigDecimal.valueOf(cv).setScale(RATIO_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Paired t-test p-values for train vs validate. Empty below two windows; 1.0 where the
     * test is undefined (e.g. identical samples).
     */
    public static Map<String, Double> calculateStatisticalSignificance(List<WalkForwardWindow> windows) {
        Map<String, Double> results = new LinkedHashMap<>();
        if (windows.size() < 2) {
            return results;
        }
        results.put("win_rate_pvalue", pairedPValue(windows, BacktestMetrics::getWinRate));
        results.put("avg_r_pvalue", pairedPValue(windows, BacktestMetrics::getAverageRMultiple));
        results.put("profit_factor_pvalue", pairedPValue(windows, BacktestMetrics::getProfitFactor));
        results.put("sharpe_ratio_pvalue", pairedPValue(windows, BacktestMetrics::getSharpeRatio));
        return results;
    }

    public static WalkForwardSummary calculateSummary(List<WalkForwardWindow> windows) {
        if (windows.isEmpty()) {
            return WalkForwardSummary.empty();
        }
        int degraded = (int) windows.stream().filter(WalkForwardWindow::isDegradationDetected).count();
        return WalkForwardSummary.builder()
                .avgValidateWinRate(averageValidate(windows, BacktestMetrics::getWinRate))
                .avgValidateAvgR(averageValidate(windows, BacktestMetrics::getAverageRMultiple))
                .avgValidateProfitFactor(averageValidate(windows, BacktestMetrics::getProfitFactor))
                .avgValidateSharpe(averageValidate(windows, BacktestMetrics::getSharpeRatio))
                .avgValidateMaxDrawdown(averageValidate(windows, BacktestMetrics::getMaxDrawdown))
                .totalWindows(windows.size())
                .degradationCount(degraded)
                .degradationPct(BigDecimal.valueOf(degraded * 100L)
                        .divide(BigDecimal.valueOf(windows.size()), RATIO_SCALE, RoundingMode.HALF_UP))
                .build();
    }

    static BigDecimal averageValidate(List<WalkForwardWindow> windows, Function<BacktestMetrics, BigDecimal> metric) {
        return windows.stream()
                .map(w -> metric.apply(w.getValidateMetrics()))
                .reduce(BigDecimal.ZERO, BigDecimal::add)
                .divide(BigDecimal.valueOf(windows.size()), 6, RoundingMode.HALF_UP);
    }

    /**
     * Bars whose UTC calendar date falls within the inclusive range.
     */
    static List<Bar> slice(List<Bar> bars, LocalDate from, LocalDate to) {
        return bars.stream()
                .filter(bar -> bar != null && bar.getTimestamp() != null)
                .filter(bar -> {
                    LocalDate date = bar.getTimestamp().atZone(ZoneOffset.UTC).toLocalDate();
                    return !date.isBefore(from) && !date.isAfter(to);
                })
                .collect(Collectors.toList());
    }

    private BacktestResult runBacktest(BacktestConfig config, List<Bar> bars, Supplier<SignalSource> signalSourceSupplier) {
        return new BacktestEngine(config, signalSourceSupplier.get(), positionSizer).run(bars);
    }

    private static double pairedPValue(List<WalkForwardWindow> windows, Function<BacktestMetrics, BigDecimal> metric) {
        double[] train = windows.stream().mapToDouble(w -> metric.apply(w.getTrainMetrics()).doubleValue()).toArray();
        double[] validate = windows.stream().mapToDouble(w -> metric.apply(w.getValidateMetrics()).doubleValue()).toArray();
        try {
            double p = new TTest().pairedTTest(train, validate);
            return Double.isNaN(p) ? 1.0 : p;
        } catch (MathIllegalArgumentException | MathIllegalStateException e) {
            log.debug("Paired t-test undefined: {}", e.getMessage());
            return 1.0;
        }
    }
}
