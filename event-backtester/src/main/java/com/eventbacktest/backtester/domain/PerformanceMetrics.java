package com.eventbacktest.backtester.domain;

import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Calculator for backtest performance metrics.
 * <p>
 * Every method is a pure function of its arguments. Degenerate inputs (no trades, no losses,
 * flat equity, non-positive capital) resolve to 0 rather than NaN, infinity or an exception.
 */
@Slf4j
public final class PerformanceMetrics {

    public static final BigDecimal DEFAULT_RISK_FREE_RATE = new BigDecimal("0.02");

    private static final int RATIO_SCALE = 4;
    private static final int FRACTION_SCALE = 6;
    private static final int RETURN_SCALE = 8;
    private static final int TRADING_DAYS = 252;
    private static final double DAYS_PER_YEAR = 365.25;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private PerformanceMetrics() {
    }

    /**
     * Compute the full metric set for a run.
     */
    public static BacktestMetrics calculate(List<EquityCurvePoint> equityCurve, List<Trade> trades,
                                            BigDecimal initialCapital, BigDecimal riskFreeRate) {
        List<BigDecimal> values = equityCurve.stream()
                .map(EquityCurvePoint::getPortfolioValue)
                .collect(Collectors.toList());
        BigDecimal finalValue = values.isEmpty() ? initialCapital : values.get(values.size() - 1);

        BigDecimal cagr = BigDecimal.ZERO.setScale(FRACTION_SCALE);
        if (!equityCurve.isEmpty()) {
            cagr = calculateCAGR(initialCapital, finalValue,
                    equityCurve.get(0).getTimestamp(),
                    equityCurve.get(equityCurve.size() - 1).getTimestamp());
        }

        Drawdown drawdown = calculateMaxDrawdown(values);
        int winning = (int) trades.stream().filter(Trade::isWinner).count();
        int losing = (int) trades.stream().filter(Trade::isLoser).count();

        return BacktestMetrics.builder()
                .totalTrades(trades.size())
                .winningTrades(winning)
                .losingTrades(losing)
                .winRate(calculateWinRate(trades))
                .averageRMultiple(calculateAverageRMultiple(trades))
                .profitFactor(calculateProfitFactor(trades))
                .totalReturnPct(calculateTotalReturn(initialCapital, finalValue))
                .cagr(cagr)
                .sharpeRatio(calculateSharpeRatio(values, riskFreeRate))
                .maxDrawdown(drawdown.maxDrawdown())
                .maxDrawdownDurationBars(drawdown.durationBars())
                .build();
    }

    /**
     * Calculate total return percentage.
     */
    public static BigDecimal calculateTotalReturn(BigDecimal initialCapital, BigDecimal finalValue) {
        if (initialCapital == null || initialCapital.signum() <= 0) {
            return BigDecimal.ZERO;
        }

        return finalValue.subtract(initialCapital)
                .multiply(HUNDRED)
                .divide(initialCapital, RATIO_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Compound annual growth rate as a fraction, years measured as elapsed days / 365.25.
     */
    public static BigDecimal calculateCAGR(BigDecimal initialCapital, BigDecimal finalValue,
                                           Instant start, Instant end) {
        BigDecimal zero = BigDecimal.ZERO.setScale(FRACTION_SCALE);
        if (initialCapital == null || finalValue == null || initialCapital.signum() <= 0 || finalValue.signum() <= 0) {
            return zero;
        }
        double years = Duration.between(start, end).getSeconds() / 86_400.0 / DAYS_PER_YEAR;
        if (years <= 0) {
            return zero;
        }

        double ratio = finalValue.divide(initialCapital, 12, RoundingMode.HALF_UP).doubleValue();
        double cagr = Math.pow(ratio, 1.0 / years) - 1.0;
        if (Double.isNaN(cagr) || Double.isInfinite(cagr)) {
            return zero;
        }
        return BigDecimal.valueOf(cagr).setScale(FRACTION_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Annualised Sharpe ratio of bar-to-bar returns using the population standard deviation.
     */
    public static BigDecimal calculateSharpeRatio(List<BigDecimal> portfolioValues, BigDecimal riskFreeRate) {
        BigDecimal zero = BigDecimal.ZERO.setScale(RATIO_SCALE);
        if (portfolioValues.size() < 2) {
            return zero;
        }

        List<BigDecimal> returns = calculateReturns(portfolioValues);
        if (returns.isEmpty()) {
            return zero;
        }

        BigDecimal meanReturn = returns.stream()
                .reduce(BigDecimal.ZERO, BigDecimal::add)
                .divide(BigDecimal.valueOf(returns.size()), RETURN_SCALE, RoundingMode.HALF_UP);

        BigDecimal sumSquaredDiff = returns.stream()
                .map(r -> r.subtract(meanReturn).pow(2))
                .reduce(BigDecimal.ZERO, BigDecimal::add);

        double variance = sumSquaredDiff
                .divide(BigDecimal.valueOf(returns.size()), 16, RoundingMode.HALF_UP)
                .doubleValue();
        double stdDev = Math.sqrt(variance);
        if (stdDev == 0) {
            return zero;
        }

        BigDecimal rf = riskFreeRate == null ? BigDecimal.ZERO : riskFreeRate;
        double dailyRiskFree = rf.doubleValue() / TRADING_DAYS;
        double sharpe = (meanReturn.doubleValue() - dailyRiskFree) / stdDev * Math.sqrt(TRADING_DAYS);
        if (Double.isNaN(sharpe) || Double.isInfinite(sharpe)) {
            return zero;
        }
        return BigDecimal.valueOf(sharpe).setScale(RATIO_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Maximum peak-to-trough decline as a fraction of the running peak, plus the longest run of
     * bars spent below a peak. The duration counter restarts on every new peak.
     */
    public static Drawdown calculateMaxDrawdown(List<BigDecimal> portfolioValues) {
        BigDecimal maxDrawdown = BigDecimal.ZERO.setScale(FRACTION_SCALE);
        if (portfolioValues.isEmpty()) {
            return new Drawdown(maxDrawdown, 0);
        }

        BigDecimal peak = portfolioValues.get(0);
        int currentDuration = 0;
        int maxDuration = 0;

        for (BigDecimal value : portfolioValues) {
            if (value.compareTo(peak) >= 0) {
                peak = value;
                currentDuration = 0;
                continue;
            }

            currentDuration++;
            maxDuration = Math.max(maxDuration, currentDuration);

            if (peak.signum() > 0) {
                BigDecimal drawdown = peak.subtract(value).divide(peak, FRACTION_SCALE, RoundingMode.HALF_UP);
                if (drawdown.compareTo(maxDrawdown) > 0) {
                    maxDrawdown = drawdown;
                }
            }
        }

        return new Drawdown(maxDrawdown.min(BigDecimal.ONE.setScale(FRACTION_SCALE)), maxDuration);
    }

    /**
     * Winning trades over all trades. Break-even trades count in the denominator only.
     */
    public static BigDecimal calculateWinRate(List<Trade> trades) {
        if (trades.isEmpty()) {
            return BigDecimal.ZERO.setScale(RATIO_SCALE);
        }
        long winners = trades.stream().filter(Trade::isWinner).count();
        return BigDecimal.valueOf(winners).divide(BigDecimal.valueOf(trades.size()), RATIO_SCALE, RoundingMode.HALF_UP);
    }

    public static BigDecimal calculateAverageRMultiple(List<Trade> trades) {
        if (trades.isEmpty()) {
            return BigDecimal.ZERO.setScale(RATIO_SCALE);
        }
        return trades.stream()
                .map(Trade::getRMultiple)
                .reduce(BigDecimal.ZERO, BigDecimal::add)
                .divide(BigDecimal.valueOf(trades.size()), RATIO_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Gross profit over gross loss. Returns 0, not infinity, when there are no losing trades.
     */
    public static BigDecimal calculateProfitFactor(List<Trade> trades) {
        BigDecimal grossProfit = trades.stream()
                .filter(Trade::isWinner)
                .map(Trade::getNetPnl)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal grossLoss = trades.stream()
                .filter(Trade::isLoser)
                .map(Trade::getNetPnl)
                .reduce(BigDecimal.ZERO, BigDecimal::add)
                .abs();

        if (grossLoss.signum() == 0) {
            return BigDecimal.ZERO.setScale(RATIO_SCALE);
        }
        return grossProfit.divide(grossLoss, RATIO_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Return per UTC calendar month, chained from the previous month's last value.
     * The first month starts from the initial capital.
     */
    public static List<MonthlyReturn> calculateMonthlyReturns(List<EquityCurvePoint> equityCurve, List<Trade> trades,
                                                              BigDecimal initialCapital) {
        Map<YearMonth, List<EquityCurvePoint>> pointsByMonth = new LinkedHashMap<>();
        for (EquityCurvePoint point : equityCurve) {
            pointsByMonth.computeIfAbsent(monthOf(point.getTimestamp()), k -> new ArrayList<>()).add(point);
        }

        Map<YearMonth, List<Trade>> tradesByMonth = trades.stream()
                .collect(Collectors.groupingBy(t -> monthOf(t.getExitTimestamp())));

        List<MonthlyReturn> result = new ArrayList<>();
        BigDecimal startValue = initialCapital;
        for (Map.Entry<YearMonth, List<EquityCurvePoint>> entry : pointsByMonth.entrySet()) {
            List<EquityCurvePoint> points = entry.getValue();
            BigDecimal endValue = points.get(points.size() - 1).getPortfolioValue();
            List<Trade> monthTrades = tradesByMonth.getOrDefault(entry.getKey(), List.of());

            result.add(MonthlyReturn.builder()
                    .year(entry.getKey().getYear())
                    .month(entry.getKey().getMonthValue())
                    .returnPct(calculateTotalReturn(startValue, endValue))
                    .tradeCount(monthTrades.size())
                    .winningTrades((int) monthTrades.stream().filter(Trade::isWinner).count())
                    .losingTrades((int) monthTrades.stream().filter(Trade::isLoser).count())
                    .build());
            startValue = endValue;
        }
        return result;
    }

    /**
     * How much commission and slippage cost the run, and how far they pulled the average R down.
     */
    public static CostSummary calculateCostSummary(List<Trade> trades) {
        BigDecimal zero = BigDecimal.ZERO.setScale(RATIO_SCALE);
        if (trades.isEmpty()) {
            return CostSummary.builder()
                    .totalTrades(0)
                    .totalCommission(BigDecimal.ZERO)
                    .totalSlippage(BigDecimal.ZERO)
                    .avgCommissionPerTrade(zero)
                    .avgSlippagePerTrade(zero)
                    .grossAvgRMultiple(zero)
                    .netAvgRMultiple(zero)
                    .rMultipleDegradation(zero)
                    .rMultipleDegradationPct(zero)
                    .build();
        }

        BigDecimal count = BigDecimal.valueOf(trades.size());
        BigDecimal totalCommission = trades.stream().map(Trade::getCommission).reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal totalSlippage = trades.stream().map(Trade::getSlippage).reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal grossAvgR = trades.stream().map(Trade::getGrossRMultiple).reduce(BigDecimal.ZERO, BigDecimal::add)
                .divide(count, RATIO_SCALE, RoundingMode.HALF_UP);
        BigDecimal netAvgR = calculateAverageRMultiple(trades);
        BigDecimal degradation = grossAvgR.subtract(netAvgR);
        BigDecimal degradationPct = grossAvgR.signum() == 0
                ? zero
                : degradation.multiply(HUNDRED).divide(grossAvgR.abs(), RATIO_SCALE, RoundingMode.HALF_UP);

        return CostSummary.builder()
                .totalTrades(trades.size())
                .totalCommission(totalCommission)
                .totalSlippage(totalSlippage)
                .avgCommissionPerTrade(totalCommission.divide(count, RATIO_SCALE, RoundingMode.HALF_UP))
                .avgSlippagePerTrade(totalSlippage.divide(count, RATIO_SCALE, RoundingMode.HALF_UP))
                .grossAvgRMultiple(grossAvgR)
                .netAvgRMultiple(netAvgR)
                .rMultipleDegradation(degradation)
                .rMultipleDegradationPct(degradationPct)
                .build();
    }

    static List<BigDecimal> calculateReturns(List<BigDecimal> portfolioValues) {
        List<BigDecimal> returns = new ArrayList<>();
        for (int i = 1; i < portfolioValues.size(); i++) {
            BigDecimal prevValue = portfolioValues.get(i - 1);
            if (prevValue.signum() > 0) {
                returns.add(portfolioValues.get(i).subtract(prevValue)
                        .divide(prevValue, RETURN_SCALE, RoundingMode.HALF_UP));
            }
        }
        return returns;
    }

    private static YearMonth monthOf(Instant timestamp) {
        return YearMonth.from(timestamp.atZone(ZoneOffset.UTC));
    }

    /**
     * @param maxDrawdown  fraction of the running peak in [0, 1]
     * @param durationBars longest consecutive run of bars below a peak
     */
    public record Drawdown(BigDecimal maxDrawdown, int durationBars) {
    }
}
