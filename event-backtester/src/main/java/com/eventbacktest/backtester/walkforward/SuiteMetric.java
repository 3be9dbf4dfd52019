package com.eventbacktest.backtester.walkforward;

import java.math.BigDecimal;
import java.util.function.Function;

/**
 * Suite metrics compared against the stored baseline, with their regression direction.
 */
public enum SuiteMetric {
    AVG_VALIDATE_WIN_RATE("avg_validate_win_rate", MetricPolarity.HIGHER_IS_BETTER,
            SymbolSuiteResult::getAvgValidateWinRate, BaselineRecord::getAvgValidateWinRate),
    AVG_VALIDATE_PROFIT_FACTOR("avg_validate_profit_factor", MetricPolarity.HIGHER_IS_BETTER,
            SymbolSuiteResult::getAvgValidateProfitFactor, BaselineRecord::getAvgValidateProfitFactor),
    AVG_VALIDATE_SHARPE("avg_validate_sharpe", MetricPolarity.HIGHER_IS_BETTER,
            SymbolSuiteResult::getAvgValidateSharpe, BaselineRecord::getAvgValidateSharpe),
    AVG_VALIDATE_MAX_DRAWDOWN("avg_validate_max_drawdown", MetricPolarity.LOWER_IS_BETTER,
            SymbolSuiteResult::getAvgValidateMaxDrawdown, BaselineRecord::getAvgValidateMaxDrawdown);

    private final String metricName;
    private final MetricPolarity polarity;
    private final Function<SymbolSuiteResult, BigDecimal> current;
    private final Function<BaselineRecord, BigDecimal> baseline;

    SuiteMetric(String metricName, MetricPolarity polarity,
                Function<SymbolSuiteResult, BigDecimal> current, Function<BaselineRecord, BigDecimal> baseline) {
        this.metricName = metricName;
        this.polarity = polarity;
        this.current = current;
        this.baseline = baseline;
    }

    public String getMetricName() {
        return metricName;
    }

    public MetricPolarity getPolarity() {
        return polarity;
    }

    public BigDecimal currentValue(SymbolSuiteResult result) {
        return current.apply(result);
    }

    /**
     * @return the stored value, or null when the baseline does not carry this metric
     */
    public BigDecimal baselineValue(BaselineRecord record) {
        return baseline.apply(record);
    }
}
