package com.eventbacktest.backtester.walkforward;

import com.eventbacktest.backtester.domain.BacktestConfig;
import com.eventbacktest.backtester.domain.BacktestConfigurationException;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Multi-symbol walk-forward suite settings shared by every symbol.
 */
@Value
@Builder(toBuilder = true)
public class WalkForwardSuiteConfig {

    @Singular
    List<SymbolSuiteConfig> symbols;

    @Builder.Default
    int trainMonths = 6;

    @Builder.Default
    int validateMonths = 3;

    @Builder.Default
    PrimaryMetric primaryMetric = PrimaryMetric.WIN_RATE;

    @Builder.Default
    BigDecimal degradationThreshold = new BigDecimal("0.80");

    /** Allowed change in percent before a baseline metric counts as regressed. */
    @Builder.Default
    BigDecimal regressionTolerancePct = new BigDecimal("10.0");

    @Builder.Default
    BacktestConfig backtestTemplate = BacktestConfig.builder().build();

    public BacktestConfig toBacktestConfig(SymbolSuiteConfig symbolConfig) {
        return backtestTemplate.toBuilder()
                .symbol(symbolConfig.getSymbol())
                .initialCapital(symbolConfig.getInitialCapital())
                .build();
    }

    public WalkForwardConfig toWalkForwardConfig(SymbolSuiteConfig symbolConfig) {
        return WalkForwardConfig.builder()
                .symbol(symbolConfig.getSymbol())
                .startDate(symbolConfig.getStartDate())
                .endDate(symbolConfig.getEndDate())
                .trainMonths(trainMonths)
                .validateMonths(validateMonths)
                .primaryMetric(primaryMetric)
                .degradationThreshold(degradationThreshold)
                .backtestConfig(toBacktestConfig(symbolConfig))
                .build();
    }

    public void validate() {
        if (symbols == null || symbols.isEmpty()) {
            throw new BacktestConfigurationException("symbols list cannot be empty");
        }
        if (regressionTolerancePct == null || regressionTolerancePct.signum() < 0) {
            throw new BacktestConfigurationException("regressionTolerancePct must not be negative, got "
                    + regressionTolerancePct);
        }
        if (trainMonths <= 0 || validateMonths <= 0) {
            throw new BacktestConfigurationException("trainMonths and validateMonths must be greater than 0");
        }
    }
}
