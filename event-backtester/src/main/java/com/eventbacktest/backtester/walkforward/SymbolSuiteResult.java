package com.eventbacktest.backtester.walkforward;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.util.List;

/**
 * Walk-forward outcome for one symbol of a suite. {@code error} is set when the symbol failed;
 * such a result is excluded from baseline comparison and saving.
 */
@Value
@Builder
@Jacksonized
public class SymbolSuiteResult {

    String symbol;
    String assetClass;
    int windowCount;

    @Builder.Default
    BigDecimal avgValidateWinRate = BigDecimal.ZERO;

    @Builder.Default
    BigDecimal avgValidateProfitFactor = BigDecimal.ZERO;

    @Builder.Default
    BigDecimal avgValidateSharpe = BigDecimal.ZERO;

    @Builder.Default
    BigDecimal avgValidateMaxDrawdown = BigDecimal.ZERO;

    @Builder.Default
    BigDecimal stabilityScore = BigDecimal.ZERO;

    int degradationCount;
    long executionTimeMs;

    @Builder.Default
    List<WindowMetricsRow> perWindowMetrics = List.of();

    String error;

    public boolean isFailed() {
        return error != null;
    }
}
