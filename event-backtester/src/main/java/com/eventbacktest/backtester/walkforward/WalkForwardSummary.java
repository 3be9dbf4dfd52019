package com.eventbacktest.backtester.walkforward;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

/**
 * Averages of the validate-run metrics across all completed windows.
 */
@Value
@Builder
@Jacksonized
public class WalkForwardSummary {

    BigDecimal avgValidateWinRate;
    BigDecimal avgValidateAvgR;
    BigDecimal avgValidateProfitFactor;
    BigDecimal avgValidateSharpe;
    BigDecimal avgValidateMaxDrawdown;
    int totalWindows;
    int degradationCount;
    BigDecimal degradationPct;

    public static WalkForwardSummary empty() {
        return WalkForwardSummary.builder()
                .avgValidateWinRate(BigDecimal.ZERO)
                .avgValidateAvgR(BigDecimal.ZERO)
                .avgValidateProfitFactor(BigDecimal.ZERO)
                .avgValidateSharpe(BigDecimal.ZERO)
                .avgValidateMaxDrawdown(BigDecimal.ZERO)
                .degradationPct(BigDecimal.ZERO)
                .build();
    }
}
