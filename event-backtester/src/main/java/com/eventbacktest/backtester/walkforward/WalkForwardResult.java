package com.eventbacktest.backtester.walkforward;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Value
@Builder
@Jacksonized
public class WalkForwardResult {

    UUID walkForwardId;
    WalkForwardConfig config;
    List<WalkForwardWindow> windows;
    WalkForwardSummary summary;

    /** Sample coefficient of variation of the validate primary metric. Lower is more stable. */
    BigDecimal stabilityScore;

    List<Integer> degradationWindows;

    /** Paired t-test p-values of train vs validate, keyed e.g. {@code win_rate_pvalue}. */
    Map<String, Double> statisticalSignificance;

    long totalExecutionTimeMs;
    long avgWindowExecutionTimeMs;
}
