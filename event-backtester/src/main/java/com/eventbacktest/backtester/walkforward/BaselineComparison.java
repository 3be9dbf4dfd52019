package com.eventbacktest.backtester.walkforward;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

@Value
@Builder
@Jacksonized
public class BaselineComparison {

    String symbol;
    String metricName;
    BigDecimal baselineValue;
    BigDecimal currentValue;

    /** (current - baseline) / baseline x 100; 0 when the baseline is 0. */
    BigDecimal changePct;
    BigDecimal tolerancePct;
    boolean regressed;
}
