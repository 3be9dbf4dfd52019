package com.eventbacktest.backtester.walkforward;

import com.eventbacktest.backtester.domain.BacktestMetrics;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
@Jacksonized
public class WalkForwardWindow {

    int windowNumber;
    LocalDate trainStart;
    LocalDate trainEnd;
    LocalDate validateStart;
    LocalDate validateEnd;

    BacktestMetrics trainMetrics;
    BacktestMetrics validateMetrics;
    UUID trainRunId;
    UUID validateRunId;
    int trainBars;
    int validateBars;

    /** validate / train on the primary metric, 0 when the train value is 0. */
    BigDecimal performanceRatio;
    boolean degradationDetected;
}
