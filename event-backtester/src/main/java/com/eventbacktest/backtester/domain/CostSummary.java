package com.eventbacktest.backtester.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

/**
 * Transaction cost impact of a run: how much commission and slippage took out of the R-multiples.
 */
@Value
@Builder
@Jacksonized
public class CostSummary {

    int totalTrades;
    BigDecimal totalCommission;
    BigDecimal totalSlippage;
    BigDecimal avgCommissionPerTrade;
    BigDecimal avgSlippagePerTrade;
    BigDecimal grossAvgRMultiple;
    BigDecimal netAvgRMultiple;
    BigDecimal rMultipleDegradation;
    BigDecimal rMultipleDegradationPct;
}
