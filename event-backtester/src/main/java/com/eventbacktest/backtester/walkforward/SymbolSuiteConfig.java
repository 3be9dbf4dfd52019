package com.eventbacktest.backtester.walkforward;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.LocalDate;

@Value
@Builder
@Jacksonized
public class SymbolSuiteConfig {

    String symbol;

    /** Free-form grouping, e.g. "forex" or "us_stock". */
    String assetClass;

    LocalDate startDate;
    LocalDate endDate;

    @Builder.Default
    BigDecimal initialCapital = new BigDecimal("100000");

    @Builder.Default
    String timeframe = "1d";
}
