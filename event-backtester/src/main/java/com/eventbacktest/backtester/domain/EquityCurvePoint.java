package com.eventbacktest.backtester.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Portfolio snapshot at the close of one processed bar.
 */
@Value
@Builder
@Jacksonized
public class EquityCurvePoint {

    Instant timestamp;
    BigDecimal portfolioValue;
    BigDecimal cash;
    BigDecimal positionsValue;
    BigDecimal dailyReturn;
}
