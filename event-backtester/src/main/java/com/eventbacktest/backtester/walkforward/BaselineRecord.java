package com.eventbacktest.backtester.walkforward;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

/**
 * Stored reference metrics for one symbol. Written only by an explicit save, read at
 * comparison time. Decimal values are kept as JSON strings.
 */
@Value
@Builder
@Jacksonized
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class BaselineRecord {

    public static final String DEFAULT_NOTES = "Walk-forward validation baseline. Auto-generated by WalkForwardSuite.";

    String symbol;
    String assetClass;
    String suiteId;

    /** Baseline version tag supplied at save time. */
    String version;

    int windowCount;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    BigDecimal avgValidateWinRate;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    BigDecimal avgValidateProfitFactor;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    BigDecimal avgValidateSharpe;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    BigDecimal avgValidateMaxDrawdown;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    BigDecimal stabilityScore;

    int degradationCount;
    String notes;
}
