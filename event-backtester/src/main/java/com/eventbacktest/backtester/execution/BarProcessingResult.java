package com.eventbacktest.backtester.execution;

import com.eventbacktest.backtester.domain.EquityCurvePoint;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

@Value
@Builder
public class BarProcessingResult {

    int barIndex;
    Instant timestamp;
    BigDecimal cash;
    BigDecimal positionsValue;
    BigDecimal portfolioValue;

    @Singular
    List<ExitSignal> exitSignals;

    EquityCurvePoint equityPoint;

    public boolean hasExitSignals() {
        return !exitSignals.isEmpty();
    }
}
