package com.eventbacktest.backtester.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

@Value
@Builder
@Jacksonized
public class MonthlyReturn {

    int year;
    int month;
    BigDecimal returnPct;
    int tradeCount;
    int winningTrades;
    int losingTrades;
}
