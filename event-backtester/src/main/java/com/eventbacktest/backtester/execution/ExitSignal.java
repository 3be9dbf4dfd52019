package com.eventbacktest.backtester.execution;

import com.eventbacktest.backtester.domain.ExitReason;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Request to close a position, raised by {@link BarProcessor}.
 */
@Value
@Builder
public class ExitSignal {

    String symbol;
    ExitReason reason;

    /** Close of the bar that triggered the exit. The closing order fills on a later bar. */
    BigDecimal exitPrice;

    /** Move from average entry to close, as a fraction. Positive means the price went up. */
    BigDecimal movePct;
}
