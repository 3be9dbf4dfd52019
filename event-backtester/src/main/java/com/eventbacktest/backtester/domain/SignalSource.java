package com.eventbacktest.backtester.domain;

import java.util.List;

/**
 * Produces candidate entries for the engine.
 * Pattern detection lives behind this interface; the engine knows nothing about it.
 */
public interface SignalSource {

    /**
     * Called once per processed bar, in chronological order.
     *
     * @param context the current bar index and trailing bars
     * @return zero or more entry candidates
     */
    List<TradeSignal> generate(SignalContext context);

    /**
     * Get the signal source name.
     */
    String getName();
}
