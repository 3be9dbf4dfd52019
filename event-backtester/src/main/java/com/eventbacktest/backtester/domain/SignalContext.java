package com.eventbacktest.backtester.domain;

import java.util.List;

/**
 * What a signal source may look at: the bars up to and including the current one.
 *
 * @param barIndex index of the current bar in the run
 * @param history  bars visible at this point, oldest first; the last element is the current bar
 */
public record SignalContext(int barIndex, List<Bar> history) {

    public Bar currentBar() {
        return history.get(history.size() - 1);
    }
}
