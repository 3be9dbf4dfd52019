package com.eventbacktest.backtester.execution;

import com.eventbacktest.backtester.domain.Bar;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;

/**
 * Data-quality check for incoming bars. A rejected bar is skipped, the run continues.
 */
public class BarValidator {

    /**
     * @param previousTimestamp timestamp of the last accepted bar, null for the first
     * @return the rejection reason, empty when the bar is usable
     */
    public Optional<String> validate(Bar bar, Instant previousTimestamp) {
        if (bar == null) {
            return Optional.of("bar is null");
        }
        if (bar.getTimestamp() == null) {
            return Optional.of("missing timestamp");
        }
        if (isNotPositive(bar.getOpen()) || isNotPositive(bar.getHigh())
                || isNotPositive(bar.getLow()) || isNotPositive(bar.getClose())) {
            return Optional.of("non-positive OHLC");
        }
        if (bar.getHigh().compareTo(bar.getLow()) < 0) {
            return Optional.of("high " + bar.getHigh() + " below low " + bar.getLow());
        }
        if (outside(bar.getOpen(), bar) || outside(bar.getClose(), bar)) {
            return Optional.of("open/close outside [low, high]");
        }
        if (bar.getVolume() < 0) {
            return Optional.of("negative volume " + bar.getVolume());
        }
        if (previousTimestamp != null && !bar.getTimestamp().isAfter(previousTimestamp)) {
            return Optional.of("timestamp " + bar.getTimestamp() + " not after " + previousTimestamp);
        }
        return Optional.empty();
    }

    private static boolean isNotPositive(BigDecimal value) {
        return value == null || value.signum() <= 0;
    }

    private static boolean outside(BigDecimal price, Bar bar) {
        return price.compareTo(bar.getLow()) < 0 || price.compareTo(bar.getHigh()) > 0;
    }
}
