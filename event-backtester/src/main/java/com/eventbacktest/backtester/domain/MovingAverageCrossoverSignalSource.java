package com.eventbacktest.backtester.domain;

import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedList;
import java.util.List;
import java.util.Queue;

/**
 * Moving Average Crossover signal source.
 * Emits a LONG entry when the short MA crosses above the long MA and, if shorting is enabled,
 * a SHORT entry when it crosses below. Stateful: use one instance per run.
 */
@Slf4j
public class MovingAverageCrossoverSignalSource implements SignalSource {

    private final int shortPeriod;
    private final int longPeriod;
    private final BigDecimal stopPct;
    private final boolean allowShort;

    private final Queue<BigDecimal> shortWindow = new LinkedList<>();
    private final Queue<BigDecimal> longWindow = new LinkedList<>();

    private BigDecimal previousShortMA = null;
    private BigDecimal previousLongMA = null;

    public MovingAverageCrossoverSignalSource(int shortPeriod, int longPeriod) {
        this(shortPeriod, longPeriod, new BigDecimal("0.02"), false);
    }

    public MovingAverageCrossoverSignalSource(int shortPeriod, int longPeriod, BigDecimal stopPct, boolean allowShort) {
        if (shortPeriod <= 0) {
            throw new IllegalArgumentException("Short period must be positive");
        }
        if (shortPeriod >= longPeriod) {
            throw new IllegalArgumentException("Short period must be less than long period");
        }
        if (stopPct == null || stopPct.signum() <= 0 || stopPct.compareTo(BigDecimal.ONE) >= 0) {
            throw new IllegalArgumentException("Stop percentage must be in (0, 1)");
        }
        this.shortPeriod = shortPeriod;
        this.longPeriod = longPeriod;
        this.stopPct = stopPct;
        this.allowShort = allowShort;
    }

    @Override
    public List<TradeSignal> generate(SignalContext context) {
        Bar bar = context.currentBar();
        BigDecimal closePrice = bar.getClose();

        // Update windows
        shortWindow.add(closePrice);
        longWindow.add(closePrice);

        if (shortWindow.size() > shortPeriod) {
            shortWindow.poll();
        }
        if (longWindow.size() > longPeriod) {
            longWindow.poll();
        }

        // Wait until we have enough data
        if (longWindow.size() < longPeriod) {
            return List.of();
        }

        BigDecimal shortMA = calculateMA(shortWindow);
        BigDecimal longMA = calculateMA(longWindow);

        TradeSignal signal = null;
        if (previousShortMA != null && previousLongMA != null) {
            boolean wasBelowLong = previousShortMA.compareTo(previousLongMA) < 0;
            boolean isAboveLong = shortMA.compareTo(longMA) > 0;
            boolean wasAboveLong = previousShortMA.compareTo(previousLongMA) > 0;
            boolean isBelowLong = shortMA.compareTo(longMA) < 0;

            // Golden cross
            if (wasBelowLong && isAboveLong) {
                signal = signal(bar, PositionSide.LONG, closePrice.multiply(BigDecimal.ONE.subtract(stopPct)), "GOLDEN_CROSS");
            }
            // Death cross
            else if (allowShort && wasAboveLong && isBelowLong) {
                signal = signal(bar, PositionSide.SHORT, closePrice.multiply(BigDecimal.ONE.add(stopPct)), "DEATH_CROSS");
            }
        }

        previousShortMA = shortMA;
        previousLongMA = longMA;

        if (signal == null) {
            return List.of();
        }
        log.debug("MA Crossover: {} at {} on {} (Short MA: {}, Long MA: {})",
                signal.getSide(), closePrice, bar.getTimestamp(), shortMA, longMA);
        return List.of(signal);
    }

    @Override
    public String getName() {
        return "MovingAverageCrossover(" + shortPeriod + "," + longPeriod + ")";
    }

    private static TradeSignal signal(Bar bar, PositionSide side, BigDecimal stop, String pattern) {
        return TradeSignal.builder()
                .symbol(bar.getSymbol())
                .side(side)
                .initialStop(stop)
                .patternType(pattern)
                .build();
    }

    private BigDecimal calculateMA(Queue<BigDecimal> window) {
        BigDecimal sum = window.stream()
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        return sum.divide(BigDecimal.valueOf(window.size()), 4, RoundingMode.HALF_UP);
    }
}
