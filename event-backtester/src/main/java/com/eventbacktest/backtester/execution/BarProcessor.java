package com.eventbacktest.backtester.execution;

import com.eventbacktest.backtester.domain.BacktestConfigurationException;
import com.eventbacktest.backtester.domain.Bar;
import com.eventbacktest.backtester.domain.EquityCurvePoint;
import com.eventbacktest.backtester.domain.ExitReason;
import com.eventbacktest.backtester.domain.Portfolio;
import com.eventbacktest.backtester.domain.Position;
import com.eventbacktest.backtester.domain.PositionSide;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;

/**
 * Marks positions to market and evaluates exits on the bar close.
 * <p>
 * Checks run in a fixed order and the first hit wins: stop-loss, trailing stop, take-profit.
 * At most one exit signal is raised per position per bar.
 */
@Slf4j
@Getter
public class BarProcessor {

    public static final BigDecimal DEFAULT_STOP_LOSS_PCT = new BigDecimal("0.02");
    public static final BigDecimal DEFAULT_TAKE_PROFIT_PCT = new BigDecimal("0.06");

    private static final int MOVE_SCALE = 8;
    private static final int RETURN_SCALE = 8;

    private final BigDecimal stopLossPct;
    private final BigDecimal takeProfitPct;
    private final BigDecimal trailingStopPct;

    public BarProcessor() {
        this(DEFAULT_STOP_LOSS_PCT, DEFAULT_TAKE_PROFIT_PCT, null);
    }

    /**
     * @param trailingStopPct optional, null disables the trailing stop
     * @throws BacktestConfigurationException if a percentage is outside (0, 1]
     */
    public BarProcessor(BigDecimal stopLossPct, BigDecimal takeProfitPct, BigDecimal trailingStopPct) {
        this.stopLossPct = requireFraction("stopLossPct", stopLossPct);
        this.takeProfitPct = requireFraction("takeProfitPct", takeProfitPct);
        this.trailingStopPct = trailingStopPct == null ? null : requireFraction("trailingStopPct", trailingStopPct);
    }

    /**
     * Process one bar against the portfolio.
     *
     * @param previousValue portfolio value after the previous bar, null on the first bar
     */
    public BarProcessingResult process(Bar bar, int barIndex, Portfolio portfolio, BigDecimal previousValue) {
        portfolio.markToMarket(bar);

        BarProcessingResult.BarProcessingResultBuilder result = BarProcessingResult.builder()
                .barIndex(barIndex)
                .timestamp(bar.getTimestamp());

        portfolio.getPosition(bar.getSymbol())
                .flatMap(position -> evaluateExit(position, bar))
                .ifPresent(result::exitSignal);

        BigDecimal cash = portfolio.getCash();
        BigDecimal positionsValue = portfolio.getPositionsValue();
        BigDecimal portfolioValue = cash.add(positionsValue);

        EquityCurvePoint point = EquityCurvePoint.builder()
                .timestamp(bar.getTimestamp())
                .portfolioValue(portfolioValue)
                .cash(cash)
                .positionsValue(positionsValue)
                .dailyReturn(periodReturn(previousValue, portfolioValue))
                .build();

        return result.cash(cash)
                .positionsValue(positionsValue)
                .portfolioValue(portfolioValue)
                .equityPoint(point)
                .build();
    }

    Optional<ExitSignal> evaluateExit(Position position, Bar bar) {
        BigDecimal entry = position.getAverageEntryPrice();
        if (entry == null || entry.signum() <= 0) {
            return Optional.empty();
        }
        BigDecimal close = bar.getClose();
        BigDecimal movePct = close.subtract(entry).divide(entry, MOVE_SCALE, RoundingMode.HALF_UP);
        BigDecimal favourableMove = movePct.multiply(position.getSide().direction());

        ExitReason reason = null;
        if (favourableMove.compareTo(stopLossPct.negate()) <= 0) {
            reason = ExitReason.STOP_LOSS;
        } else if (trailingStopHit(position, close)) {
            reason = ExitReason.TRAILING_STOP;
        } else if (favourableMove.compareTo(takeProfitPct) >= 0) {
            reason = ExitReason.TAKE_PROFIT;
        }

        if (reason == null) {
            return Optional.empty();
        }
        log.debug("{} on {} {} at {} (move {})", reason, position.getSide(), position.getSymbol(), close, movePct);
        return Optional.of(ExitSignal.builder()
                .symbol(position.getSymbol())
                .reason(reason)
                .exitPrice(close)
                .movePct(movePct)
                .build());
    }

    private boolean trailingStopHit(Position position, BigDecimal close) {
        if (trailingStopPct == null || position.getExtremePrice() == null) {
            return false;
        }
        BigDecimal extreme = position.getExtremePrice();
        if (position.getSide() == PositionSide.LONG) {
            return close.compareTo(extreme.multiply(BigDecimal.ONE.subtract(trailingStopPct))) <= 0;
        }
        return close.compareTo(extreme.multiply(BigDecimal.ONE.add(trailingStopPct))) >= 0;
    }

    private static BigDecimal periodReturn(BigDecimal previousValue, BigDecimal currentValue) {
        if (previousValue == null || previousValue.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        return currentValue.subtract(previousValue).divide(previousValue, RETURN_SCALE, RoundingMode.HALF_UP);
    }

    private static BigDecimal requireFraction(String name, BigDecimal value) {
        if (value == null || value.signum() <= 0 || value.compareTo(BigDecimal.ONE) > 0) {
            throw new BacktestConfigurationException(name + " must be in (0, 1], got " + value);
        }
        return value;
    }
}
