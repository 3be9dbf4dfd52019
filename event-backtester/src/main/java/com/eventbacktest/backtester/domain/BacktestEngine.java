package com.eventbacktest.backtester.domain;

import com.eventbacktest.backtester.execution.BarProcessingResult;
import com.eventbacktest.backtester.execution.BarProcessor;
import com.eventbacktest.backtester.execution.BarValidator;
import com.eventbacktest.backtester.execution.ExitSignal;
import com.eventbacktest.backtester.execution.FillGuard;
import com.eventbacktest.backtester.execution.OrderSimulator;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Core backtesting engine: replays bars in order and turns signals into orders, fills,
 * positions and metrics.
 * <p>
 * Per accepted bar: pending orders from earlier bars fill at this bar's open; positions are
 * marked at the close and exits raise closing orders; the signal source is asked for entries;
 * the equity point is recorded; progress is reported; cancellation and the time budget are
 * checked. Orders raised on a bar never fill on that bar.
 * <p>
 * One engine instance runs one backtest. It is single-threaded except for {@link #cancel()}.
 */
@Slf4j
public class BacktestEngine {

    private static final String INSUFFICIENT_CASH = "insufficient cash";

    private final BacktestConfig config;
    private final SignalSource signalSource;
    private final PositionSizer positionSizer;
    private final ProgressNotifier progressNotifier;
    private final Clock clock;
    private final BarValidator barValidator = new BarValidator();

    private volatile boolean cancelRequested;

    @Getter
    private volatile BacktestProgress lastProgress;

    public BacktestEngine(BacktestConfig config, SignalSource signalSource, PositionSizer positionSizer) {
        this(config, signalSource, positionSizer, ProgressNotifier.NO_OP, Clock.systemUTC());
    }

    /**
     * @throws BacktestConfigurationException if the configuration is invalid
     */
    public BacktestEngine(BacktestConfig config, SignalSource signalSource, PositionSizer positionSizer,
                          ProgressNotifier progressNotifier, Clock clock) {
        config.validate();
        this.config = config;
        this.signalSource = signalSource;
        this.positionSizer = positionSizer;
        this.progressNotifier = progressNotifier == null ? ProgressNotifier.NO_OP : progressNotifier;
        this.clock = clock;
    }

    /**
     * Request a stop. The loop finishes the current bar and returns a partial result.
     */
    public void cancel() {
        cancelRequested = true;
    }

    public boolean isCancelRequested() {
        return cancelRequested;
    }

    public BacktestResult run(List<Bar> bars) {
        return run(UUID.randomUUID(), bars);
    }

    /**
     * Run a backtest over the given bars, oldest first.
     */
    public BacktestResult run(UUID runId, List<Bar> bars) {
        log.info("Starting backtest - Symbol: {}, Signal source: {}, Bars: {}",
                config.getSymbol(), signalSource.getName(), bars.size());

        Instant startedAt = clock.instant();
        Instant lastNotifiedAt = startedAt;
        int notifyEvery = config.getProgressEveryBars() > 0
                ? config.getProgressEveryBars()
                : Math.max(1, bars.size() / 20);

        Portfolio portfolio = new Portfolio(config.getInitialCapital());
        OrderSimulator simulator = new OrderSimulator(config.getCostModel());
        BarProcessor barProcessor = new BarProcessor(config.getStopLossPct(), config.getTakeProfitPct(),
                config.getTrailingStopPct());
        FillGuard cashGuard = (order, fillPrice, commission) ->
                portfolio.canAfford(order, fillPrice, commission) ? null : INSUFFICIENT_CASH;

        List<Bar> history = new ArrayList<>();
        List<Bar> historyView = Collections.unmodifiableList(history);
        Deque<BigDecimal> recentDollarVolumes = new ArrayDeque<>();
        List<EquityCurvePoint> equityCurve = new ArrayList<>();

        Instant previousTimestamp = null;
        BigDecimal previousValue = null;
        int barsProcessed = 0;
        int rejectedBars = 0;
        boolean cancelled = false;
        boolean timedOut = false;

        for (int i = 0; i < bars.size(); i++) {
            Bar bar = bars.get(i);
            barsProcessed++;

            Optional<String> rejection = barValidator.validate(bar, previousTimestamp);
            if (rejection.isEmpty() && !config.getSymbol().equals(bar.getSymbol())) {
                rejection = Optional.of("symbol " + bar.getSymbol() + " does not match " + config.getSymbol());
            }
            if (rejection.isPresent()) {
                rejectedBars++;
                log.warn("Skipping bar {} at {}: {}", i, bar == null ? null : bar.getTimestamp(), rejection.get());
            } else {
                previousTimestamp = bar.getTimestamp();

                BigDecimal avgDollarVolume = averageDollarVolume(recentDollarVolumes, bar);
                for (Order order : simulator.fillPending(bar, avgDollarVolume, cashGuard)) {
                    if (order.isFilled()) {
                        portfolio.applyFill(order);
                    }
                }
                recentDollarVolumes.addLast(bar.getDollarVolume());
                if (recentDollarVolumes.size() > config.getVolumeLookback()) {
                    recentDollarVolumes.removeFirst();
                }
                history.add(bar);

                BarProcessingResult processed = barProcessor.process(bar, i, portfolio, previousValue);
                for (ExitSignal exit : processed.getExitSignals()) {
                    submitExit(exit, bar, portfolio, simulator);
                }

                List<TradeSignal> signals = signalSource.generate(new SignalContext(i, historyView));
                for (TradeSignal signal : signals) {
                    submitEntry(signal, bar, portfolio, simulator, processed.getPortfolioValue());
                }

                equityCurve.add(processed.getEquityPoint());
                previousValue = processed.getPortfolioValue();
            }

            Instant now = clock.instant();
            if (barsProcessed % notifyEvery == 0
                    || Duration.between(lastNotifiedAt, now).compareTo(config.getProgressInterval()) >= 0) {
                notifyProgress(BacktestProgress.of(barsProcessed, bars.size()));
                lastNotifiedAt = now;
            }

            if (cancelRequested) {
                cancelled = true;
                log.info("Backtest cancelled after {} of {} bars", barsProcessed, bars.size());
                break;
            }
            if (Duration.between(startedAt, now).compareTo(config.getMaxRunDuration()) > 0) {
                timedOut = true;
                log.warn("Backtest exceeded max run duration {} after {} of {} bars, returning partial result",
                        config.getMaxRunDuration(), barsProcessed, bars.size());
                break;
            }
        }

        simulator.cancelAll();
        if (lastProgress == null || lastProgress.barsProcessed() != barsProcessed) {
            notifyProgress(BacktestProgress.of(barsProcessed, bars.size()));
        }

        List<Trade> trades = new ArrayList<>(portfolio.getClosedTrades());
        BacktestMetrics metrics = PerformanceMetrics.calculate(equityCurve, trades,
                config.getInitialCapital(), config.getRiskFreeRate());
        long executionTimeMs = Duration.between(startedAt, clock.instant()).toMillis();

        log.info("Backtest completed - Trades: {}, Total Return: {}%, CAGR: {}, Sharpe: {}, " +
                        "Max DD: {}, Win Rate: {}, Profit Factor: {}, Rejected bars: {}",
                metrics.getTotalTrades(), metrics.getTotalReturnPct(), metrics.getCagr(),
                metrics.getSharpeRatio(), metrics.getMaxDrawdown(), metrics.getWinRate(),
                metrics.getProfitFactor(), rejectedBars);

        return BacktestResult.builder()
                .runId(runId)
                .config(config)
                .signalSourceName(signalSource.getName())
                .trades(trades)
                .equityCurve(equityCurve)
                .metrics(metrics)
                .costSummary(PerformanceMetrics.calculateCostSummary(trades))
                .monthlyReturns(PerformanceMetrics.calculateMonthlyReturns(equityCurve, trades,
                        config.getInitialCapital()))
                .openPositions(new ArrayList<>(portfolio.getPositions()))
                .finalValue(previousValue == null ? config.getInitialCapital() : previousValue)
                .cancelled(cancelled)
                .timedOut(timedOut)
                .barsProcessed(barsProcessed)
                .rejectedBars(rejectedBars)
                .executionTimeMs(executionTimeMs)
                .build();
    }

    private void submitExit(ExitSignal exit, Bar bar, Portfolio portfolio, OrderSimulator simulator) {
        if (simulator.hasPendingOrder(exit.getSymbol())) {
            return;
        }
        portfolio.getPosition(exit.getSymbol()).ifPresent(position ->
                simulator.submit(position.getSymbol(), OrderType.MARKET, position.getSide().exitSide(),
                        position.getQuantity(), bar, null, null, exit.getReason()));
    }

    private void submitEntry(TradeSignal signal, Bar bar, Portfolio portfolio, OrderSimulator simulator,
                             BigDecimal equity) {
        String symbol = signal.getSymbol() == null ? bar.getSymbol() : signal.getSymbol();
        if (!symbol.equals(bar.getSymbol()) || signal.getSide() == null) {
            log.debug("Ignoring signal {} on {}", signal, bar.getSymbol());
            return;
        }
        if (portfolio.hasPosition(symbol) || simulator.hasPendingOrder(symbol)) {
            return;
        }

        BigDecimal close = bar.getClose();
        BigDecimal stop = signal.getInitialStop() != null ? signal.getInitialStop() : defaultStop(signal.getSide(), close);
        BigDecimal stopDistance = close.subtract(stop).abs();
        if (stopDistance.signum() == 0) {
            log.debug("Ignoring {} signal with zero stop distance at {}", signal.getSide(), bar.getTimestamp());
            return;
        }

        int quantity = positionSizer.size(equity, config.getRiskPerTradePct(), stopDistance);
        if (signal.getSizeHint() != null && signal.getSizeHint() > 0) {
            quantity = Math.min(quantity, signal.getSizeHint());
        }

        int maxByPosition = PositionSizer.floorQuantity(equity.multiply(config.getMaxPositionPct()), close);
        BigDecimal costPerShare = close.add(config.getCostModel().getCommissionPerShare());
        int maxByCash = PositionSizer.floorQuantity(portfolio.getCash().max(BigDecimal.ZERO), costPerShare);
        BigDecimal heatBudget = equity.multiply(config.getMaxPortfolioHeatPct())
                .divide(BigDecimal.valueOf(100), 10, RoundingMode.HALF_UP)
                .subtract(portfolio.getCommittedRisk());
        int maxByHeat = heatBudget.signum() <= 0 ? 0 : PositionSizer.floorQuantity(heatBudget, stopDistance);

        quantity = Math.min(quantity, Math.min(maxByPosition, Math.min(maxByCash, maxByHeat)));
        if (quantity <= 0) {
            log.debug("Sized {} signal to zero at {} (position cap {}, cash cap {}, heat cap {})",
                    signal.getSide(), bar.getTimestamp(), maxByPosition, maxByCash, maxByHeat);
            return;
        }

        simulator.submit(symbol, OrderType.MARKET, signal.getSide().entrySide(), quantity, bar, null, stop, null);
    }

    private BigDecimal defaultStop(PositionSide side, BigDecimal close) {
        BigDecimal offset = side == PositionSide.LONG
                ? BigDecimal.ONE.subtract(config.getStopLossPct())
                : BigDecimal.ONE.add(config.getStopLossPct());
        return close.multiply(offset);
    }

    private static BigDecimal averageDollarVolume(Deque<BigDecimal> recent, Bar bar) {
        if (recent.isEmpty()) {
            return bar.getDollarVolume();
        }
        BigDecimal sum = recent.stream().reduce(BigDecimal.ZERO, BigDecimal::add);
        return sum.divide(BigDecimal.valueOf(recent.size()), 4, RoundingMode.HALF_UP);
    }

    private void notifyProgress(BacktestProgress progress) {
        lastProgress = progress;
        try {
            progressNotifier.onProgress(progress);
        } catch (RuntimeException e) {
            log.warn("Progress notifier failed at {}/{} bars: {}", progress.barsProcessed(),
                    progress.totalBars(), e.getMessage(), e);
        }
    }
}
