package com.eventbacktest.backtester.service;

import com.eventbacktest.backtester.domain.BacktestConfig;
import com.eventbacktest.backtester.domain.BacktestEngine;
import com.eventbacktest.backtester.domain.BacktestResult;
import com.eventbacktest.backtester.domain.Bar;
import com.eventbacktest.backtester.domain.PositionSizer;
import com.eventbacktest.backtester.domain.ProgressNotifier;
import com.eventbacktest.backtester.domain.SignalSource;
import com.eventbacktest.backtester.walkforward.WalkForwardConfig;
import com.eventbacktest.backtester.walkforward.WalkForwardEngine;
import com.eventbacktest.backtester.walkforward.WalkForwardResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Runs backtests with logging context, cancellation tracking and operational metrics.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BacktestServiceImpl implements BacktestService {

    private final BacktestConfig backtestTemplate;
    private final PositionSizer positionSizer;
    private final ProgressNotifier progressNotifier;
    private final SignalSourceFactory signalSourceFactory;
    private final WalkForwardEngine walkForwardEngine;
    private final BacktestMetricsService metricsService;

    private final Map<UUID, BacktestEngine> activeRuns = new ConcurrentHashMap<>();

    @Override
    public BacktestResult runBacktest(UUID runId, BacktestConfig config, List<Bar> bars, SignalSource signalSource) {
        MDC.put("runId", runId.toString());
        MDC.put("symbol", String.valueOf(config.getSymbol()));

        try {
            BacktestEngine engine = new BacktestEngine(config, signalSource, positionSizer, progressNotifier,
                    Clock.systemUTC());
            if (activeRuns.putIfAbsent(runId, engine) != null) {
                throw new IllegalStateException("Backtest " + runId + " is already running");
            }

            log.info("Started");
            try {
                BacktestResult result = engine.run(runId, bars);
                boolean stoppedEarly = result.isCancelled() || result.isTimedOut();
                metricsService.recordRun(result.getExecutionTimeMs(), stoppedEarly,
                        result.getTrades().size(), result.getRejectedBars());

                if (!result.hasTrades()) {
                    log.info("Completed with zero trades in {}ms", result.getExecutionTimeMs());
                } else {
                    log.info("Completed in {}ms with {} trades", result.getExecutionTimeMs(), result.getTrades().size());
                }
                return result;
            } finally {
                activeRuns.remove(runId);
            }
        } finally {
            MDC.remove("runId");
            MDC.remove("symbol");
        }
    }

    @Override
    public BacktestResult runBacktest(String symbol, List<Bar> bars, String signalSourceName, String parametersJson) {
        BacktestConfig config = backtestTemplate.toBuilder().symbol(symbol).build();
        SignalSource signalSource = signalSourceFactory.create(signalSourceName, parametersJson);
        return runBacktest(UUID.randomUUID(), config, bars, signalSource);
    }

    @Override
    public boolean cancel(UUID runId) {
        BacktestEngine engine = activeRuns.get(runId);
        if (engine == null) {
            log.warn("Cancel requested for unknown run {}", runId);
            return false;
        }
        engine.cancel();
        log.info("Cancellation requested for run {}", runId);
        return true;
    }

    @Override
    public Set<UUID> getActiveRuns() {
        return Set.copyOf(activeRuns.keySet());
    }

    @Override
    public WalkForwardResult runWalkForward(WalkForwardConfig config, List<Bar> bars,
                                            Supplier<SignalSource> signalSourceSupplier) {
        MDC.put("symbol", String.valueOf(config.getSymbol()));
        try {
            WalkForwardResult result = walkForwardEngine.run(config, bars, signalSourceSupplier);
            metricsService.recordWindowsDegraded(result.getDegradationWindows().size());
            return result;
        } finally {
            MDC.remove("symbol");
        }
    }
}
