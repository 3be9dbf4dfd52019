package com.eventbacktest.backtester.infrastructure;

import com.eventbacktest.backtester.config.BacktestProperties;
import com.eventbacktest.backtester.domain.Bar;
import com.eventbacktest.backtester.domain.SignalSource;
import com.eventbacktest.backtester.service.BacktestMetricsService;
import com.eventbacktest.backtester.service.SignalSourceFactory;
import com.eventbacktest.backtester.service.SyntheticBarGenerator;
import com.eventbacktest.backtester.walkforward.SymbolSuiteConfig;
import com.eventbacktest.backtester.walkforward.WalkForwardEngine;
import com.eventbacktest.backtester.walkforward.WalkForwardSuite;
import com.eventbacktest.backtester.walkforward.WalkForwardSuiteConfig;
import com.eventbacktest.backtester.walkforward.WalkForwardSuiteResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.function.Supplier;

/**
 * Runs the configured walk-forward suite once on startup over synthetic bars and, if enabled,
 * stores the outcome as the new baseline.
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(prefix = "backtest.suite", name = "run-on-startup", havingValue = "true")
public class WalkForwardSuiteRunner implements ApplicationRunner {

    private final BacktestProperties properties;
    private final WalkForwardSuiteConfig suiteConfig;
    private final WalkForwardEngine walkForwardEngine;
    private final BaselineStore baselineStore;
    private final SignalSourceFactory signalSourceFactory;
    private final SyntheticBarGenerator barGenerator;
    private final BacktestMetricsService metricsService;

    private final ExecutorService suiteExecutorService;

    @Override
    public void run(ApplicationArguments args) {
        runSuite();
    }

    public WalkForwardSuiteResult runSuite() {
        if (suiteConfig.getSymbols().isEmpty()) {
            log.warn("No walk-forward symbols configured, skipping suite");
            return null;
        }

        Map<String, List<Bar>> barsBySymbol = new LinkedHashMap<>();
        for (SymbolSuiteConfig symbol : suiteConfig.getSymbols()) {
            barsBySymbol.put(symbol.getSymbol(),
                    barGenerator.generate(symbol.getSymbol(), symbol.getStartDate(), symbol.getEndDate()));
        }

        BacktestProperties.SignalSourceSettings signal = properties.getSignalSource();
        Supplier<SignalSource> signalSources = signalSourceFactory.supplier(signal.getName(), signal.getParameters());

        WalkForwardSuite suite = new WalkForwardSuite(suiteConfig, walkForwardEngine, baselineStore, suiteExecutorService);
        WalkForwardSuiteResult result = suite.run(barsBySymbol, signalSources);

        result.getSymbolResults().forEach(r -> metricsService.recordWindowsDegraded(r.getDegradationCount()));
        metricsService.recordRegressions(result.getRegressionCount());

        if (properties.getSuite().isSaveBaseline()) {
            suite.saveBaselines(result, properties.getSuite().getBaselineVersion());
        }

        log.info("Walk-forward suite {} {} - {}", result.getSuiteId(),
                result.isOverallPass() ? "PASSED" : "FAILED", metricsService.getMetricsSummary());
        return result;
    }
}
