package com.eventbacktest.backtester.config;

import com.eventbacktest.backtester.domain.BacktestConfig;
import com.eventbacktest.backtester.domain.FixedFractionalPositionSizer;
import com.eventbacktest.backtester.domain.PositionSizer;
import com.eventbacktest.backtester.domain.ProgressNotifier;
import com.eventbacktest.backtester.execution.CostModelConfig;
import com.eventbacktest.backtester.infrastructure.AsyncProgressNotifier;
import com.eventbacktest.backtester.infrastructure.BaselineStore;
import com.eventbacktest.backtester.infrastructure.JsonFileBaselineStore;
import com.eventbacktest.backtester.infrastructure.LoggingProgressNotifier;
import com.eventbacktest.backtester.walkforward.SymbolSuiteConfig;
import com.eventbacktest.backtester.walkforward.WalkForwardEngine;
import com.eventbacktest.backtester.walkforward.WalkForwardSuiteConfig;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;

import java.nio.file.Path;

/**
 * Builds the immutable engine defaults from {@link BacktestProperties}.
 * Services receive these values instead of reading configuration themselves.
 */
@Configuration
@EnableConfigurationProperties(BacktestProperties.class)
@Slf4j
public class BacktestEngineConfig {

    @Bean
    public CostModelConfig costModelConfig(BacktestProperties properties) {
        BacktestProperties.Slippage slippage = properties.getSlippage();
        CostModelConfig costModel = CostModelConfig.builder()
                .liquidRate(slippage.getLiquidRate())
                .illiquidRate(slippage.getIlliquidRate())
                .liquidityThreshold(slippage.getLiquidityThreshold())
                .impactThreshold(slippage.getImpactThreshold())
                .impactStep(slippage.getImpactStep())
                .impactRate(slippage.getImpactRate())
                .zeroVolumePenaltyRate(slippage.getZeroVolumePenaltyRate())
                .commissionPerShare(properties.getCommissionPerShare())
                .build();
        costModel.validate();
        log.info("Cost model: {}", costModel);
        return costModel;
    }

    /**
     * Run parameters without a symbol; callers set the symbol per run.
     */
    @Bean
    public BacktestConfig backtestTemplate(BacktestProperties properties, CostModelConfig costModelConfig) {
        return BacktestConfig.builder()
                .initialCapital(properties.getInitialCapital())
                .costModel(costModelConfig)
                .stopLossPct(properties.getStopLossPct())
                .takeProfitPct(properties.getTakeProfitPct())
                .trailingStopPct(properties.getTrailingStopPct())
                .riskPerTradePct(properties.getRiskPerTradePct())
                .maxPositionPct(properties.getMaxPositionPct())
                .maxPortfolioHeatPct(properties.getMaxPortfolioHeatPct())
                .volumeLookback(properties.getVolumeLookback())
                .riskFreeRate(properties.getRiskFreeRate())
                .maxRunDuration(properties.getMaxRunDuration())
                .progressEveryBars(properties.getProgress().getEveryBars())
                .progressInterval(properties.getProgress().getInterval())
                .build();
    }

    @Bean
    public PositionSizer positionSizer() {
        return new FixedFractionalPositionSizer();
    }

    @Bean
    public ProgressNotifier progressNotifier(@Qualifier("progressTaskExecutor") TaskExecutor progressTaskExecutor) {
        return new AsyncProgressNotifier(progressTaskExecutor, new LoggingProgressNotifier());
    }

    @Bean
    public WalkForwardEngine walkForwardEngine(PositionSizer positionSizer) {
        return new WalkForwardEngine(positionSizer);
    }

    @Bean
    public BaselineStore baselineStore(BacktestProperties properties, ObjectMapper objectMapper) {
        return new JsonFileBaselineStore(Path.of(properties.getWalkForward().getBaselineDir()), objectMapper);
    }

    @Bean
    public WalkForwardSuiteConfig walkForwardSuiteConfig(BacktestProperties properties, BacktestConfig backtestTemplate) {
        BacktestProperties.WalkForward walkForward = properties.getWalkForward();
        WalkForwardSuiteConfig.WalkForwardSuiteConfigBuilder builder = WalkForwardSuiteConfig.builder()
                .trainMonths(walkForward.getTrainMonths())
                .validateMonths(walkForward.getValidateMonths())
                .primaryMetric(walkForward.getPrimaryMetric())
                .degradationThreshold(walkForward.getDegradationThreshold())
                .regressionTolerancePct(walkForward.getRegressionTolerancePct())
                .backtestTemplate(backtestTemplate);

        for (BacktestProperties.SymbolEntry entry : walkForward.getSymbols()) {
            builder.symbol(SymbolSuiteConfig.builder()
                    .symbol(entry.getSymbol())
                    .assetClass(entry.getAssetClass())
                    .startDate(entry.getStartDate())
                    .endDate(entry.getEndDate())
                    .initialCapital(properties.getInitialCapital())
                    .build());
        }
        return builder.build();
    }
}
