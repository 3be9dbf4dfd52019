package com.eventbacktest.backtester.config;

import com.eventbacktest.backtester.walkforward.PrimaryMetric;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Engine defaults bound from {@code backtest.*}. Turned into immutable config values once at startup.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "backtest")
public class BacktestProperties {

    @NotNull
    @DecimalMin(value = "0", inclusive = false)
    private BigDecimal initialCapital = new BigDecimal("100000");

    @NotNull
    @DecimalMin(value = "0", inclusive = false)
    @DecimalMax("1")
    private BigDecimal riskPerTradePct = new BigDecimal("0.02");

    @NotNull
    @DecimalMin(value = "0", inclusive = false)
    @DecimalMax("1")
    private BigDecimal maxPositionPct = new BigDecimal("0.25");

    @NotNull
    @DecimalMin(value = "0", inclusive = false)
    @DecimalMax("100")
    private BigDecimal maxPortfolioHeatPct = new BigDecimal("10");

    @NotNull
    @DecimalMin("0")
    private BigDecimal commissionPerShare = new BigDecimal("0.005");

    @Valid
    private Slippage slippage = new Slippage();

    @NotNull
    @DecimalMin(value = "0", inclusive = false)
    @DecimalMax("1")
    private BigDecimal stopLossPct = new BigDecimal("0.02");

    @NotNull
    @DecimalMin(value = "0", inclusive = false)
    @DecimalMax("1")
    private BigDecimal takeProfitPct = new BigDecimal("0.06");

    @DecimalMin(value = "0", inclusive = false)
    @DecimalMax("1")
    private BigDecimal trailingStopPct;

    @Min(1)
    private int volumeLookback = 20;

    @NotNull
    private BigDecimal riskFreeRate = new BigDecimal("0.02");

    @NotNull
    private Duration maxRunDuration = Duration.ofMinutes(5);

    @Valid
    private Progress progress = new Progress();

    @Valid
    private SignalSourceSettings signalSource = new SignalSourceSettings();

    @Valid
    private WalkForward walkForward = new WalkForward();

    @Valid
    private Suite suite = new Suite();

    @Data
    public static class Slippage {

        @NotNull
        @DecimalMin("0")
        private BigDecimal liquidRate = new BigDecimal("0.0002");

        @NotNull
        @DecimalMin("0")
        private BigDecimal illiquidRate = new BigDecimal("0.0005");

        /** Trailing average dollar volume below which the illiquid rate applies. */
        @NotNull
        @DecimalMin(value = "0", inclusive = false)
        private BigDecimal liquidityThreshold = new BigDecimal("1000000");

        @NotNull
        @DecimalMin(value = "0", inclusive = false)
        private BigDecimal impactThreshold = new BigDecimal("0.10");

        @NotNull
        @DecimalMin(value = "0", inclusive = false)
        private BigDecimal impactStep = new BigDecimal("0.10");

        @NotNull
        @DecimalMin("0")
        private BigDecimal impactRate = new BigDecimal("0.0001");

        @NotNull
        @DecimalMin("0")
        private BigDecimal zeroVolumePenaltyRate = new BigDecimal("0.0005");
    }

    @Data
    public static class Progress {

        /** 0 means every 5% of the run. */
        @Min(0)
        private int everyBars = 0;

        @NotNull
        private Duration interval = Duration.ofSeconds(10);
    }

    @Data
    public static class SignalSourceSettings {

        @NotBlank
        private String name = "ma_crossover";

        private String parameters = "{\"shortPeriod\":10,\"longPeriod\":50}";
    }

    @Data
    public static class WalkForward {

        @Min(1)
        private int trainMonths = 6;

        @Min(1)
        private int validateMonths = 3;

        @NotNull
        private PrimaryMetric primaryMetric = PrimaryMetric.WIN_RATE;

        @NotNull
        @DecimalMin("0")
        private BigDecimal degradationThreshold = new BigDecimal("0.80");

        @NotNull
        @DecimalMin("0")
        private BigDecimal regressionTolerancePct = new BigDecimal("10.0");

        @NotBlank
        private String baselineDir = "baselines/walk_forward";

        @Min(1)
        private int suiteThreads = 4;

        @Valid
        private List<SymbolEntry> symbols = new ArrayList<>();
    }

    @Data
    public static class SymbolEntry {

        @NotBlank
        private String symbol;

        private String assetClass = "us_stock";

        @NotNull
        @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
        private LocalDate startDate;

        @NotNull
        @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
        private LocalDate endDate;
    }

    @Data
    public static class Suite {

        private boolean runOnStartup = false;

        private boolean saveBaseline = false;

        @NotBlank
        private String baselineVersion = "v1";
    }
}
