package com.eventbacktest.backtester.execution;

import com.eventbacktest.backtester.domain.Bar;
import com.eventbacktest.backtester.domain.OrderSide;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Liquidity-tiered slippage with stepwise market impact.
 * <p>
 * Base rate: {@code illiquidRate} when the trailing average dollar volume is below the
 * liquidity threshold, {@code liquidRate} otherwise. Market impact: one {@code impactRate}
 * per whole {@code impactStep} by which quantity / bar volume exceeds {@code impactThreshold}
 * (floor, not continuous). A bar with zero volume is charged {@code illiquidRate +
 * zeroVolumePenaltyRate} and no impact is computed.
 * <p>
 * The result is a per-unit price amount, exact to the scale of {@code price x rate}.
 */
public class SlippageCalculator {

    private final CostModelConfig config;

    public SlippageCalculator(CostModelConfig config) {
        config.validate();
        this.config = config;
    }

    public BigDecimal calculateSlippage(Bar bar, OrderSide side, int quantity, BigDecimal avgVolume) {
        return bar.getOpen().multiply(calculateSlippageRate(bar, quantity, avgVolume));
    }

    /**
     * Total slippage as a fraction of price. Side does not change the magnitude.
     */
    public BigDecimal calculateSlippageRate(Bar bar, int quantity, BigDecimal avgVolume) {
        if (bar.getVolume() <= 0) {
            return config.getIlliquidRate().add(config.getZeroVolumePenaltyRate());
        }
        boolean illiquid = avgVolume == null || avgVolume.compareTo(config.getLiquidityThreshold()) < 0;
        BigDecimal baseRate = illiquid ? config.getIlliquidRate() : config.getLiquidRate();
        return baseRate.add(marketImpactRate(bar.getVolume(), quantity));
    }

    /**
     * Number of whole impact steps the order exceeds the threshold by.
     */
    public int marketImpactIncrements(long barVolume, int quantity) {
        if (barVolume <= 0 || quantity <= 0) {
            return 0;
        }
        BigDecimal volume = BigDecimal.valueOf(barVolume);
        BigDecimal excess = BigDecimal.valueOf(quantity).subtract(config.getImpactThreshold().multiply(volume));
        if (excess.signum() <= 0) {
            return 0;
        }
        return excess.divide(config.getImpactStep().multiply(volume), 0, RoundingMode.FLOOR).intValue();
    }

    private BigDecimal marketImpactRate(long barVolume, int quantity) {
        int increments = marketImpactIncrements(barVolume, quantity);
        return config.getImpactRate().multiply(BigDecimal.valueOf(increments));
    }

    /**
     * BUY fills move up, SELL fills move down.
     */
    public BigDecimal applySlippageToPrice(BigDecimal price, BigDecimal slippage, OrderSide side) {
        return side == OrderSide.BUY ? price.add(slippage) : price.subtract(slippage);
    }
}
