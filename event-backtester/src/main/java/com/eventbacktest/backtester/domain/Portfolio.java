package com.eventbacktest.backtester.domain;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Cash, open positions (one per symbol) and closed trades.
 * <p>
 * Entries debit {@code price x quantity + commission}; a SHORT entry posts the same
 * amount as collateral. Exits credit the collateral plus the directional price move
 * minus commission. Committed risk is fixed when a position is opened or extended and
 * is not re-marked as price moves.
 */
@Slf4j
public class Portfolio {

    private static final int PRICE_SCALE = 10;
    private static final int RATIO_SCALE = 4;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    @Getter
    private final BigDecimal initialCapital;

    @Getter
    private BigDecimal cash;

    private final Map<String, Position> positions = new LinkedHashMap<>();
    private final List<Trade> closedTrades = new ArrayList<>();

    public Portfolio(BigDecimal initialCapital) {
        if (initialCapital == null || initialCapital.signum() <= 0) {
            throw new BacktestConfigurationException("Initial capital must be positive, got " + initialCapital);
        }
        this.initialCapital = initialCapital;
        this.cash = initialCapital;
    }

    /**
     * Apply a filled order: open, extend, reduce or close the symbol's position.
     *
     * @return the completed trade when the fill reduced or closed a position
     */
    public Optional<Trade> applyFill(Order order) {
        if (!order.isFilled()) {
            throw new IllegalStateException("Only FILLED orders can be applied, got " + order.getStatus());
        }

        Position position = positions.get(order.getSymbol());
        if (position == null) {
            openPosition(order);
            return Optional.empty();
        }
        if (position.getSide().entrySide() == order.getSide()) {
            extendPosition(position, order);
            return Optional.empty();
        }
        return Optional.of(reducePosition(position, order));
    }

    /**
     * Whether the account has cash for this fill. Exits are always affordable.
     */
    public boolean canAfford(Order order, BigDecimal fillPrice, BigDecimal commission) {
        return canAfford(order.getSymbol(), order.getSide(), fillPrice, order.getQuantity(), commission);
    }

    public boolean canAfford(String symbol, OrderSide side, BigDecimal price, int quantity, BigDecimal commission) {
        Position position = positions.get(symbol);
        boolean isEntry = position == null || position.getSide().entrySide() == side;
        if (!isEntry) {
            return true;
        }
        BigDecimal cost = price.multiply(BigDecimal.valueOf(quantity)).add(commission);
        return cash.compareTo(cost) >= 0;
    }

    /**
     * Re-mark the position for the bar's symbol at the bar close. Other symbols are untouched.
     */
    public void markToMarket(Bar bar) {
        Position position = positions.get(bar.getSymbol());
        if (position == null) {
            return;
        }
        BigDecimal close = bar.getClose();
        position.setCurrentPrice(close);
        position.setLastUpdated(bar.getTimestamp());
        position.setUnrealizedPnl(close.subtract(position.getAverageEntryPrice())
                .multiply(BigDecimal.valueOf(position.getQuantity()))
                .multiply(position.getSide().direction()));

        BigDecimal extreme = position.getExtremePrice();
        if (position.getSide() == PositionSide.LONG && close.compareTo(extreme) > 0
                || position.getSide() == PositionSide.SHORT && close.compareTo(extreme) < 0) {
            position.setExtremePrice(close);
        }
    }

    public BigDecimal getPositionsValue() {
        return positions.values().stream()
                .map(Position::getMarketValue)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    /**
     * Cash plus the market value of every open position.
     */
    public BigDecimal getTotalValue() {
        return cash.add(getPositionsValue());
    }

    public BigDecimal getUnrealizedPnl() {
        return positions.values().stream()
                .map(Position::getUnrealizedPnl)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public BigDecimal getRealizedPnl() {
        return closedTrades.stream()
                .map(Trade::getNetPnl)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    /**
     * Committed risk of all open positions as a percentage of equity. 0 when equity is not positive.
     */
    public BigDecimal portfolioHeat(BigDecimal equity) {
        if (equity == null || equity.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        return getCommittedRisk().multiply(HUNDRED).divide(equity, RATIO_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Sum of the risk amounts fixed at entry across open positions.
     */
    public BigDecimal getCommittedRisk() {
        return positions.values().stream()
                .map(Position::getRiskAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public boolean hasPosition(String symbol) {
        return positions.containsKey(symbol);
    }

    public Optional<Position> getPosition(String symbol) {
        return Optional.ofNullable(positions.get(symbol));
    }

    public Collection<Position> getPositions() {
        return Collections.unmodifiableCollection(positions.values());
    }

    public List<Trade> getClosedTrades() {
        return Collections.unmodifiableList(closedTrades);
    }

    private void openPosition(Order order) {
        PositionSide side = PositionSide.openedBy(order.getSide());
        BigDecimal qty = BigDecimal.valueOf(order.getQuantity());
        BigDecimal price = order.getFillPrice();

        Position position = Position.builder()
                .symbol(order.getSymbol())
                .side(side)
                .quantity(order.getQuantity())
                .averageEntryPrice(price)
                .currentPrice(price)
                .extremePrice(price)
                .entryTimestamp(order.getFilledAt())
                .lastUpdated(order.getFilledAt())
                .totalCommission(order.getCommission())
                .totalSlippage(order.getSlippage().multiply(qty))
                .initialStop(order.getInitialStop())
                .riskAmount(riskOf(price, order.getInitialStop(), qty))
                .build();

        cash = cash.subtract(price.multiply(qty)).subtract(order.getCommission());
        positions.put(order.getSymbol(), position);
        log.debug("Opened {} {} x{} at {}", side, order.getSymbol(), order.getQuantity(), price);
    }

    private void extendPosition(Position position, Order order) {
        BigDecimal addedQty = BigDecimal.valueOf(order.getQuantity());
        BigDecimal price = order.getFillPrice();
        int newQuantity = position.getQuantity() + order.getQuantity();

        BigDecimal totalCost = position.getAverageEntryPrice()
                .multiply(BigDecimal.valueOf(position.getQuantity()))
                .add(price.multiply(addedQty));
        position.setAverageEntryPrice(totalCost.divide(BigDecimal.valueOf(newQuantity), PRICE_SCALE, RoundingMode.HALF_UP));
        position.setQuantity(newQuantity);
        position.setTotalCommission(position.getTotalCommission().add(order.getCommission()));
        position.setTotalSlippage(position.getTotalSlippage().add(order.getSlippage().multiply(addedQty)));

        BigDecimal stop = order.getInitialStop() != null ? order.getInitialStop() : position.getInitialStop();
        position.setRiskAmount(position.getRiskAmount().add(riskOf(price, stop, addedQty)));
        position.setLastUpdated(order.getFilledAt());

        cash = cash.subtract(price.multiply(addedQty)).subtract(order.getCommission());
        log.debug("Extended {} {} by {} at {}, now x{}", position.getSide(), position.getSymbol(),
                order.getQuantity(), price, newQuantity);
    }

    private Trade reducePosition(Position position, Order order) {
        int closingQuantity = order.getQuantity();
        int openQuantity = position.getQuantity();
        if (closingQuantity > openQuantity) {
            throw new IllegalStateException("Exit quantity " + closingQuantity + " exceeds open quantity "
                    + openQuantity + " for " + position.getSymbol());
        }

        BigDecimal qty = BigDecimal.valueOf(closingQuantity);
        BigDecimal entryPrice = position.getAverageEntryPrice();
        BigDecimal exitPrice = order.getFillPrice();

        BigDecimal entryCommission = portion(position.getTotalCommission(), closingQuantity, openQuantity);
        BigDecimal entrySlippage = portion(position.getTotalSlippage(), closingQuantity, openQuantity);
        BigDecimal initialRisk = portion(position.getRiskAmount(), closingQuantity, openQuantity);

        BigDecimal priceMove = exitPrice.subtract(entryPrice).multiply(qty).multiply(position.getSide().direction());
        BigDecimal commission = entryCommission.add(order.getCommission());
        BigDecimal slippage = entrySlippage.add(order.getSlippage().multiply(qty));
        BigDecimal netPnl = priceMove.subtract(commission);
        BigDecimal grossPnl = netPnl.add(commission).add(slippage);

        Trade trade = Trade.builder()
                .tradeId(UUID.randomUUID())
                .symbol(position.getSymbol())
                .side(position.getSide())
                .quantity(closingQuantity)
                .entryPrice(entryPrice)
                .entryTimestamp(position.getEntryTimestamp())
                .exitPrice(exitPrice)
                .exitTimestamp(order.getFilledAt())
                .grossPnl(grossPnl)
                .netPnl(netPnl)
                .commission(commission)
                .slippage(slippage)
                .initialRisk(initialRisk)
                .rMultiple(rMultiple(netPnl, initialRisk))
                .grossRMultiple(rMultiple(grossPnl, initialRisk))
                .exitReason(order.getExitReason() != null ? order.getExitReason() : ExitReason.SIGNAL)
                .build();

        cash = cash.add(entryPrice.multiply(qty)).add(priceMove).subtract(order.getCommission());

        if (closingQuantity == openQuantity) {
            positions.remove(position.getSymbol());
        } else {
            position.setQuantity(openQuantity - closingQuantity);
            position.setTotalCommission(position.getTotalCommission().subtract(entryCommission));
            position.setTotalSlippage(position.getTotalSlippage().subtract(entrySlippage));
            position.setRiskAmount(position.getRiskAmount().subtract(initialRisk));
            position.setUnrealizedPnl(position.getCurrentPrice().subtract(entryPrice)
                    .multiply(BigDecimal.valueOf(position.getQuantity()))
                    .multiply(position.getSide().direction()));
            position.setLastUpdated(order.getFilledAt());
        }

        closedTrades.add(trade);
        log.debug("Closed {} {} x{} at {}: net {} ({}R)", trade.getSide(), trade.getSymbol(),
                closingQuantity, exitPrice, netPnl, trade.getRMultiple());
        return trade;
    }

    private static BigDecimal riskOf(BigDecimal entryPrice, BigDecimal stop, BigDecimal quantity) {
        if (stop == null) {
            return BigDecimal.ZERO;
        }
        return entryPrice.subtract(stop).abs().multiply(quantity);
    }

    private static BigDecimal portion(BigDecimal total, int part, int whole) {
        if (part == whole) {
            return total;
        }
        return total.multiply(BigDecimal.valueOf(part)).divide(BigDecimal.valueOf(whole), PRICE_SCALE, RoundingMode.HALF_UP);
    }

    private static BigDecimal rMultiple(BigDecimal pnl, BigDecimal initialRisk) {
        if (initialRisk.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        return pnl.divide(initialRisk, RATIO_SCALE, RoundingMode.HALF_UP);
    }
}
