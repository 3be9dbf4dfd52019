package com.eventbacktest.backtester.execution;

import com.eventbacktest.backtester.domain.Bar;
import com.eventbacktest.backtester.domain.ExitReason;
import com.eventbacktest.backtester.domain.Order;
import com.eventbacktest.backtester.domain.OrderSide;
import com.eventbacktest.backtester.domain.OrderType;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Queues orders and fills them against later bars.
 * <p>
 * An order submitted while observing bar N is stamped with bar N's timestamp and can only
 * fill on a bar whose timestamp is strictly later. MARKET orders fill at the bar open plus
 * or minus slippage. LIMIT orders fill at exactly their limit price, with zero slippage, once
 * the bar's range touches it; otherwise they stay pending until cancelled.
 */
@Slf4j
public class OrderSimulator {

    private final SlippageCalculator slippageCalculator;
    private final CommissionCalculator commissionCalculator;
    private final List<Order> pendingOrders = new ArrayList<>();

    public OrderSimulator(CostModelConfig costModel) {
        this(new SlippageCalculator(costModel), new CommissionCalculator(costModel.getCommissionPerShare()));
    }

    public OrderSimulator(SlippageCalculator slippageCalculator, CommissionCalculator commissionCalculator) {
        this.slippageCalculator = slippageCalculator;
        this.commissionCalculator = commissionCalculator;
    }

    public Order submit(String symbol, OrderType type, OrderSide side, int quantity, Bar currentBar) {
        return submit(symbol, type, side, quantity, currentBar, null);
    }

    public Order submit(String symbol, OrderType type, OrderSide side, int quantity, Bar currentBar,
                        BigDecimal limitPrice) {
        return submit(symbol, type, side, quantity, currentBar, limitPrice, null, null);
    }

    /**
     * Queue a new PENDING order stamped with the current bar's timestamp.
     *
     * @param initialStop protective stop carried to the position on entry, may be null
     * @param exitReason  why a closing order was raised, null for entries
     */
    public Order submit(String symbol, OrderType type, OrderSide side, int quantity, Bar currentBar,
                        BigDecimal limitPrice, BigDecimal initialStop, ExitReason exitReason) {
        if (quantity <= 0) {
            throw new IllegalArgumentException("Order quantity must be positive, got " + quantity);
        }
        if (type == OrderType.LIMIT && (limitPrice == null || limitPrice.signum() <= 0)) {
            throw new IllegalArgumentException("LIMIT order requires a positive limit price");
        }

        Order order = Order.builder()
                .symbol(symbol)
                .orderType(type)
                .side(side)
                .quantity(quantity)
                .limitPrice(type == OrderType.LIMIT ? limitPrice : null)
                .createdAt(currentBar.getTimestamp())
                .initialStop(initialStop)
                .exitReason(exitReason)
                .build();

        pendingOrders.add(order);
        log.debug("Submitted {} {} {} x{} at bar {}", type, side, symbol, quantity, currentBar.getTimestamp());
        return order;
    }

    public List<Order> fillPending(Bar nextBar, BigDecimal avgVolume) {
        return fillPending(nextBar, avgVolume, commissionCalculator.getDefaultRate(), FillGuard.ACCEPT_ALL);
    }

    public List<Order> fillPending(Bar nextBar, BigDecimal avgVolume, BigDecimal commissionRate) {
        return fillPending(nextBar, avgVolume, commissionRate, FillGuard.ACCEPT_ALL);
    }

    public List<Order> fillPending(Bar nextBar, BigDecimal avgVolume, FillGuard guard) {
        return fillPending(nextBar, avgVolume, commissionCalculator.getDefaultRate(), guard);
    }

    /**
     * Try to fill every pending order for the bar's symbol.
     *
     * @return orders that left the queue on this bar, FILLED or guard-REJECTED, in submission order
     */
    public List<Order> fillPending(Bar nextBar, BigDecimal avgVolume, BigDecimal commissionRate, FillGuard guard) {
        List<Order> completed = new ArrayList<>();
        Iterator<Order> iterator = pendingOrders.iterator();

        while (iterator.hasNext()) {
            Order order = iterator.next();
            if (!order.getSymbol().equals(nextBar.getSymbol())) {
                continue;
            }
            if (!nextBar.getTimestamp().isAfter(order.getCreatedAt())) {
                continue;
            }

            BigDecimal fillPrice;
            BigDecimal slippage;
            if (order.getOrderType() == OrderType.MARKET) {
                slippage = slippageCalculator.calculateSlippage(nextBar, order.getSide(), order.getQuantity(), avgVolume);
                fillPrice = slippageCalculator.applySlippageToPrice(nextBar.getOpen(), slippage, order.getSide());
            } else if (limitTouched(order, nextBar)) {
                slippage = BigDecimal.ZERO;
                fillPrice = order.getLimitPrice();
            } else {
                continue;
            }

            BigDecimal commission = commissionCalculator.calculateCommission(order.getQuantity(), commissionRate);
            String rejection = guard.check(order, fillPrice, commission);
            if (rejection != null) {
                order.markRejected(rejection);
                log.info("Rejected {} {} x{} at {}: {}", order.getSide(), order.getSymbol(),
                        order.getQuantity(), nextBar.getTimestamp(), rejection);
            } else {
                order.markFilled(fillPrice, nextBar.getTimestamp(), slippage, commission);
                log.debug("Filled {} {} x{} at {} (slippage {}, commission {})", order.getSide(),
                        order.getSymbol(), order.getQuantity(), fillPrice, slippage, commission);
            }
            iterator.remove();
            completed.add(order);
        }

        return completed;
    }

    /**
     * Reject every pending order. Used on shutdown and cancellation.
     */
    public List<Order> cancelAll() {
        List<Order> cancelled = new ArrayList<>(pendingOrders);
        cancelled.forEach(order -> order.markRejected("cancelled"));
        pendingOrders.clear();
        if (!cancelled.isEmpty()) {
            log.info("Cancelled {} pending orders", cancelled.size());
        }
        return cancelled;
    }

    public List<Order> getPendingOrders() {
        return Collections.unmodifiableList(pendingOrders);
    }

    public int getPendingCount() {
        return pendingOrders.size();
    }

    public boolean hasPendingOrder(String symbol) {
        return pendingOrders.stream().anyMatch(order -> order.getSymbol().equals(symbol));
    }

    private static boolean limitTouched(Order order, Bar bar) {
        if (order.getSide() == OrderSide.BUY) {
            return bar.getLow().compareTo(order.getLimitPrice()) <= 0;
        }
        return bar.getHigh().compareTo(order.getLimitPrice()) >= 0;
    }
}
