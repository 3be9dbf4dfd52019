package com.eventbacktest.backtester.domain;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A simulated order.
 * Created PENDING by the order simulator and moved exactly once to FILLED or REJECTED.
 * The initial stop and exit reason travel with the order so that the portfolio can
 * fix the position's committed risk at entry and label the resulting trade.
 */
@Getter
@ToString
public class Order {

    private final UUID orderId;
    private final String symbol;
    private final OrderType orderType;
    private final OrderSide side;
    private final int quantity;
    private final BigDecimal limitPrice;
    private final Instant createdAt;
    private final BigDecimal initialStop;
    private final ExitReason exitReason;

    private OrderStatus status;
    private BigDecimal fillPrice;
    private Instant filledAt;
    private BigDecimal slippage;
    private BigDecimal commission;
    private String rejectionReason;

    @Builder
    private Order(UUID orderId, String symbol, OrderType orderType, OrderSide side, int quantity,
                  BigDecimal limitPrice, Instant createdAt, BigDecimal initialStop, ExitReason exitReason) {
        this.orderId = orderId != null ? orderId : UUID.randomUUID();
        this.symbol = symbol;
        this.orderType = orderType;
        this.side = side;
        this.quantity = quantity;
        this.limitPrice = limitPrice;
        this.createdAt = createdAt;
        this.initialStop = initialStop;
        this.exitReason = exitReason;
        this.status = OrderStatus.PENDING;
        this.slippage = BigDecimal.ZERO;
        this.commission = BigDecimal.ZERO;
    }

    public boolean isPending() {
        return status == OrderStatus.PENDING;
    }

    public boolean isFilled() {
        return status == OrderStatus.FILLED;
    }

    /**
     * Transition PENDING -> FILLED.
     *
     * @param price      execution price including slippage
     * @param timestamp  timestamp of the bar that produced the fill
     * @param slippage   per-unit slippage amount
     * @param commission total commission for the order
     */
    public void markFilled(BigDecimal price, Instant timestamp, BigDecimal slippage, BigDecimal commission) {
        requirePending("fill");
        if (!timestamp.isAfter(createdAt)) {
            throw new IllegalStateException("Order " + orderId + " created at " + createdAt
                    + " cannot fill on bar " + timestamp);
        }
        this.fillPrice = price;
        this.filledAt = timestamp;
        this.slippage = slippage;
        this.commission = commission;
        this.status = OrderStatus.FILLED;
    }

    /**
     * Transition PENDING -> REJECTED.
     */
    public void markRejected(String reason) {
        requirePending("reject");
        this.rejectionReason = reason;
        this.status = OrderStatus.REJECTED;
    }

    private void requirePending(String action) {
        if (status != OrderStatus.PENDING) {
            throw new IllegalStateException("Cannot " + action + " order " + orderId + " in status " + status);
        }
    }
}
