package com.eventbacktest.backtester.domain;

import java.math.BigDecimal;

public enum PositionSide {
    LONG, SHORT;

    /**
     * +1 for LONG, -1 for SHORT.
     */
    public BigDecimal direction() {
        return this == LONG ? BigDecimal.ONE : BigDecimal.ONE.negate();
    }

    public OrderSide entrySide() {
        return this == LONG ? OrderSide.BUY : OrderSide.SELL;
    }

    public OrderSide exitSide() {
        return entrySide().opposite();
    }

    public static PositionSide openedBy(OrderSide side) {
        return side == OrderSide.BUY ? LONG : SHORT;
    }
}
