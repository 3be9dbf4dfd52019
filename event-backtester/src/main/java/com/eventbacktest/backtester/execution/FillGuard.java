package com.eventbacktest.backtester.execution;

import com.eventbacktest.backtester.domain.Order;

import java.math.BigDecimal;

/**
 * Last check before an order is marked FILLED, given the priced fill.
 * Returning a non-null reason rejects the order instead.
 */
@FunctionalInterface
public interface FillGuard {

    FillGuard ACCEPT_ALL = (order, fillPrice, commission) -> null;

    /**
     * @return null to accept, otherwise the rejection reason
     */
    String check(Order order, BigDecimal fillPrice, BigDecimal commission);
}
