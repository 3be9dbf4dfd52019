package com.eventbacktest.backtester.domain;

/**
 * Order lifecycle. PENDING is the only non-terminal state.
 */
public enum OrderStatus {
    PENDING, FILLED, REJECTED
}
