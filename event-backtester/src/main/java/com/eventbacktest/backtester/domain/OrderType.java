package com.eventbacktest.backtester.domain;

public enum OrderType {
    MARKET, LIMIT
}
