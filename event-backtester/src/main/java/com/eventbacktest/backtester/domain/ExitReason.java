package com.eventbacktest.backtester.domain;

public enum ExitReason {
    STOP_LOSS, TRAILING_STOP, TAKE_PROFIT, SIGNAL
}
