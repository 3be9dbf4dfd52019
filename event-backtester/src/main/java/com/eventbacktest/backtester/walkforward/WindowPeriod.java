package com.eventbacktest.backtester.walkforward;

import java.time.LocalDate;

/**
 * Inclusive date ranges of one train/validate window.
 */
public record WindowPeriod(LocalDate trainStart, LocalDate trainEnd, LocalDate validateStart, LocalDate validateEnd) {
}
