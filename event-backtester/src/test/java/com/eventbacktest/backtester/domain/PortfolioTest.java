package com.eventbacktest.backtester.domain;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for Portfolio operations.
 */
class PortfolioTest {

    private static final Instant DAY_0 = Instant.parse("2024-01-02T00:00:00Z");

    private Portfolio portfolio;

    @BeforeEach
    void setUp() {
        portfolio = new Portfolio(new BigDecimal("100000"));
    }

    @Test
    void testOpenLong_DebitsPriceAndCommission() {
        // Act
        Optional<Trade> trade = portfolio.applyFill(filled(OrderSide.BUY, 100, "150.03", "0.03", "0.50", "147.03", null, 1));

        // Assert
        assertTrue(trade.isEmpty());
        assertTrue(portfolio.hasPosition("AAPL"));
        assertEquals(0, new BigDecimal("84996.50").compareTo(portfolio.getCash()));
        assertEquals(0, new BigDecimal("300").compareTo(portfolio.getCommittedRisk()));
        assertEquals(0, new BigDecimal("99999.50").compareTo(portfolio.getTotalValue()));
    }

    @Test
    void testCloseLong_RealizedPnlNetOfCosts() {
        // Arrange
        portfolio.applyFill(filled(OrderSide.BUY, 100, "150.03", "0.03", "0.50", "147.03", null, 1));

        // Act
        Trade trade = portfolio.applyFill(
                filled(OrderSide.SELL, 100, "155.47", "0.03", "0.50", null, ExitReason.TAKE_PROFIT, 5)).orElseThrow();

        // Assert
        assertEquals(PositionSide.LONG, trade.getSide());
        assertEquals(0, new BigDecimal("543.00").compareTo(trade.getNetPnl()));
        assertEquals(0, new BigDecimal("550.00").compareTo(trade.getGrossPnl()));
        assertEquals(0, new BigDecimal("1.00").compareTo(trade.getCommission()));
        assertEquals(0, new BigDecimal("6.00").compareTo(trade.getSlippage()));
        assertEquals(new BigDecimal("1.8100"), trade.getRMultiple());
        assertEquals(new BigDecimal("1.8333"), trade.getGrossRMultiple());
        assertEquals(ExitReason.TAKE_PROFIT, trade.getExitReason());
        assertEquals(0, new BigDecimal("100543.00").compareTo(portfolio.getCash()));
        assertEquals(0, new BigDecimal("543.00").compareTo(portfolio.getRealizedPnl()));
        assertFalse(portfolio.hasPosition("AAPL"));
        assertEquals(1, portfolio.getClosedTrades().size());
    }

    @Test
    void testExitWithoutReason_DefaultsToSignal() {
        portfolio.applyFill(filled(OrderSide.BUY, 10, "100", "0", "0", null, null, 1));

        Trade trade = portfolio.applyFill(filled(OrderSide.SELL, 10, "99", "0", "0", null, null, 2)).orElseThrow();

        assertEquals(ExitReason.SIGNAL, trade.getExitReason());
        assertEquals(0, BigDecimal.ZERO.compareTo(trade.getRMultiple()));
        assertTrue(trade.isLoser());
    }

    @Test
    void testPartialClose_ProratesEntryCostsAndRisk() {
        // Arrange
        portfolio.applyFill(filled(OrderSide.BUY, 100, "100", "0", "1.00", "95", null, 1));

        // Act
        Trade trade = portfolio.applyFill(filled(OrderSide.SELL, 40, "110", "0", "0.40", null, null, 3)).orElseThrow();

        // Assert
        assertEquals(40, trade.getQuantity());
        assertEquals(0, new BigDecimal("399.20").compareTo(trade.getNetPnl()));
        assertEquals(0, new BigDecimal("200").compareTo(trade.getInitialRisk()));
        Position remaining = portfolio.getPosition("AAPL").orElseThrow();
        assertEquals(60, remaining.getQuantity());
        assertEquals(0, new BigDecimal("0.60").compareTo(remaining.getTotalCommission()));
        assertEquals(0, new BigDecimal("300").compareTo(remaining.getRiskAmount()));
        assertEquals(0, new BigDecimal("94398.60").compareTo(portfolio.getCash()));
    }

    @Test
    void testExtendPosition_AveragesEntryPrice() {
        portfolio.applyFill(filled(OrderSide.BUY, 100, "100", "0", "0", "95", null, 1));
        portfolio.applyFill(filled(OrderSide.BUY, 100, "110", "0", "0", "105", null, 2));

        Position position = portfolio.getPosition("AAPL").orElseThrow();
        assertEquals(200, position.getQuantity());
        assertEquals(0, new BigDecimal("105").compareTo(position.getAverageEntryPrice()));
        assertEquals(0, new BigDecimal("1000").compareTo(position.getRiskAmount()));
        assertEquals(0, new BigDecimal("79000").compareTo(portfolio.getCash()));
    }

    @Test
    void testShortRoundTrip_ProfitsWhenPriceFalls() {
        // Arrange
        portfolio.applyFill(filled(OrderSide.SELL, 50, "200", "0", "0", "204", null, 1));
        assertEquals(0, new BigDecimal("90000").compareTo(portfolio.getCash()));

        // Act
        portfolio.markToMarket(bar("190", 2));

        // Assert
        Position position = portfolio.getPosition("AAPL").orElseThrow();
        assertEquals(PositionSide.SHORT, position.getSide());
        assertEquals(0, new BigDecimal("500").compareTo(position.getUnrealizedPnl()));
        assertEquals(0, new BigDecimal("10500").compareTo(position.getMarketValue()));
        assertEquals(0, new BigDecimal("190").compareTo(position.getExtremePrice()));
        assertEquals(0, new BigDecimal("100500").compareTo(portfolio.getTotalValue()));

        Trade trade = portfolio.applyFill(filled(OrderSide.BUY, 50, "190", "0", "0", null, null, 3)).orElseThrow();
        assertEquals(0, new BigDecimal("500").compareTo(trade.getNetPnl()));
        assertEquals(0, new BigDecimal("100500").compareTo(portfolio.getCash()));
        assertTrue(portfolio.getPositions().isEmpty());
    }

    @Test
    void testPortfolioHeat_IsCommittedRiskOverEquity() {
        portfolio.applyFill(filled(OrderSide.BUY, 100, "150.03", "0", "0", "147.03", null, 1));

        assertEquals(new BigDecimal("0.3000"), portfolio.portfolioHeat(new BigDecimal("100000")));
        assertEquals(BigDecimal.ZERO, portfolio.portfolioHeat(BigDecimal.ZERO));
    }

    @Test
    void testMarkToMarket_LongTracksHighestClose() {
        portfolio.applyFill(filled(OrderSide.BUY, 10, "100", "0", "0", null, null, 1));

        portfolio.markToMarket(bar("108", 2));
        portfolio.markToMarket(bar("104", 3));

        Position position = portfolio.getPosition("AAPL").orElseThrow();
        assertEquals(0, new BigDecimal("108").compareTo(position.getExtremePrice()));
        assertEquals(0, new BigDecimal("40").compareTo(position.getUnrealizedPnl()));
    }

    @Test
    void testCanAfford_EntriesNeedCashExitsDoNot() {
        assertTrue(portfolio.canAfford("AAPL", OrderSide.BUY, new BigDecimal("100"), 999, new BigDecimal("5")));
        assertFalse(portfolio.canAfford("AAPL", OrderSide.BUY, new BigDecimal("100"), 1000, new BigDecimal("5")));

        portfolio.applyFill(filled(OrderSide.BUY, 900, "100", "0", "0", null, null, 1));
        assertTrue(portfolio.canAfford("AAPL", OrderSide.SELL, new BigDecimal("100"), 900, new BigDecimal("5")));
    }

    @Test
    void testExitLargerThanPosition_Throws() {
        portfolio.applyFill(filled(OrderSide.BUY, 10, "100", "0", "0", null, null, 1));

        assertThrows(IllegalStateException.class,
                () -> portfolio.applyFill(filled(OrderSide.SELL, 11, "100", "0", "0", null, null, 2)));
    }

    @Test
    void testPendingOrder_CannotBeApplied() {
        Order pending = Order.builder()
                .symbol("AAPL")
                .orderType(OrderType.MARKET)
                .side(OrderSide.BUY)
                .quantity(10)
                .createdAt(DAY_0)
                .build();

        assertThrows(IllegalStateException.class, () -> portfolio.applyFill(pending));
    }

    @Test
    void testNonPositiveCapital_Rejected() {
        assertThrows(BacktestConfigurationException.class, () -> new Portfolio(BigDecimal.ZERO));
        assertThrows(BacktestConfigurationException.class, () -> new Portfolio(new BigDecimal("-1")));
    }

    private static Order filled(OrderSide side, int quantity, String price, String slippage, String commission,
                                String stop, ExitReason reason, int day) {
        Order order = Order.builder()
                .symbol("AAPL")
                .orderType(OrderType.MARKET)
                .side(side)
                .quantity(quantity)
                .createdAt(DAY_0.plus(day - 1, ChronoUnit.DAYS))
                .initialStop(stop == null ? null : new BigDecimal(stop))
                .exitReason(reason)
                .build();
        order.markFilled(new BigDecimal(price), DAY_0.plus(day, ChronoUnit.DAYS),
                new BigDecimal(slippage), new BigDecimal(commission));
        return order;
    }

    private static Bar bar(String close, int day) {
        BigDecimal price = new BigDecimal(close);
        return Bar.builder()
                .symbol("AAPL")
                .timeframe("1d")
                .timestamp(DAY_0.plus(day, ChronoUnit.DAYS))
                .open(price)
                .high(price)
                .low(price)
                .close(price)
                .volume(1_000_000L)
                .build();
    }
}
