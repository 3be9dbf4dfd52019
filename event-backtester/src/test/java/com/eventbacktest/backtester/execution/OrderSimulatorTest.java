package com.eventbacktest.backtester.execution;

import com.eventbacktest.backtester.domain.Bar;
import com.eventbacktest.backtester.domain.Order;
import com.eventbacktest.backtester.domain.OrderSide;
import com.eventbacktest.backtester.domain.OrderStatus;
import com.eventbacktest.backtester.domain.OrderType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for OrderSimulator.
 */
class OrderSimulatorTest {

    private static final BigDecimal AVG_VOLUME = new BigDecimal("2000000");
    private static final Instant DAY_1 = Instant.parse("2024-03-04T00:00:00Z");

    private OrderSimulator simulator;

    @BeforeEach
    void setUp() {
        simulator = new OrderSimulator(CostModelConfig.defaults());
    }

    @Test
    void testMarketOrder_NeverFillsOnSubmittingBar() {
        // Arrange
        Bar today = bar(DAY_1, "100.00", "101.00", "99.00", "100.50");
        Order order = simulator.submit("AAPL", OrderType.MARKET, OrderSide.BUY, 100, today);

        // Act
        List<Order> filled = simulator.fillPending(today, AVG_VOLUME);

        // Assert
        assertTrue(filled.isEmpty());
        assertTrue(order.isPending());
        assertEquals(1, simulator.getPendingCount());
    }

    @Test
    void testMarketOrder_FillsAtNextOpenPlusSlippage() {
        // Arrange
        Bar today = bar(DAY_1, "100.00", "101.00", "99.00", "100.50");
        Bar tomorrow = bar(DAY_1.plus(1, ChronoUnit.DAYS), "151.50", "152.00", "150.80", "151.90");
        Order order = simulator.submit("AAPL", OrderType.MARKET, OrderSide.BUY, 100, today);

        // Act
        List<Order> filled = simulator.fillPending(tomorrow, AVG_VOLUME);

        // Assert
        assertEquals(1, filled.size());
        assertEquals(OrderStatus.FILLED, order.getStatus());
        assertEquals(0, new BigDecimal("151.5303").compareTo(order.getFillPrice()));
        assertEquals(0, new BigDecimal("0.0303").compareTo(order.getSlippage()));
        assertEquals(0, new BigDecimal("0.50").compareTo(order.getCommission()));
        assertEquals(tomorrow.getTimestamp(), order.getFilledAt());
        assertTrue(order.getFilledAt().isAfter(order.getCreatedAt()));
        assertEquals(0, simulator.getPendingCount());
    }

    @Test
    void testSellMarketOrder_FillsBelowOpen() {
        Bar today = bar(DAY_1, "100.00", "101.00", "99.00", "100.50");
        Bar tomorrow = bar(DAY_1.plus(1, ChronoUnit.DAYS), "100.00", "101.00", "99.00", "100.50");
        Order order = simulator.submit("AAPL", OrderType.MARKET, OrderSide.SELL, 100, today);

        simulator.fillPending(tomorrow, AVG_VOLUME);

        assertTrue(order.getFillPrice().compareTo(tomorrow.getOpen()) < 0);
    }

    @Test
    void testLimitOrder_FillsAtExactLimitWithoutSlippage() {
        // Arrange
        Bar today = bar(DAY_1, "100.00", "101.00", "99.00", "100.50");
        Bar tomorrow = bar(DAY_1.plus(1, ChronoUnit.DAYS), "100.20", "100.80", "98.40", "99.10");
        Order order = simulator.submit("AAPL", OrderType.LIMIT, OrderSide.BUY, 50, today, new BigDecimal("98.75"));

        // Act
        simulator.fillPending(tomorrow, AVG_VOLUME);

        // Assert
        assertTrue(order.isFilled());
        assertEquals(0, new BigDecimal("98.75").compareTo(order.getFillPrice()));
        assertEquals(0, BigDecimal.ZERO.compareTo(order.getSlippage()));
    }

    @Test
    void testLimitOrder_NotTouched_StaysPending() {
        // Arrange
        Bar today = bar(DAY_1, "100.00", "101.00", "99.00", "100.50");
        Bar tomorrow = bar(DAY_1.plus(1, ChronoUnit.DAYS), "100.20", "100.80", "99.50", "100.10");
        Order order = simulator.submit("AAPL", OrderType.LIMIT, OrderSide.BUY, 50, today, new BigDecimal("98.75"));

        // Act
        List<Order> filled = simulator.fillPending(tomorrow, AVG_VOLUME);

        // Assert
        assertTrue(filled.isEmpty());
        assertTrue(order.isPending());
        assertEquals(1, simulator.getPendingCount());
    }

    @Test
    void testSellLimit_FillsWhenHighReachesLimit() {
        Bar today = bar(DAY_1, "100.00", "101.00", "99.00", "100.50");
        Bar tomorrow = bar(DAY_1.plus(1, ChronoUnit.DAYS), "100.20", "102.00", "99.50", "101.10");
        Order order = simulator.submit("AAPL", OrderType.LIMIT, OrderSide.SELL, 50, today, new BigDecimal("102.00"));

        simulator.fillPending(tomorrow, AVG_VOLUME);

        assertTrue(order.isFilled());
        assertEquals(0, new BigDecimal("102.00").compareTo(order.getFillPrice()));
    }

    @Test
    void testFillGuard_RejectsOrder() {
        // Arrange
        Bar today = bar(DAY_1, "100.00", "101.00", "99.00", "100.50");
        Bar tomorrow = bar(DAY_1.plus(1, ChronoUnit.DAYS), "100.00", "101.00", "99.00", "100.50");
        Order order = simulator.submit("AAPL", OrderType.MARKET, OrderSide.BUY, 100, today);

        // Act
        List<Order> completed = simulator.fillPending(tomorrow, AVG_VOLUME, (o, price, commission) -> "insufficient cash");

        // Assert
        assertEquals(1, completed.size());
        assertEquals(OrderStatus.REJECTED, order.getStatus());
        assertEquals("insufficient cash", order.getRejectionReason());
        assertEquals(0, simulator.getPendingCount());
    }

    @Test
    void testOtherSymbolBar_DoesNotFillOrder() {
        Bar today = bar(DAY_1, "100.00", "101.00", "99.00", "100.50");
        Bar otherSymbol = Bar.builder()
                .symbol("MSFT")
                .timeframe("1d")
                .timestamp(DAY_1.plus(1, ChronoUnit.DAYS))
                .open(new BigDecimal("300.00"))
                .high(new BigDecimal("301.00"))
                .low(new BigDecimal("299.00"))
                .close(new BigDecimal("300.50"))
                .volume(1_000_000L)
                .build();
        simulator.submit("AAPL", OrderType.MARKET, OrderSide.BUY, 100, today);

        assertTrue(simulator.fillPending(otherSymbol, AVG_VOLUME).isEmpty());
        assertTrue(simulator.hasPendingOrder("AAPL"));
        assertFalse(simulator.hasPendingOrder("MSFT"));
    }

    @Test
    void testCancelAll_RejectsEveryPendingOrder() {
        // Arrange
        Bar today = bar(DAY_1, "100.00", "101.00", "99.00", "100.50");
        Order first = simulator.submit("AAPL", OrderType.MARKET, OrderSide.BUY, 100, today);
        Order second = simulator.submit("AAPL", OrderType.LIMIT, OrderSide.BUY, 100, today, new BigDecimal("95.00"));

        // Act
        List<Order> cancelled = simulator.cancelAll();

        // Assert
        assertEquals(2, cancelled.size());
        assertEquals(OrderStatus.REJECTED, first.getStatus());
        assertEquals(OrderStatus.REJECTED, second.getStatus());
        assertEquals(0, simulator.getPendingCount());
    }

    @Test
    void testInvalidOrders_Rejected() {
        Bar today = bar(DAY_1, "100.00", "101.00", "99.00", "100.50");

        assertThrows(IllegalArgumentException.class,
                () -> simulator.submit("AAPL", OrderType.MARKET, OrderSide.BUY, 0, today));
        assertThrows(IllegalArgumentException.class,
                () -> simulator.submit("AAPL", OrderType.LIMIT, OrderSide.BUY, 10, today, null));
    }

    @Test
    void testFilledOrder_CannotTransitionAgain() {
        Bar today = bar(DAY_1, "100.00", "101.00", "99.00", "100.50");
        Bar tomorrow = bar(DAY_1.plus(1, ChronoUnit.DAYS), "100.00", "101.00", "99.00", "100.50");
        Order order = simulator.submit("AAPL", OrderType.MARKET, OrderSide.BUY, 100, today);
        simulator.fillPending(tomorrow, AVG_VOLUME);

        assertThrows(IllegalStateException.class, () -> order.markRejected("late"));
    }

    private static Bar bar(Instant timestamp, String open, String high, String low, String close) {
        return Bar.builder()
                .symbol("AAPL")
                .timeframe("1d")
                .timestamp(timestamp)
                .open(new BigDecimal(open))
                .high(new BigDecimal(high))
                .low(new BigDecimal(low))
                .close(new BigDecimal(close))
                .volume(48_000L)
                .build();
    }
}
