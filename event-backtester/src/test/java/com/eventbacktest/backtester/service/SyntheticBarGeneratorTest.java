package com.eventbacktest.backtester.service;

import com.eventbacktest.backtester.domain.Bar;
import com.eventbacktest.backtester.execution.BarValidator;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SyntheticBarGeneratorTest {

    private static final LocalDate START = LocalDate.of(2024, 1, 1);
    private static final LocalDate END = LocalDate.of(2024, 1, 31);

    @Test
    void testGenerate_WeekdaysOnlyAtUtcMidnight() {
        List<Bar> bars = new SyntheticBarGenerator().generate("AAPL", START, END);

        assertEquals(23, bars.size());
        for (Bar bar : bars) {
            LocalDate date = bar.getTimestamp().atZone(ZoneOffset.UTC).toLocalDate();
            assertNotEquals(DayOfWeek.SATURDAY, date.getDayOfWeek());
            assertNotEquals(DayOfWeek.SUNDAY, date.getDayOfWeek());
            assertEquals(date.atStartOfDay(ZoneOffset.UTC).toInstant(), bar.getTimestamp());
            assertEquals("AAPL", bar.getSymbol());
        }
    }

    @Test
    void testGenerate_EveryBarPassesValidation() {
        List<Bar> bars = new SyntheticBarGenerator().generate("EURUSD", LocalDate.of(2020, 1, 1), LocalDate.of(2021, 12, 31));
        BarValidator validator = new BarValidator();

        Instant previous = null;
        for (Bar bar : bars) {
            assertTrue(validator.validate(bar, previous).isEmpty());
            previous = bar.getTimestamp();
        }
    }

    @Test
    void testGenerate_DeterministicForSeedAndSymbol() {
        List<Bar> first = new SyntheticBarGenerator(7L).generate("AAPL", START, END);
        List<Bar> second = new SyntheticBarGenerator(7L).generate("AAPL", START, END);
        List<Bar> other = new SyntheticBarGenerator(7L).generate("MSFT", START, END);

        assertEquals(first, second);
        assertNotEquals(first, other);
    }
}
