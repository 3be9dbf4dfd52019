package com.eventbacktest.backtester.service;

import com.eventbacktest.backtester.domain.Bar;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Deterministic synthetic daily bars for demonstration or testing.
 * Same seed, symbol and range always yield the same series.
 */
@Service
@Slf4j
public class SyntheticBarGenerator {

    public static final long DEFAULT_SEED = 42L;

    private final long seed;

    public SyntheticBarGenerator() {
        this(DEFAULT_SEED);
    }

    public SyntheticBarGenerator(long seed) {
        this.seed = seed;
    }

    /**
     * Generate weekday bars from {@code startDate} to {@code endDate}, both inclusive, stamped at 00:00 UTC.
     */
    public List<Bar> generate(String symbol, LocalDate startDate, LocalDate endDate) {
        List<Bar> bars = new ArrayList<>();
        Random random = new Random(seed ^ symbol.hashCode());

        BigDecimal basePrice = new BigDecimal("100.00");
        LocalDate currentDate = startDate;

        while (!currentDate.isAfter(endDate)) {
            DayOfWeek day = currentDate.getDayOfWeek();
            if (day != DayOfWeek.SATURDAY && day != DayOfWeek.SUNDAY) {
                // Random walk: 2% volatility, 0.03% daily drift
                double changePercent = (random.nextGaussian() * 0.02) + 0.0003;
                basePrice = basePrice.add(basePrice.multiply(BigDecimal.valueOf(changePercent)));

                if (basePrice.compareTo(BigDecimal.ONE) < 0) {
                    basePrice = BigDecimal.ONE;
                }

                BigDecimal open = scale(basePrice);
                BigDecimal close = scale(basePrice.multiply(BigDecimal.valueOf(1 + (random.nextGaussian() * 0.005))));
                BigDecimal high = scale(open.max(close).multiply(BigDecimal.valueOf(1 + Math.abs(random.nextGaussian()) * 0.01)));
                BigDecimal low = scale(open.min(close).multiply(BigDecimal.valueOf(1 - Math.abs(random.nextGaussian()) * 0.01)));

                bars.add(Bar.builder()
                        .symbol(symbol)
                        .timeframe("1d")
                        .timestamp(currentDate.atStartOfDay(ZoneOffset.UTC).toInstant())
                        .open(open)
                        .high(high.max(open).max(close))
                        .low(low.min(open).min(close))
                        .close(close)
                        .volume(1_000_000L + random.nextInt(500_000))
                        .build());
            }
            currentDate = currentDate.plusDays(1);
        }

        log.info("Generated {} synthetic bars for {} from {} to {}", bars.size(), symbol, startDate, endDate);
        return bars;
    }

    private static BigDecimal scale(BigDecimal value) {
        return value.setScale(2, RoundingMode.HALF_UP);
    }
}
