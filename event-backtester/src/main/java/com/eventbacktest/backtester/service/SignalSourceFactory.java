package com.eventbacktest.backtester.service;

import com.eventbacktest.backtester.domain.BacktestConfigurationException;
import com.eventbacktest.backtester.domain.MovingAverageCrossoverSignalSource;
import com.eventbacktest.backtester.domain.SignalSource;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.function.Supplier;

/**
 * Factory for creating signal source instances based on name and parameters.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SignalSourceFactory {

    private final ObjectMapper objectMapper;

    /**
     * Create a signal source instance from name and JSON parameters.
     *
     * @throws BacktestConfigurationException for an unknown name or unreadable parameters
     */
    public SignalSource create(String name, String parametersJson) {
        log.debug("Creating signal source: {} with parameters: {}", name, parametersJson);
        if (name == null) {
            throw new BacktestConfigurationException("Signal source name is required");
        }

        JsonNode params = readParameters(parametersJson);
        try {
            return switch (name.toLowerCase(Locale.ROOT)) {
                case "movingaveragecrossover", "ma_crossover" -> {
                    int shortPeriod = params.path("shortPeriod").asInt(10);
                    int longPeriod = params.path("longPeriod").asInt(50);
                    BigDecimal stopPct = params.hasNonNull("stopPct")
                            ? new BigDecimal(params.get("stopPct").asText())
                            : new BigDecimal("0.02");
                    boolean allowShort = params.path("allowShort").asBoolean(false);
                    yield new MovingAverageCrossoverSignalSource(shortPeriod, longPeriod, stopPct, allowShort);
                }
                default -> throw new BacktestConfigurationException("Unknown signal source: " + name);
            };
        } catch (BacktestConfigurationException e) {
            throw e;
        } catch (IllegalArgumentException e) {
            throw new BacktestConfigurationException("Invalid parameters for " + name + ": " + e.getMessage());
        }
    }

    /**
     * Supplier of fresh instances, one per backtest run. Parameters are checked eagerly.
     */
    public Supplier<SignalSource> supplier(String name, String parametersJson) {
        create(name, parametersJson);
        return () -> create(name, parametersJson);
    }

    private JsonNode readParameters(String parametersJson) {
        if (parametersJson == null || parametersJson.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(parametersJson);
        } catch (JsonProcessingException e) {
            throw new BacktestConfigurationException("Failed to parse signal source parameters: " + e.getOriginalMessage());
        }
    }
}
