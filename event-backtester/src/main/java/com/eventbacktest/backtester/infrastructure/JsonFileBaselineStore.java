package com.eventbacktest.backtester.infrastructure;

import com.eventbacktest.backtester.walkforward.BaselineRecord;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Baselines as pretty-printed JSON files, one per symbol: {@code <dir>/<symbol>_wf_baseline.json}.
 */
@Slf4j
public class JsonFileBaselineStore implements BaselineStore {

    private static final String FILE_SUFFIX = "_wf_baseline.json";

    private final Path baselineDir;
    private final ObjectMapper objectMapper;

    public JsonFileBaselineStore(Path baselineDir, ObjectMapper objectMapper) {
        this.baselineDir = baselineDir;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<BaselineRecord> load(String symbol) {
        Path file = resolve(symbol);
        if (!Files.exists(file)) {
            log.debug("No baseline file at {}", file);
            return Optional.empty();
        }

        try {
            return Optional.of(objectMapper.readValue(file.toFile(), BaselineRecord.class));
        } catch (IOException e) {
            log.error("Failed to load walk-forward baseline for {} from {}: {}", symbol, file, e.getMessage(), e);
            return Optional.empty();
        }
    }

    @Override
    public void save(BaselineRecord record) {
        Path file = resolve(record.getSymbol());
        try {
            Files.createDirectories(baselineDir);
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), record);
            log.info("Walk-forward baseline for {} written to {}", record.getSymbol(), file);
        } catch (IOException e) {
            log.error("Failed to write walk-forward baseline for {} to {}: {}", record.getSymbol(), file, e.getMessage(), e);
            throw new UncheckedIOException("Failed to write baseline " + file, e);
        }
    }

    public Path resolve(String symbol) {
        return baselineDir.resolve(symbol + FILE_SUFFIX);
    }

    public Path getBaselineDir() {
        return baselineDir;
    }
}
