package com.eventbacktest.backtester.infrastructure;

import com.eventbacktest.backtester.walkforward.BaselineRecord;

import java.util.Optional;

/**
 * Storage for walk-forward baselines, one record per symbol.
 */
public interface BaselineStore {

    /**
     * Load the baseline for a symbol.
     *
     * @return the record, or empty if none is stored or it cannot be read
     */
    Optional<BaselineRecord> load(String symbol);

    /**
     * Store a record, replacing any existing baseline for its symbol.
     */
    void save(BaselineRecord record);
}
