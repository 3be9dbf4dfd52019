package com.eventbacktest.backtester.walkforward;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
public class WalkForwardSuiteResult {

    String suiteId;
    List<SymbolSuiteResult> symbolResults;
    List<BaselineComparison> baselineComparisons;
    List<String> regressionDetails;
    int regressionCount;
    boolean overallPass;
    int totalSymbols;
    int totalWindows;
    long totalExecutionTimeMs;
}
