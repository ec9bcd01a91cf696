package com.portfoliorisk.backend.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record OptimizationResult(
        OptimizationStrategy strategy,
        Map<String, Double> weights,
        double expectedReturn,
        double expectedVolatility,
        double sharpeRatio,
        double maxDrawdownEstimate,
        double confidence,
        boolean rebalancingNeeded,
        List<Trade> suggestedTrades,
        double dataCoverage,
        int observations,
        boolean fallbackUsed
) {

    public OptimizationResult {
        weights = weights == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(weights));
        suggestedTrades = suggestedTrades == null ? List.of() : List.copyOf(suggestedTrades);
    }

    public static OptimizationResult empty(OptimizationStrategy strategy) {
        return new OptimizationResult(strategy, Map.of(), 0.0, 0.0, 0.0, 0.0, 0.0, false, List.of(), 0.0, 0, false);
    }
}
