package com.portfoliorisk.backend.service.optimization;

import com.portfoliorisk.backend.model.Trade;

import java.util.List;
import java.util.Map;

/**
 * Raw strategy output. {@code rebalancingNeeded} and {@code trades} are null unless the
 * strategy decides them itself.
 */
public record AllocationDecision(
        Map<String, Double> weights,
        Boolean rebalancingNeeded,
        List<Trade> trades
) {

    public static AllocationDecision of(Map<String, Double> weights) {
        return new AllocationDecision(weights, null, null);
    }
}
