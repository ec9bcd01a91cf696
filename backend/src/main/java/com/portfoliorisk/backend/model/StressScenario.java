package com.portfoliorisk.backend.model;

import java.util.Map;

/**
 * Predefined market shock. Shocks are fractional price moves keyed by base asset.
 */
public record StressScenario(
        String name,
        String description,
        Map<String, Double> shocks,
        double correlationShock,
        double probability
) {

    public StressScenario {
        shocks = shocks == null ? Map.of() : Map.copyOf(shocks);
    }
}
