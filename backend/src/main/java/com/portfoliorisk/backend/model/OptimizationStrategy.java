package com.portfoliorisk.backend.model;

import java.util.Locale;
import java.util.Optional;

public enum OptimizationStrategy {
    RISK_PARITY("risk_parity"),
    EQUAL_WEIGHT("equal_weight"),
    MAX_SHARPE("max_sharpe"),
    MIN_VARIANCE("min_variance"),
    KELLY_CRITERION("kelly_criterion"),
    ADAPTIVE("adaptive");

    private final String code;

    OptimizationStrategy(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static Optional<OptimizationStrategy> fromCode(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (OptimizationStrategy strategy : values()) {
            if (strategy.code.equals(normalized)) {
                return Optional.of(strategy);
            }
        }
        return Optional.empty();
    }
}
