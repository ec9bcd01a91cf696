package com.portfoliorisk.backend.model;

import java.util.Locale;

public enum TradingMode {
    CONSERVATIVE(0.5),
    BALANCED(0.8),
    AGGRESSIVE(1.2),
    BEAST_MODE(1.5);

    private final double sizeMultiplier;

    TradingMode(double sizeMultiplier) {
        this.sizeMultiplier = sizeMultiplier;
    }

    public double sizeMultiplier() {
        return sizeMultiplier;
    }

    public static TradingMode parseOrDefault(String value) {
        if (value == null || value.isBlank()) {
            return BALANCED;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return BALANCED;
        }
    }
}
