package com.portfoliorisk.backend.model;

import java.util.Locale;

/**
 * Daily-volume liquidity tiers reported by the asset discovery service.
 */
public enum LiquidityTier {
    INSTITUTIONAL,
    ENTERPRISE,
    PROFESSIONAL,
    RETAIL,
    EMERGING,
    MICRO,
    UNKNOWN;

    /** Accepts both {@code tier_retail} and {@code retail} forms. */
    public static LiquidityTier parse(String value) {
        if (value == null || value.isBlank()) {
            return UNKNOWN;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        if (normalized.startsWith("TIER_")) {
            normalized = normalized.substring("TIER_".length());
        }
        for (LiquidityTier tier : values()) {
            if (tier.name().equals(normalized)) {
                return tier;
            }
        }
        return UNKNOWN;
    }
}
