package com.portfoliorisk.backend.model;

public enum StressSeverity {
    LOW,
    MEDIUM,
    HIGH,
    EXTREME;

    /** Bands on portfolio loss percentage: below 10, 25 and 50. */
    public static StressSeverity fromLossPct(double lossPct) {
        if (lossPct < 10) {
            return LOW;
        }
        if (lossPct < 25) {
            return MEDIUM;
        }
        if (lossPct < 50) {
            return HIGH;
        }
        return EXTREME;
    }

    public String recoveryEstimate() {
        return switch (this) {
            case LOW -> "1-3 months";
            case MEDIUM -> "6-12 months";
            case HIGH -> "1-2 years";
            case EXTREME -> "2+ years";
        };
    }
}
