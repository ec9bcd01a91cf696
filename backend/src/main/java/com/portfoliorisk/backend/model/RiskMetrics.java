package com.portfoliorisk.backend.model;

public record RiskMetrics(
        double var95,
        double var99,
        double expectedShortfall,
        double maximumDrawdown,
        double volatilityAnnual,
        double sharpeRatio,
        double sortinoRatio,
        double beta,
        double alpha,
        double correlationToMarket
) {

    public static RiskMetrics zero() {
        return new RiskMetrics(0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0);
    }
}
