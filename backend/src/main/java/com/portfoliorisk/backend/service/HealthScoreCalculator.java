package com.portfoliorisk.backend.service;

import com.portfoliorisk.backend.config.RiskProperties;
import com.portfoliorisk.backend.dto.HealthScore;
import com.portfoliorisk.backend.model.HealthStatus;
import com.portfoliorisk.backend.model.RiskMetrics;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Rolls the assessment components into a 0-10 score. Components that were not computed are
 * left out of the weighted mean.
 */
@Component
@RequiredArgsConstructor
public class HealthScoreCalculator {

    private static final double NEUTRAL_SCORE = 5.0;

    private final RiskProperties riskProperties;

    /**
     * @param risk               risk metrics, or null when risk analysis did not run
     * @param averageCorrelation mean pairwise correlation, or null
     * @param allocationDrift    sum of |target - current| weight, or null
     * @param resilienceScore    stress-test resilience (0-10), or null
     */
    public HealthScore calculate(RiskMetrics risk, Double averageCorrelation, Double allocationDrift, Double resilienceScore) {
        RiskProperties.Health health = riskProperties.getHealth();
        Map<String, Double> scores = new LinkedHashMap<>();
        Map<String, Double> weights = new LinkedHashMap<>();

        if (risk != null) {
            double sharpePart = Math.min(5.0, Math.max(0.0, 2.5 * risk.sharpeRatio()));
            double varPart = Math.max(0.0, 5.0 - 50.0 * risk.var95());
            scores.put("risk", sharpePart + varPart);
            weights.put("risk", health.getRiskWeight());
        }
        if (averageCorrelation != null) {
            scores.put("diversification", 10.0 * (1.0 - Math.max(0.0, averageCorrelation)));
            weights.put("diversification", health.getDiversificationWeight());
        }
        if (allocationDrift != null) {
            scores.put("optimization", 10.0 * (1.0 - Math.min(1.0, allocationDrift / 2.0)));
            weights.put("optimization", health.getOptimizationWeight());
        }
        if (resilienceScore != null) {
            scores.put("stress", resilienceScore);
            weights.put("stress", health.getStressWeight());
        }

        double totalWeight = weights.values().stream().mapToDouble(Double::doubleValue).sum();
        double overall = NEUTRAL_SCORE;
        if (totalWeight > 0) {
            double weighted = 0.0;
            for (Map.Entry<String, Double> entry : scores.entrySet()) {
                weighted += entry.getValue() * weights.get(entry.getKey());
            }
            overall = weighted / totalWeight;
        }
        overall = Math.round(overall * 100.0) / 100.0;

        return HealthScore.builder()
                .overallScore(overall)
                .status(classify(overall))
                .componentScores(scores)
                .weightsUsed(weights)
                .build();
    }

    HealthStatus classify(double score) {
        RiskProperties.Health health = riskProperties.getHealth();
        if (score > health.getHealthyThreshold()) {
            return HealthStatus.HEALTHY;
        }
        if (score > health.getAttentionThreshold()) {
            return HealthStatus.NEEDS_ATTENTION;
        }
        return HealthStatus.HIGH_RISK;
    }
}
