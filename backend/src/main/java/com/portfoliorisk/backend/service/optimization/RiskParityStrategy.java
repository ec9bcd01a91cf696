package com.portfoliorisk.backend.service.optimization;

import com.portfoliorisk.backend.config.OptimizationProperties;
import com.portfoliorisk.backend.model.OptimizationStrategy;
import lombok.RequiredArgsConstructor;
import org.apache.commons.math3.linear.RealMatrix;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Inverse-volatility weights.
 */
@Component
@RequiredArgsConstructor
public class RiskParityStrategy implements AllocationStrategy {

    private final OptimizationProperties optimizationProperties;

    @Override
    public OptimizationStrategy strategy() {
        return OptimizationStrategy.RISK_PARITY;
    }

    @Override
    public AllocationDecision allocate(OptimizationContext context) {
        return AllocationDecision.of(weights(context));
    }

    Map<String, Double> weights(OptimizationContext context) {
        RealMatrix covariance = context.inputs().covariance();
        double floor = optimizationProperties.getRiskParity().getVolatilityFloor();
        int n = context.inputs().size();
        double[] inverseVol = new double[n];
        for (int i = 0; i < n; i++) {
            double vol = Math.sqrt(Math.max(0.0, covariance.getEntry(i, i)));
            inverseVol[i] = 1.0 / Math.max(floor, vol);
        }
        return context.toWeightMap(MatrixOps.clipAndNormalize(inverseVol));
    }
}
