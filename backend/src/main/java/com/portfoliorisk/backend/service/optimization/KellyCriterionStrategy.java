package com.portfoliorisk.backend.service.optimization;

import com.portfoliorisk.backend.config.OptimizationProperties;
import com.portfoliorisk.backend.model.OptimizationStrategy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Fractional Kelly: {@code f * (Sigma + eps I)^-1 (mu - rf)}, long-only. Any failure in the
 * solve yields equal weights.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class KellyCriterionStrategy implements AllocationStrategy {

    private final OptimizationProperties optimizationProperties;

    @Override
    public OptimizationStrategy strategy() {
        return OptimizationStrategy.KELLY_CRITERION;
    }

    @Override
    public AllocationDecision allocate(OptimizationContext context) {
        int n = context.inputs().size();
        OptimizationProperties.Kelly kelly = optimizationProperties.getKelly();
        double[] weights;
        try {
            double[] full = MatrixOps.solveRegularized(
                    context.inputs().covariance(), kelly.getRegularization(), context.excessReturns());
            double[] fractional = new double[n];
            double sum = 0.0;
            for (int i = 0; i < n; i++) {
                fractional[i] = Math.max(0.0, kelly.getFraction() * full[i]);
                sum += fractional[i];
            }
            if (!(sum > 0) || !Double.isFinite(sum)) {
                log.warn("Kelly weights degenerate for {} assets, using equal weights", n);
                weights = MatrixOps.equalWeights(n);
            } else {
                weights = MatrixOps.clipAndNormalize(fractional);
            }
        } catch (RuntimeException e) {
            log.warn("Kelly solve failed for {} assets, using equal weights: {}", n, e.getMessage());
            weights = MatrixOps.equalWeights(n);
        }
        return AllocationDecision.of(context.toWeightMap(weights));
    }
}
