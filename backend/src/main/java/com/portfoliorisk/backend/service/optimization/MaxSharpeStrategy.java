package com.portfoliorisk.backend.service.optimization;

import com.portfoliorisk.backend.exception.NumericalInstabilityException;
import com.portfoliorisk.backend.model.OptimizationStrategy;
import com.portfoliorisk.backend.service.market.AssetLiquidityAdjuster;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.linear.RealMatrix;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Tangency-style weights {@code pinv(Sigma)(mu - rf)}, long-only, then scaled by liquidity tier.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MaxSharpeStrategy implements AllocationStrategy {

    private final AssetLiquidityAdjuster liquidityAdjuster;

    @Override
    public OptimizationStrategy strategy() {
        return OptimizationStrategy.MAX_SHARPE;
    }

    @Override
    public AllocationDecision allocate(OptimizationContext context) {
        return AllocationDecision.of(weights(context));
    }

    Map<String, Double> weights(OptimizationContext context) {
        double[] raw;
        try {
            RealMatrix inverse = MatrixOps.pseudoInverse(context.inputs().covariance());
            raw = MatrixOps.clipAndNormalize(MatrixOps.multiply(inverse, context.excessReturns()));
        } catch (NumericalInstabilityException e) {
            log.warn("Max Sharpe solve failed for {} assets, using equal weights: {}", context.inputs().size(), e.getMessage());
            raw = MatrixOps.equalWeights(context.inputs().size());
        }
        Map<String, Double> adjusted = liquidityAdjuster.adjust(context.symbols(), context.toWeightMap(raw));
        return WeightBounds.normalize(adjusted);
    }
}
