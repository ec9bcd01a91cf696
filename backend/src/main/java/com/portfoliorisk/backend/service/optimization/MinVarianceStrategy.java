package com.portfoliorisk.backend.service.optimization;

import com.portfoliorisk.backend.exception.NumericalInstabilityException;
import com.portfoliorisk.backend.model.OptimizationStrategy;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.linear.RealMatrix;
import org.springframework.stereotype.Component;

import java.util.Arrays;

@Slf4j
@Component
public class MinVarianceStrategy implements AllocationStrategy {

    @Override
    public OptimizationStrategy strategy() {
        return OptimizationStrategy.MIN_VARIANCE;
    }

    @Override
    public AllocationDecision allocate(OptimizationContext context) {
        int n = context.inputs().size();
        double[] weights;
        try {
            RealMatrix inverse = MatrixOps.pseudoInverse(context.inputs().covariance());
            double[] ones = new double[n];
            Arrays.fill(ones, 1.0);
            weights = MatrixOps.clipAndNormalize(MatrixOps.multiply(inverse, ones));
        } catch (NumericalInstabilityException e) {
            log.warn("Minimum variance solve failed for {} assets, using equal weights: {}", n, e.getMessage());
            weights = MatrixOps.equalWeights(n);
        }
        return AllocationDecision.of(context.toWeightMap(weights));
    }
}
