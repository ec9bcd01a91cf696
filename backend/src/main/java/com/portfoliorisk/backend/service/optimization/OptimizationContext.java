package com.portfoliorisk.backend.service.optimization;

import com.portfoliorisk.backend.model.Portfolio;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record OptimizationContext(
        Portfolio portfolio,
        OptimizationInputs inputs,
        Map<String, Double> currentWeights,
        double riskFreeRate
) {

    public List<String> symbols() {
        return inputs.symbols();
    }

    /** Zips a weight vector with the symbol order of the inputs. */
    public Map<String, Double> toWeightMap(double[] weights) {
        Map<String, Double> result = new LinkedHashMap<>();
        List<String> symbols = inputs.symbols();
        for (int i = 0; i < symbols.size(); i++) {
            result.put(symbols.get(i), weights[i]);
        }
        return result;
    }

    public double[] excessReturns() {
        double[] mu = inputs.expectedReturns();
        double[] excess = new double[mu.length];
        for (int i = 0; i < mu.length; i++) {
            excess[i] = mu[i] - riskFreeRate;
        }
        return excess;
    }
}
