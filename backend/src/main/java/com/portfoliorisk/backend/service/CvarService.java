package com.portfoliorisk.backend.service;

import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Historical-simulation tail measures. Both are reported as positive loss fractions.
 */
@Service
public class CvarService {

    public double valueAtRisk(List<Double> returns, double confidence) {
        if (returns == null || returns.isEmpty()) {
            return 0.0;
        }
        List<Double> sorted = returns.stream().sorted().toList();
        double quantile = sorted.get(tailIndex(sorted.size(), confidence));
        return Math.max(0.0, -quantile);
    }

    /** Mean of the tail up to and including the VaR quantile point. */
    public double expectedShortfall(List<Double> returns, double confidence) {
        if (returns == null || returns.isEmpty()) {
            return 0.0;
        }
        List<Double> sorted = returns.stream().sorted().toList();
        List<Double> tail = sorted.subList(0, tailIndex(sorted.size(), confidence) + 1);
        double mean = tail.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        return Math.max(0.0, -mean);
    }

    private int tailIndex(int size, double confidence) {
        int index = (int) Math.floor((1.0 - confidence) * size);
        return Math.min(Math.max(index, 0), size - 1);
    }
}
