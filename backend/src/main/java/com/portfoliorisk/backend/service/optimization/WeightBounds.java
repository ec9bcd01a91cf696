package com.portfoliorisk.backend.service.optimization;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.ToDoubleFunction;

/**
 * Iterative clamp-and-renormalize used for per-asset caps and floors.
 */
public final class WeightBounds {

    private static final double TOLERANCE = 1e-9;

    private WeightBounds() {}

    /**
     * Clamps each weight into {@code [floor, cap(symbol)]} and renormalizes, repeating until
     * every weight sits inside its bounds or {@code maxPasses} is reached. The result always
     * sums to 1, even when the bounds are infeasible.
     */
    public static Map<String, Double> clampAndNormalize(Map<String, Double> weights,
                                                        ToDoubleFunction<String> capFor,
                                                        double floor,
                                                        int maxPasses) {
        Map<String, Double> current = normalize(weights);
        if (current.isEmpty()) {
            return current;
        }
        for (int pass = 0; pass < maxPasses; pass++) {
            Map<String, Double> clamped = new LinkedHashMap<>();
            current.forEach((symbol, weight) -> {
                double cap = capFor.applyAsDouble(symbol);
                clamped.put(symbol, Math.min(cap, Math.max(floor, weight)));
            });
            current = normalize(clamped);
            if (withinBounds(current, capFor, floor)) {
                break;
            }
        }
        return current;
    }

    public static Map<String, Double> normalize(Map<String, Double> weights) {
        Map<String, Double> result = new LinkedHashMap<>();
        double sum = weights.values().stream().mapToDouble(value -> Math.max(0.0, value)).sum();
        if (weights.isEmpty()) {
            return result;
        }
        if (sum <= 0) {
            double equal = 1.0 / weights.size();
            weights.keySet().forEach(symbol -> result.put(symbol, equal));
            return result;
        }
        weights.forEach((symbol, weight) -> result.put(symbol, Math.max(0.0, weight) / sum));
        return result;
    }

    private static boolean withinBounds(Map<String, Double> weights, ToDoubleFunction<String> capFor, double floor) {
        for (Map.Entry<String, Double> entry : weights.entrySet()) {
            double weight = entry.getValue();
            if (weight > capFor.applyAsDouble(entry.getKey()) + TOLERANCE || weight < floor - TOLERANCE) {
                return false;
            }
        }
        return true;
    }
}
