package com.portfoliorisk.backend.model;

import java.util.Set;

/**
 * Optional caller-supplied bounds. Null bounds are ignored.
 */
public record OptimizationConstraints(
        Double maxWeight,
        Double minWeight,
        Set<String> excludedSymbols
) {

    public OptimizationConstraints {
        excludedSymbols = excludedSymbols == null ? Set.of() : Set.copyOf(excludedSymbols);
    }

    public static OptimizationConstraints none() {
        return new OptimizationConstraints(null, null, Set.of());
    }

    public boolean isEmpty() {
        return maxWeight == null && minWeight == null && excludedSymbols.isEmpty();
    }
}
