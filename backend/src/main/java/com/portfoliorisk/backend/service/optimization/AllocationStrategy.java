package com.portfoliorisk.backend.service.optimization;

import com.portfoliorisk.backend.model.OptimizationStrategy;

public interface AllocationStrategy {
    OptimizationStrategy strategy();

    AllocationDecision allocate(OptimizationContext context);
}
