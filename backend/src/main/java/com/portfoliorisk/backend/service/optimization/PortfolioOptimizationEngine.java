package com.portfoliorisk.backend.service.optimization;

import com.portfoliorisk.backend.config.OptimizationProperties;
import com.portfoliorisk.backend.config.RiskProperties;
import com.portfoliorisk.backend.model.OptimizationConstraints;
import com.portfoliorisk.backend.model.OptimizationResult;
import com.portfoliorisk.backend.model.OptimizationStrategy;
import com.portfoliorisk.backend.model.Portfolio;
import com.portfoliorisk.backend.service.RiskEngineMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Computes target allocations for a portfolio under one of the supported strategies.
 */
@Slf4j
@Service
public class PortfolioOptimizationEngine {

    private final OptimizationInputBuilder inputBuilder;
    private final OptimizationResultBuilder resultBuilder;
    private final RiskProperties riskProperties;
    private final OptimizationProperties optimizationProperties;
    private final RiskEngineMetrics metrics;
    private final Executor riskComputeExecutor;
    private final Map<OptimizationStrategy, AllocationStrategy> strategies = new EnumMap<>(OptimizationStrategy.class);

    public PortfolioOptimizationEngine(List<AllocationStrategy> allocationStrategies,
                                       OptimizationInputBuilder inputBuilder,
                                       OptimizationResultBuilder resultBuilder,
                                       RiskProperties riskProperties,
                                       OptimizationProperties optimizationProperties,
                                       RiskEngineMetrics metrics,
                                       @Qualifier("riskComputeExecutor") Executor riskComputeExecutor) {
        for (AllocationStrategy strategy : allocationStrategies) {
            AllocationStrategy previous = strategies.put(strategy.strategy(), strategy);
            if (previous != null) {
                throw new IllegalStateException("Duplicate allocation strategy for " + strategy.strategy());
            }
        }
        for (OptimizationStrategy strategy : OptimizationStrategy.values()) {
            if (!strategies.containsKey(strategy)) {
                throw new IllegalStateException("No allocation strategy registered for " + strategy);
            }
        }
        this.inputBuilder = inputBuilder;
        this.resultBuilder = resultBuilder;
        this.riskProperties = riskProperties;
        this.optimizationProperties = optimizationProperties;
        this.metrics = metrics;
        this.riskComputeExecutor = riskComputeExecutor;
    }

    public OptimizationResult optimizePortfolio(Portfolio portfolio, OptimizationStrategy strategy) {
        return optimizePortfolio(portfolio, strategy, OptimizationConstraints.none());
    }

    public OptimizationResult optimizePortfolio(Portfolio portfolio,
                                                OptimizationStrategy strategy,
                                                OptimizationConstraints constraints) {
        OptimizationStrategy tag = strategy == null ? OptimizationStrategy.ADAPTIVE : strategy;
        if (portfolio == null || portfolio.isEmpty()) {
            return OptimizationResult.empty(tag);
        }
        List<String> symbols = portfolio.symbols();
        OptimizationInputs inputs = inputBuilder.build(symbols);
        if (inputs.fallbackUsed()) {
            metrics.recordOptimizationFallback();
        }
        OptimizationContext context = new OptimizationContext(
                portfolio, inputs, portfolio.currentWeights(), riskProperties.getRiskFreeRate());

        AllocationDecision decision = strategies.get(tag).allocate(context);
        if (constraints != null && !constraints.isEmpty()) {
            decision = applyConstraints(decision, constraints);
        }
        OptimizationResult result = resultBuilder.build(tag, context, decision);
        metrics.recordOptimization(tag);
        log.debug("Optimized {} symbols with {} (fallback={}, confidence={})",
                symbols.size(), tag.code(), result.fallbackUsed(), result.confidence());
        return result;
    }

    public CompletableFuture<OptimizationResult> optimizePortfolioAsync(Portfolio portfolio,
                                                                        OptimizationStrategy strategy,
                                                                        OptimizationConstraints constraints) {
        return CompletableFuture.supplyAsync(() -> optimizePortfolio(portfolio, strategy, constraints), riskComputeExecutor);
    }

    /**
     * Excluded symbols drop to zero while at least one symbol remains, then the global
     * bounds are enforced over the rest.
     */
    AllocationDecision applyConstraints(AllocationDecision decision, OptimizationConstraints constraints) {
        Map<String, Double> eligible = new LinkedHashMap<>();
        decision.weights().forEach((symbol, weight) -> {
            if (!constraints.excludedSymbols().contains(symbol)) {
                eligible.put(symbol, weight);
            }
        });
        if (eligible.isEmpty()) {
            log.warn("All {} symbols excluded by constraints, ignoring exclusions", decision.weights().size());
            eligible.putAll(decision.weights());
        }

        double cap = constraints.maxWeight() == null ? 1.0 : constraints.maxWeight();
        double floor = constraints.minWeight() == null ? 0.0 : constraints.minWeight();
        Map<String, Double> bounded = WeightBounds.clampAndNormalize(eligible, symbol -> cap, floor,
                optimizationProperties.getAdaptive().getMaxPasses());

        Map<String, Double> weights = new LinkedHashMap<>();
        decision.weights().keySet().forEach(symbol -> weights.put(symbol, bounded.getOrDefault(symbol, 0.0)));
        return AllocationDecision.of(weights);
    }
}
