package com.portfoliorisk.backend.service.optimization;

import com.portfoliorisk.backend.config.OptimizationProperties;
import com.portfoliorisk.backend.model.OptimizationStrategy;
import com.portfoliorisk.backend.model.Trade;
import com.portfoliorisk.backend.service.rebalancing.RebalancingTradeGenerator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class EqualWeightStrategy implements AllocationStrategy {

    private final RebalancingTradeGenerator tradeGenerator;
    private final OptimizationProperties optimizationProperties;

    @Override
    public OptimizationStrategy strategy() {
        return OptimizationStrategy.EQUAL_WEIGHT;
    }

    @Override
    public AllocationDecision allocate(OptimizationContext context) {
        Map<String, Double> weights = context.toWeightMap(MatrixOps.equalWeights(context.inputs().size()));
        double target = 1.0 / context.inputs().size();

        boolean rebalancingNeeded = context.currentWeights().values().stream()
                .anyMatch(current -> Math.abs(current - target) > optimizationProperties.getRebalanceThreshold());

        double tradeThreshold = optimizationProperties.getEqualWeightTradeThreshold();
        List<Trade> trades = tradeGenerator.generateTrades(context.portfolio(), weights).stream()
                .filter(trade -> Math.abs(trade.weightChange()) > tradeThreshold)
                .toList();
        return new AllocationDecision(weights, rebalancingNeeded, trades);
    }
}
