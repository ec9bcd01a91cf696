package com.portfoliorisk.backend.service.optimization;

import com.portfoliorisk.backend.config.OptimizationProperties;
import com.portfoliorisk.backend.model.OptimizationStrategy;
import com.portfoliorisk.backend.service.market.SymbolNormalizer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Blend of risk parity and max Sharpe, then per-ticker caps and a global floor.
 */
@Component
@RequiredArgsConstructor
public class AdaptiveStrategy implements AllocationStrategy {

    private final RiskParityStrategy riskParityStrategy;
    private final MaxSharpeStrategy maxSharpeStrategy;
    private final SymbolNormalizer symbolNormalizer;
    private final OptimizationProperties optimizationProperties;

    @Override
    public OptimizationStrategy strategy() {
        return OptimizationStrategy.ADAPTIVE;
    }

    @Override
    public AllocationDecision allocate(OptimizationContext context) {
        OptimizationProperties.Adaptive adaptive = optimizationProperties.getAdaptive();
        Map<String, Double> riskParity = riskParityStrategy.weights(context);
        Map<String, Double> maxSharpe = maxSharpeStrategy.weights(context);

        Map<String, Double> blended = new LinkedHashMap<>();
        for (String symbol : context.symbols()) {
            blended.put(symbol, adaptive.getRiskParityShare() * riskParity.getOrDefault(symbol, 0.0)
                    + adaptive.getMaxSharpeShare() * maxSharpe.getOrDefault(symbol, 0.0));
        }

        Map<String, Double> capped = WeightBounds.clampAndNormalize(
                blended, this::capFor, adaptive.getMinWeight(), adaptive.getMaxPasses());
        return AllocationDecision.of(capped);
    }

    private double capFor(String symbol) {
        String asset = symbolNormalizer.baseAsset(symbol);
        for (Map.Entry<String, Double> entry : optimizationProperties.getAdaptive().getCaps().entrySet()) {
            if (entry.getKey().equalsIgnoreCase(asset)) {
                return entry.getValue();
            }
        }
        return 1.0;
    }
}
