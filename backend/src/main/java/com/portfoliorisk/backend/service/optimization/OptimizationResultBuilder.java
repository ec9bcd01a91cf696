package com.portfoliorisk.backend.service.optimization;

import com.portfoliorisk.backend.config.OptimizationProperties;
import com.portfoliorisk.backend.config.RiskProperties;
import com.portfoliorisk.backend.model.OptimizationResult;
import com.portfoliorisk.backend.model.OptimizationStrategy;
import com.portfoliorisk.backend.model.Trade;
import com.portfoliorisk.backend.service.rebalancing.RebalancingTradeGenerator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shared post-processing for every strategy: normalization, portfolio statistics,
 * confidence and suggested trades.
 */
@Component
@RequiredArgsConstructor
public class OptimizationResultBuilder {

    private static final double MIN_CONFIDENCE = 0.4;
    private static final double MAX_CONFIDENCE = 0.99;
    private static final double MAX_HEURISTIC_DRAWDOWN = 0.95;

    private final RebalancingTradeGenerator tradeGenerator;
    private final OptimizationProperties optimizationProperties;
    private final RiskProperties riskProperties;

    public OptimizationResult build(OptimizationStrategy strategy, OptimizationContext context, AllocationDecision decision) {
        OptimizationInputs inputs = context.inputs();
        Map<String, Double> weights = WeightBounds.normalize(ordered(context, decision.weights()));
        double[] w = new double[inputs.size()];
        for (int i = 0; i < w.length; i++) {
            w[i] = weights.get(inputs.symbols().get(i));
        }

        double expectedReturn = 0.0;
        for (int i = 0; i < w.length; i++) {
            expectedReturn += w[i] * inputs.expectedReturns()[i];
        }
        double volatility = Math.sqrt(Math.max(0.0, MatrixOps.quadraticForm(inputs.covariance(), w)));
        double sharpe = volatility > 0 ? (expectedReturn - context.riskFreeRate()) / volatility : 0.0;

        double coverage = 0.0;
        for (Map.Entry<String, Double> entry : weights.entrySet()) {
            if (inputs.hasHistory(entry.getKey())) {
                coverage += entry.getValue();
            }
        }
        double maxDrawdown = replayDrawdown(inputs, weights);
        if (Double.isNaN(maxDrawdown)) {
            maxDrawdown = Math.min(MAX_HEURISTIC_DRAWDOWN, 2.0 * volatility);
        }

        boolean rebalancingNeeded = decision.rebalancingNeeded() != null
                ? decision.rebalancingNeeded()
                : rebalancingNeeded(context.currentWeights(), weights);
        List<Trade> trades = decision.trades() != null
                ? decision.trades()
                : tradeGenerator.generateTrades(context.portfolio(), weights);

        return new OptimizationResult(
                strategy,
                weights,
                expectedReturn,
                volatility,
                sharpe,
                maxDrawdown,
                confidence(inputs.observations(), coverage),
                rebalancingNeeded,
                trades,
                coverage,
                inputs.observations(),
                inputs.fallbackUsed());
    }

    double confidence(int observations, double coverage) {
        int tradingDays = riskProperties.getTradingDays();
        double sampleScore = Math.min(1.0, (double) observations / tradingDays);
        double raw = MIN_CONFIDENCE + (MAX_CONFIDENCE - MIN_CONFIDENCE) * (0.5 * sampleScore + 0.5 * coverage);
        return Math.min(MAX_CONFIDENCE, Math.max(MIN_CONFIDENCE, raw));
    }

    boolean rebalancingNeeded(Map<String, Double> current, Map<String, Double> target) {
        double threshold = optimizationProperties.getRebalanceThreshold();
        for (Map.Entry<String, Double> entry : target.entrySet()) {
            if (Math.abs(entry.getValue() - current.getOrDefault(entry.getKey(), 0.0)) > threshold) {
                return true;
            }
        }
        return false;
    }

    /**
     * Replays the aligned history under the target weights renormalized over the symbols that
     * have it. NaN when there is nothing to replay.
     */
    private double replayDrawdown(OptimizationInputs inputs, Map<String, Double> weights) {
        double[][] prices = inputs.historyPrices();
        List<String> columns = inputs.priceColumns();
        if (prices.length < 2 || columns.isEmpty()) {
            return Double.NaN;
        }
        double[] w = new double[columns.size()];
        double sum = 0.0;
        for (int c = 0; c < columns.size(); c++) {
            w[c] = weights.getOrDefault(columns.get(c), 0.0);
            sum += w[c];
        }
        if (sum <= 0) {
            return Double.NaN;
        }
        double peak = Double.NEGATIVE_INFINITY;
        double worst = 0.0;
        for (double[] row : prices) {
            double index = 0.0;
            for (int c = 0; c < w.length; c++) {
                index += (w[c] / sum) * row[c] / prices[0][c];
            }
            peak = Math.max(peak, index);
            if (peak > 0) {
                worst = Math.max(worst, (peak - index) / peak);
            }
        }
        return Math.min(1.0, Math.max(0.0, worst));
    }

    private Map<String, Double> ordered(OptimizationContext context, Map<String, Double> weights) {
        Map<String, Double> ordered = new LinkedHashMap<>();
        for (String symbol : context.symbols()) {
            Double weight = weights.get(symbol);
            ordered.put(symbol, weight == null || !Double.isFinite(weight) ? 0.0 : weight);
        }
        return ordered;
    }
}
