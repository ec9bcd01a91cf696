package com.portfoliorisk.backend.service;

import com.portfoliorisk.backend.config.RiskProperties;
import com.portfoliorisk.backend.dto.ConcentrationMetrics;
import com.portfoliorisk.backend.dto.CorrelationCluster;
import com.portfoliorisk.backend.dto.CorrelationReport;
import com.portfoliorisk.backend.dto.DiversificationMetrics;
import com.portfoliorisk.backend.dto.Recommendation;
import com.portfoliorisk.backend.model.Portfolio;
import com.portfoliorisk.backend.model.PriceSeries;
import com.portfoliorisk.backend.service.market.AlignedReturns;
import com.portfoliorisk.backend.service.market.HistoricalPriceCache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Slf4j
@Service
@RequiredArgsConstructor
public class CorrelationService {

    private static final String DAILY = "1d";

    private final HistoricalPriceCache priceCache;
    private final SyntheticReturnGenerator syntheticReturnGenerator;
    private final RiskProperties riskProperties;

    /** Pearson coefficient of two equal-length series; 0 if either is flat or too short. */
    public double calculateCorrelation(List<Double> series1, List<Double> series2) {
        if (series1.size() != series2.size() || series1.size() < 2) {
            return 0;
        }
        double[] x = series1.stream().mapToDouble(Double::doubleValue).toArray();
        double[] y = series2.stream().mapToDouble(Double::doubleValue).toArray();
        double correlation = new PearsonsCorrelation().correlation(x, y);
        return Double.isFinite(correlation) ? correlation : 0;
    }

    /**
     * Pearson correlation of daily returns between {@code candidate} and each of {@code held}.
     * Only real history is used; symbols without it are left out.
     */
    public Map<String, Double> correlationsTo(String candidate, List<String> held, int lookbackDays) {
        List<String> symbols = new ArrayList<>(held);
        symbols.add(candidate);
        Map<String, PriceSeries> history = realHistory(symbols, lookbackDays);
        PriceSeries candidateHistory = history.get(candidate);
        Map<String, Double> result = new LinkedHashMap<>();
        if (candidateHistory == null) {
            return result;
        }
        for (String symbol : held) {
            PriceSeries other = history.get(symbol);
            if (other == null || symbol.equals(candidate)) {
                continue;
            }
            Map<String, PriceSeries> pair = new LinkedHashMap<>();
            pair.put(candidate, candidateHistory);
            pair.put(symbol, other);
            AlignedReturns aligned = AlignedReturns.of(pair);
            result.put(symbol, calculateCorrelation(aligned.returns(candidate), aligned.returns(symbol)));
        }
        return result;
    }

    public CorrelationReport analyze(Portfolio portfolio) {
        return analyze(portfolio, riskProperties.getCorrelation().getLookbackDays());
    }

    public CorrelationReport analyze(Portfolio portfolio, int lookbackDays) {
        List<String> symbols = portfolio.symbols();
        if (symbols.size() < 2) {
            return CorrelationReport.builder()
                    .success(false)
                    .error("Insufficient positions for correlation analysis (minimum 2 required)")
                    .lookbackDays(lookbackDays)
                    .correlationMatrix(Map.of())
                    .clusters(List.of())
                    .recommendations(List.of())
                    .syntheticSymbols(List.of())
                    .build();
        }

        Map<String, PriceSeries> history = realHistory(symbols, lookbackDays);
        AlignedReturns aligned = AlignedReturns.of(history);
        boolean dated = aligned.length() >= 2;
        if (!history.isEmpty() && !dated) {
            log.warn("Price histories for {} share too few dates, using synthetic factor returns", history.keySet());
        }
        AlignedReturns real = dated ? aligned : AlignedReturns.of(Map.of());
        int length = dated ? real.length() : lookbackDays;
        List<String> missing = symbols.stream().filter(symbol -> !real.contains(symbol)).toList();
        if (!missing.isEmpty()) {
            log.warn("No price history for {}, using synthetic factor returns", missing);
        }
        Map<String, List<Double>> synthetic = syntheticReturnGenerator.generateFactorModel(
                missing, length, riskProperties.getCorrelation().getMarketFactorVolatility());

        Map<String, List<Double>> returns = new LinkedHashMap<>();
        for (String symbol : symbols) {
            List<Double> series = real.contains(symbol) ? real.returns(symbol) : synthetic.get(symbol);
            returns.put(symbol, series);
        }

        Map<String, Map<String, Double>> matrix = correlationMatrix(returns);
        Map<String, Double> weights = portfolio.currentWeights();
        return CorrelationReport.builder()
                .success(true)
                .lookbackDays(lookbackDays)
                .correlationMatrix(matrix)
                .averageCorrelation(averageCorrelation(matrix))
                .syntheticSymbols(missing)
                .diversification(diversificationMetrics(matrix, weights))
                .clusters(clusters(matrix))
                .concentration(concentrationMetrics(weights))
                .recommendations(recommendations(matrix, weights))
                .build();
    }

    Map<String, Map<String, Double>> correlationMatrix(Map<String, List<Double>> returns) {
        List<String> symbols = new ArrayList<>(returns.keySet());
        Map<String, Map<String, Double>> matrix = new LinkedHashMap<>();
        for (String row : symbols) {
            Map<String, Double> values = new LinkedHashMap<>();
            for (String column : symbols) {
                values.put(column, row.equals(column) ? 1.0 : calculateCorrelation(returns.get(row), returns.get(column)));
            }
            matrix.put(row, values);
        }
        return matrix;
    }

    double averageCorrelation(Map<String, Map<String, Double>> matrix) {
        List<String> symbols = new ArrayList<>(matrix.keySet());
        double total = 0.0;
        int count = 0;
        for (int i = 0; i < symbols.size(); i++) {
            for (int j = i + 1; j < symbols.size(); j++) {
                total += matrix.get(symbols.get(i)).get(symbols.get(j));
                count++;
            }
        }
        return count > 0 ? total / count : 0.0;
    }

    DiversificationMetrics diversificationMetrics(Map<String, Map<String, Double>> matrix, Map<String, Double> weights) {
        double vol = riskProperties.getCorrelation().getAssumedVolatility();
        double weightedVol = 0.0;
        double variance = 0.0;
        for (String first : matrix.keySet()) {
            double w1 = weights.getOrDefault(first, 0.0);
            weightedVol += w1 * vol;
            for (String second : matrix.keySet()) {
                double w2 = weights.getOrDefault(second, 0.0);
                variance += w1 * w2 * vol * vol * matrix.get(first).getOrDefault(second, 0.0);
            }
        }
        double portfolioVol = Math.sqrt(Math.max(0.0, variance));
        double ratio = portfolioVol > 0 ? weightedVol / portfolioVol : 1.0;
        double hhi = weights.values().stream().mapToDouble(w -> w * w).sum();
        return DiversificationMetrics.builder()
                .diversificationRatio(ratio)
                .effectiveAssets(hhi > 0 ? 1.0 / hhi : 1.0)
                .portfolioConcentration(hhi)
                .diversificationScore(Math.min(10.0, ratio * 2))
                .build();
    }

    List<CorrelationCluster> clusters(Map<String, Map<String, Double>> matrix) {
        double threshold = riskProperties.getCorrelation().getClusterThreshold();
        List<String> symbols = new ArrayList<>(matrix.keySet());
        Set<String> used = new HashSet<>();
        List<CorrelationCluster> clusters = new ArrayList<>();
        for (String anchor : symbols) {
            if (used.contains(anchor)) {
                continue;
            }
            List<String> members = new ArrayList<>();
            members.add(anchor);
            for (String other : symbols) {
                if (!other.equals(anchor) && !used.contains(other)
                        && Math.abs(matrix.get(anchor).get(other)) > threshold) {
                    members.add(other);
                    used.add(other);
                }
            }
            used.add(anchor);
            if (members.size() < 2) {
                continue;
            }
            double total = 0.0;
            int count = 0;
            for (int i = 0; i < members.size(); i++) {
                for (int j = i + 1; j < members.size(); j++) {
                    total += Math.abs(matrix.get(members.get(i)).get(members.get(j)));
                    count++;
                }
            }
            double average = count > 0 ? total / count : 0.0;
            clusters.add(CorrelationCluster.builder()
                    .clusterId(clusters.size() + 1)
                    .members(members)
                    .averageCorrelation(average)
                    .size(members.size())
                    .diversificationBenefit(Math.max(0.0, 1.0 - average))
                    .build());
        }
        return clusters;
    }

    ConcentrationMetrics concentrationMetrics(Map<String, Double> weights) {
        double hhi = weights.values().stream().mapToDouble(w -> w * w).sum();
        double max = weights.values().stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
        double top3 = weights.values().stream()
                .sorted((a, b) -> Double.compare(b, a))
                .limit(3)
                .mapToDouble(Double::doubleValue)
                .sum();
        return ConcentrationMetrics.builder()
                .herfindahlIndex(hhi)
                .maxPositionPct(max * 100)
                .top3ConcentrationPct(top3 * 100)
                .concentrationScore(Math.min(10.0, hhi * 10))
                .diversificationNeeded(hhi > 0.3 || max > 0.25)
                .build();
    }

    List<Recommendation> recommendations(Map<String, Map<String, Double>> matrix, Map<String, Double> weights) {
        RiskProperties.Correlation config = riskProperties.getCorrelation();
        List<Recommendation> recommendations = new ArrayList<>();
        List<String> symbols = new ArrayList<>(matrix.keySet());
        for (int i = 0; i < symbols.size(); i++) {
            for (int j = i + 1; j < symbols.size(); j++) {
                double correlation = matrix.get(symbols.get(i)).get(symbols.get(j));
                if (correlation > config.getHighCorrelationThreshold()) {
                    recommendations.add(Recommendation.builder()
                            .category("REDUCE_CORRELATION")
                            .priority(correlation > 0.9 ? "HIGH" : "MEDIUM")
                            .message(String.format("Consider reducing exposure to %s or %s due to high correlation (%.2f)",
                                    symbols.get(i), symbols.get(j), correlation))
                            .symbols(List.of(symbols.get(i), symbols.get(j)))
                            .metric(String.format("correlation %.2f", correlation))
                            .build());
                }
            }
        }
        weights.forEach((symbol, weight) -> {
            if (weight > config.getConcentrationThreshold()) {
                recommendations.add(Recommendation.builder()
                        .category("REDUCE_CONCENTRATION")
                        .priority("HIGH")
                        .message(String.format("Consider reducing %s position (%.1f%% of portfolio)", symbol, weight * 100))
                        .symbols(List.of(symbol))
                        .metric(String.format("weight %.1f%%", weight * 100))
                        .build());
            }
        });
        return recommendations;
    }

    /** Fetched series with at least two returns, in request order. */
    private Map<String, PriceSeries> realHistory(List<String> symbols, int lookbackDays) {
        Map<String, PriceSeries> fetched = priceCache.fetchAll(symbols, lookbackDays + 1, DAILY);
        Map<String, PriceSeries> history = new LinkedHashMap<>();
        for (String symbol : symbols) {
            PriceSeries series = fetched.get(symbol);
            if (series != null && series.size() >= 3) {
                history.put(symbol, series);
            }
        }
        return history;
    }
}
