package com.portfoliorisk.backend.service.optimization;

import com.portfoliorisk.backend.config.OptimizationProperties;
import com.portfoliorisk.backend.config.RiskProperties;
import com.portfoliorisk.backend.model.PricePoint;
import com.portfoliorisk.backend.model.PriceSeries;
import com.portfoliorisk.backend.service.market.HistoricalPriceCache;
import com.portfoliorisk.backend.service.market.SymbolNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.correlation.Covariance;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

@Slf4j
@Component
@RequiredArgsConstructor
public class OptimizationInputBuilder {

    private final HistoricalPriceCache priceCache;
    private final SymbolNormalizer symbolNormalizer;
    private final OptimizationProperties optimizationProperties;
    private final RiskProperties riskProperties;

    public OptimizationInputs build(List<String> symbols) {
        Map<String, PriceSeries> history = priceCache.fetchAll(
                symbols, optimizationProperties.getLookbackDays(), optimizationProperties.getTimeframe());

        List<String> columns = new ArrayList<>();
        for (String symbol : symbols) {
            if (history.containsKey(symbol)) {
                columns.add(symbol);
            }
        }
        double[][] prices = alignedPrices(columns, history);
        int returnRows = Math.max(0, prices.length - 1);
        if (columns.isEmpty() || returnRows < 2) {
            columns = List.of();
            prices = new double[0][0];
            returnRows = 0;
        }

        int n = symbols.size();
        int tradingDays = riskProperties.getTradingDays();
        OptimizationProperties.Fallback fallback = optimizationProperties.getFallback();
        double[] mu = new double[n];
        RealMatrix sigma = new Array2DRowRealMatrix(n, n);

        Map<String, Integer> columnIndex = new HashMap<>();
        for (int c = 0; c < columns.size(); c++) {
            columnIndex.put(columns.get(c), c);
        }
        double[][] logReturns = logReturns(prices);
        RealMatrix historyCovariance = columns.isEmpty()
                ? null
                : new Covariance(logReturns, true).getCovarianceMatrix().scalarMultiply(tradingDays);

        for (int i = 0; i < n; i++) {
            String symbol = symbols.get(i);
            Integer ci = columnIndex.get(symbol);
            if (ci == null) {
                mu[i] = symbolNormalizer.isStablecoin(symbol) ? fallback.getStablecoinReturn() : fallback.getDefaultReturn();
                sigma.setEntry(i, i, fallback.getVariance());
                continue;
            }
            mu[i] = StatUtils.mean(column(logReturns, ci)) * tradingDays;
            for (int j = 0; j < n; j++) {
                Integer cj = columnIndex.get(symbols.get(j));
                if (cj != null) {
                    sigma.setEntry(i, j, historyCovariance.getEntry(ci, cj));
                }
            }
        }

        if (columns.isEmpty()) {
            log.warn("Price data unavailable for {} symbols, using heuristic inputs", n);
        } else if (columns.size() < n) {
            log.warn("Price data unavailable for {} of {} symbols, using heuristic inputs for them", n - columns.size(), n);
        }
        return new OptimizationInputs(List.copyOf(symbols), mu, sigma, new LinkedHashSet<>(columns),
                prices, List.copyOf(columns), returnRows);
    }

    /**
     * Price matrix on the union of timestamps, forward-filled, with any row that still has
     * a gap dropped.
     */
    private double[][] alignedPrices(List<String> columns, Map<String, PriceSeries> history) {
        if (columns.isEmpty()) {
            return new double[0][0];
        }
        TreeSet<Instant> timestamps = new TreeSet<>();
        List<Map<Instant, Double>> byColumn = new ArrayList<>();
        for (String symbol : columns) {
            Map<Instant, Double> closes = new HashMap<>();
            for (PricePoint point : history.get(symbol).points()) {
                closes.put(point.timestamp(), point.close());
                timestamps.add(point.timestamp());
            }
            byColumn.add(closes);
        }

        List<double[]> rows = new ArrayList<>();
        double[] last = new double[columns.size()];
        Arrays.fill(last, Double.NaN);
        for (Instant timestamp : timestamps) {
            double[] row = new double[columns.size()];
            boolean complete = true;
            for (int c = 0; c < columns.size(); c++) {
                Double close = byColumn.get(c).get(timestamp);
                if (close != null) {
                    last[c] = close;
                }
                row[c] = last[c];
                if (Double.isNaN(row[c])) {
                    complete = false;
                }
            }
            if (complete) {
                rows.add(row);
            }
        }
        return rows.toArray(new double[0][]);
    }

    private static double[][] logReturns(double[][] prices) {
        if (prices.length < 2) {
            return new double[0][0];
        }
        int cols = prices[0].length;
        double[][] returns = new double[prices.length - 1][cols];
        for (int t = 1; t < prices.length; t++) {
            for (int c = 0; c < cols; c++) {
                returns[t - 1][c] = Math.log(prices[t][c] / prices[t - 1][c]);
            }
        }
        return returns;
    }

    private static double[] column(double[][] matrix, int index) {
        double[] values = new double[matrix.length];
        for (int r = 0; r < matrix.length; r++) {
            values[r] = matrix[r][index];
        }
        return values;
    }
}
