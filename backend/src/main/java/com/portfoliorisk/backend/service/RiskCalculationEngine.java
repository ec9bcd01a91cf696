package com.portfoliorisk.backend.service;

import com.portfoliorisk.backend.config.RiskProperties;
import com.portfoliorisk.backend.model.Portfolio;
import com.portfoliorisk.backend.model.PriceSeries;
import com.portfoliorisk.backend.model.RiskMetrics;
import com.portfoliorisk.backend.service.market.AlignedReturns;
import com.portfoliorisk.backend.service.market.HistoricalPriceCache;
import com.portfoliorisk.backend.service.market.SymbolNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.correlation.Covariance;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Portfolio-level VaR, expected shortfall, drawdown and performance ratios from daily
 * returns, benchmarked against BTC.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RiskCalculationEngine {

    private static final String DAILY = "1d";

    private final HistoricalPriceCache priceCache;
    private final SyntheticReturnGenerator syntheticReturnGenerator;
    private final SymbolNormalizer symbolNormalizer;
    private final CvarService cvarService;
    private final RiskProperties riskProperties;

    public RiskMetrics calculatePortfolioRisk(Portfolio portfolio) {
        RiskProperties.Metrics metrics = riskProperties.getMetrics();
        return calculatePortfolioRisk(portfolio, metrics.getLookbackDays(), metrics.getConfidenceLevels());
    }

    public RiskMetrics calculatePortfolioRisk(Portfolio portfolio, int lookbackDays, List<Double> confidenceLevels) {
        if (portfolio == null || portfolio.isEmpty()) {
            return RiskMetrics.zero();
        }
        Map<String, Double> weights = portfolio.currentWeights();
        double totalValue = portfolio.valueBySymbol().values().stream().mapToDouble(Double::doubleValue).sum();
        if (totalValue <= 0) {
            return RiskMetrics.zero();
        }
        double lowerConfidence = confidenceLevels.isEmpty() ? 0.95 : confidenceLevels.get(0);
        double upperConfidence = confidenceLevels.size() > 1 ? confidenceLevels.get(1) : 0.99;

        List<String> symbols = new ArrayList<>(weights.keySet());
        String benchmark = riskProperties.getMetrics().getBenchmark();
        List<String> toFetch = new ArrayList<>(symbols);
        if (!containsAsset(symbols, benchmark)) {
            toFetch.add(benchmark);
        }
        Map<String, PriceSeries> history = priceCache.fetchAll(toFetch, lookbackDays + 1, DAILY);

        Map<String, PriceSeries> realHistory = new LinkedHashMap<>();
        for (String symbol : symbols) {
            PriceSeries series = history.get(symbol);
            if (series != null && series.size() >= 2) {
                realHistory.put(symbol, series);
            }
        }
        AlignedReturns aligned = AlignedReturns.of(realHistory).tail(lookbackDays);
        boolean dated = aligned.length() >= 2;
        if (!realHistory.isEmpty() && !dated) {
            log.warn("Price histories for {} share too few dates, using synthetic returns", realHistory.keySet());
        }
        int length = dated ? aligned.length() : lookbackDays;

        Map<String, List<Double>> assetReturns = new LinkedHashMap<>();
        for (String symbol : symbols) {
            if (dated && aligned.contains(symbol)) {
                assetReturns.put(symbol, aligned.returns(symbol));
            } else {
                log.warn("No price history for {}, using synthetic returns", symbol);
                assetReturns.put(symbol, syntheticReturnGenerator.generate(symbol, length));
            }
        }

        List<Double> portfolioReturns = new ArrayList<>(length);
        for (int t = 0; t < length; t++) {
            double value = 0.0;
            for (String symbol : symbols) {
                value += weights.get(symbol) * assetReturns.get(symbol).get(t);
            }
            portfolioReturns.add(value);
        }
        if (portfolioReturns.isEmpty()) {
            return RiskMetrics.zero();
        }

        double[] returns = toArray(portfolioReturns);
        int tradingDays = riskProperties.getTradingDays();
        double riskFree = riskProperties.getRiskFreeRate();

        double var95 = cvarService.valueAtRisk(portfolioReturns, lowerConfidence);
        double var99 = cvarService.valueAtRisk(portfolioReturns, upperConfidence);
        double expectedShortfall = cvarService.expectedShortfall(portfolioReturns, lowerConfidence);
        double maxDrawdown = maxDrawdown(returns);

        double annualReturn = StatUtils.mean(returns) * tradingDays;
        double volatility = Math.sqrt(StatUtils.populationVariance(returns)) * Math.sqrt(tradingDays);
        double sharpe = volatility > 0 ? (annualReturn - riskFree) / volatility : 0.0;
        double downside = downsideDeviation(returns) * Math.sqrt(tradingDays);
        double sortino = downside > 0 ? (annualReturn - riskFree) / downside : 0.0;

        double beta = 0.0;
        double alpha = 0.0;
        double correlation = 0.0;
        List<Double> market = marketReturns(history, dated ? aligned : null, assetReturns, benchmark, lookbackDays);
        double[][] paired = pairWithMarket(portfolioReturns, market);
        if (paired[0].length >= 2) {
            double[] p = paired[0];
            double[] m = paired[1];
            double marketVariance = StatUtils.populationVariance(m);
            if (marketVariance > 0) {
                beta = new Covariance().covariance(p, m, true) / marketVariance;
            }
            alpha = StatUtils.mean(p) * tradingDays - beta * StatUtils.mean(m) * tradingDays;
            correlation = finiteOrZero(new PearsonsCorrelation().correlation(p, m));
        }

        return new RiskMetrics(
                finiteOrZero(var95),
                finiteOrZero(Math.max(var99, var95)),
                finiteOrZero(expectedShortfall),
                maxDrawdown,
                finiteOrZero(volatility),
                finiteOrZero(sharpe),
                finiteOrZero(sortino),
                finiteOrZero(beta),
                finiteOrZero(alpha),
                correlation);
    }

    /** Largest peak-to-trough decline of the compounded wealth curve, in [0, 1]. */
    public double maxDrawdown(double[] returns) {
        double wealth = 1.0;
        double peak = 1.0;
        double worst = 0.0;
        for (double r : returns) {
            wealth *= 1.0 + r;
            peak = Math.max(peak, wealth);
            if (peak > 0) {
                worst = Math.max(worst, (peak - wealth) / peak);
            }
        }
        if (!Double.isFinite(worst)) {
            return 0.0;
        }
        return Math.min(1.0, Math.max(0.0, worst));
    }

    /**
     * Benchmark returns. With dated portfolio returns they cover the same intervals, {@code NaN}
     * where the benchmark has no close.
     */
    private List<Double> marketReturns(Map<String, PriceSeries> history,
                                       AlignedReturns aligned,
                                       Map<String, List<Double>> assetReturns,
                                       String benchmark,
                                       int lookbackDays) {
        PriceSeries real = history.get(benchmark);
        if (real == null) {
            for (Map.Entry<String, PriceSeries> entry : history.entrySet()) {
                if (symbolNormalizer.baseAsset(entry.getKey()).equals(benchmark)) {
                    real = entry.getValue();
                    break;
                }
            }
        }
        if (real != null && real.size() >= 2) {
            return aligned != null ? aligned.returnsOf(real) : tail(real.simpleReturns(), lookbackDays);
        }
        for (Map.Entry<String, List<Double>> entry : assetReturns.entrySet()) {
            if (symbolNormalizer.baseAsset(entry.getKey()).equals(benchmark)) {
                return entry.getValue();
            }
        }
        return List.of();
    }

    /** Portfolio and market returns as two arrays of equal length, skipping gaps in the market. */
    private static double[][] pairWithMarket(List<Double> portfolio, List<Double> market) {
        if (portfolio.size() != market.size()) {
            int common = Math.min(portfolio.size(), market.size());
            return new double[][] {toArray(tail(portfolio, common)), toArray(tail(market, common))};
        }
        List<Double> p = new ArrayList<>();
        List<Double> m = new ArrayList<>();
        for (int t = 0; t < portfolio.size(); t++) {
            if (Double.isFinite(market.get(t))) {
                p.add(portfolio.get(t));
                m.add(market.get(t));
            }
        }
        return new double[][] {toArray(p), toArray(m)};
    }

    private boolean containsAsset(List<String> symbols, String asset) {
        return symbols.stream().anyMatch(symbol -> symbolNormalizer.baseAsset(symbol).equals(asset));
    }

    private static double downsideDeviation(double[] returns) {
        double[] negatives = Arrays.stream(returns).filter(r -> r < 0).toArray();
        if (negatives.length == 0) {
            return 0.0;
        }
        return Math.sqrt(StatUtils.populationVariance(negatives));
    }

    private static List<Double> tail(List<Double> values, int length) {
        if (values.size() <= length) {
            return values;
        }
        return values.subList(values.size() - length, values.size());
    }

    private static double[] toArray(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).toArray();
    }

    private static double finiteOrZero(double value) {
        return Double.isFinite(value) ? value : 0.0;
    }
}
