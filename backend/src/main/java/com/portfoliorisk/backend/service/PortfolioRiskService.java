package com.portfoliorisk.backend.service;

import com.portfoliorisk.backend.config.RiskProperties;
import com.portfoliorisk.backend.dto.CompleteAssessmentReport;
import com.portfoliorisk.backend.dto.CorrelationReport;
import com.portfoliorisk.backend.dto.HealthScore;
import com.portfoliorisk.backend.dto.OptimizationReport;
import com.portfoliorisk.backend.dto.PortfolioSummary;
import com.portfoliorisk.backend.dto.PositionSizingReport;
import com.portfoliorisk.backend.dto.Recommendation;
import com.portfoliorisk.backend.dto.RiskAlert;
import com.portfoliorisk.backend.dto.RiskAnalysisReport;
import com.portfoliorisk.backend.dto.ServiceHealthReport;
import com.portfoliorisk.backend.dto.StressScenarioResult;
import com.portfoliorisk.backend.dto.StressTestReport;
import com.portfoliorisk.backend.exception.PortfolioRiskException;
import com.portfoliorisk.backend.model.OptimizationConstraints;
import com.portfoliorisk.backend.model.OptimizationResult;
import com.portfoliorisk.backend.model.OptimizationStrategy;
import com.portfoliorisk.backend.model.Portfolio;
import com.portfoliorisk.backend.model.RiskMetrics;
import com.portfoliorisk.backend.model.StressSeverity;
import com.portfoliorisk.backend.model.TradingMode;
import com.portfoliorisk.backend.model.TradingOpportunity;
import com.portfoliorisk.backend.service.market.HistoricalPriceCache;
import com.portfoliorisk.backend.service.optimization.PortfolioOptimizationEngine;
import com.portfoliorisk.backend.service.port.PortfolioProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Entry point for portfolio risk operations. Every call returns a report; failures are
 * reported through {@code success=false} and a short reason.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PortfolioRiskService {

    private static final String PORTFOLIO_UNAVAILABLE = "Portfolio unavailable";

    private final PortfolioProvider portfolioProvider;
    private final RiskCalculationEngine riskCalculationEngine;
    private final PortfolioOptimizationEngine optimizationEngine;
    private final CorrelationService correlationService;
    private final StressTestService stressTestService;
    private final PositionSizingService positionSizingService;
    private final HealthScoreCalculator healthScoreCalculator;
    private final HistoricalPriceCache priceCache;
    private final RiskEngineMetrics metrics;
    private final RiskProperties riskProperties;
    private final Clock clock;

    public RiskAnalysisReport analyzeRisk(String userId) {
        String requestId = newRequestId();
        log.info("Risk analysis requested user={} requestId={}", userId, requestId);
        PortfolioLoad load = loadPortfolio(userId, requestId);
        if (load.error() != null) {
            return riskFailure(requestId, userId, load.error());
        }
        return analyzeRisk(requestId, userId, load.portfolio());
    }

    public OptimizationReport optimizeAllocation(String userId, String strategy) {
        return optimizeAllocation(userId, strategy, OptimizationConstraints.none());
    }

    /** Unknown strategy names fall back to ADAPTIVE. */
    public OptimizationReport optimizeAllocation(String userId, String strategy, OptimizationConstraints constraints) {
        Optional<OptimizationStrategy> parsed = OptimizationStrategy.fromCode(strategy);
        if (parsed.isEmpty()) {
            log.warn("Unknown optimization strategy '{}' for user {}, using adaptive", strategy, userId);
        }
        OptimizationReport report = optimizeAllocation(userId, parsed.orElse(OptimizationStrategy.ADAPTIVE), constraints);
        report.setStrategyFallback(parsed.isEmpty());
        return report;
    }

    public OptimizationReport optimizeAllocation(String userId, OptimizationStrategy strategy, OptimizationConstraints constraints) {
        String requestId = newRequestId();
        OptimizationStrategy tag = strategy == null ? OptimizationStrategy.ADAPTIVE : strategy;
        log.info("Optimization requested user={} requestId={} strategy={}", userId, requestId, tag.code());
        PortfolioLoad load = loadPortfolio(userId, requestId);
        if (load.error() != null) {
            return optimizationFailure(requestId, userId, tag, load.error());
        }
        return optimizeAllocation(requestId, userId, load.portfolio(), tag, constraints);
    }

    public CorrelationReport correlationAnalysis(String userId) {
        return correlationAnalysis(userId, riskProperties.getCorrelation().getLookbackDays());
    }

    public CorrelationReport correlationAnalysis(String userId, int lookbackDays) {
        String requestId = newRequestId();
        log.info("Correlation analysis requested user={} requestId={} lookback={}", userId, requestId, lookbackDays);
        PortfolioLoad load = loadPortfolio(userId, requestId);
        if (load.error() != null) {
            return correlationFailure(requestId, userId, lookbackDays, load.error());
        }
        return correlationAnalysis(requestId, userId, load.portfolio(), lookbackDays);
    }

    public StressTestReport stressTest(String userId) {
        return stressTest(userId, null);
    }

    public StressTestReport stressTest(String userId, List<String> scenarios) {
        String requestId = newRequestId();
        log.info("Stress test requested user={} requestId={} scenarios={}", userId, requestId, scenarios);
        PortfolioLoad load = loadPortfolio(userId, requestId);
        if (load.error() != null) {
            return stamp(StressTestReport.builder().success(false).error(load.error()).build(), requestId, userId);
        }
        return stressTest(requestId, userId, load.portfolio(), scenarios);
    }

    /** Unknown or blank mode names size as BALANCED. */
    public PositionSizingReport positionSizing(String userId, TradingOpportunity opportunity, String mode) {
        return positionSizing(userId, opportunity, TradingMode.parseOrDefault(mode));
    }

    public PositionSizingReport positionSizing(String userId, TradingOpportunity opportunity, TradingMode mode) {
        String requestId = newRequestId();
        log.info("Position sizing requested user={} requestId={} symbol={}", userId, requestId,
                opportunity == null ? null : opportunity.symbol());
        PositionSizingReport report;
        PortfolioLoad load = loadPortfolio(userId, requestId);
        if (load.error() != null) {
            report = PositionSizingReport.builder().success(false).error(load.error()).build();
        } else {
            try {
                report = positionSizingService.calculate(load.portfolio(), opportunity, mode);
            } catch (RuntimeException e) {
                log.error("Position sizing failed user={} requestId={}", userId, requestId, e);
                report = PositionSizingReport.builder().success(false).error("Position sizing failed").build();
            }
        }
        report.setRequestId(requestId);
        report.setUserId(userId);
        report.setTimestamp(clock.instant());
        return report;
    }

    public CompleteAssessmentReport completeAssessment(String userId) {
        return completeAssessment(userId, true, true);
    }

    public CompleteAssessmentReport completeAssessment(String userId, boolean includeOptimization, boolean includeStressTest) {
        String requestId = newRequestId();
        log.info("Complete assessment requested user={} requestId={} optimization={} stress={}",
                userId, requestId, includeOptimization, includeStressTest);
        PortfolioLoad load = loadPortfolio(userId, requestId);
        if (load.error() != null) {
            return CompleteAssessmentReport.builder()
                    .success(false)
                    .error(load.error())
                    .requestId(requestId)
                    .userId(userId)
                    .timestamp(clock.instant())
                    .build();
        }
        Portfolio portfolio = load.portfolio();

        RiskAnalysisReport risk = analyzeRisk(requestId, userId, portfolio);
        CorrelationReport correlation = portfolio.symbols().size() >= 2
                ? correlationAnalysis(requestId, userId, portfolio, riskProperties.getCorrelation().getLookbackDays())
                : null;
        OptimizationReport optimization = includeOptimization
                ? optimizeAllocation(requestId, userId, portfolio, OptimizationStrategy.ADAPTIVE, OptimizationConstraints.none())
                : null;
        StressTestReport stress = includeStressTest ? stressTest(requestId, userId, portfolio, null) : null;

        HealthScore healthScore = healthScoreCalculator.calculate(
                risk.isSuccess() ? risk.getRiskMetrics() : null,
                correlation != null && correlation.isSuccess() ? correlation.getAverageCorrelation() : null,
                optimization != null && optimization.isSuccess() ? allocationDrift(portfolio, optimization.getResult()) : null,
                stress != null && stress.isSuccess() ? stress.getSummary().getResilienceScore() : null);

        Map<String, Boolean> completeness = new LinkedHashMap<>();
        completeness.put("riskAnalysis", risk.isSuccess());
        completeness.put("correlationAnalysis", correlation != null && correlation.isSuccess());
        completeness.put("optimization", optimization != null && optimization.isSuccess());
        completeness.put("stressTest", stress != null && stress.isSuccess());

        return CompleteAssessmentReport.builder()
                .success(risk.isSuccess())
                .error(risk.isSuccess() ? null : risk.getError())
                .requestId(requestId)
                .userId(userId)
                .timestamp(clock.instant())
                .riskAnalysis(risk)
                .correlationAnalysis(correlation)
                .optimization(optimization)
                .stressTest(stress)
                .healthScore(healthScore)
                .recommendations(comprehensiveRecommendations(risk, correlation, optimization, stress))
                .completeness(completeness)
                .build();
    }

    public ServiceHealthReport healthCheck() {
        Map<String, String> components = new LinkedHashMap<>();
        components.put("riskCalculationEngine", "operational");
        components.put("optimizationEngine", "operational (" + OptimizationStrategy.values().length + " strategies)");
        components.put("correlationEngine", "operational");
        int scenarioCount = stressTestService.getScenarios().size();
        components.put("stressTestingEngine", scenarioCount > 0 ? "operational" : "no scenarios loaded");
        components.put("positionSizingEngine", "operational");
        return ServiceHealthReport.builder()
                .status(scenarioCount > 0 ? "HEALTHY" : "DEGRADED")
                .timestamp(clock.instant())
                .components(components)
                .counters(metrics.snapshot())
                .cachedPriceSeries(priceCache.size())
                .stressScenarios(scenarioCount)
                .build();
    }

    private RiskAnalysisReport analyzeRisk(String requestId, String userId, Portfolio portfolio) {
        if (portfolio.isEmpty()) {
            return riskFailure(requestId, userId, "No positions found for risk analysis");
        }
        RiskProperties.Metrics config = riskProperties.getMetrics();
        try {
            RiskMetrics riskMetrics = riskCalculationEngine.calculatePortfolioRisk(
                    portfolio, config.getLookbackDays(), config.getConfidenceLevels());
            List<RiskAlert> alerts = alerts(riskMetrics);
            metrics.recordRiskAssessment();
            metrics.recordRiskAlerts(alerts.size());
            return RiskAnalysisReport.builder()
                    .success(true)
                    .requestId(requestId)
                    .userId(userId)
                    .timestamp(clock.instant())
                    .portfolioValue(portfolio.totalValueUsd())
                    .riskMetrics(riskMetrics)
                    .alerts(alerts)
                    .lookbackDays(config.getLookbackDays())
                    .confidenceLevels(List.copyOf(config.getConfidenceLevels()))
                    .benchmark(config.getBenchmark())
                    .build();
        } catch (RuntimeException e) {
            log.error("Risk analysis failed user={} requestId={}", userId, requestId, e);
            return riskFailure(requestId, userId, "Risk analysis failed");
        }
    }

    private OptimizationReport optimizeAllocation(String requestId, String userId, Portfolio portfolio,
                                                  OptimizationStrategy strategy, OptimizationConstraints constraints) {
        if (portfolio.isEmpty()) {
            OptimizationReport report = optimizationFailure(requestId, userId, strategy, "No positions found for optimization");
            report.setResult(OptimizationResult.empty(strategy));
            return report;
        }
        try {
            OptimizationResult result = optimizationEngine.optimizePortfolio(portfolio, strategy, constraints);
            return OptimizationReport.builder()
                    .success(true)
                    .requestId(requestId)
                    .userId(userId)
                    .timestamp(clock.instant())
                    .strategy(strategy)
                    .result(result)
                    .currentPortfolio(summarize(portfolio))
                    .build();
        } catch (RuntimeException e) {
            log.error("Optimization failed user={} requestId={} strategy={}", userId, requestId, strategy.code(), e);
            return optimizationFailure(requestId, userId, strategy, "Optimization failed");
        }
    }

    private CorrelationReport correlationAnalysis(String requestId, String userId, Portfolio portfolio, int lookbackDays) {
        CorrelationReport report;
        try {
            report = correlationService.analyze(portfolio, lookbackDays);
        } catch (RuntimeException e) {
            log.error("Correlation analysis failed user={} requestId={}", userId, requestId, e);
            return correlationFailure(requestId, userId, lookbackDays, "Correlation analysis failed");
        }
        report.setRequestId(requestId);
        report.setUserId(userId);
        report.setTimestamp(clock.instant());
        return report;
    }

    private StressTestReport stressTest(String requestId, String userId, Portfolio portfolio, List<String> scenarios) {
        StressTestReport report;
        try {
            report = stressTestService.runStressTests(portfolio, scenarios);
        } catch (RuntimeException e) {
            log.error("Stress test failed user={} requestId={}", userId, requestId, e);
            report = StressTestReport.builder().success(false).error("Stress test failed").build();
        }
        return stamp(report, requestId, userId);
    }

    List<RiskAlert> alerts(RiskMetrics riskMetrics) {
        RiskProperties.Alerts thresholds = riskProperties.getAlerts();
        List<RiskAlert> alerts = new ArrayList<>();
        if (riskMetrics.var95() > thresholds.getHighVar()) {
            alerts.add(RiskAlert.builder()
                    .type("HIGH_VAR")
                    .severity("HIGH")
                    .message(String.format("Daily VaR(95%%) of %.1f%% exceeds %.0f%%", riskMetrics.var95() * 100, thresholds.getHighVar() * 100))
                    .value(riskMetrics.var95())
                    .threshold(thresholds.getHighVar())
                    .build());
        }
        if (riskMetrics.sharpeRatio() < thresholds.getLowSharpe()) {
            alerts.add(RiskAlert.builder()
                    .type("LOW_SHARPE")
                    .severity("MEDIUM")
                    .message(String.format("Sharpe ratio %.2f is below %.2f", riskMetrics.sharpeRatio(), thresholds.getLowSharpe()))
                    .value(riskMetrics.sharpeRatio())
                    .threshold(thresholds.getLowSharpe())
                    .build());
        }
        if (riskMetrics.maximumDrawdown() > thresholds.getHighDrawdown()) {
            alerts.add(RiskAlert.builder()
                    .type("HIGH_DRAWDOWN")
                    .severity("HIGH")
                    .message(String.format("Maximum drawdown of %.1f%% exceeds %.0f%%", riskMetrics.maximumDrawdown() * 100, thresholds.getHighDrawdown() * 100))
                    .value(riskMetrics.maximumDrawdown())
                    .threshold(thresholds.getHighDrawdown())
                    .build());
        }
        return alerts;
    }

    List<Recommendation> comprehensiveRecommendations(RiskAnalysisReport risk,
                                                      CorrelationReport correlation,
                                                      OptimizationReport optimization,
                                                      StressTestReport stress) {
        List<Recommendation> recommendations = new ArrayList<>();
        if (risk != null && risk.isSuccess()) {
            RiskMetrics riskMetrics = risk.getRiskMetrics();
            if (riskMetrics.var95() > 0.05) {
                recommendations.add(Recommendation.builder()
                        .category("RISK_MANAGEMENT")
                        .priority("HIGH")
                        .message("High portfolio risk detected - consider position size reduction")
                        .metric(String.format("VaR 95%%: %.1f%%", riskMetrics.var95() * 100))
                        .build());
            }
            if (riskMetrics.sharpeRatio() < 1.0) {
                recommendations.add(Recommendation.builder()
                        .category("PERFORMANCE")
                        .priority("MEDIUM")
                        .message("Low risk-adjusted returns - review asset allocation")
                        .metric(String.format("Sharpe Ratio: %.2f", riskMetrics.sharpeRatio()))
                        .build());
            }
        }
        if (correlation != null && correlation.isSuccess()
                && correlation.getAverageCorrelation() > riskProperties.getCorrelation().getHighCorrelationThreshold()) {
            recommendations.add(Recommendation.builder()
                    .category("DIVERSIFICATION")
                    .priority("HIGH")
                    .message("Holdings move together - add less correlated assets")
                    .metric(String.format("Average correlation: %.2f", correlation.getAverageCorrelation()))
                    .build());
        }
        if (optimization != null && optimization.isSuccess() && optimization.getResult().rebalancingNeeded()) {
            recommendations.add(Recommendation.builder()
                    .category("OPTIMIZATION")
                    .priority("MEDIUM")
                    .message("Portfolio has drifted from its target allocation - consider rebalancing")
                    .metric(optimization.getResult().suggestedTrades().size() + " suggested trades")
                    .build());
        }
        if (stress != null && stress.isSuccess()) {
            for (StressScenarioResult result : stress.getResults().values()) {
                if (result.getSeverity() == StressSeverity.EXTREME) {
                    recommendations.add(Recommendation.builder()
                            .category("STRESS")
                            .priority("HIGH")
                            .message(String.format("Extreme loss under %s scenario", result.getScenario()))
                            .metric(String.format("Loss: %.1f%%", result.getLossPct()))
                            .build());
                }
            }
        }
        return recommendations;
    }

    private double allocationDrift(Portfolio portfolio, OptimizationResult result) {
        Map<String, Double> current = portfolio.currentWeights();
        double drift = 0.0;
        for (Map.Entry<String, Double> entry : result.weights().entrySet()) {
            drift += Math.abs(entry.getValue() - current.getOrDefault(entry.getKey(), 0.0));
        }
        return drift;
    }

    private PortfolioSummary summarize(Portfolio portfolio) {
        return PortfolioSummary.builder()
                .totalValueUsd(portfolio.totalValueUsd())
                .positionCount(portfolio.positions().size())
                .source(portfolio.source())
                .exchangeBreakdown(portfolio.exchangeBreakdown())
                .currentWeights(portfolio.currentWeights())
                .build();
    }

    private PortfolioLoad loadPortfolio(String userId, String requestId) {
        try {
            Portfolio portfolio = portfolioProvider.getConsolidatedPortfolio(userId);
            return new PortfolioLoad(portfolio == null ? Portfolio.empty(userId, clock.instant()) : portfolio, null);
        } catch (PortfolioRiskException e) {
            log.warn("Portfolio load failed user={} requestId={}: {}", userId, requestId, e.getMessage());
            return new PortfolioLoad(null, e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Portfolio load failed user={} requestId={}", userId, requestId, e);
            return new PortfolioLoad(null, PORTFOLIO_UNAVAILABLE);
        }
    }

    String newRequestId() {
        String suffix = UUID.randomUUID().toString().replace("-", "").substring(0, 8);
        return "PRS_" + clock.instant().getEpochSecond() + "_" + suffix;
    }

    private RiskAnalysisReport riskFailure(String requestId, String userId, String reason) {
        return RiskAnalysisReport.builder()
                .success(false)
                .error(reason)
                .requestId(requestId)
                .userId(userId)
                .timestamp(clock.instant())
                .riskMetrics(RiskMetrics.zero())
                .alerts(List.of())
                .build();
    }

    private OptimizationReport optimizationFailure(String requestId, String userId, OptimizationStrategy strategy, String reason) {
        return OptimizationReport.builder()
                .success(false)
                .error(reason)
                .requestId(requestId)
                .userId(userId)
                .timestamp(clock.instant())
                .strategy(strategy)
                .build();
    }

    private CorrelationReport correlationFailure(String requestId, String userId, int lookbackDays, String reason) {
        return CorrelationReport.builder()
                .success(false)
                .error(reason)
                .requestId(requestId)
                .userId(userId)
                .timestamp(clock.instant())
                .lookbackDays(lookbackDays)
                .correlationMatrix(Map.of())
                .clusters(List.of())
                .recommendations(List.of())
                .build();
    }

    private StressTestReport stamp(StressTestReport report, String requestId, String userId) {
        report.setRequestId(requestId);
        report.setUserId(userId);
        report.setTimestamp(clock.instant());
        return report;
    }

    private record PortfolioLoad(Portfolio portfolio, String error) {}
}
