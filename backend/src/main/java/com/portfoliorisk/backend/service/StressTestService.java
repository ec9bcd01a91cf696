package com.portfoliorisk.backend.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.portfoliorisk.backend.config.RiskProperties;
import com.portfoliorisk.backend.dto.Recommendation;
import com.portfoliorisk.backend.dto.StressScenarioResult;
import com.portfoliorisk.backend.dto.StressSummary;
import com.portfoliorisk.backend.dto.StressTestReport;
import com.portfoliorisk.backend.dto.StressedPosition;
import com.portfoliorisk.backend.exception.PortfolioRiskException;
import com.portfoliorisk.backend.model.Portfolio;
import com.portfoliorisk.backend.model.Position;
import com.portfoliorisk.backend.model.StressScenario;
import com.portfoliorisk.backend.model.StressSeverity;
import com.portfoliorisk.backend.service.market.SymbolNormalizer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Applies predefined market shocks to the current holdings.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StressTestService {

    private static final String BENCHMARK = "BTC";
    private static final double DEFAULT_SHOCK = -0.20;

    private final ObjectMapper objectMapper = new ObjectMapper();

    private final SymbolNormalizer symbolNormalizer;
    private final RiskProperties riskProperties;

    private volatile Map<String, StressScenario> scenarios = Map.of();

    @PostConstruct
    public void init() {
        String resource = riskProperties.getStress().getScenariosResource();
        try (InputStream in = new ClassPathResource(resource).getInputStream()) {
            Map<String, StressScenario> loaded = objectMapper.readValue(in, new TypeReference<LinkedHashMap<String, StressScenario>>() {});
            scenarios = Collections.unmodifiableMap(loaded);
            log.info("Loaded {} stress scenarios from {}", scenarios.size(), resource);
        } catch (IOException e) {
            throw new PortfolioRiskException("Failed to load stress scenarios from " + resource, e);
        }
    }

    public Map<String, StressScenario> getScenarios() {
        return scenarios;
    }

    public StressTestReport runStressTests(Portfolio portfolio, List<String> requested) {
        if (portfolio == null || portfolio.isEmpty()) {
            return failure("No positions available for stress testing");
        }
        List<String> names = requested == null || requested.isEmpty() ? new ArrayList<>(scenarios.keySet()) : requested;
        List<String> tested = new ArrayList<>();
        for (String name : names) {
            if (scenarios.containsKey(name)) {
                tested.add(name);
            } else {
                log.debug("Ignoring unknown stress scenario {}", name);
            }
        }
        if (tested.isEmpty()) {
            return failure("No valid stress scenarios requested");
        }

        double originalValue = portfolioValue(portfolio);
        Map<String, StressScenarioResult> results = new LinkedHashMap<>();
        for (String name : tested) {
            results.put(name, runScenario(portfolio, originalValue, name, scenarios.get(name)));
        }

        return StressTestReport.builder()
                .success(true)
                .portfolioValue(originalValue)
                .results(results)
                .summary(summarize(results))
                .recommendations(recommendations(results))
                .scenariosTested(tested)
                .build();
    }

    StressScenarioResult runScenario(Portfolio portfolio, double originalValue, String key, StressScenario scenario) {
        List<StressedPosition> stressed = new ArrayList<>();
        double stressedTotal = 0.0;
        for (Position position : portfolio.positions()) {
            double shock = shockFor(position.symbol(), scenario);
            double value = position.valueUsd();
            double stressedValue = value * (1.0 + shock);
            stressedTotal += stressedValue;
            stressed.add(StressedPosition.builder()
                    .symbol(position.symbol())
                    .originalValue(value)
                    .stressedValue(stressedValue)
                    .shockApplied(shock)
                    .lossAmount(value - stressedValue)
                    .lossPct(-shock * 100)
                    .build());
        }
        double totalLoss = originalValue - stressedTotal;
        double lossPct = originalValue > 0 ? totalLoss / originalValue * 100 : 0.0;
        StressSeverity severity = StressSeverity.fromLossPct(lossPct);
        return StressScenarioResult.builder()
                .scenario(key)
                .name(scenario.name())
                .description(scenario.description())
                .probability(scenario.probability())
                .originalValue(originalValue)
                .stressedValue(stressedTotal)
                .totalLoss(totalLoss)
                .lossPct(lossPct)
                .maxPositionLossPct(stressed.stream().mapToDouble(StressedPosition::getLossPct).max().orElse(0.0))
                .avgPositionLossPct(stressed.stream().mapToDouble(StressedPosition::getLossPct).average().orElse(0.0))
                .severity(severity)
                .recoveryEstimate(severity.recoveryEstimate())
                .positions(stressed)
                .build();
    }

    double shockFor(String symbol, StressScenario scenario) {
        if (symbolNormalizer.isStablecoin(symbol)) {
            return riskProperties.getStress().getStablecoinShock();
        }
        Double shock = scenario.shocks().get(symbolNormalizer.baseAsset(symbol));
        if (shock != null) {
            return shock;
        }
        return scenario.shocks().getOrDefault(BENCHMARK, DEFAULT_SHOCK);
    }

    StressSummary summarize(Map<String, StressScenarioResult> results) {
        double[] losses = results.values().stream().mapToDouble(StressScenarioResult::getLossPct).toArray();
        double worst = 0.0;
        double sum = 0.0;
        double expected = 0.0;
        int severe = 0;
        for (StressScenarioResult result : results.values()) {
            worst = Math.max(worst, result.getLossPct());
            sum += result.getLossPct();
            expected += result.getProbability() * result.getLossPct();
            if (result.getLossPct() > riskProperties.getStress().getSevereLossPct()) {
                severe++;
            }
        }
        double average = losses.length > 0 ? sum / losses.length : 0.0;
        return StressSummary.builder()
                .worstCaseLossPct(worst)
                .averageLossPct(average)
                .medianLossPct(losses.length > 0 ? new Median().evaluate(losses) : 0.0)
                .expectedLossPct(expected)
                .severeScenarioCount(severe)
                .scenariosTested(losses.length)
                .resilienceScore(Math.max(0.0, 10.0 - average / 5.0))
                .recommendedHedgeRatio(Math.min(0.3, worst / 100.0))
                .build();
    }

    List<Recommendation> recommendations(Map<String, StressScenarioResult> results) {
        List<Recommendation> recommendations = new ArrayList<>();
        double worst = 0.0;
        for (StressScenarioResult result : results.values()) {
            worst = Math.max(worst, result.getLossPct());
            if (result.getSeverity() == StressSeverity.EXTREME) {
                recommendations.add(Recommendation.builder()
                        .category("CRITICAL")
                        .priority("HIGH")
                        .message(String.format("Portfolio highly vulnerable to %s ($%,.0f loss)", result.getScenario(), result.getTotalLoss()))
                        .metric(String.format("loss %.1f%%", result.getLossPct()))
                        .suggestedActions(List.of(
                                "Consider reducing position sizes",
                                "Add hedging instruments",
                                "Diversify across uncorrelated assets"))
                        .build());
            } else if (result.getSeverity() == StressSeverity.HIGH) {
                recommendations.add(Recommendation.builder()
                        .category("WARNING")
                        .priority("MEDIUM")
                        .message(String.format("Significant exposure to %s scenario", result.getScenario()))
                        .metric(String.format("loss %.1f%%", result.getLossPct()))
                        .suggestedActions(List.of("Review position concentrations", "Consider partial hedging"))
                        .build());
            }
        }
        if (worst > 70) {
            recommendations.add(Recommendation.builder()
                    .category("PORTFOLIO")
                    .priority("HIGH")
                    .message("Portfolio lacks sufficient diversification for extreme scenarios")
                    .suggestedActions(List.of(
                            "Add uncorrelated assets",
                            "Consider systematic hedging strategy",
                            "Reduce overall crypto allocation"))
                    .build());
        }
        return recommendations;
    }

    private double portfolioValue(Portfolio portfolio) {
        if (portfolio.totalValueUsd() > 0) {
            return portfolio.totalValueUsd();
        }
        return portfolio.positions().stream().mapToDouble(Position::valueUsd).sum();
    }

    private StressTestReport failure(String reason) {
        return StressTestReport.builder()
                .success(false)
                .error(reason)
                .results(Map.of())
                .recommendations(List.of())
                .scenariosTested(List.of())
                .build();
    }
}
