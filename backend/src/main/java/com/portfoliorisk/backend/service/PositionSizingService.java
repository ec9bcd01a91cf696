package com.portfoliorisk.backend.service;

import com.portfoliorisk.backend.config.RiskProperties;
import com.portfoliorisk.backend.dto.PositionSizingReport;
import com.portfoliorisk.backend.model.Portfolio;
import com.portfoliorisk.backend.model.TradingMode;
import com.portfoliorisk.backend.model.TradingOpportunity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Quarter-Kelly sizing for a new opportunity, adjusted for trading mode, portfolio heat
 * and correlation with existing holdings.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PositionSizingService {

    private static final double SCALED_ENTRY_THRESHOLD_USD = 10_000;
    private static final double MONITORING_THRESHOLD = 0.05;

    private final CorrelationService correlationService;
    private final RiskProperties riskProperties;

    public PositionSizingReport calculate(Portfolio portfolio, TradingOpportunity opportunity, TradingMode mode) {
        TradingMode tradingMode = mode == null ? TradingMode.BALANCED : mode;
        String symbol = opportunity == null ? null : opportunity.symbol();
        double confidence = opportunity == null ? 0.0 : opportunity.confidencePct() / 100.0;
        double expectedReturn = opportunity == null ? 0.0 : opportunity.expectedReturnPct() / 100.0;

        if (symbol == null || symbol.isBlank() || confidence <= 0) {
            return zero(symbol, tradingMode, "Invalid opportunity data");
        }
        double totalValue = portfolio == null ? 0.0 : portfolio.totalValueUsd();
        if (totalValue <= 0) {
            return zero(symbol, tradingMode, "No portfolio value");
        }

        RiskProperties.Sizing sizing = riskProperties.getSizing();
        double kellySize = kellySize(expectedReturn, confidence);
        double modeAdjusted = kellySize * tradingMode.sizeMultiplier();

        double constrained = Math.min(modeAdjusted, sizing.getMaxPositionPct());
        double heat = portfolioHeat(portfolio);
        if (heat > sizing.getMaxHeat()) {
            constrained *= Math.max(0.5, sizing.getMaxHeat() / heat);
        }
        double correlationAdjustment = correlationAdjustment(symbol, portfolio);
        constrained = Math.max(0.0, constrained * correlationAdjustment);

        double positionValue = totalValue * constrained;
        return PositionSizingReport.builder()
                .success(true)
                .symbol(symbol)
                .tradingMode(tradingMode)
                .recommendedSize(constrained)
                .positionValueUsd(positionValue)
                .kellySize(kellySize)
                .modeAdjustedSize(modeAdjusted)
                .riskAdjustedSize(constrained)
                .portfolioHeat(heat)
                .correlationAdjustment(correlationAdjustment)
                .confidenceUsed(confidence)
                .expectedReturnUsed(expectedReturn)
                .monitoringRequired(constrained > MONITORING_THRESHOLD)
                .entryMethod(positionValue > SCALED_ENTRY_THRESHOLD_USD ? "scaled" : "immediate")
                .build();
    }

    /** Fractional Kelly against an assumed average loss, capped per position. */
    double kellySize(double expectedReturn, double winProbability) {
        if (expectedReturn <= 0) {
            return 0.0;
        }
        RiskProperties.Sizing sizing = riskProperties.getSizing();
        double lossProbability = 1.0 - winProbability;
        double kelly = (expectedReturn * winProbability - sizing.getAverageLoss() * lossProbability) / expectedReturn;
        return Math.min(Math.max(0.0, kelly * sizing.getKellyFraction()), sizing.getMaxPositionPct());
    }

    double portfolioHeat(Portfolio portfolio) {
        double total = portfolio.totalValueUsd();
        if (portfolio.isEmpty() || total <= 0) {
            return 0.0;
        }
        double factor = riskProperties.getSizing().getPositionRiskFactor();
        return portfolio.positions().stream().mapToDouble(position -> position.valueUsd() / total * factor).sum();
    }

    private double correlationAdjustment(String symbol, Portfolio portfolio) {
        List<String> held = portfolio.symbols().stream().filter(s -> !s.equals(symbol)).toList();
        if (held.isEmpty()) {
            return 1.0;
        }
        RiskProperties.Sizing sizing = riskProperties.getSizing();
        Map<String, Double> correlations = correlationService.correlationsTo(
                symbol, held, riskProperties.getCorrelation().getLookbackDays());
        double adjustment = 1.0;
        for (double correlation : correlations.values()) {
            if (correlation > sizing.getCorrelationThreshold()) {
                adjustment *= sizing.getCorrelationPenalty();
            }
        }
        return adjustment;
    }

    private PositionSizingReport zero(String symbol, TradingMode mode, String reason) {
        log.debug("Zero position size for {}: {}", symbol, reason);
        return PositionSizingReport.builder()
                .success(false)
                .error(reason)
                .symbol(symbol)
                .tradingMode(mode)
                .recommendedSize(0.0)
                .positionValueUsd(0.0)
                .correlationAdjustment(1.0)
                .build();
    }
}
