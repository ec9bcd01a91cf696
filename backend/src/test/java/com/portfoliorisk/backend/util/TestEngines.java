package com.portfoliorisk.backend.util;

import com.portfoliorisk.backend.config.MarketDataProperties;
import com.portfoliorisk.backend.config.OptimizationProperties;
import com.portfoliorisk.backend.config.RebalancingProperties;
import com.portfoliorisk.backend.config.RiskProperties;
import com.portfoliorisk.backend.service.CorrelationService;
import com.portfoliorisk.backend.service.CvarService;
import com.portfoliorisk.backend.service.HealthScoreCalculator;
import com.portfoliorisk.backend.service.PortfolioRiskService;
import com.portfoliorisk.backend.service.PositionSizingService;
import com.portfoliorisk.backend.service.RiskCalculationEngine;
import com.portfoliorisk.backend.service.RiskEngineMetrics;
import com.portfoliorisk.backend.service.StressTestService;
import com.portfoliorisk.backend.service.SyntheticReturnGenerator;
import com.portfoliorisk.backend.service.market.AssetLiquidityAdjuster;
import com.portfoliorisk.backend.service.market.HistoricalPriceCache;
import com.portfoliorisk.backend.service.market.SymbolNormalizer;
import com.portfoliorisk.backend.service.optimization.AdaptiveStrategy;
import com.portfoliorisk.backend.service.optimization.EqualWeightStrategy;
import com.portfoliorisk.backend.service.optimization.KellyCriterionStrategy;
import com.portfoliorisk.backend.service.optimization.MaxSharpeStrategy;
import com.portfoliorisk.backend.service.optimization.MinVarianceStrategy;
import com.portfoliorisk.backend.service.optimization.OptimizationInputBuilder;
import com.portfoliorisk.backend.service.optimization.OptimizationResultBuilder;
import com.portfoliorisk.backend.service.optimization.PortfolioOptimizationEngine;
import com.portfoliorisk.backend.service.optimization.RiskParityStrategy;
import com.portfoliorisk.backend.service.port.AssetMetadataSource;
import com.portfoliorisk.backend.service.port.ConfiguredAssetMetadataSource;
import com.portfoliorisk.backend.service.port.HistoricalPriceSource;
import com.portfoliorisk.backend.service.port.PortfolioProvider;
import com.portfoliorisk.backend.service.rebalancing.RebalancingTradeGenerator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.Executor;

/**
 * Wires the engine by hand with a same-thread executor.
 */
public final class TestEngines {

    private TestEngines() {}

    public static Fixture create(HistoricalPriceSource prices) {
        return create(prices, noMetadata(), new MutableClock(TestCandleFactory.START), null);
    }

    /** Metadata source with no configured tiers. */
    public static AssetMetadataSource noMetadata() {
        MarketDataProperties marketData = new MarketDataProperties();
        return new ConfiguredAssetMetadataSource(marketData, new SymbolNormalizer(marketData));
    }

    public static Fixture create(HistoricalPriceSource prices, AssetMetadataSource metadata, Clock clock,
                                 PortfolioProvider provider) {
        MarketDataProperties marketData = new MarketDataProperties();
        RiskProperties risk = new RiskProperties();
        OptimizationProperties optimization = new OptimizationProperties();
        RebalancingProperties rebalancing = new RebalancingProperties();
        Executor sameThread = Runnable::run;

        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        RiskEngineMetrics metrics = new RiskEngineMetrics(registry);
        SymbolNormalizer normalizer = new SymbolNormalizer(marketData);
        HistoricalPriceCache cache = new HistoricalPriceCache(prices, normalizer, marketData, clock, sameThread, metrics);
        AssetLiquidityAdjuster adjuster = new AssetLiquidityAdjuster(metadata, normalizer, marketData, clock);
        SyntheticReturnGenerator synthetic = new SyntheticReturnGenerator(normalizer);
        RiskCalculationEngine riskEngine = new RiskCalculationEngine(cache, synthetic, normalizer, new CvarService(), risk);

        RebalancingTradeGenerator tradeGenerator = new RebalancingTradeGenerator(rebalancing);
        RiskParityStrategy riskParity = new RiskParityStrategy(optimization);
        MaxSharpeStrategy maxSharpe = new MaxSharpeStrategy(adjuster);
        PortfolioOptimizationEngine optimizer = new PortfolioOptimizationEngine(
                List.of(riskParity,
                        new EqualWeightStrategy(tradeGenerator, optimization),
                        maxSharpe,
                        new MinVarianceStrategy(),
                        new KellyCriterionStrategy(optimization),
                        new AdaptiveStrategy(riskParity, maxSharpe, normalizer, optimization)),
                new OptimizationInputBuilder(cache, normalizer, optimization, risk),
                new OptimizationResultBuilder(tradeGenerator, optimization, risk),
                risk,
                optimization,
                metrics,
                sameThread);

        CorrelationService correlation = new CorrelationService(cache, synthetic, risk);
        StressTestService stress = new StressTestService(normalizer, risk);
        stress.init();
        PositionSizingService sizing = new PositionSizingService(correlation, risk);
        HealthScoreCalculator health = new HealthScoreCalculator(risk);

        PortfolioRiskService service = provider == null ? null : new PortfolioRiskService(
                provider, riskEngine, optimizer, correlation, stress, sizing, health, cache, metrics, risk, clock);
        return new Fixture(registry, metrics, cache, adjuster, riskEngine, tradeGenerator, optimizer,
                correlation, stress, sizing, health, service);
    }

    public record Fixture(
            SimpleMeterRegistry registry,
            RiskEngineMetrics metrics,
            HistoricalPriceCache priceCache,
            AssetLiquidityAdjuster liquidityAdjuster,
            RiskCalculationEngine riskEngine,
            RebalancingTradeGenerator tradeGenerator,
            PortfolioOptimizationEngine optimizer,
            CorrelationService correlationService,
            StressTestService stressTestService,
            PositionSizingService positionSizingService,
            HealthScoreCalculator healthScoreCalculator,
            PortfolioRiskService portfolioRiskService
    ) {}
}
