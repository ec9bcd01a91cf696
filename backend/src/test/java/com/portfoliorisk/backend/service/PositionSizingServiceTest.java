package com.portfoliorisk.backend.service;

import com.portfoliorisk.backend.dto.PositionSizingReport;
import com.portfoliorisk.backend.model.Candle;
import com.portfoliorisk.backend.model.TradingMode;
import com.portfoliorisk.backend.model.TradingOpportunity;
import com.portfoliorisk.backend.util.MapHistoricalPriceSource;
import com.portfoliorisk.backend.util.TestCandleFactory;
import com.portfoliorisk.backend.util.TestEngines;
import com.portfoliorisk.backend.util.TestPortfolios;
import org.assertj.core.data.Offset;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PositionSizingServiceTest {

    private final TradingOpportunity solana = new TradingOpportunity("SOL", 60.0, 30.0);

    @Test
    void kellyIsFractionalAndCapped() {
        PositionSizingService service = TestEngines.create(new MapHistoricalPriceSource()).positionSizingService();

        assertThat(service.kellySize(0.30, 0.60)).isCloseTo(0.25 / 3.0, Offset.offset(1e-9));
        assertThat(service.kellySize(0.50, 0.80)).isEqualTo(0.10);
        assertThat(service.kellySize(0.10, 0.60)).isZero();
        assertThat(service.kellySize(-0.10, 0.90)).isZero();
    }

    @Test
    void hotPortfolioScalesSizeDown() {
        PositionSizingService service = TestEngines.create(new MapHistoricalPriceSource()).positionSizingService();

        PositionSizingReport report = service.calculate(TestPortfolios.btcEth(), solana, TradingMode.BALANCED);

        assertThat(report.isSuccess()).isTrue();
        assertThat(report.getPortfolioHeat()).isCloseTo(0.4, Offset.offset(1e-9));
        assertThat(report.getCorrelationAdjustment()).isEqualTo(1.0);
        assertThat(report.getRecommendedSize()).isCloseTo(0.05, Offset.offset(1e-9));
        assertThat(report.getPositionValueUsd()).isCloseTo(1_250.0, Offset.offset(1e-6));
        assertThat(report.getEntryMethod()).isEqualTo("immediate");
    }

    @Test
    void tradingModeScalesBeforeTheCap() {
        PositionSizingService service = TestEngines.create(new MapHistoricalPriceSource()).positionSizingService();

        double conservative = service.calculate(TestPortfolios.btcEth(), solana, TradingMode.CONSERVATIVE).getRecommendedSize();
        double beast = service.calculate(TestPortfolios.btcEth(), solana, TradingMode.BEAST_MODE).getRecommendedSize();

        assertThat(conservative).isCloseTo(0.03125, Offset.offset(1e-9));
        assertThat(beast).isCloseTo(0.075, Offset.offset(1e-9));
    }

    @Test
    void correlatedHoldingPenalizesSize() {
        List<Candle> sol = TestCandleFactory.randomWalkCandles(120, 100.0, 0.05, 9L);
        MapHistoricalPriceSource prices = new MapHistoricalPriceSource()
                .with("SOL/USDT", sol)
                .with("BTC/USDT", TestCandleFactory.scaled(sol, 300.0));
        PositionSizingService service = TestEngines.create(prices).positionSizingService();

        PositionSizingReport report = service.calculate(TestPortfolios.btcEth(), solana, TradingMode.BALANCED);

        assertThat(report.getCorrelationAdjustment()).isCloseTo(0.7, Offset.offset(1e-9));
        assertThat(report.getRecommendedSize()).isCloseTo(0.035, Offset.offset(1e-9));
    }

    @Test
    void rejectsInvalidOpportunityAndEmptyPortfolio() {
        PositionSizingService service = TestEngines.create(new MapHistoricalPriceSource()).positionSizingService();

        PositionSizingReport invalid = service.calculate(TestPortfolios.btcEth(),
                new TradingOpportunity("SOL", 0.0, 30.0), TradingMode.BALANCED);
        PositionSizingReport empty = service.calculate(TestPortfolios.empty(), solana, TradingMode.BALANCED);

        assertThat(invalid.isSuccess()).isFalse();
        assertThat(invalid.getError()).isEqualTo("Invalid opportunity data");
        assertThat(empty.getError()).isEqualTo("No portfolio value");
        assertThat(empty.getRecommendedSize()).isZero();
    }
}
