package com.portfoliorisk.backend.service.rebalancing;

import com.portfoliorisk.backend.config.RebalancingProperties;
import com.portfoliorisk.backend.model.Portfolio;
import com.portfoliorisk.backend.model.Position;
import com.portfoliorisk.backend.model.Trade;
import com.portfoliorisk.backend.model.TradeAction;
import com.portfoliorisk.backend.model.TradePriority;
import com.portfoliorisk.backend.util.TestPortfolios;
import org.assertj.core.data.Offset;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RebalancingTradeGeneratorTest {

    private final RebalancingTradeGenerator generator = new RebalancingTradeGenerator(new RebalancingProperties());

    @Test
    void neverTradesSymbolsThatAreNotHeld() {
        List<Trade> trades = generator.generateTrades(TestPortfolios.btcEth(), Map.of("BTC", 0.5, "DOGE", 0.5));

        assertThat(trades).extracting(Trade::symbol).containsExactlyInAnyOrder("BTC", "ETH");
        Trade eth = find(trades, "ETH");
        assertThat(eth.action()).isEqualTo(TradeAction.SELL);
        assertThat(eth.targetWeight()).isZero();
        assertThat(eth.notionalUsd()).isCloseTo(10_000.0, Offset.offset(1e-6));
        assertThat(eth.priority()).isEqualTo(TradePriority.HIGH);
    }

    @Test
    void capsTradeCountAndOrdersByWeightChange() {
        List<Position> positions = new ArrayList<>();
        Map<String, Double> targets = new HashMap<>();
        for (int i = 1; i <= 15; i++) {
            positions.add(TestPortfolios.value("ASSET" + i, 1_000.0 * i));
            targets.put("ASSET" + i, 1.0 / 15);
        }
        Portfolio portfolio = TestPortfolios.portfolio(positions.toArray(new Position[0]));

        List<Trade> trades = generator.generateTrades(portfolio, targets);

        assertThat(trades).hasSize(10);
        for (int i = 1; i < trades.size(); i++) {
            assertThat(Math.abs(trades.get(i - 1).weightChange()))
                    .isGreaterThanOrEqualTo(Math.abs(trades.get(i).weightChange()));
        }
    }

    @Test
    void smallDriftProducesNoTrades() {
        List<Trade> trades = generator.generateTrades(TestPortfolios.btcEth(), Map.of("BTC", 0.6001, "ETH", 0.3999));

        assertThat(trades).isEmpty();
    }

    @Test
    void multiExchangeHoldingUsesValueWeightedPrice() {
        Portfolio portfolio = TestPortfolios.portfolio(
                TestPortfolios.position("BTC", "binance", 0.5, 30_000.0),
                TestPortfolios.position("BTC", "kraken", 1.0, 31_000.0),
                TestPortfolios.value("ETH", 10_000.0));

        Trade btc = find(generator.generateTrades(portfolio, Map.of("BTC", 0.5, "ETH", 0.5)), "BTC");

        double referencePrice = (30_000.0 * 15_000.0 + 31_000.0 * 31_000.0) / 46_000.0;
        assertThat(btc.currentValue()).isCloseTo(46_000.0, Offset.offset(1e-6));
        assertThat(btc.action()).isEqualTo(TradeAction.SELL);
        assertThat(btc.notionalUsd()).isCloseTo(18_000.0, Offset.offset(1e-6));
        assertThat(btc.referencePrice()).isCloseTo(referencePrice, Offset.offset(1e-6));
        assertThat(btc.quantityChange()).isCloseTo(-18_000.0 / referencePrice, Offset.offset(1e-9));
    }

    @Test
    void unpricedHoldingGetsValueOnlyTrade() {
        Position unpriced = Position.builder().symbol("LUNA").exchange("binance").valueUsd(5_000.0).build();
        Portfolio portfolio = TestPortfolios.portfolio(unpriced, TestPortfolios.value("BTC", 5_000.0));

        Trade luna = find(generator.generateTrades(portfolio, Map.of("LUNA", 0.2, "BTC", 0.8)), "LUNA");

        assertThat(luna.notionalUsd()).isCloseTo(3_000.0, Offset.offset(1e-6));
        assertThat(luna.referencePrice()).isNull();
        assertThat(luna.targetQuantity()).isNull();
        assertThat(luna.quantityChange()).isNull();
    }

    @Test
    void applyingTradesReachesTargetWeights() {
        Portfolio portfolio = TestPortfolios.btcEth();
        Map<String, Double> targets = Map.of("BTC", 0.3, "ETH", 0.7);

        List<Trade> trades = generator.generateTrades(portfolio, targets);

        double total = portfolio.totalValueUsd();
        for (Trade trade : trades) {
            double signed = trade.action() == TradeAction.BUY ? trade.notionalUsd() : -trade.notionalUsd();
            assertThat((trade.currentValue() + signed) / total).isCloseTo(targets.get(trade.symbol()), Offset.offset(1e-9));
            assertThat(trade.currentWeight() + trade.weightChange()).isCloseTo(trade.targetWeight(), Offset.offset(1e-12));
        }
    }

    @Test
    void targetsThatCoverNoHoldingProduceNothing() {
        assertThat(generator.generateTrades(TestPortfolios.btcEth(), Map.of("DOGE", 1.0))).isEmpty();
        assertThat(generator.generateTrades(TestPortfolios.empty(), Map.of("BTC", 1.0))).isEmpty();
    }

    private static Trade find(List<Trade> trades, String symbol) {
        return trades.stream().filter(trade -> trade.symbol().equals(symbol)).findFirst().orElseThrow();
    }
}
