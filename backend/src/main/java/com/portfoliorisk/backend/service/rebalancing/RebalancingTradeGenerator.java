package com.portfoliorisk.backend.service.rebalancing;

import com.portfoliorisk.backend.config.RebalancingProperties;
import com.portfoliorisk.backend.model.Portfolio;
import com.portfoliorisk.backend.model.Position;
import com.portfoliorisk.backend.model.Trade;
import com.portfoliorisk.backend.model.TradeAction;
import com.portfoliorisk.backend.model.TradePriority;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns target weights into the trades that move the current holdings there. Only held
 * symbols are traded.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RebalancingTradeGenerator {

    private final RebalancingProperties rebalancingProperties;

    public List<Trade> generateTrades(Portfolio portfolio, Map<String, Double> targetWeights) {
        if (portfolio == null || portfolio.isEmpty() || targetWeights == null) {
            return List.of();
        }
        Map<String, Holding> holdings = aggregate(portfolio.positions());
        double total = holdings.values().stream().mapToDouble(Holding::value).sum();
        if (total <= 0) {
            total = portfolio.totalValueUsd();
        }
        if (total <= 0) {
            return List.of();
        }

        double targetSum = 0.0;
        for (String symbol : holdings.keySet()) {
            targetSum += Math.max(0.0, targetWeights.getOrDefault(symbol, 0.0));
        }
        if (targetSum <= 0) {
            log.debug("Target weights do not cover any held symbol for user {}", portfolio.userId());
            return List.of();
        }

        double minTrade = Math.max(rebalancingProperties.getMinTradeFraction() * total, rebalancingProperties.getMinTradeUsd());
        List<Trade> trades = new ArrayList<>();
        for (Map.Entry<String, Holding> entry : holdings.entrySet()) {
            String symbol = entry.getKey();
            Holding holding = entry.getValue();
            double targetWeight = Math.max(0.0, targetWeights.getOrDefault(symbol, 0.0)) / targetSum;
            double targetValue = targetWeight * total;
            double tradeValue = targetValue - holding.value();
            if (Math.abs(tradeValue) < minTrade) {
                continue;
            }
            double currentWeight = holding.value() / total;
            double weightChange = targetWeight - currentWeight;
            Double price = holding.referencePrice();
            boolean priced = price != null && price > 0;
            trades.add(Trade.builder()
                    .symbol(symbol)
                    .action(tradeValue > 0 ? TradeAction.BUY : TradeAction.SELL)
                    .notionalUsd(Math.abs(tradeValue))
                    .currentValue(holding.value())
                    .targetValue(targetValue)
                    .currentWeight(currentWeight)
                    .targetWeight(targetWeight)
                    .weightChange(weightChange)
                    .priority(Math.abs(weightChange) > rebalancingProperties.getHighPriorityWeightChange()
                            ? TradePriority.HIGH : TradePriority.MEDIUM)
                    .referencePrice(priced ? price : null)
                    .targetQuantity(priced ? targetValue / price : null)
                    .quantityChange(priced ? tradeValue / price : null)
                    .build());
        }

        trades.sort(Comparator.comparingDouble((Trade trade) -> Math.abs(trade.weightChange())).reversed());
        if (trades.size() > rebalancingProperties.getMaxTrades()) {
            return List.copyOf(trades.subList(0, rebalancingProperties.getMaxTrades()));
        }
        return trades;
    }

    private Map<String, Holding> aggregate(List<Position> positions) {
        Map<String, List<Position>> bySymbol = new LinkedHashMap<>();
        for (Position position : positions) {
            if (position.symbol() != null) {
                bySymbol.computeIfAbsent(position.symbol(), key -> new ArrayList<>()).add(position);
            }
        }
        Map<String, Holding> holdings = new LinkedHashMap<>();
        bySymbol.forEach((symbol, rows) -> holdings.put(symbol, toHolding(rows)));
        return holdings;
    }

    private Holding toHolding(List<Position> rows) {
        double value = 0.0;
        double quantity = 0.0;
        double pricedValue = 0.0;
        double pricedValueWeighted = 0.0;
        double pricedQuantity = 0.0;
        double pricedQuantityWeighted = 0.0;
        for (Position row : rows) {
            value += Math.max(0.0, row.valueUsd());
            quantity += row.quantity();
            if (row.currentPrice() > 0) {
                if (row.valueUsd() > 0) {
                    pricedValue += row.valueUsd();
                    pricedValueWeighted += row.currentPrice() * row.valueUsd();
                }
                if (row.quantity() > 0) {
                    pricedQuantity += row.quantity();
                    pricedQuantityWeighted += row.currentPrice() * row.quantity();
                }
            }
        }

        Double referencePrice;
        if (pricedValue > 0) {
            referencePrice = pricedValueWeighted / pricedValue;
        } else if (pricedQuantity > 0) {
            referencePrice = pricedQuantityWeighted / pricedQuantity;
        } else {
            referencePrice = lastKnownPrice(rows);
        }
        return new Holding(value, quantity, referencePrice);
    }

    private Double lastKnownPrice(List<Position> rows) {
        for (int i = rows.size() - 1; i >= 0; i--) {
            Position row = rows.get(i);
            if (row.currentPrice() > 0) {
                return row.currentPrice();
            }
            if (row.quantity() > 0 && row.valueUsd() > 0) {
                return row.valueUsd() / row.quantity();
            }
        }
        return null;
    }

    private record Holding(double value, double quantity, Double referencePrice) {}
}
