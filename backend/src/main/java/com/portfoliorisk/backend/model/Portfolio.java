package com.portfoliorisk.backend.model;

import lombok.Builder;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Consolidated multi-exchange snapshot for one user. Treated as immutable for the
 * duration of an engine call.
 */
@Builder(toBuilder = true)
public record Portfolio(
        String userId,
        double totalValueUsd,
        List<Position> positions,
        Map<String, Double> exchangeBreakdown,
        PortfolioSource source,
        Instant lastUpdated
) {

    public Portfolio {
        positions = positions == null ? List.of() : List.copyOf(positions);
        exchangeBreakdown = exchangeBreakdown == null ? Map.of() : Map.copyOf(exchangeBreakdown);
        source = source == null ? PortfolioSource.LIVE : source;
    }

    public static Portfolio empty(String userId, Instant asOf) {
        return new Portfolio(userId, 0.0, List.of(), Map.of(), PortfolioSource.EMPTY, asOf);
    }

    /**
     * Builds a portfolio from raw rows, deriving total value, percentages and the
     * exchange breakdown.
     */
    public static Portfolio of(String userId, List<Position> rows, PortfolioSource source, Instant asOf) {
        double total = rows.stream().mapToDouble(Position::valueUsd).sum();
        List<Position> withPct = new ArrayList<>(rows.size());
        Map<String, Double> breakdown = new LinkedHashMap<>();
        for (Position row : rows) {
            double pct = total > 0 ? row.valueUsd() / total * 100.0 : 0.0;
            withPct.add(row.toBuilder().percentage(pct).build());
            if (row.exchange() != null) {
                breakdown.merge(row.exchange(), row.valueUsd(), Double::sum);
            }
        }
        return new Portfolio(userId, total, withPct, breakdown, source, asOf);
    }

    public boolean isEmpty() {
        return positions.isEmpty();
    }

    /** Unique held symbols in first-seen order. */
    public List<String> symbols() {
        LinkedHashSet<String> symbols = new LinkedHashSet<>();
        for (Position position : positions) {
            if (position.symbol() != null) {
                symbols.add(position.symbol());
            }
        }
        return new ArrayList<>(symbols);
    }

    /** USD value per symbol, summed across exchanges, in first-seen order. */
    public Map<String, Double> valueBySymbol() {
        Map<String, Double> values = new LinkedHashMap<>();
        for (Position position : positions) {
            if (position.symbol() != null) {
                values.merge(position.symbol(), Math.max(0.0, position.valueUsd()), Double::sum);
            }
        }
        return values;
    }

    /** Current weight per symbol as a fraction of summed position value. */
    public Map<String, Double> currentWeights() {
        Map<String, Double> values = valueBySymbol();
        double total = values.values().stream().mapToDouble(Double::doubleValue).sum();
        Map<String, Double> weights = new LinkedHashMap<>();
        values.forEach((symbol, value) -> weights.put(symbol, total > 0 ? value / total : 0.0));
        return weights;
    }
}
