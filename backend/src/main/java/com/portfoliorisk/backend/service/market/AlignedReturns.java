package com.portfoliorisk.backend.service.market;

import com.portfoliorisk.backend.model.PricePoint;
import com.portfoliorisk.backend.model.PriceSeries;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Simple returns of several price series over the timestamps they all share. The return at
 * index {@code t} runs from {@code dates[t]} to {@code dates[t + 1]} for every symbol.
 */
public final class AlignedReturns {

    private final List<Instant> dates;
    private final Map<String, List<Double>> returns;

    private AlignedReturns(List<Instant> dates, Map<String, List<Double>> returns) {
        this.dates = dates;
        this.returns = returns;
    }

    public static AlignedReturns of(Map<String, PriceSeries> history) {
        if (history.isEmpty()) {
            return new AlignedReturns(List.of(), Map.of());
        }
        Map<String, Map<Instant, Double>> closes = new LinkedHashMap<>();
        TreeSet<Instant> shared = null;
        for (Map.Entry<String, PriceSeries> entry : history.entrySet()) {
            Map<Instant, Double> byDate = closesByDate(entry.getValue());
            closes.put(entry.getKey(), byDate);
            if (shared == null) {
                shared = new TreeSet<>(byDate.keySet());
            } else {
                shared.retainAll(byDate.keySet());
            }
        }
        List<Instant> dates = new ArrayList<>(shared);
        Map<String, List<Double>> returns = new LinkedHashMap<>();
        closes.forEach((symbol, byDate) -> returns.put(symbol, returnsOver(dates, byDate)));
        return new AlignedReturns(List.copyOf(dates), returns);
    }

    /** Number of return observations per symbol. */
    public int length() {
        return Math.max(0, dates.size() - 1);
    }

    public boolean contains(String symbol) {
        return returns.containsKey(symbol);
    }

    public List<Double> returns(String symbol) {
        return returns.get(symbol);
    }

    /**
     * Returns of {@code series} over the same date intervals. An interval where the series lacks
     * either close is {@code NaN}.
     */
    public List<Double> returnsOf(PriceSeries series) {
        return returnsOver(dates, closesByDate(series));
    }

    /** Keeps only the most recent {@code count} observations. */
    public AlignedReturns tail(int count) {
        if (count >= length()) {
            return this;
        }
        int from = length() - count;
        Map<String, List<Double>> trimmed = new LinkedHashMap<>();
        returns.forEach((symbol, values) -> trimmed.put(symbol, values.subList(from, values.size())));
        return new AlignedReturns(dates.subList(from, dates.size()), trimmed);
    }

    private static Map<Instant, Double> closesByDate(PriceSeries series) {
        Map<Instant, Double> byDate = new HashMap<>();
        for (PricePoint point : series.points()) {
            byDate.put(point.timestamp(), point.close());
        }
        return byDate;
    }

    private static List<Double> returnsOver(List<Instant> dates, Map<Instant, Double> byDate) {
        List<Double> values = new ArrayList<>(Math.max(0, dates.size() - 1));
        for (int i = 1; i < dates.size(); i++) {
            Double prev = byDate.get(dates.get(i - 1));
            Double curr = byDate.get(dates.get(i));
            values.add(prev != null && curr != null && prev > 0 ? curr / prev - 1.0 : Double.NaN);
        }
        return values;
    }
}
