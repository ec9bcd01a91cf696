package com.portfoliorisk.backend.model;

import java.util.ArrayList;
import java.util.List;

public record PriceSeries(String symbol, List<PricePoint> points) {

    public PriceSeries {
        points = points == null ? List.of() : List.copyOf(points);
    }

    public static PriceSeries empty(String symbol) {
        return new PriceSeries(symbol, List.of());
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    public int size() {
        return points.size();
    }

    public List<Double> closes() {
        List<Double> closes = new ArrayList<>(points.size());
        for (PricePoint point : points) {
            closes.add(point.close());
        }
        return closes;
    }

    /** Simple daily returns, one fewer than the number of points. */
    public List<Double> simpleReturns() {
        List<Double> returns = new ArrayList<>();
        for (int i = 1; i < points.size(); i++) {
            double prev = points.get(i - 1).close();
            double curr = points.get(i).close();
            if (prev > 0) {
                returns.add(curr / prev - 1.0);
            }
        }
        return returns;
    }
}
