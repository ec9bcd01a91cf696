package com.portfoliorisk.backend.service.optimization;

import org.apache.commons.math3.linear.RealMatrix;

import java.util.List;
import java.util.Set;

/**
 * Annualized return vector and covariance matrix over the held symbols, plus the aligned
 * price history they came from.
 *
 * @param symbols          held symbols in first-seen order; indexes line up with the vectors
 * @param expectedReturns  annualized mean log returns, heuristic where history is missing
 * @param covariance       annualized covariance, diagonal heuristic where history is missing
 * @param historySymbols   symbols backed by usable history
 * @param historyPrices    aligned close prices, one column per entry of {@code priceColumns}
 * @param priceColumns     column order of {@code historyPrices}
 * @param observations     number of return rows used
 */
public record OptimizationInputs(
        List<String> symbols,
        double[] expectedReturns,
        RealMatrix covariance,
        Set<String> historySymbols,
        double[][] historyPrices,
        List<String> priceColumns,
        int observations
) {

    public boolean hasHistory(String symbol) {
        return historySymbols.contains(symbol);
    }

    public boolean fallbackUsed() {
        return historySymbols.size() < symbols.size();
    }

    public int size() {
        return symbols.size();
    }
}
