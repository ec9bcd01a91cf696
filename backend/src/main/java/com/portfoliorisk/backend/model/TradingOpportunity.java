package com.portfoliorisk.backend.model;

/**
 * Candidate trade for position sizing. Confidence and expected return are percentages.
 */
public record TradingOpportunity(String symbol, double confidencePct, double expectedReturnPct) {}
