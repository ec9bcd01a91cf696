package com.portfoliorisk.backend.model;

import lombok.Builder;

/**
 * A single holding on one exchange. Several rows may share a symbol when the
 * asset is held on more than one exchange.
 */
@Builder(toBuilder = true)
public record Position(
        String symbol,
        String exchange,
        double quantity,
        double valueUsd,
        double percentage,
        double avgEntryPrice,
        double currentPrice,
        double unrealizedPnl,
        double unrealizedPnlPct
) {}
