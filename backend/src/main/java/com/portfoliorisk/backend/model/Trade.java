package com.portfoliorisk.backend.model;

import lombok.Builder;

/**
 * A proposed rebalancing trade. Quantity fields are null when no reference price
 * could be derived for the symbol.
 */
@Builder
public record Trade(
        String symbol,
        TradeAction action,
        double notionalUsd,
        double currentValue,
        double targetValue,
        double currentWeight,
        double targetWeight,
        double weightChange,
        TradePriority priority,
        Double referencePrice,
        Double targetQuantity,
        Double quantityChange
) {}
