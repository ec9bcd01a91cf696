package com.portfoliorisk.backend.model;

public record AssetInfo(
        String symbol,
        LiquidityTier tier,
        double volume24hUsd,
        double priceUsd,
        double marketCapUsd
) {}
