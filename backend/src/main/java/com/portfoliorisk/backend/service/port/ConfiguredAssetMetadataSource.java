package com.portfoliorisk.backend.service.port;

import com.portfoliorisk.backend.config.MarketDataProperties;
import com.portfoliorisk.backend.model.AssetInfo;
import com.portfoliorisk.backend.model.LiquidityTier;
import com.portfoliorisk.backend.service.market.SymbolNormalizer;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Serves tiers from {@code market-data.liquidity.tiers}. Unlisted symbols are left out.
 */
public class ConfiguredAssetMetadataSource implements AssetMetadataSource {

    private final SymbolNormalizer symbolNormalizer;
    private final Map<String, LiquidityTier> tiers = new HashMap<>();

    public ConfiguredAssetMetadataSource(MarketDataProperties marketDataProperties, SymbolNormalizer symbolNormalizer) {
        this.symbolNormalizer = symbolNormalizer;
        marketDataProperties.getLiquidity().getTiers().forEach((asset, label) ->
                tiers.put(asset.trim().toUpperCase(Locale.ROOT), LiquidityTier.parse(label)));
    }

    @Override
    public Map<String, AssetInfo> getAssetsForSymbolList(List<String> symbols) {
        Map<String, AssetInfo> assets = new LinkedHashMap<>();
        for (String symbol : symbols) {
            LiquidityTier tier = tiers.get(symbolNormalizer.baseAsset(symbol));
            if (tier != null) {
                assets.put(symbol, new AssetInfo(symbol, tier, 0.0, 0.0, 0.0));
            }
        }
        return assets;
    }
}
