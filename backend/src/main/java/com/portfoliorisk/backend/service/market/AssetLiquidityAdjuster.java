package com.portfoliorisk.backend.service.market;

import com.portfoliorisk.backend.config.MarketDataProperties;
import com.portfoliorisk.backend.model.AssetInfo;
import com.portfoliorisk.backend.model.LiquidityTier;
import com.portfoliorisk.backend.service.port.AssetMetadataSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Scales allocation weights by each asset's liquidity tier.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AssetLiquidityAdjuster {

    private final AssetMetadataSource assetMetadataSource;
    private final SymbolNormalizer symbolNormalizer;
    private final MarketDataProperties marketDataProperties;
    private final Clock clock;

    private final Map<String, TierEntry> tierCache = new ConcurrentHashMap<>();

    public Map<String, Double> adjust(List<String> symbols, Map<String, Double> rawWeights) {
        Map<String, LiquidityTier> tiers = resolveTiers(symbols);
        Map<String, Double> adjusted = new LinkedHashMap<>();
        double sum = 0.0;
        for (String symbol : symbols) {
            double raw = rawWeights.getOrDefault(symbol, 0.0);
            double weight = raw * multiplierFor(symbol, tiers.getOrDefault(symbol, LiquidityTier.UNKNOWN));
            adjusted.put(symbol, weight);
            sum += weight;
        }
        if (sum <= 0) {
            return new LinkedHashMap<>(rawWeights);
        }
        for (Map.Entry<String, Double> entry : adjusted.entrySet()) {
            entry.setValue(entry.getValue() / sum);
        }
        return adjusted;
    }

    public LiquidityTier tierOf(String symbol) {
        return resolveTiers(List.of(symbol)).getOrDefault(symbol, LiquidityTier.UNKNOWN);
    }

    public double multiplierFor(String symbol) {
        return multiplierFor(symbol, tierOf(symbol));
    }

    double multiplierFor(String symbol, LiquidityTier tier) {
        MarketDataProperties.Liquidity liquidity = marketDataProperties.getLiquidity();
        double multiplier = switch (tier) {
            case INSTITUTIONAL -> liquidity.getInstitutional();
            case ENTERPRISE -> liquidity.getEnterprise();
            case PROFESSIONAL -> liquidity.getProfessional();
            case RETAIL -> liquidity.getRetail();
            case EMERGING -> liquidity.getEmerging();
            case MICRO -> liquidity.getMicro();
            case UNKNOWN -> liquidity.getUnknown();
        };
        if (symbolNormalizer.isStablecoin(symbol)) {
            multiplier = Math.max(multiplier, liquidity.getStablecoinFloor());
        }
        return multiplier;
    }

    private Map<String, LiquidityTier> resolveTiers(List<String> symbols) {
        Instant now = clock.instant();
        Map<String, LiquidityTier> tiers = new HashMap<>();
        List<String> missing = new ArrayList<>();
        for (String symbol : new LinkedHashSet<>(symbols)) {
            TierEntry entry = tierCache.get(symbol);
            if (entry != null && now.isBefore(entry.expiresAt())) {
                tiers.put(symbol, entry.tier());
            } else {
                missing.add(symbol);
            }
        }
        if (missing.isEmpty()) {
            return tiers;
        }

        Map<String, AssetInfo> fetched;
        try {
            fetched = assetMetadataSource.getAssetsForSymbolList(missing);
        } catch (RuntimeException e) {
            log.warn("Asset metadata lookup failed for {} symbols, treating as unknown liquidity: {}",
                    missing.size(), e.getMessage());
            missing.forEach(symbol -> tiers.put(symbol, LiquidityTier.UNKNOWN));
            return tiers;
        }

        Instant expiresAt = now.plus(marketDataProperties.getCache().getLiquidityTtl());
        for (String symbol : missing) {
            AssetInfo info = fetched == null ? null : fetched.get(symbol);
            LiquidityTier tier = info == null || info.tier() == null ? LiquidityTier.UNKNOWN : info.tier();
            tierCache.put(symbol, new TierEntry(tier, expiresAt));
            tiers.put(symbol, tier);
        }
        return tiers;
    }

    private record TierEntry(LiquidityTier tier, Instant expiresAt) {}
}
