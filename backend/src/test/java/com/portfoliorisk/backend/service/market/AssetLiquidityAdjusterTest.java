package com.portfoliorisk.backend.service.market;

import com.portfoliorisk.backend.config.MarketDataProperties;
import com.portfoliorisk.backend.model.AssetInfo;
import com.portfoliorisk.backend.model.LiquidityTier;
import com.portfoliorisk.backend.service.port.AssetMetadataSource;
import com.portfoliorisk.backend.util.MutableClock;
import com.portfoliorisk.backend.util.TestCandleFactory;
import org.assertj.core.data.Offset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AssetLiquidityAdjusterTest {

    private AssetMetadataSource metadataSource;
    private MutableClock clock;
    private AssetLiquidityAdjuster adjuster;

    @BeforeEach
    void setUp() {
        metadataSource = mock(AssetMetadataSource.class);
        clock = new MutableClock(TestCandleFactory.START);
        MarketDataProperties properties = new MarketDataProperties();
        adjuster = new AssetLiquidityAdjuster(metadataSource, new SymbolNormalizer(properties), properties, clock);
    }

    @Test
    void scalesByTierAndRenormalizes() {
        when(metadataSource.getAssetsForSymbolList(anyList())).thenReturn(Map.of(
                "BTC", info("BTC", LiquidityTier.INSTITUTIONAL),
                "SHIB", info("SHIB", LiquidityTier.MICRO)));

        Map<String, Double> adjusted = adjuster.adjust(List.of("BTC", "SHIB"), Map.of("BTC", 0.5, "SHIB", 0.5));

        assertThat(adjusted.get("BTC")).isCloseTo(0.55 / 0.725, Offset.offset(1e-9));
        assertThat(adjusted.get("SHIB")).isCloseTo(0.175 / 0.725, Offset.offset(1e-9));
    }

    @Test
    void stablecoinsNeverDropBelowFloor() {
        when(metadataSource.getAssetsForSymbolList(anyList()))
                .thenReturn(Map.of("USDC", info("USDC", LiquidityTier.MICRO)));

        assertThat(adjuster.multiplierFor("USDC")).isEqualTo(0.85);
    }

    @Test
    void failedLookupTreatsEverySymbolAsUnknownAndIsNotCached() {
        when(metadataSource.getAssetsForSymbolList(anyList())).thenThrow(new IllegalStateException("timeout"));

        Map<String, Double> adjusted = adjuster.adjust(List.of("BTC", "ETH"), Map.of("BTC", 0.5, "ETH", 0.5));
        adjuster.adjust(List.of("BTC", "ETH"), Map.of("BTC", 0.5, "ETH", 0.5));

        assertThat(adjusted.get("BTC")).isCloseTo(0.5, Offset.offset(1e-12));
        assertThat(adjusted.get("ETH")).isCloseTo(0.5, Offset.offset(1e-12));
        verify(metadataSource, times(2)).getAssetsForSymbolList(anyList());
    }

    @Test
    void partialResponseCachesMissingSymbolsAsUnknownUntilTtlExpires() {
        when(metadataSource.getAssetsForSymbolList(anyList()))
                .thenReturn(Map.of("BTC", info("BTC", LiquidityTier.INSTITUTIONAL)));

        adjuster.adjust(List.of("BTC", "DOGE"), Map.of("BTC", 0.5, "DOGE", 0.5));

        assertThat(adjuster.tierOf("DOGE")).isEqualTo(LiquidityTier.UNKNOWN);
        assertThat(adjuster.tierOf("BTC")).isEqualTo(LiquidityTier.INSTITUTIONAL);
        verify(metadataSource, times(1)).getAssetsForSymbolList(anyList());

        clock.advance(Duration.ofMinutes(11));
        adjuster.tierOf("BTC");

        verify(metadataSource, times(2)).getAssetsForSymbolList(anyList());
    }

    @Test
    void zeroWeightsAreReturnedUnchanged() {
        when(metadataSource.getAssetsForSymbolList(anyList())).thenReturn(Map.of());

        Map<String, Double> adjusted = adjuster.adjust(List.of("BTC"), Map.of("BTC", 0.0));

        assertThat(adjusted).containsEntry("BTC", 0.0);
    }

    private static AssetInfo info(String symbol, LiquidityTier tier) {
        return new AssetInfo(symbol, tier, 1_000_000.0, 1.0, 10_000_000.0);
    }
}
