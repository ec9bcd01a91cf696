package com.portfoliorisk.backend.config;

import com.portfoliorisk.backend.service.market.SymbolNormalizer;
import com.portfoliorisk.backend.service.port.AssetMetadataSource;
import com.portfoliorisk.backend.service.port.ConfiguredAssetMetadataSource;
import com.portfoliorisk.backend.service.port.EmptyHistoricalPriceSource;
import com.portfoliorisk.backend.service.port.HistoricalPriceSource;
import com.portfoliorisk.backend.service.port.InMemoryPortfolioProvider;
import com.portfoliorisk.backend.service.port.PortfolioProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * In-process collaborators used when no exchange-backed implementation is on the context.
 */
@Configuration
public class CollaboratorConfig {

    @Bean
    @ConditionalOnMissingBean(PortfolioProvider.class)
    public InMemoryPortfolioProvider portfolioProvider(Clock clock) {
        return new InMemoryPortfolioProvider(clock);
    }

    @Bean
    @ConditionalOnMissingBean(HistoricalPriceSource.class)
    public HistoricalPriceSource historicalPriceSource() {
        return new EmptyHistoricalPriceSource();
    }

    @Bean
    @ConditionalOnMissingBean(AssetMetadataSource.class)
    public AssetMetadataSource assetMetadataSource(MarketDataProperties marketDataProperties,
                                                   SymbolNormalizer symbolNormalizer) {
        return new ConfiguredAssetMetadataSource(marketDataProperties, symbolNormalizer);
    }
}
