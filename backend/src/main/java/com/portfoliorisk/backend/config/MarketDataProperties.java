package com.portfoliorisk.backend.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Configuration
@ConfigurationProperties(prefix = "market-data")
@Data
@Validated
public class MarketDataProperties {

    private Cache cache = new Cache();
    private Fetch fetch = new Fetch();
    private Liquidity liquidity = new Liquidity();
    private Set<String> stablecoins = new LinkedHashSet<>(List.of("USDT", "USDC", "DAI", "BUSD", "TUSD", "FDUSD"));

    @Data
    public static class Cache {
        private Duration priceTtl = Duration.ofMinutes(15);

        private Duration liquidityTtl = Duration.ofMinutes(10);
    }

    @Data
    public static class Fetch {
        @Min(1)
        private int maxConcurrency = 16;

        @Positive
        private int defaultLookback = 180;

        @NotBlank
        private String defaultTimeframe = "1d";
    }

    @Data
    public static class Liquidity {
        private double institutional = 1.1;
        private double enterprise = 1.0;
        private double professional = 0.9;
        private double retail = 0.75;
        private double emerging = 0.5;
        private double micro = 0.35;
        private double unknown = 0.65;

        @Positive
        private double stablecoinFloor = 0.85;

        /** Static tier labels by base asset, e.g. {@code tier_institutional}. */
        private Map<String, String> tiers = new LinkedHashMap<>();
    }
}
