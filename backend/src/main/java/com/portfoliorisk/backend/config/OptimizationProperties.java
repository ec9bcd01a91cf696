package com.portfoliorisk.backend.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.LinkedHashMap;
import java.util.Map;

@Configuration
@ConfigurationProperties(prefix = "optimization")
@Data
@Validated
public class OptimizationProperties {

    @Min(2)
    private int lookbackDays = 180;

    @NotBlank
    private String timeframe = "1d";

    private Fallback fallback = new Fallback();
    private Kelly kelly = new Kelly();
    private RiskParity riskParity = new RiskParity();
    private Adaptive adaptive = new Adaptive();

    @Positive
    private double rebalanceThreshold = 0.05;

    @Positive
    private double equalWeightTradeThreshold = 0.01;

    @Data
    public static class Fallback {
        private double stablecoinReturn = 0.03;

        private double defaultReturn = 0.18;

        @Positive
        private double variance = 0.12;
    }

    @Data
    public static class Kelly {
        @Positive
        @Max(1)
        private double fraction = 0.25;

        @Positive
        private double regularization = 1e-6;
    }

    @Data
    public static class RiskParity {
        @Positive
        private double volatilityFloor = 0.01;
    }

    @Data
    public static class Adaptive {
        private double riskParityShare = 0.8;

        private double maxSharpeShare = 0.2;

        private double minWeight = 0.02;

        @Min(1)
        private int maxPasses = 20;

        private Map<String, Double> caps = new LinkedHashMap<>(Map.of(
                "XRP", 0.25,
                "ADA", 0.20,
                "DOGE", 0.10,
                "USDC", 0.25,
                "REEF", 0.05));
    }
}
