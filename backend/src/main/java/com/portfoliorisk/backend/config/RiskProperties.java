package com.portfoliorisk.backend.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "risk")
@Data
@Validated
public class RiskProperties {

    private double riskFreeRate = 0.02;

    @Positive
    private int tradingDays = 252;

    private Metrics metrics = new Metrics();
    private Alerts alerts = new Alerts();
    private Correlation correlation = new Correlation();
    private Stress stress = new Stress();
    private Sizing sizing = new Sizing();
    private Health health = new Health();

    @Data
    public static class Metrics {
        @Min(2)
        private int lookbackDays = 252;

        @NotEmpty
        private List<Double> confidenceLevels = new ArrayList<>(List.of(0.95, 0.99));

        private String benchmark = "BTC";
    }

    @Data
    public static class Alerts {
        private double highVar = 0.10;
        private double lowSharpe = 0.5;
        private double highDrawdown = 0.30;
    }

    @Data
    public static class Correlation {
        @Min(2)
        private int lookbackDays = 90;

        @Positive
        private double clusterThreshold = 0.7;

        @Positive
        private double highCorrelationThreshold = 0.8;

        @Positive
        private double concentrationThreshold = 0.30;

        @Positive
        private double assumedVolatility = 0.40;

        @Positive
        private double marketFactorVolatility = 0.04;
    }

    @Data
    public static class Stress {
        private String scenariosResource = "stress-scenarios.json";

        private double stablecoinShock = 0.0;

        @Positive
        private double severeLossPct = 30.0;
    }

    @Data
    public static class Sizing {
        @Positive
        private double kellyFraction = 0.25;

        @Positive
        private double averageLoss = 0.2;

        @Positive
        private double maxPositionPct = 0.10;

        @Positive
        private double positionRiskFactor = 0.4;

        @Positive
        private double maxHeat = 0.3;

        @Positive
        private double correlationPenalty = 0.7;

        @Positive
        private double correlationThreshold = 0.8;
    }

    @Data
    public static class Health {
        private double riskWeight = 0.4;
        private double diversificationWeight = 0.25;
        private double optimizationWeight = 0.15;
        private double stressWeight = 0.2;
        private double healthyThreshold = 7.0;
        private double attentionThreshold = 4.0;
    }
}
