package com.portfoliorisk.backend.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "rebalancing")
@Data
@Validated
public class RebalancingProperties {

    @Min(1)
    private int maxTrades = 10;

    @PositiveOrZero
    private double minTradeFraction = 0.003;

    @PositiveOrZero
    private double minTradeUsd = 1.0;

    @PositiveOrZero
    private double highPriorityWeightChange = 0.05;
}
