package com.portfoliorisk.backend.dto;

import com.portfoliorisk.backend.model.PortfolioSource;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PortfolioSummary {

    private double totalValueUsd;
    private int positionCount;
    private PortfolioSource source;
    private Map<String, Double> exchangeBreakdown;
    private Map<String, Double> currentWeights;
}
