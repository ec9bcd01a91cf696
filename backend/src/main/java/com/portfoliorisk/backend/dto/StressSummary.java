package com.portfoliorisk.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StressSummary {

    private double worstCaseLossPct;
    private double averageLossPct;
    private double medianLossPct;
    private double expectedLossPct;
    private int severeScenarioCount;
    private int scenariosTested;
    private double resilienceScore;
    private double recommendedHedgeRatio;
}
