package com.portfoliorisk.backend.dto;

import com.portfoliorisk.backend.model.RiskMetrics;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RiskAnalysisReport {

    private boolean success;
    private String error;
    private String requestId;
    private Instant timestamp;
    private String userId;
    private double portfolioValue;
    private RiskMetrics riskMetrics;
    private List<RiskAlert> alerts;
    private int lookbackDays;
    private List<Double> confidenceLevels;
    private String benchmark;
}
