package com.portfoliorisk.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompleteAssessmentReport {

    private boolean success;
    private String error;
    private String requestId;
    private Instant timestamp;
    private String userId;
    private RiskAnalysisReport riskAnalysis;
    private CorrelationReport correlationAnalysis;
    private OptimizationReport optimization;
    private StressTestReport stressTest;
    private HealthScore healthScore;
    private List<Recommendation> recommendations;
    private Map<String, Boolean> completeness;
}
