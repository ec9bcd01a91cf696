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
public class CorrelationReport {

    private boolean success;
    private String error;
    private String requestId;
    private Instant timestamp;
    private String userId;
    private int lookbackDays;
    private Map<String, Map<String, Double>> correlationMatrix;
    private double averageCorrelation;
    private List<String> syntheticSymbols;
    private DiversificationMetrics diversification;
    private List<CorrelationCluster> clusters;
    private ConcentrationMetrics concentration;
    private List<Recommendation> recommendations;
}
