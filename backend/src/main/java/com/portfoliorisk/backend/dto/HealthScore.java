package com.portfoliorisk.backend.dto;

import com.portfoliorisk.backend.model.HealthStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HealthScore {

    private double overallScore;
    private HealthStatus status;
    private Map<String, Double> componentScores;
    private Map<String, Double> weightsUsed;
}
