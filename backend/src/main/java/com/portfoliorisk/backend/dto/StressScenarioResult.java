package com.portfoliorisk.backend.dto;

import com.portfoliorisk.backend.model.StressSeverity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StressScenarioResult {

    private String scenario;
    private String name;
    private String description;
    private double probability;
    private double originalValue;
    private double stressedValue;
    private double totalLoss;
    private double lossPct;
    private double maxPositionLossPct;
    private double avgPositionLossPct;
    private StressSeverity severity;
    private String recoveryEstimate;
    private List<StressedPosition> positions;
}
