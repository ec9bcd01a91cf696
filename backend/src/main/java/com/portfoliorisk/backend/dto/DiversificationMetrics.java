package com.portfoliorisk.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DiversificationMetrics {

    private double diversificationRatio;
    private double effectiveAssets;
    private double portfolioConcentration;
    private double diversificationScore;
}
