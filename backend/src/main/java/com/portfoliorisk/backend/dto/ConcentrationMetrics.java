package com.portfoliorisk.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConcentrationMetrics {

    private double herfindahlIndex;
    private double maxPositionPct;
    private double top3ConcentrationPct;
    private double concentrationScore;
    private boolean diversificationNeeded;
}
