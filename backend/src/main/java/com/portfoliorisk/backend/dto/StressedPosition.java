package com.portfoliorisk.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StressedPosition {

    private String symbol;
    private double originalValue;
    private double stressedValue;
    private double shockApplied;
    private double lossAmount;
    private double lossPct;
}
