package com.portfoliorisk.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CorrelationCluster {

    private int clusterId;
    private List<String> members;
    private double averageCorrelation;
    private int size;
    private double diversificationBenefit;
}
