package com.portfoliorisk.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ServiceHealthReport {

    private String status;
    private Instant timestamp;
    private Map<String, String> components;
    private Map<String, Long> counters;
    private int cachedPriceSeries;
    private int stressScenarios;
}
