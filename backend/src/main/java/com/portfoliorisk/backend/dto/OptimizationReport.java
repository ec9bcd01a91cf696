package com.portfoliorisk.backend.dto;

import com.portfoliorisk.backend.model.OptimizationResult;
import com.portfoliorisk.backend.model.OptimizationStrategy;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OptimizationReport {

    private boolean success;
    private String error;
    private String requestId;
    private Instant timestamp;
    private String userId;
    private OptimizationStrategy strategy;
    private boolean strategyFallback;
    private OptimizationResult result;
    private PortfolioSummary currentPortfolio;
}
