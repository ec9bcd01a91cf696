package com.portfoliorisk.backend.dto;

import com.portfoliorisk.backend.model.TradingMode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PositionSizingReport {

    private boolean success;
    private String error;
    private String requestId;
    private Instant timestamp;
    private String userId;
    private String symbol;
    private TradingMode tradingMode;
    private double recommendedSize;
    private double positionValueUsd;
    private double kellySize;
    private double modeAdjustedSize;
    private double riskAdjustedSize;
    private double portfolioHeat;
    private double correlationAdjustment;
    private double confidenceUsed;
    private double expectedReturnUsed;
    private boolean monitoringRequired;
    private String entryMethod;
}
