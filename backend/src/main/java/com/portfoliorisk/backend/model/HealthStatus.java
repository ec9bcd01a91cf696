package com.portfoliorisk.backend.model;

public enum HealthStatus {
    HEALTHY,
    NEEDS_ATTENTION,
    HIGH_RISK
}
