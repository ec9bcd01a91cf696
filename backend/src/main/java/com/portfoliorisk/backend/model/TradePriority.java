package com.portfoliorisk.backend.model;

public enum TradePriority {
    HIGH,
    MEDIUM
}
