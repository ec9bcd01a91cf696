package com.portfoliorisk.backend.model;

public enum PortfolioSource {
    LIVE,
    SIMULATED,
    EMPTY
}
