package com.portfoliorisk.backend.model;

public enum TradeAction {
    BUY,
    SELL
}
