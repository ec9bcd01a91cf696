package com.portfoliorisk.backend.exception;

public class PortfolioRiskException extends RuntimeException {
    public PortfolioRiskException(String message) {
        super(message);
    }

    public PortfolioRiskException(String message, Throwable cause) {
        super(message, cause);
    }
}
