package com.portfoliorisk.backend.exception;

/**
 * Raised by matrix routines on singular or non-finite results. Strategies catch it
 * and fall back to a simpler allocation.
 */
public class NumericalInstabilityException extends RuntimeException {
    public NumericalInstabilityException(String message) {
        super(message);
    }

    public NumericalInstabilityException(String message, Throwable cause) {
        super(message, cause);
    }
}
