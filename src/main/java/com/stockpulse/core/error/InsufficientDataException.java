package com.stockpulse.core.error;

/**
 * Thrown when the price series is too short or empty to analyze.
 */
public class InsufficientDataException extends RuntimeException {
    public InsufficientDataException(String message) {
        super(message);
    }
}
