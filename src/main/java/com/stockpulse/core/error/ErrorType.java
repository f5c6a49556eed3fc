package com.stockpulse.core.error;

/**
 * Why a run failed, reported in {@code StageFailure}.
 */
public enum ErrorType {
    FETCH_ERROR,
    INSUFFICIENT_DATA,
    CONFIGURATION_ERROR,
    TIMEOUT,
    INTERNAL_ERROR
}
