package com.stockpulse.workflow;

import com.stockpulse.core.error.ErrorType;

import java.util.Objects;

/**
 * Why a run ended in {@link RunStatus#FAILED}. {@code stage} is the state the run was trying to reach.
 */
public record StageFailure(RunStatus stage, ErrorType errorType, String reason) {
    public StageFailure {
        Objects.requireNonNull(stage, "stage");
        Objects.requireNonNull(errorType, "errorType");
        reason = reason == null ? "" : reason;
    }

    @Override
    public String toString() {
        return "FAILED(" + stage + ", " + errorType + ", " + reason + ")";
    }
}
