package com.stockpulse.workflow;

/**
 * Pipeline states in execution order. A run only ever moves to the next state or to {@link #FAILED}.
 */
public enum RunStatus {
    INIT,
    NEWS_FETCHED,
    SENTIMENT_EXTRACTED,
    PRICES_FETCHED,
    PATTERNS_DETECTED,
    CORRELATED,
    REPORTED,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }

    public boolean canAdvanceTo(RunStatus next) {
        if (next == null || isTerminal()) {
            return false;
        }
        if (next == FAILED) {
            return true;
        }
        return next.ordinal() == ordinal() + 1;
    }
}
