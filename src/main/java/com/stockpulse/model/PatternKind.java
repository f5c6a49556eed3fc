package com.stockpulse.model;

/** Kinds of price pattern the detector reports. */
public enum PatternKind {
    BULLISH_MOVE("Bullish move"),
    BEARISH_MOVE("Bearish move"),
    BREAKOUT("Breakout"),
    REVERSAL("Reversal"),
    SIDEWAYS_RANGE("Sideways range");

    private final String label;

    PatternKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
