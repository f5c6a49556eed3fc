package com.stockpulse.model;

/** Sign of a price pattern. */
public enum Direction {
    BULLISH(1),
    BEARISH(-1),
    NEUTRAL(0);

    private final int sign;

    Direction(int sign) {
        this.sign = sign;
    }

    public int sign() {
        return sign;
    }

    public static Direction ofSign(double value) {
        if (value > 0) {
            return BULLISH;
        }
        if (value < 0) {
            return BEARISH;
        }
        return NEUTRAL;
    }
}
