package com.stockpulse.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Tone of an article toward the stock. Parsed leniently from model output.
 */
public enum Polarity {
    BULLISH(1),
    BEARISH(-1),
    NEUTRAL(0);

    private final int sign;

    Polarity(int sign) {
        this.sign = sign;
    }

    public int sign() {
        return sign;
    }

    /**
     * Accepts both market wording (bullish/bearish) and plain sentiment wording (positive/negative).
     */
    public static Optional<Polarity> fromLabel(String raw) {
        String value = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        switch (value) {
            case "bullish":
            case "positive":
                return Optional.of(BULLISH);
            case "bearish":
            case "negative":
                return Optional.of(BEARISH);
            case "neutral":
            case "mixed":
                return Optional.of(NEUTRAL);
            default:
                return Optional.empty();
        }
    }
}
