package com.stockpulse.pattern;

import com.stockpulse.config.Config;
import com.stockpulse.core.error.ConfigurationException;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * Window sizes and thresholds for {@link PatternDetector}. Thresholds are fractions (0.05 = 5%).
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class PatternSettings {
    public final int moveWindow;
    public final double moveThreshold;
    public final int breakoutWindow;
    public final double breakoutThreshold;
    public final int reversalRunLength;
    public final int reversalConfirmDays;
    public final double reversalThreshold;
    public final boolean sidewaysEnabled;
    public final double sidewaysThreshold;
    public final int sidewaysMinPoints;

    public static PatternSettings defaults() {
        return new PatternSettings(5, 0.05, 10, 0.02, 3, 3, 0.02, true, 0.03, 3).validated();
    }

    public static PatternSettings fromConfig(Config config) {
        PatternSettings d = defaults();
        return PatternSettings.builder()
                .moveWindow(config.requireInt("pattern.move.window", d.moveWindow))
                .moveThreshold(config.requireDouble("pattern.move.threshold", d.moveThreshold))
                .breakoutWindow(config.requireInt("pattern.breakout.window", d.breakoutWindow))
                .breakoutThreshold(config.requireDouble("pattern.breakout.threshold", d.breakoutThreshold))
                .reversalRunLength(config.requireInt("pattern.reversal.run_length", d.reversalRunLength))
                .reversalConfirmDays(config.requireInt("pattern.reversal.confirm_days", d.reversalConfirmDays))
                .reversalThreshold(config.requireDouble("pattern.reversal.threshold", d.reversalThreshold))
                .sidewaysEnabled(config.getBoolean("pattern.sideways.enabled", d.sidewaysEnabled))
                .sidewaysThreshold(config.requireDouble("pattern.sideways.threshold", d.sidewaysThreshold))
                .sidewaysMinPoints(config.requireInt("pattern.sideways.min_points", d.sidewaysMinPoints))
                .build()
                .validated();
    }

    public PatternSettings validated() {
        requireAtLeast("pattern.move.window", moveWindow, 1);
        requireAtLeast("pattern.breakout.window", breakoutWindow, 1);
        requireAtLeast("pattern.reversal.run_length", reversalRunLength, 1);
        requireAtLeast("pattern.reversal.confirm_days", reversalConfirmDays, 1);
        requireAtLeast("pattern.sideways.min_points", sidewaysMinPoints, 2);
        requireFraction("pattern.move.threshold", moveThreshold);
        requireFraction("pattern.breakout.threshold", breakoutThreshold);
        requireFraction("pattern.reversal.threshold", reversalThreshold);
        requireFraction("pattern.sideways.threshold", sidewaysThreshold);
        return this;
    }

    private static void requireAtLeast(String key, int value, int min) {
        if (value < min) {
            throw new ConfigurationException(key, "must be >= " + min + ", got " + value);
        }
    }

    private static void requireFraction(String key, double value) {
        if (!(value >= 0.0 && value < 1.0)) {
            throw new ConfigurationException(key, "must be within [0, 1), got " + value);
        }
    }
}
