package com.stockpulse.correlate;

import com.stockpulse.config.Config;
import com.stockpulse.core.error.ConfigurationException;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * Correlation window and scoring knobs. The window is {@code [-lookbackDays, +lookaheadDays]} around the news date.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class CorrelationSettings {
    public final int lookbackDays;
    public final int lookaheadDays;
    public final double minConfidence;
    public final double agreementBoost;
    public final double disagreementPenalty;

    public static CorrelationSettings defaults() {
        return symmetric(3);
    }

    public static CorrelationSettings symmetric(int windowDays) {
        return new CorrelationSettings(windowDays, windowDays, 0.1, 0.25, 0.5).validated();
    }

    public static CorrelationSettings fromConfig(Config config) {
        CorrelationSettings d = defaults();
        int window = config.requireInt("correlation.window_days", d.lookaheadDays);
        return CorrelationSettings.builder()
                .lookbackDays(config.requireInt("correlation.lookback_days", window))
                .lookaheadDays(config.requireInt("correlation.lookahead_days", window))
                .minConfidence(config.requireDouble("correlation.min_confidence", d.minConfidence))
                .agreementBoost(config.requireDouble("correlation.agreement_boost", d.agreementBoost))
                .disagreementPenalty(config.requireDouble("correlation.disagreement_penalty", d.disagreementPenalty))
                .build()
                .validated();
    }

    public CorrelationSettings validated() {
        if (lookbackDays < 0) {
            throw new ConfigurationException("correlation.lookback_days", "must be >= 0, got " + lookbackDays);
        }
        if (lookaheadDays < 0) {
            throw new ConfigurationException("correlation.lookahead_days", "must be >= 0, got " + lookaheadDays);
        }
        if (!(minConfidence >= 0.0 && minConfidence <= 1.0)) {
            throw new ConfigurationException("correlation.min_confidence", "must be within [0, 1], got " + minConfidence);
        }
        if (!(agreementBoost >= 0.0 && agreementBoost <= 1.0)) {
            throw new ConfigurationException("correlation.agreement_boost", "must be within [0, 1], got " + agreementBoost);
        }
        if (!(disagreementPenalty >= 0.0 && disagreementPenalty <= 1.0)) {
            throw new ConfigurationException("correlation.disagreement_penalty", "must be within [0, 1], got " + disagreementPenalty);
        }
        return this;
    }
}
