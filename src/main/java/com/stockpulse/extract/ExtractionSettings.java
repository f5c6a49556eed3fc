package com.stockpulse.extract;

import com.stockpulse.config.Config;
import com.stockpulse.core.error.ConfigurationException;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.DateTimeException;
import java.time.ZoneId;

/**
 * Retry, backoff and concurrency limits for sentiment extraction, plus the zone used for event dates.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class ExtractionSettings {
    public final int maxAttempts;
    public final long retrySleepMs;
    public final int parallelism;
    /** Zone used to turn an article timestamp into its market event date. */
    public final ZoneId zone;

    public static ExtractionSettings defaults() {
        return new ExtractionSettings(3, 250L, 4, ZoneId.of("America/New_York")).validated();
    }

    public static ExtractionSettings fromConfig(Config config) {
        ExtractionSettings d = defaults();
        String zoneId = config.getString("app.zone", d.zone.getId());
        ZoneId zone;
        try {
            zone = ZoneId.of(zoneId);
        } catch (DateTimeException e) {
            throw new ConfigurationException("app.zone", "unknown zone '" + zoneId + "'");
        }
        return ExtractionSettings.builder()
                .maxAttempts(config.requireInt("extraction.max_attempts", d.maxAttempts))
                .retrySleepMs(config.requireInt("extraction.retry_sleep_ms", (int) d.retrySleepMs))
                .parallelism(config.requireInt("extraction.parallelism", d.parallelism))
                .zone(zone)
                .build()
                .validated();
    }

    public ExtractionSettings validated() {
        if (maxAttempts < 1) {
            throw new ConfigurationException("extraction.max_attempts", "must be >= 1, got " + maxAttempts);
        }
        if (retrySleepMs < 0) {
            throw new ConfigurationException("extraction.retry_sleep_ms", "must be >= 0, got " + retrySleepMs);
        }
        if (parallelism < 1) {
            throw new ConfigurationException("extraction.parallelism", "must be >= 1, got " + parallelism);
        }
        if (zone == null) {
            throw new ConfigurationException("app.zone", "missing");
        }
        return this;
    }
}
