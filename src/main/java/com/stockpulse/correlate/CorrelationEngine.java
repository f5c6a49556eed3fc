package com.stockpulse.correlate;

import com.stockpulse.model.CorrelationRecord;
import com.stockpulse.model.CorrelationResult;
import com.stockpulse.model.SentimentRecord;
import com.stockpulse.model.TechnicalPattern;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Links sentiment events to price patterns whose anchor date falls inside the correlation window.
 * <p>
 * Both inputs are stable-sorted by date (ties keep input order) and joined with a single sweep.
 * Every input item ends up either in at least one {@link CorrelationRecord} or in the uncorrelated lists.
 */
public final class CorrelationEngine {
    private static final Logger LOG = LogManager.getLogger(CorrelationEngine.class);

    private final CorrelationSettings settings;

    public CorrelationEngine() {
        this(CorrelationSettings.defaults());
    }

    public CorrelationEngine(CorrelationSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings").validated();
    }

    public CorrelationSettings settings() {
        return settings;
    }

    public CorrelationResult correlate(List<SentimentRecord> sentiments, List<TechnicalPattern> patterns) {
        List<SentimentRecord> events = sortedCopy(sentiments, Comparator.comparing(SentimentRecord::eventDate));
        List<TechnicalPattern> anchors = sortedCopy(patterns, Comparator.comparing(TechnicalPattern::anchorDate));

        List<CorrelationRecord> records = new ArrayList<>();
        List<SentimentRecord> unmatchedEvents = new ArrayList<>();
        boolean[] patternMatched = new boolean[anchors.size()];

        int lower = 0;
        for (SentimentRecord event : events) {
            LocalDate from = event.eventDate().minusDays(settings.lookbackDays);
            LocalDate to = event.eventDate().plusDays(settings.lookaheadDays);
            while (lower < anchors.size() && anchors.get(lower).anchorDate().isBefore(from)) {
                lower++;
            }
            boolean matched = false;
            for (int j = lower; j < anchors.size(); j++) {
                TechnicalPattern pattern = anchors.get(j);
                if (pattern.anchorDate().isAfter(to)) {
                    break;
                }
                int offset = (int) ChronoUnit.DAYS.between(event.eventDate(), pattern.anchorDate());
                double confidence = confidence(event, pattern, offset);
                if (confidence < settings.minConfidence) {
                    continue;
                }
                records.add(new CorrelationRecord(event, pattern, offset, confidence, agrees(event, pattern)));
                patternMatched[j] = true;
                matched = true;
            }
            if (!matched) {
                unmatchedEvents.add(event);
            }
        }

        List<TechnicalPattern> unmatchedPatterns = new ArrayList<>();
        for (int j = 0; j < anchors.size(); j++) {
            if (!patternMatched[j]) {
                unmatchedPatterns.add(anchors.get(j));
            }
        }
        LOG.debug(
                "correlated events={} patterns={} -> records={} unmatched_events={} unmatched_patterns={}",
                events.size(),
                anchors.size(),
                records.size(),
                unmatchedEvents.size(),
                unmatchedPatterns.size()
        );
        return new CorrelationResult(records, unmatchedEvents, unmatchedPatterns);
    }

    /**
     * Proximity (1 at offset 0, falling linearly towards the window edge) weighted by the event magnitude,
     * then boosted on directional agreement or penalised on opposite directions. Rounded to 4 decimals.
     */
    double confidence(SentimentRecord event, TechnicalPattern pattern, int offsetDays) {
        int side = offsetDays >= 0 ? settings.lookaheadDays : settings.lookbackDays;
        double proximity = 1.0 - Math.abs(offsetDays) / (double) (side + 1);
        double magnitudeWeight = 0.5 + 0.5 * event.magnitude();
        double directionFactor = 1.0;
        int eventSign = event.polarity().sign();
        int patternSign = pattern.direction().sign();
        if (eventSign == patternSign) {
            directionFactor += settings.agreementBoost;
        } else if (eventSign != 0 && patternSign != 0) {
            directionFactor -= settings.disagreementPenalty;
        }
        double raw = proximity * magnitudeWeight * directionFactor;
        double clamped = Math.max(0.0, Math.min(1.0, raw));
        return Math.round(clamped * 10_000.0) / 10_000.0;
    }

    static boolean agrees(SentimentRecord event, TechnicalPattern pattern) {
        return event.polarity().sign() == pattern.direction().sign();
    }

    private static <T> List<T> sortedCopy(List<T> input, Comparator<T> order) {
        List<T> out = new ArrayList<>();
        if (input != null) {
            for (T item : input) {
                if (item != null) {
                    out.add(item);
                }
            }
        }
        out.sort(order);
        return out;
    }
}
