package com.stockpulse.model;

import java.util.List;

/**
 * Links found between sentiment records and patterns, plus whatever stayed unlinked on either side.
 */
public record CorrelationResult(
        List<CorrelationRecord> records,
        List<SentimentRecord> uncorrelatedSentiments,
        List<TechnicalPattern> uncorrelatedPatterns
) {
    public CorrelationResult {
        records = records == null ? List.of() : List.copyOf(records);
        uncorrelatedSentiments = uncorrelatedSentiments == null ? List.of() : List.copyOf(uncorrelatedSentiments);
        uncorrelatedPatterns = uncorrelatedPatterns == null ? List.of() : List.copyOf(uncorrelatedPatterns);
    }

    public static CorrelationResult empty() {
        return new CorrelationResult(List.of(), List.of(), List.of());
    }
}
