package com.stockpulse.model;

import java.util.List;

/**
 * Finished explanation of one run: narrative sections per correlation, every detected pattern,
 * and the appendix of uncorrelated items.
 */
public record Report(
        String title,
        String ticker,
        DateRange range,
        ReportSummary summary,
        List<ReportSection> sections,
        List<TechnicalPattern> patterns,
        List<SentimentRecord> uncorrelatedSentiments,
        List<TechnicalPattern> uncorrelatedPatterns,
        List<String> warnings
) {
    public Report {
        sections = sections == null ? List.of() : List.copyOf(sections);
        patterns = patterns == null ? List.of() : List.copyOf(patterns);
        uncorrelatedSentiments = uncorrelatedSentiments == null ? List.of() : List.copyOf(uncorrelatedSentiments);
        uncorrelatedPatterns = uncorrelatedPatterns == null ? List.of() : List.copyOf(uncorrelatedPatterns);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public boolean isDegraded() {
        return !warnings.isEmpty();
    }
}
