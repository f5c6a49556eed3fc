package com.stockpulse.extract;

import com.stockpulse.model.Polarity;

import java.util.List;

/**
 * Validated structured answer of the analysis capability for one piece of text.
 */
public record AnalysisPayload(
        Polarity polarity,
        double confidence,
        double impact,
        List<String> eventTags,
        String reasoning
) {
    public AnalysisPayload {
        eventTags = eventTags == null ? List.of() : List.copyOf(eventTags);
        reasoning = reasoning == null ? "" : reasoning;
    }
}
