package com.stockpulse.model;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Sentiment and event tags extracted from one article. Polarity and magnitude always travel together.
 */
public record SentimentRecord(
        String articleId,
        Polarity polarity,
        double magnitude,
        double confidence,
        List<String> eventTags,
        String reasoning,
        Instant publishedAt,
        LocalDate eventDate
) {
    public SentimentRecord {
        Objects.requireNonNull(polarity, "polarity");
        Objects.requireNonNull(eventDate, "eventDate");
        if (!(magnitude >= 0.0 && magnitude <= 1.0)) {
            throw new IllegalArgumentException("magnitude out of [0,1]: " + magnitude);
        }
        if (!(confidence >= 0.0 && confidence <= 1.0)) {
            throw new IllegalArgumentException("confidence out of [0,1]: " + confidence);
        }
        articleId = articleId == null ? "" : articleId;
        reasoning = reasoning == null ? "" : reasoning.trim();
        Set<String> tags = new LinkedHashSet<>();
        if (eventTags != null) {
            for (String tag : eventTags) {
                String t = tag == null ? "" : tag.trim().toLowerCase(Locale.ROOT);
                if (!t.isEmpty()) {
                    tags.add(t);
                }
            }
        }
        eventTags = List.copyOf(new ArrayList<>(tags));
    }
}
