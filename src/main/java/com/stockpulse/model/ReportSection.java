package com.stockpulse.model;

import java.time.LocalDate;

/** Narrative for one news-to-pattern link. */
public record ReportSection(
        LocalDate date,
        String heading,
        String body,
        double confidence
) {
}
