package com.stockpulse.model;

/**
 * One news event linked to one pattern. {@code offsetDays} is pattern anchor minus event date,
 * so a positive offset means the price pattern followed the news.
 */
public record CorrelationRecord(
        SentimentRecord sentiment,
        TechnicalPattern pattern,
        int offsetDays,
        double confidence,
        boolean directionalAgreement
) {
}
