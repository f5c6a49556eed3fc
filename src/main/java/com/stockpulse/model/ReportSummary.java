package com.stockpulse.model;

/** Headline numbers of a report. */
public record ReportSummary(
        int articleCount,
        int sentimentCount,
        int patternCount,
        int correlationCount,
        int agreeingCount,
        double agreementRate,
        int bullishNews,
        int bearishNews,
        int neutralNews,
        String newsTone,
        String marketTone,
        String strongestLink
) {
}
