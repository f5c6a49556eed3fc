package com.stockpulse.report;

import com.stockpulse.correlate.CorrelationEngine;
import com.stockpulse.model.CorrelationResult;
import com.stockpulse.model.DateRange;
import com.stockpulse.model.Direction;
import com.stockpulse.model.NewsArticle;
import com.stockpulse.model.PatternKind;
import com.stockpulse.model.Polarity;
import com.stockpulse.model.Report;
import com.stockpulse.model.ReportSection;
import com.stockpulse.model.SentimentRecord;
import com.stockpulse.model.TechnicalPattern;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReportGeneratorTest {
    private static final LocalDate D = LocalDate.of(2024, 3, 1);
    private static final DateRange RANGE = new DateRange(D, LocalDate.of(2024, 3, 31));

    private final ReportGenerator generator = new ReportGenerator();

    @Test
    void generate_shouldOrderSectionsByNewsDateThenConfidence() {
        Report report = sampleReport();

        List<String> headings = report.sections().stream().map(ReportSection::heading).toList();
        assertEquals(List.of(
                "2024-03-04: Bullish news -> Bullish move",
                "2024-03-04: Bullish news -> Bearish reversal",
                "2024-03-05: Bearish news -> Bearish reversal",
                "2024-03-05: Bearish news -> Bullish move"
        ), headings);
        assertEquals("News-Pattern Report: AAPL", report.title());
        assertTrue(report.sections().get(0).body().startsWith("\"Apple upgraded\" (Reuters) read as bullish"));
        assertTrue(report.sections().get(0).body().contains("same day as the news"));
        assertTrue(report.sections().get(1).body().contains("does not agree"));
    }

    @Test
    void generate_shouldSummarizeToneAndAgreement() {
        Report report = sampleReport();

        assertEquals(3, report.summary().articleCount());
        assertEquals(3, report.summary().sentimentCount());
        assertEquals(2, report.summary().patternCount());
        assertEquals(4, report.summary().correlationCount());
        assertEquals(2, report.summary().agreeingCount());
        assertEquals(0.5, report.summary().agreementRate(), 1e-9);
        assertEquals("mixed/neutral", report.summary().newsTone());
        assertEquals("price action remained relatively balanced or sideways", report.summary().marketTone());
        assertEquals(
                "article A-1 -> Bullish move on 2024-03-04 (confidence 0.88, same day as the news)",
                report.summary().strongestLink()
        );
        assertEquals(1, report.uncorrelatedSentiments().size());
        assertEquals("A-2", report.uncorrelatedSentiments().get(0).articleId());
        assertTrue(report.uncorrelatedPatterns().isEmpty());
        assertEquals(2, report.patterns().size());
        assertFalse(report.isDegraded());
    }

    @Test
    void generate_shouldHandleRunWithoutNews() {
        TechnicalPattern move = pattern(PatternKind.BULLISH_MOVE, Direction.BULLISH, 6);
        CorrelationResult result = new CorrelationEngine().correlate(List.of(), List.of(move));

        Report report = generator.generate("AAPL", RANGE, List.of(), List.of(), List.of(move), result,
                List.of("no news found for range " + RANGE));

        assertTrue(report.sections().isEmpty());
        assertEquals("no analyzed news", report.summary().newsTone());
        assertEquals("price action tilted bullish", report.summary().marketTone());
        assertEquals("", report.summary().strongestLink());
        assertEquals(List.of(move), report.uncorrelatedPatterns());
        assertTrue(report.isDegraded());
    }

    @Test
    void generate_shouldBeDeterministic() {
        assertEquals(sampleReport(), sampleReport());
    }

    @Test
    void toneHelpers_shouldDescribeCounts() {
        assertEquals("overall bullish", ReportGenerator.newsTone(3, 2, 1, 0));
        assertEquals("overall bearish", ReportGenerator.newsTone(4, 0, 3, 1));
        assertEquals("price action tilted bearish", ReportGenerator.marketTone(2, 0, 2));
        assertEquals("no technical patterns detected", ReportGenerator.marketTone(0, 0, 0));
        assertEquals("1 day after the news", ReportGenerator.offsetText(1));
        assertEquals("3 days before the news", ReportGenerator.offsetText(-3));
    }

    private Report sampleReport() {
        SentimentRecord bearish = sentiment("A-0", Polarity.BEARISH, 0.8, 5);
        SentimentRecord bullish = sentiment("A-1", Polarity.BULLISH, 0.4, 4);
        SentimentRecord neutral = sentiment("A-2", Polarity.NEUTRAL, 0.1, 20);
        TechnicalPattern reversal = TechnicalPattern.of(
                PatternKind.REVERSAL, D.plusDays(2), D.plusDays(5), D.plusDays(6), Direction.BEARISH, 0.03, "3-session up run"
        );
        TechnicalPattern move = pattern(PatternKind.BULLISH_MOVE, Direction.BULLISH, 3);
        List<SentimentRecord> sentiments = List.of(bearish, bullish, neutral);
        List<TechnicalPattern> patterns = List.of(move, reversal);
        CorrelationResult result = new CorrelationEngine().correlate(sentiments, patterns);
        List<NewsArticle> articles = List.of(
                article("A-0", "Apple sued"),
                article("A-1", "Apple upgraded"),
                article("A-2", "Apple event scheduled")
        );
        return generator.generate("AAPL", RANGE, articles, sentiments, patterns, result, List.of());
    }

    private static SentimentRecord sentiment(String id, Polarity polarity, double magnitude, int dayOffset) {
        return new SentimentRecord(id, polarity, magnitude, 0.9, List.of("analyst"), "", null, D.plusDays(dayOffset - 1));
    }

    private static TechnicalPattern pattern(PatternKind kind, Direction direction, int dayOffset) {
        LocalDate anchor = D.plusDays(dayOffset);
        return TechnicalPattern.of(kind, anchor.minusDays(5), anchor, anchor, direction, 0.06, "");
    }

    private static NewsArticle article(String id, String title) {
        return new NewsArticle(id, "AAPL", title, "", "Reuters", Instant.parse("2024-03-04T15:00:00Z"), title);
    }
}
