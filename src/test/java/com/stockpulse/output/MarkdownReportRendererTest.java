package com.stockpulse.output;

import com.stockpulse.correlate.CorrelationEngine;
import com.stockpulse.model.CorrelationResult;
import com.stockpulse.model.DateRange;
import com.stockpulse.model.Direction;
import com.stockpulse.model.NewsArticle;
import com.stockpulse.model.PatternKind;
import com.stockpulse.model.Polarity;
import com.stockpulse.model.Report;
import com.stockpulse.model.SentimentRecord;
import com.stockpulse.model.TechnicalPattern;
import com.stockpulse.report.ReportGenerator;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MarkdownReportRendererTest {
    private static final LocalDate ANCHOR = LocalDate.of(2024, 3, 6);
    private static final DateRange RANGE = new DateRange(LocalDate.of(2024, 3, 1), LocalDate.of(2024, 3, 8));

    private final MarkdownReportRenderer renderer = new MarkdownReportRenderer();

    @Test
    void render_shouldContainGoldenSections() {
        SentimentRecord sentiment = new SentimentRecord(
                "AAPL-0", Polarity.BEARISH, 0.7, 0.9, List.of("guidance"), "Weak outlook.", null, ANCHOR.minusDays(1)
        );
        TechnicalPattern reversal = TechnicalPattern.of(
                PatternKind.REVERSAL, ANCHOR.minusDays(3), ANCHOR, ANCHOR.plusDays(1), Direction.BEARISH, 0.04, "3-session up run"
        );
        TechnicalPattern sideways = TechnicalPattern.of(
                PatternKind.SIDEWAYS_RANGE, RANGE.start(), RANGE.start(), RANGE.end(), Direction.NEUTRAL, 0.01, ""
        );
        List<TechnicalPattern> patterns = List.of(reversal, sideways);
        CorrelationResult result = new CorrelationEngine().correlate(List.of(sentiment), patterns);
        NewsArticle article = new NewsArticle(
                "AAPL-0", "AAPL", "Apple cuts outlook", "", "Reuters", Instant.parse("2024-03-05T15:00:00Z"), "text"
        );
        Report report = new ReportGenerator().generate(
                "AAPL", RANGE, List.of(article), List.of(sentiment), patterns, result, List.of("1 articles failed extraction")
        );

        String markdown = renderer.render(report);

        assertTrue(markdown.startsWith("# News-Pattern Report: AAPL\n"));
        assertTrue(markdown.contains("**Date range:** 2024-03-01 to 2024-03-08"));
        assertTrue(markdown.contains("## Summary"));
        assertTrue(markdown.contains("## Detected Technical Patterns"));
        assertTrue(markdown.contains("- **Bearish reversal** (`reversal:bearish@2024-03-06`) from 2024-03-03 to 2024-03-07"));
        assertTrue(markdown.contains("## News Events and Their Market Impact"));
        assertTrue(markdown.contains("### 2024-03-05: Bearish news -> Bearish reversal"));
        assertTrue(markdown.contains("\"Apple cuts outlook\" (Reuters)"));
        assertTrue(markdown.contains("## Appendix: Uncorrelated Items"));
        assertTrue(markdown.contains("## Warnings"));
        assertTrue(markdown.contains("- 1 articles failed extraction"));
        assertTrue(markdown.contains("- **Strongest link:** article AAPL-0 -> Bearish reversal"));
        assertTrue(markdown.endsWith("no prediction._\n"));
    }

    @Test
    void render_shouldExplainEmptySections() {
        Report report = new ReportGenerator().generate(
                "MSFT", RANGE, List.of(), List.of(), List.of(), CorrelationResult.empty(), List.of()
        );

        String markdown = renderer.render(report);

        assertTrue(markdown.contains("_No clear technical patterns detected in this date range._"));
        assertTrue(markdown.contains("_No news event could be linked to a price pattern in this date range._"));
        assertTrue(markdown.contains("_None._"));
        assertFalse(markdown.contains("## Warnings"));
        assertFalse(markdown.contains("Strongest link"));
    }

    @Test
    void variables_shouldFormatAgreementRateAsPercent() {
        Report report = new ReportGenerator().generate(
                "MSFT", RANGE, List.of(), List.of(), List.of(), CorrelationResult.empty(), List.of()
        );

        Map<String, Object> vars = renderer.variables(report);

        assertEquals("0%", vars.get("agreementRate"));
        assertEquals("2024-03-01 to 2024-03-08", vars.get("range"));
        assertEquals(List.of(), vars.get("sections"));
    }
}
