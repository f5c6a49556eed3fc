package com.stockpulse.workflow;

import com.stockpulse.core.error.ConfigurationException;
import com.stockpulse.core.error.ErrorType;
import com.stockpulse.core.error.FetchException;
import com.stockpulse.core.error.MalformedOutputException;
import com.stockpulse.correlate.CorrelationEngine;
import com.stockpulse.data.MarketDataSource;
import com.stockpulse.data.NewsSource;
import com.stockpulse.extract.AnalysisPayload;
import com.stockpulse.extract.ExtractionAdapter;
import com.stockpulse.extract.ExtractionError;
import com.stockpulse.extract.ExtractionSettings;
import com.stockpulse.extract.StructuredAnalyzer;
import com.stockpulse.model.NewsArticle;
import com.stockpulse.model.PatternKind;
import com.stockpulse.model.Polarity;
import com.stockpulse.model.PricePoint;
import com.stockpulse.model.PriceSeries;
import com.stockpulse.pattern.PatternDetector;
import com.stockpulse.report.ReportGenerator;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WorkflowOrchestratorTest {
    private static final LocalDate START = LocalDate.of(2024, 3, 1);
    private static final LocalDate END = LocalDate.of(2024, 3, 7);
    private static final ExtractionSettings FAST = new ExtractionSettings(2, 0L, 2, ZoneId.of("America/New_York"));
    private static final AnalysisPayload BULLISH = new AnalysisPayload(
            Polarity.BULLISH, 0.9, 0.8, List.of("earnings"), "Record quarter."
    );

    @Test
    void run_shouldFinishDegradedWhenNoNewsFound() {
        WorkflowOrchestrator orchestrator = orchestrator(
                (ticker, range) -> List.of(),
                (ticker, range) -> bullishMoveSeries(),
                text -> BULLISH,
                WorkflowSettings.defaults()
        );

        RunState state = orchestrator.run("aapl", START, END);

        assertEquals(RunStatus.DONE, state.status());
        assertTrue(state.isDegraded());
        assertEquals("AAPL", state.ticker());
        assertTrue(state.sentiments().isEmpty());
        assertEquals(1, state.patterns().size());
        assertEquals(PatternKind.BULLISH_MOVE, state.patterns().get(0).kind());
        assertTrue(state.correlation().records().isEmpty());
        assertEquals(state.patterns(), state.correlation().uncorrelatedPatterns());
        assertTrue(state.warnings().contains("no news found for range 2024-03-01..2024-03-07"));
        assertNotNull(state.report());
        assertTrue(state.report().sections().isEmpty());
        assertEquals(state.patterns(), state.report().uncorrelatedPatterns());
        assertTrue(state.report().isDegraded());
    }

    @Test
    void run_shouldCorrelateNewsWithSameDayMove() {
        WorkflowOrchestrator orchestrator = orchestrator(
                (ticker, range) -> List.of(article("AAPL-0", Instant.parse("2024-03-07T15:00:00Z"))),
                (ticker, range) -> bullishMoveSeries(),
                text -> BULLISH,
                WorkflowSettings.defaults()
        );

        RunState state = orchestrator.run("AAPL", START, END);

        assertTrue(state.isDone());
        assertFalse(state.isDegraded());
        assertEquals(1, state.sentiments().size());
        assertEquals(1, state.correlation().records().size());
        assertEquals(0, state.correlation().records().get(0).offsetDays());
        assertTrue(state.correlation().records().get(0).directionalAgreement());
        assertEquals(1, state.report().sections().size());
        assertEquals("2024-03-07: Bullish news -> Bullish move", state.report().sections().get(0).heading());
        assertEquals(1, state.report().summary().agreeingCount());
    }

    @Test
    void run_shouldKeepGoingWhenEveryExtractionFails() {
        WorkflowOrchestrator orchestrator = orchestrator(
                (ticker, range) -> List.of(
                        article("AAPL-0", Instant.parse("2024-03-04T15:00:00Z")),
                        article("AAPL-1", Instant.parse("2024-03-05T15:00:00Z"))
                ),
                (ticker, range) -> bullishMoveSeries(),
                text -> {
                    throw new MalformedOutputException("no JSON object in model output", "hello");
                },
                WorkflowSettings.defaults()
        );

        RunState state = orchestrator.run("AAPL", START, END);

        assertEquals(RunStatus.DONE, state.status());
        assertTrue(state.isDegraded());
        assertTrue(state.sentiments().isEmpty());
        assertEquals(2, state.extractionErrors().size());
        for (ExtractionError error : state.extractionErrors()) {
            assertEquals(ExtractionError.Kind.MALFORMED_OUTPUT, error.kind);
            assertEquals(2, error.attempts);
        }
        assertTrue(state.warnings().contains("2 articles failed extraction"));
        assertTrue(state.warnings().stream().anyMatch(w -> w.startsWith("article AAPL-1 failed extraction")));
        assertEquals(1, state.report().uncorrelatedPatterns().size());
    }

    @Test
    void run_shouldFailWhenNoPriceData() {
        WorkflowOrchestrator orchestrator = orchestrator(
                (ticker, range) -> List.of(),
                (ticker, range) -> PriceSeries.empty(),
                text -> BULLISH,
                WorkflowSettings.defaults()
        );

        RunState state = orchestrator.run("AAPL", START, END);

        assertTrue(state.isFailed());
        assertFalse(state.isDegraded());
        assertEquals(RunStatus.PRICES_FETCHED, state.failure().stage());
        assertEquals(ErrorType.INSUFFICIENT_DATA, state.failure().errorType());
        assertNull(state.report());
        assertEquals(
                List.of(RunStatus.INIT, RunStatus.NEWS_FETCHED, RunStatus.SENTIMENT_EXTRACTED, RunStatus.FAILED),
                state.history()
        );
    }

    @Test
    void run_shouldFailWithFetchErrorWhenPriceSourceFails() {
        WorkflowOrchestrator orchestrator = orchestrator(
                (ticker, range) -> List.of(),
                (ticker, range) -> {
                    throw new FetchException("stooq", "HTTP 503");
                },
                text -> BULLISH,
                WorkflowSettings.defaults()
        );

        RunState state = orchestrator.run("AAPL", START, END);

        assertEquals(ErrorType.FETCH_ERROR, state.failure().errorType());
        assertTrue(state.failure().reason().contains("HTTP 503"));
    }

    @Test
    void run_shouldFailWithTimeoutWhenPriceSourceHangs() {
        WorkflowOrchestrator orchestrator = orchestrator(
                (ticker, range) -> List.of(),
                (ticker, range) -> {
                    sleepQuietly(10_000L);
                    return bullishMoveSeries();
                },
                text -> BULLISH,
                new WorkflowSettings(60_000L, 300L)
        );

        RunState state = orchestrator.run("AAPL", START, END);

        assertTrue(state.isFailed());
        assertEquals(RunStatus.PRICES_FETCHED, state.failure().stage());
        assertEquals(ErrorType.TIMEOUT, state.failure().errorType());
    }

    @Test
    void run_shouldDegradeWhenExtractionExceedsDeadline() {
        WorkflowOrchestrator orchestrator = orchestrator(
                (ticker, range) -> List.of(
                        article("AAPL-0", Instant.parse("2024-03-07T15:00:00Z")),
                        article("AAPL-1", Instant.parse("2024-03-07T16:00:00Z"))
                ),
                (ticker, range) -> bullishMoveSeries(),
                text -> {
                    if (text.contains("AAPL-1")) {
                        sleepQuietly(10_000L);
                    }
                    return BULLISH;
                },
                new WorkflowSettings(500L, 60_000L)
        );

        RunState state = orchestrator.run("AAPL", START, END);

        assertEquals(RunStatus.DONE, state.status());
        assertTrue(state.isDegraded());
        assertEquals(1, state.sentiments().size());
        assertEquals("AAPL-0", state.sentiments().get(0).articleId());
        assertEquals(1, state.extractionErrors().size());
        assertEquals("AAPL-1", state.extractionErrors().get(0).articleId);
        assertEquals(ExtractionError.Kind.TIMED_OUT, state.extractionErrors().get(0).kind);
        assertTrue(state.warnings().contains("extraction timed out; 1 of 2 articles not analyzed"));
        assertEquals(1, state.report().sections().size());
    }

    @Test
    void run_shouldFinishWhenNewsFetchHangs() {
        WorkflowOrchestrator orchestrator = orchestrator(
                (ticker, range) -> {
                    sleepQuietly(10_000L);
                    return List.of(article("AAPL-0", Instant.parse("2024-03-07T15:00:00Z")));
                },
                (ticker, range) -> bullishMoveSeries(),
                text -> BULLISH,
                new WorkflowSettings(300L, 60_000L)
        );

        RunState state = orchestrator.run("AAPL", START, END);

        assertEquals(RunStatus.DONE, state.status());
        assertTrue(state.isDegraded());
        assertTrue(state.articles().isEmpty());
        assertTrue(state.warnings().contains("news fetch timed out; continuing without news"));
        assertEquals(1, state.patterns().size());
    }

    @Test
    void collectUntil_shouldKeepResultsFinishedBeforeExpiredDeadline() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            CompletionService<String> completion = new ExecutorCompletionService<>(pool);
            Future<String> first = completion.submit(() -> "a");
            Future<String> second = completion.submit(() -> "b");
            first.get();
            second.get();

            List<String> collected = WorkflowOrchestrator.collectUntil(completion, 3, System.nanoTime() - 1L);

            assertEquals(2, collected.size());
            assertTrue(collected.containsAll(List.of("a", "b")));
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void run_shouldDegradeWhenNewsSourceFails() {
        WorkflowOrchestrator orchestrator = orchestrator(
                (ticker, range) -> {
                    throw new FetchException("rss", "all news sources failed");
                },
                (ticker, range) -> bullishMoveSeries(),
                text -> BULLISH,
                WorkflowSettings.defaults()
        );

        RunState state = orchestrator.run("AAPL", START, END);

        assertTrue(state.isDone());
        assertTrue(state.isDegraded());
        assertTrue(state.warnings().get(0).startsWith("news fetch failed (rss)"));
    }

    @Test
    void run_shouldProduceEqualReportsForEqualInputs() {
        WorkflowOrchestrator orchestrator = orchestrator(
                (ticker, range) -> List.of(
                        article("AAPL-0", Instant.parse("2024-03-05T15:00:00Z")),
                        article("AAPL-1", Instant.parse("2024-03-07T15:00:00Z"))
                ),
                (ticker, range) -> bullishMoveSeries(),
                text -> BULLISH,
                WorkflowSettings.defaults()
        );

        RunState first = orchestrator.run("AAPL", START, END);
        RunState second = orchestrator.run("AAPL", START, END);

        assertEquals(first.report(), second.report());
        assertEquals(first.history(), second.history());
    }

    @Test
    void run_shouldRecordStrictlyForwardHistory() {
        WorkflowOrchestrator orchestrator = orchestrator(
                (ticker, range) -> List.of(article("AAPL-0", Instant.parse("2024-03-07T15:00:00Z"))),
                (ticker, range) -> bullishMoveSeries(),
                text -> BULLISH,
                WorkflowSettings.defaults()
        );

        RunState state = orchestrator.run("AAPL", START, END);

        assertEquals(List.of(RunStatus.values()).subList(0, RunStatus.DONE.ordinal() + 1), state.history());
        assertEquals(6, state.telemetry().stepRecords().size());
    }

    @Test
    void run_shouldRejectInvalidRequestsBeforeAnyStage() {
        List<String> calls = new ArrayList<>();
        WorkflowOrchestrator orchestrator = orchestrator(
                (ticker, range) -> {
                    calls.add("news");
                    return List.of();
                },
                (ticker, range) -> bullishMoveSeries(),
                text -> BULLISH,
                WorkflowSettings.defaults()
        );

        assertThrows(ConfigurationException.class, () -> orchestrator.run("  ", START, END));
        assertThrows(ConfigurationException.class, () -> orchestrator.run("AAPL", END, START));
        assertTrue(calls.isEmpty());
    }

    private static WorkflowOrchestrator orchestrator(
            NewsSource news,
            MarketDataSource prices,
            StructuredAnalyzer analyzer,
            WorkflowSettings settings
    ) {
        return new WorkflowOrchestrator(
                news,
                prices,
                new ExtractionAdapter(analyzer, FAST),
                new PatternDetector(),
                new CorrelationEngine(),
                new ReportGenerator(),
                settings
        );
    }

    private static void sleepQuietly(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static NewsArticle article(String id, Instant publishedAt) {
        return new NewsArticle(id, "AAPL", "Apple posts record quarter " + id, "", "Reuters", publishedAt, "Apple beat estimates.");
    }

    /**
     * Six flat closes then a 7% jump: one bullish move anchored on 2024-03-07.
     */
    private static PriceSeries bullishMoveSeries() {
        List<PricePoint> points = new ArrayList<>();
        double[] closes = {100, 100, 100, 100, 100, 100, 107};
        for (int i = 0; i < closes.length; i++) {
            points.add(new PricePoint(START.plusDays(i), closes[i], closes[i], closes[i], closes[i], 1_000));
        }
        return PriceSeries.of(points);
    }
}
