package com.stockpulse.workflow;

import com.stockpulse.core.RunTelemetry;
import com.stockpulse.extract.ExtractionError;
import com.stockpulse.model.CorrelationResult;
import com.stockpulse.model.DateRange;
import com.stockpulse.model.NewsArticle;
import com.stockpulse.model.PriceSeries;
import com.stockpulse.model.Report;
import com.stockpulse.model.SentimentRecord;
import com.stockpulse.model.TechnicalPattern;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Everything one run has produced so far, one field per stage output.
 * <p>
 * Owned by a single orchestrator run and mutated only through the package-private fold methods,
 * which also enforce strictly forward status transitions.
 */
public final class RunState {
    private final String ticker;
    private final DateRange range;
    private final RunTelemetry telemetry;

    private RunStatus status = RunStatus.INIT;
    private StageFailure failure;
    private final List<RunStatus> history = new ArrayList<>(List.of(RunStatus.INIT));
    private final List<String> warnings = new ArrayList<>();

    private List<NewsArticle> articles = List.of();
    private List<SentimentRecord> sentiments = List.of();
    private List<ExtractionError> extractionErrors = List.of();
    private PriceSeries prices = PriceSeries.empty();
    private List<TechnicalPattern> patterns = List.of();
    private CorrelationResult correlation = CorrelationResult.empty();
    private Report report;

    RunState(String ticker, DateRange range, RunTelemetry telemetry) {
        this.ticker = Objects.requireNonNull(ticker, "ticker");
        this.range = Objects.requireNonNull(range, "range");
        this.telemetry = telemetry == null ? new RunTelemetry(ticker, null) : telemetry;
    }

    void apply(StageDelta delta) {
        Objects.requireNonNull(delta, "delta");
        requireTransition(delta.target());
        if (delta instanceof StageDelta.News news) {
            articles = news.articles();
        } else if (delta instanceof StageDelta.Sentiment sentiment) {
            sentiments = sentiment.records();
            extractionErrors = sentiment.failures();
        } else if (delta instanceof StageDelta.Prices priceDelta) {
            prices = priceDelta.series();
        } else if (delta instanceof StageDelta.Patterns patternDelta) {
            patterns = patternDelta.patterns();
        } else if (delta instanceof StageDelta.Correlation correlationDelta) {
            correlation = correlationDelta.result();
        } else if (delta instanceof StageDelta.Reported reported) {
            report = reported.report();
        }
        warnings.addAll(delta.warnings());
        advance(delta.target());
    }

    void complete() {
        advance(RunStatus.DONE);
    }

    void fail(StageFailure stageFailure) {
        Objects.requireNonNull(stageFailure, "stageFailure");
        advance(RunStatus.FAILED);
        failure = stageFailure;
    }

    private void advance(RunStatus next) {
        requireTransition(next);
        status = next;
        history.add(next);
    }

    private void requireTransition(RunStatus next) {
        if (!status.canAdvanceTo(next)) {
            throw new IllegalStateException("illegal run transition " + status + " -> " + next);
        }
    }

    public String ticker() {
        return ticker;
    }

    public DateRange range() {
        return range;
    }

    public RunTelemetry telemetry() {
        return telemetry;
    }

    public RunStatus status() {
        return status;
    }

    public List<RunStatus> history() {
        return Collections.unmodifiableList(history);
    }

    /**
     * Present only when {@link #status()} is {@link RunStatus#FAILED}.
     */
    public StageFailure failure() {
        return failure;
    }

    public boolean isDone() {
        return status == RunStatus.DONE;
    }

    public boolean isFailed() {
        return status == RunStatus.FAILED;
    }

    /**
     * Finished, but with at least one warning (no news, failed extractions, no patterns, timeouts).
     */
    public boolean isDegraded() {
        return status == RunStatus.DONE && !warnings.isEmpty();
    }

    public List<String> warnings() {
        return Collections.unmodifiableList(warnings);
    }

    public List<NewsArticle> articles() {
        return articles;
    }

    public List<SentimentRecord> sentiments() {
        return sentiments;
    }

    public List<ExtractionError> extractionErrors() {
        return extractionErrors;
    }

    public PriceSeries prices() {
        return prices;
    }

    public List<TechnicalPattern> patterns() {
        return patterns;
    }

    public CorrelationResult correlation() {
        return correlation;
    }

    public Report report() {
        return report;
    }
}
