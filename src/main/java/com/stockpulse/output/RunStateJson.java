package com.stockpulse.output;

import com.stockpulse.core.RunTelemetry;
import com.stockpulse.extract.ExtractionError;
import com.stockpulse.model.CorrelationRecord;
import com.stockpulse.model.NewsArticle;
import com.stockpulse.model.PricePoint;
import com.stockpulse.model.SentimentRecord;
import com.stockpulse.model.TechnicalPattern;
import com.stockpulse.workflow.RunState;
import com.stockpulse.workflow.RunStatus;
import com.stockpulse.workflow.StageFailure;
import org.json.JSONArray;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * JSON snapshot of a finished run, written by {@code --dump-state} for inspection.
 */
public final class RunStateJson {
    private RunStateJson() {
    }

    public static JSONObject toJson(RunState state) {
        JSONObject root = new JSONObject();
        root.put("ticker", state.ticker());
        root.put("start", state.range().start().toString());
        root.put("end", state.range().end().toString());
        root.put("status", state.status().name());
        root.put("degraded", state.isDegraded());

        JSONArray history = new JSONArray();
        for (RunStatus status : state.history()) {
            history.put(status.name());
        }
        root.put("history", history);

        StageFailure failure = state.failure();
        if (failure != null) {
            JSONObject f = new JSONObject();
            f.put("stage", failure.stage().name());
            f.put("error_type", failure.errorType().name());
            f.put("reason", failure.reason());
            root.put("failure", f);
        }
        root.put("warnings", new JSONArray(state.warnings()));

        JSONArray articles = new JSONArray();
        for (NewsArticle a : state.articles()) {
            JSONObject row = new JSONObject();
            row.put("id", a.id());
            row.put("title", a.title());
            row.put("url", a.url());
            row.put("source", a.source());
            row.put("published_at", a.publishedAt() == null ? JSONObject.NULL : a.publishedAt().toString());
            row.put("text_length", a.text().length());
            articles.put(row);
        }
        root.put("articles", articles);

        JSONArray sentiments = new JSONArray();
        for (SentimentRecord s : state.sentiments()) {
            sentiments.put(sentiment(s));
        }
        root.put("sentiments", sentiments);

        JSONArray errors = new JSONArray();
        for (ExtractionError e : state.extractionErrors()) {
            JSONObject row = new JSONObject();
            row.put("article_id", e.articleId);
            row.put("kind", e.kind.name());
            row.put("attempts", e.attempts);
            row.put("message", e.message);
            errors.put(row);
        }
        root.put("extraction_errors", errors);

        JSONArray prices = new JSONArray();
        for (PricePoint p : state.prices().points()) {
            JSONObject row = new JSONObject();
            row.put("date", p.date().toString());
            row.put("open", p.open());
            row.put("high", p.high());
            row.put("low", p.low());
            row.put("close", p.close());
            row.put("volume", p.volume());
            prices.put(row);
        }
        root.put("prices", prices);

        JSONArray patterns = new JSONArray();
        for (TechnicalPattern p : state.patterns()) {
            patterns.put(pattern(p));
        }
        root.put("patterns", patterns);

        JSONArray correlations = new JSONArray();
        for (CorrelationRecord r : state.correlation().records()) {
            JSONObject row = new JSONObject();
            row.put("article_id", r.sentiment().articleId());
            row.put("pattern_id", r.pattern().id());
            row.put("offset_days", r.offsetDays());
            row.put("confidence", r.confidence());
            row.put("directional_agreement", r.directionalAgreement());
            correlations.put(row);
        }
        root.put("correlations", correlations);

        JSONArray uncorrelatedSentiments = new JSONArray();
        for (SentimentRecord s : state.correlation().uncorrelatedSentiments()) {
            uncorrelatedSentiments.put(s.articleId());
        }
        root.put("uncorrelated_sentiments", uncorrelatedSentiments);

        JSONArray uncorrelatedPatterns = new JSONArray();
        for (TechnicalPattern p : state.correlation().uncorrelatedPatterns()) {
            uncorrelatedPatterns.put(p.id());
        }
        root.put("uncorrelated_patterns", uncorrelatedPatterns);

        root.put("telemetry", telemetry(state.telemetry()));
        return root;
    }

    public static void write(RunState state, Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(target, toJson(state).toString(2), StandardCharsets.UTF_8);
    }

    private static JSONObject sentiment(SentimentRecord s) {
        JSONObject row = new JSONObject();
        row.put("article_id", s.articleId());
        row.put("polarity", s.polarity().name());
        row.put("magnitude", s.magnitude());
        row.put("confidence", s.confidence());
        row.put("event_tags", new JSONArray(s.eventTags()));
        row.put("reasoning", s.reasoning());
        row.put("event_date", s.eventDate().toString());
        return row;
    }

    private static JSONObject pattern(TechnicalPattern p) {
        JSONObject row = new JSONObject();
        row.put("id", p.id());
        row.put("kind", p.kind().name());
        row.put("start_date", p.startDate().toString());
        row.put("anchor_date", p.anchorDate().toString());
        row.put("end_date", p.endDate().toString());
        row.put("direction", p.direction().name());
        row.put("magnitude", p.magnitude());
        row.put("note", p.note());
        return row;
    }

    private static JSONObject telemetry(RunTelemetry telemetry) {
        JSONObject t = new JSONObject();
        t.put("total_elapsed_ms", telemetry.totalElapsedMs());
        t.put("errors_total", telemetry.errorsTotal());
        JSONArray steps = new JSONArray();
        for (RunTelemetry.StepRecord step : telemetry.stepRecords()) {
            JSONObject row = new JSONObject();
            row.put("name", step.name());
            row.put("elapsed_ms", step.elapsedMs());
            row.put("items_in", step.itemsIn());
            row.put("items_out", step.itemsOut());
            row.put("error_count", step.errorCount());
            row.put("note", step.optionalNote());
            steps.put(row);
        }
        t.put("steps", steps);
        return t;
    }
}
