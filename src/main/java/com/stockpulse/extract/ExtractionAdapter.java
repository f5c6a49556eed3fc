package com.stockpulse.extract;

import com.stockpulse.core.error.MalformedOutputException;
import com.stockpulse.model.NewsArticle;
import com.stockpulse.model.SentimentRecord;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;

/**
 * Turns one article into a {@link SentimentRecord} through a {@link StructuredAnalyzer}.
 * <p>
 * Malformed answers and analyzer failures are retried up to {@code maxAttempts} times with a linear
 * backoff. The adapter keeps no state between calls, so one instance can serve many worker threads.
 */
public final class ExtractionAdapter {
    private static final Logger LOG = LogManager.getLogger(ExtractionAdapter.class);

    private final StructuredAnalyzer analyzer;
    private final ExtractionSettings settings;
    private final Clock clock;

    public ExtractionAdapter(StructuredAnalyzer analyzer, ExtractionSettings settings) {
        this(analyzer, settings, Clock.systemUTC());
    }

    ExtractionAdapter(StructuredAnalyzer analyzer, ExtractionSettings settings, Clock clock) {
        this.analyzer = Objects.requireNonNull(analyzer, "analyzer");
        this.settings = Objects.requireNonNull(settings, "settings").validated();
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public ExtractionSettings settings() {
        return settings;
    }

    public ExtractionResult extract(NewsArticle article) {
        if (article == null || !article.hasText()) {
            String id = article == null ? "" : article.id();
            return ExtractionResult.failure(new ExtractionError(id, ExtractionError.Kind.EMPTY_TEXT, 0, "article has no text"));
        }
        String text = SentimentPrompts.articleText(article);
        ExtractionError.Kind lastKind = ExtractionError.Kind.CAPABILITY_FAILURE;
        String lastError = "";
        int maxAttempts = settings.maxAttempts;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                AnalysisPayload payload = analyzer.analyze(text);
                if (payload == null || payload.polarity() == null) {
                    throw new MalformedOutputException("analyzer returned no payload", "");
                }
                if (attempt > 1) {
                    LOG.debug("article {} extracted on attempt {}", article.id(), attempt);
                }
                return ExtractionResult.success(toRecord(article, payload));
            } catch (MalformedOutputException e) {
                lastKind = ExtractionError.Kind.MALFORMED_OUTPUT;
                lastError = messageOf(e);
            } catch (RuntimeException e) {
                lastKind = ExtractionError.Kind.CAPABILITY_FAILURE;
                lastError = messageOf(e);
            }
            LOG.debug("article {} attempt {}/{} failed: {} {}", article.id(), attempt, maxAttempts, lastKind, lastError);
            if (attempt >= maxAttempts) {
                break;
            }
            try {
                Thread.sleep(settings.retrySleepMs * attempt);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                return ExtractionResult.failure(
                        new ExtractionError(article.id(), ExtractionError.Kind.INTERRUPTED, attempt, "interrupted while backing off")
                );
            }
        }
        LOG.warn("article {} failed extraction after {} attempts: {}", article.id(), maxAttempts, lastError);
        return ExtractionResult.failure(new ExtractionError(article.id(), lastKind, maxAttempts, lastError));
    }

    private SentimentRecord toRecord(NewsArticle article, AnalysisPayload payload) {
        Instant publishedAt = article.publishedAt();
        LocalDate eventDate = publishedAt == null
                ? LocalDate.now(clock.withZone(settings.zone))
                : publishedAt.atZone(settings.zone).toLocalDate();
        return new SentimentRecord(
                article.id(),
                payload.polarity(),
                clamp01(payload.impact()),
                clamp01(payload.confidence()),
                payload.eventTags(),
                payload.reasoning(),
                publishedAt,
                eventDate
        );
    }

    private static double clamp01(double value) {
        if (!Double.isFinite(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static String messageOf(Exception e) {
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }
}
