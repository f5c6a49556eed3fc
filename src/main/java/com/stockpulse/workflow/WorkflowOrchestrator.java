package com.stockpulse.workflow;

import com.stockpulse.core.RunTelemetry;
import com.stockpulse.core.error.ConfigurationException;
import com.stockpulse.core.error.ErrorType;
import com.stockpulse.core.error.FetchException;
import com.stockpulse.core.error.InsufficientDataException;
import com.stockpulse.correlate.CorrelationEngine;
import com.stockpulse.data.MarketDataSource;
import com.stockpulse.data.NewsSource;
import com.stockpulse.extract.ExtractionAdapter;
import com.stockpulse.extract.ExtractionError;
import com.stockpulse.extract.ExtractionResult;
import com.stockpulse.model.CorrelationResult;
import com.stockpulse.model.DateRange;
import com.stockpulse.model.NewsArticle;
import com.stockpulse.model.PriceSeries;
import com.stockpulse.model.Report;
import com.stockpulse.model.SentimentRecord;
import com.stockpulse.model.TechnicalPattern;
import com.stockpulse.pattern.PatternDetector;
import com.stockpulse.report.ReportGenerator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Drives one analysis run through the pipeline states and decides how it ends.
 * <p>
 * Each stage produces a {@link StageDelta} that is folded into a fresh {@link RunState}. Optional
 * outputs (news, sentiment, patterns) degrade the run with a warning when empty; prices are required.
 * News and extraction share the run deadline; the price fetch has a budget of its own.
 * Every run gets its own worker pool, so concurrent runs share no mutable state.
 */
public final class WorkflowOrchestrator {
    private static final Logger LOG = LogManager.getLogger(WorkflowOrchestrator.class);

    private final NewsSource newsSource;
    private final MarketDataSource marketDataSource;
    private final ExtractionAdapter extractionAdapter;
    private final PatternDetector patternDetector;
    private final CorrelationEngine correlationEngine;
    private final ReportGenerator reportGenerator;
    private final WorkflowSettings settings;

    public WorkflowOrchestrator(
            NewsSource newsSource,
            MarketDataSource marketDataSource,
            ExtractionAdapter extractionAdapter,
            PatternDetector patternDetector,
            CorrelationEngine correlationEngine,
            ReportGenerator reportGenerator,
            WorkflowSettings settings
    ) {
        this.newsSource = Objects.requireNonNull(newsSource, "newsSource");
        this.marketDataSource = Objects.requireNonNull(marketDataSource, "marketDataSource");
        this.extractionAdapter = Objects.requireNonNull(extractionAdapter, "extractionAdapter");
        this.patternDetector = Objects.requireNonNull(patternDetector, "patternDetector");
        this.correlationEngine = Objects.requireNonNull(correlationEngine, "correlationEngine");
        this.reportGenerator = Objects.requireNonNull(reportGenerator, "reportGenerator");
        this.settings = Objects.requireNonNull(settings, "settings").validated();
    }

    /**
     * Runs the whole pipeline and returns the finished state, either {@link RunStatus#DONE} or
     * {@link RunStatus#FAILED}.
     *
     * @throws ConfigurationException when the ticker is blank or {@code start} is after {@code end}
     */
    public RunState run(String ticker, LocalDate start, LocalDate end) {
        String symbol = ticker == null ? "" : ticker.trim().toUpperCase(Locale.ROOT);
        if (symbol.isEmpty()) {
            throw new ConfigurationException("ticker", "ticker is required");
        }
        DateRange range = new DateRange(start, end);
        RunTelemetry telemetry = new RunTelemetry(symbol, Instant.now());
        RunState state = new RunState(symbol, range, telemetry);
        long deadlineNanos = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(settings.runTimeoutMs);
        LOG.info("run started ticker={} range={}", symbol, range);

        boolean ok = runStage(state, RunStatus.NEWS_FETCHED, RunTelemetry.STEP_NEWS_FETCH,
                () -> fetchNews(symbol, range, deadlineNanos))
                && runStage(state, RunStatus.SENTIMENT_EXTRACTED, RunTelemetry.STEP_EXTRACTION,
                () -> extractAll(state.articles(), deadlineNanos))
                && runStage(state, RunStatus.PRICES_FETCHED, RunTelemetry.STEP_PRICE_FETCH,
                () -> fetchPrices(symbol, range))
                && runStage(state, RunStatus.PATTERNS_DETECTED, RunTelemetry.STEP_PATTERNS,
                () -> detectPatterns(state.prices()))
                && runStage(state, RunStatus.CORRELATED, RunTelemetry.STEP_CORRELATION,
                () -> new StageDelta.Correlation(correlationEngine.correlate(state.sentiments(), state.patterns())))
                && runStage(state, RunStatus.REPORTED, RunTelemetry.STEP_REPORT,
                () -> new StageDelta.Reported(reportGenerator.generate(state)));
        if (ok) {
            state.complete();
        }

        telemetry.finish();
        if (state.isFailed()) {
            LOG.error("run failed ticker={} {}", symbol, state.failure());
        } else if (state.isDegraded()) {
            LOG.warn("run finished degraded ticker={} warnings={}", symbol, state.warnings().size());
        } else {
            LOG.info("run finished ticker={}", symbol);
        }
        LOG.info("run telemetry\n{}", telemetry.getSummary());
        return state;
    }

    private boolean runStage(RunState state, RunStatus target, String step, StageBody body) {
        RunTelemetry telemetry = state.telemetry();
        telemetry.startStep(step);
        StageDelta delta;
        try {
            delta = body.run();
        } catch (FetchException e) {
            return failStage(state, target, step, ErrorType.FETCH_ERROR, e.source() + ": " + e.getMessage());
        } catch (InsufficientDataException e) {
            return failStage(state, target, step, ErrorType.INSUFFICIENT_DATA, e.getMessage());
        } catch (TimeoutException e) {
            return failStage(state, target, step, ErrorType.TIMEOUT, e.getMessage());
        } catch (ConfigurationException e) {
            return failStage(state, target, step, ErrorType.CONFIGURATION_ERROR, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return failStage(state, target, step, ErrorType.INTERNAL_ERROR, "interrupted");
        } catch (RuntimeException e) {
            LOG.error("stage {} raised an unexpected error", target, e);
            return failStage(state, target, step, ErrorType.INTERNAL_ERROR,
                    e.getClass().getSimpleName() + (e.getMessage() == null ? "" : ": " + e.getMessage()));
        }
        state.apply(delta);
        telemetry.endStep(step, itemsIn(delta), itemsOut(delta), delta.warnings().size());
        LOG.debug("stage {} done, warnings={}", target, delta.warnings().size());
        return true;
    }

    private boolean failStage(RunState state, RunStatus target, String step, ErrorType type, String reason) {
        state.telemetry().endStep(step, 0, 0, 1, type.name());
        state.fail(new StageFailure(target, type, reason));
        return false;
    }

    private StageDelta fetchNews(String ticker, DateRange range, long deadlineNanos) throws InterruptedException {
        List<String> warnings = new ArrayList<>();
        List<NewsArticle> articles;
        try {
            articles = callWithDeadline(() -> newsSource.fetchNews(ticker, range), deadlineNanos);
        } catch (TimeoutException e) {
            LOG.warn("news fetch timed out for {}", ticker);
            warnings.add("news fetch timed out; continuing without news");
            articles = List.of();
        } catch (FetchException e) {
            LOG.warn("news fetch failed for {}: {}", ticker, e.getMessage());
            warnings.add("news fetch failed (" + e.source() + "): " + e.getMessage());
            articles = List.of();
        }
        if (articles == null) {
            articles = List.of();
        }
        List<NewsArticle> kept = new ArrayList<>();
        for (NewsArticle article : articles) {
            if (article != null) {
                kept.add(article);
            }
        }
        if (kept.isEmpty()) {
            warnings.add("no news found for range " + range);
        }
        return new StageDelta.News(kept, warnings);
    }

    private StageDelta extractAll(List<NewsArticle> articles, long deadlineNanos) throws InterruptedException {
        int total = articles.size();
        if (total == 0) {
            return new StageDelta.Sentiment(List.of(), List.of(), List.of());
        }
        ExtractionResult[] results = new ExtractionResult[total];
        int threads = Math.max(1, Math.min(extractionAdapter.settings().parallelism, total));
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CompletionService<ArticleOutcome> completion = new ExecutorCompletionService<>(pool);
        List<Future<ArticleOutcome>> futures = new ArrayList<>(total);
        for (int i = 0; i < total; i++) {
            futures.add(completion.submit(new ArticleTask(i, articles.get(i))));
        }

        boolean timedOut;
        try {
            List<ArticleOutcome> outcomes = collectUntil(completion, total, deadlineNanos);
            for (ArticleOutcome outcome : outcomes) {
                results[outcome.index] = outcome.result;
            }
            timedOut = outcomes.size() < total;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            throw new IllegalStateException("extraction worker failed: " + cause.getMessage(), cause);
        } finally {
            for (Future<ArticleOutcome> future : futures) {
                future.cancel(true);
            }
            pool.shutdownNow();
        }

        List<SentimentRecord> records = new ArrayList<>();
        List<ExtractionError> failures = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        int unfinished = 0;
        for (int i = 0; i < total; i++) {
            ExtractionResult result = results[i];
            if (result == null) {
                unfinished++;
                result = ExtractionResult.failure(new ExtractionError(
                        articles.get(i).id(), ExtractionError.Kind.TIMED_OUT, 0, "run deadline reached"));
            }
            if (result.success) {
                records.add(result.record);
            } else {
                failures.add(result.error);
                warnings.add(result.error.describe());
            }
        }
        if (timedOut) {
            LOG.warn("extraction deadline reached with {} of {} articles unfinished", unfinished, total);
            warnings.add("extraction timed out; " + unfinished + " of " + total + " articles not analyzed");
        }
        if (!failures.isEmpty()) {
            warnings.add(failures.size() + " articles failed extraction");
        }
        LOG.info("extracted {} of {} articles", records.size(), total);
        return new StageDelta.Sentiment(records, failures, warnings);
    }

    /**
     * Bounded by {@code priceTimeoutMs} from the start of this stage, independent of the run deadline.
     */
    private StageDelta fetchPrices(String ticker, DateRange range)
            throws FetchException, TimeoutException, InterruptedException {
        long deadlineNanos = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(settings.priceTimeoutMs);
        PriceSeries series;
        try {
            series = callWithDeadline(() -> marketDataSource.fetchPrices(ticker, range), deadlineNanos);
        } catch (TimeoutException e) {
            throw new TimeoutException(
                    "price fetch for " + ticker + " exceeded " + settings.priceTimeoutMs + " ms");
        }
        if (series == null || series.isEmpty()) {
            throw new InsufficientDataException("no price data for " + ticker + " in " + range);
        }
        return new StageDelta.Prices(series);
    }

    private StageDelta detectPatterns(PriceSeries series) {
        List<TechnicalPattern> patterns = patternDetector.detect(series);
        List<String> warnings = patterns.isEmpty()
                ? List.of("no technical patterns detected in " + series.size() + " price bars")
                : List.of();
        return new StageDelta.Patterns(patterns, warnings);
    }

    /**
     * Takes finished tasks until {@code expected} arrived or the deadline passed. Past the deadline the
     * queue is still drained without blocking.
     */
    static <T> List<T> collectUntil(CompletionService<T> completion, int expected, long deadlineNanos)
            throws InterruptedException, ExecutionException {
        List<T> out = new ArrayList<>(expected);
        while (out.size() < expected) {
            long remaining = deadlineNanos - System.nanoTime();
            Future<T> future = remaining > 0L
                    ? completion.poll(remaining, TimeUnit.NANOSECONDS)
                    : completion.poll();
            if (future == null) {
                break;
            }
            out.add(future.get());
        }
        return out;
    }

    /**
     * Runs a collaborator call on its own thread, bounded by {@code deadlineNanos}.
     */
    private static <T> T callWithDeadline(FetchCall<T> call, long deadlineNanos)
            throws FetchException, TimeoutException, InterruptedException {
        long remaining = deadlineNanos - System.nanoTime();
        if (remaining <= 0L) {
            throw new TimeoutException("run deadline reached");
        }
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Callable<T> task = call::call;
            Future<T> future = executor.submit(task);
            try {
                return future.get(remaining, TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                future.cancel(true);
                throw e;
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof FetchException fetch) {
                    throw fetch;
                }
                if (cause instanceof RuntimeException runtime) {
                    throw runtime;
                }
                if (cause instanceof Error error) {
                    throw error;
                }
                throw new IllegalStateException(cause);
            }
        } finally {
            executor.shutdownNow();
        }
    }

    private static long itemsIn(StageDelta delta) {
        if (delta instanceof StageDelta.Sentiment sentiment) {
            return sentiment.records().size() + sentiment.failures().size();
        }
        return 0L;
    }

    private static long itemsOut(StageDelta delta) {
        if (delta instanceof StageDelta.News news) {
            return news.articles().size();
        }
        if (delta instanceof StageDelta.Sentiment sentiment) {
            return sentiment.records().size();
        }
        if (delta instanceof StageDelta.Prices prices) {
            return prices.series().size();
        }
        if (delta instanceof StageDelta.Patterns patterns) {
            return patterns.patterns().size();
        }
        if (delta instanceof StageDelta.Correlation correlation) {
            CorrelationResult result = correlation.result();
            return result.records().size();
        }
        if (delta instanceof StageDelta.Reported reported) {
            Report report = reported.report();
            return report.sections().size();
        }
        return 0L;
    }

    @FunctionalInterface
    private interface StageBody {
        StageDelta run() throws FetchException, TimeoutException, InterruptedException;
    }

    @FunctionalInterface
    private interface FetchCall<T> {
        T call() throws FetchException;
    }

    private static final class ArticleOutcome {
        private final int index;
        private final ExtractionResult result;

        private ArticleOutcome(int index, ExtractionResult result) {
            this.index = index;
            this.result = result;
        }
    }

    private final class ArticleTask implements Callable<ArticleOutcome> {
        private final int index;
        private final NewsArticle article;

        private ArticleTask(int index, NewsArticle article) {
            this.index = index;
            this.article = article;
        }

        @Override
        public ArticleOutcome call() {
            return new ArticleOutcome(index, extractionAdapter.extract(article));
        }
    }
}
