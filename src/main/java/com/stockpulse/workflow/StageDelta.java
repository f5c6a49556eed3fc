package com.stockpulse.workflow;

import com.stockpulse.extract.ExtractionError;
import com.stockpulse.model.CorrelationResult;
import com.stockpulse.model.NewsArticle;
import com.stockpulse.model.PriceSeries;
import com.stockpulse.model.Report;
import com.stockpulse.model.SentimentRecord;
import com.stockpulse.model.TechnicalPattern;

import java.util.List;
import java.util.Objects;

/**
 * Immutable output of one stage, folded into {@link RunState} by the orchestrator.
 */
public interface StageDelta {

    RunStatus target();

    List<String> warnings();

    record News(List<NewsArticle> articles, List<String> warnings) implements StageDelta {
        public News {
            articles = articles == null ? List.of() : List.copyOf(articles);
            warnings = warnings == null ? List.of() : List.copyOf(warnings);
        }

        @Override
        public RunStatus target() {
            return RunStatus.NEWS_FETCHED;
        }
    }

    record Sentiment(List<SentimentRecord> records, List<ExtractionError> failures, List<String> warnings)
            implements StageDelta {
        public Sentiment {
            records = records == null ? List.of() : List.copyOf(records);
            failures = failures == null ? List.of() : List.copyOf(failures);
            warnings = warnings == null ? List.of() : List.copyOf(warnings);
        }

        @Override
        public RunStatus target() {
            return RunStatus.SENTIMENT_EXTRACTED;
        }
    }

    record Prices(PriceSeries series) implements StageDelta {
        public Prices {
            Objects.requireNonNull(series, "series");
        }

        @Override
        public RunStatus target() {
            return RunStatus.PRICES_FETCHED;
        }

        @Override
        public List<String> warnings() {
            return List.of();
        }
    }

    record Patterns(List<TechnicalPattern> patterns, List<String> warnings) implements StageDelta {
        public Patterns {
            patterns = patterns == null ? List.of() : List.copyOf(patterns);
            warnings = warnings == null ? List.of() : List.copyOf(warnings);
        }

        @Override
        public RunStatus target() {
            return RunStatus.PATTERNS_DETECTED;
        }
    }

    record Correlation(CorrelationResult result) implements StageDelta {
        public Correlation {
            Objects.requireNonNull(result, "result");
        }

        @Override
        public RunStatus target() {
            return RunStatus.CORRELATED;
        }

        @Override
        public List<String> warnings() {
            return List.of();
        }
    }

    record Reported(Report report) implements StageDelta {
        public Reported {
            Objects.requireNonNull(report, "report");
        }

        @Override
        public RunStatus target() {
            return RunStatus.REPORTED;
        }

        @Override
        public List<String> warnings() {
            return List.of();
        }
    }
}
