package com.stockpulse.report;

import com.stockpulse.model.CorrelationRecord;
import com.stockpulse.model.CorrelationResult;
import com.stockpulse.model.DateRange;
import com.stockpulse.model.Direction;
import com.stockpulse.model.NewsArticle;
import com.stockpulse.model.Polarity;
import com.stockpulse.model.Report;
import com.stockpulse.model.ReportSection;
import com.stockpulse.model.ReportSummary;
import com.stockpulse.model.SentimentRecord;
import com.stockpulse.model.TechnicalPattern;
import com.stockpulse.workflow.RunState;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Builds the {@link Report} of a run: one narrative section per correlation, summary statistics,
 * every detected pattern, the uncorrelated appendix and the run warnings. Pure.
 */
public final class ReportGenerator {
    private static final Comparator<CorrelationRecord> SECTION_ORDER = Comparator
            .comparing((CorrelationRecord r) -> r.sentiment().eventDate())
            .thenComparing(CorrelationRecord::confidence, Comparator.reverseOrder())
            .thenComparing(r -> r.pattern().anchorDate())
            .thenComparing(r -> r.sentiment().articleId())
            .thenComparing(r -> r.pattern().id());

    public Report generate(RunState state) {
        return generate(
                state.ticker(),
                state.range(),
                state.articles(),
                state.sentiments(),
                state.patterns(),
                state.correlation(),
                state.warnings()
        );
    }

    public Report generate(
            String ticker,
            DateRange range,
            List<NewsArticle> articles,
            List<SentimentRecord> sentiments,
            List<TechnicalPattern> patterns,
            CorrelationResult correlation,
            List<String> warnings
    ) {
        List<NewsArticle> articleList = articles == null ? List.of() : articles;
        List<SentimentRecord> sentimentList = sentiments == null ? List.of() : sentiments;
        List<TechnicalPattern> patternList = patterns == null ? List.of() : patterns;
        CorrelationResult result = correlation == null ? CorrelationResult.empty() : correlation;

        Map<String, NewsArticle> byId = new HashMap<>();
        for (NewsArticle article : articleList) {
            byId.putIfAbsent(article.id(), article);
        }

        List<CorrelationRecord> ordered = new ArrayList<>(result.records());
        ordered.sort(SECTION_ORDER);
        List<ReportSection> sections = new ArrayList<>(ordered.size());
        for (CorrelationRecord record : ordered) {
            sections.add(section(record, byId.get(record.sentiment().articleId())));
        }

        return new Report(
                "News-Pattern Report: " + ticker,
                ticker,
                range,
                summary(articleList, sentimentList, patternList, ordered),
                sections,
                patternList,
                result.uncorrelatedSentiments(),
                result.uncorrelatedPatterns(),
                warnings
        );
    }

    ReportSummary summary(
            List<NewsArticle> articles,
            List<SentimentRecord> sentiments,
            List<TechnicalPattern> patterns,
            List<CorrelationRecord> ordered
    ) {
        int bullish = 0;
        int bearish = 0;
        int neutral = 0;
        for (SentimentRecord s : sentiments) {
            if (s.polarity() == Polarity.BULLISH) {
                bullish++;
            } else if (s.polarity() == Polarity.BEARISH) {
                bearish++;
            } else {
                neutral++;
            }
        }
        int bullishPatterns = 0;
        int bearishPatterns = 0;
        for (TechnicalPattern p : patterns) {
            if (p.direction() == Direction.BULLISH) {
                bullishPatterns++;
            } else if (p.direction() == Direction.BEARISH) {
                bearishPatterns++;
            }
        }
        int agreeing = 0;
        CorrelationRecord strongest = null;
        for (CorrelationRecord record : ordered) {
            if (record.directionalAgreement()) {
                agreeing++;
            }
            if (strongest == null || record.confidence() > strongest.confidence()) {
                strongest = record;
            }
        }
        double agreementRate = ordered.isEmpty() ? 0.0 : agreeing / (double) ordered.size();

        return new ReportSummary(
                articles.size(),
                sentiments.size(),
                patterns.size(),
                ordered.size(),
                agreeing,
                agreementRate,
                bullish,
                bearish,
                neutral,
                newsTone(sentiments.size(), bullish, bearish, neutral),
                marketTone(patterns.size(), bullishPatterns, bearishPatterns),
                strongest == null ? "" : strongestLink(strongest)
        );
    }

    static String newsTone(int total, int bullish, int bearish, int neutral) {
        if (total == 0) {
            return "no analyzed news";
        }
        if (bullish > bearish && bullish > neutral) {
            return "overall bullish";
        }
        if (bearish > bullish && bearish > neutral) {
            return "overall bearish";
        }
        return "mixed/neutral";
    }

    static String marketTone(int total, int bullish, int bearish) {
        if (total == 0) {
            return "no technical patterns detected";
        }
        if (bullish > bearish) {
            return "price action tilted bullish";
        }
        if (bearish > bullish) {
            return "price action tilted bearish";
        }
        return "price action remained relatively balanced or sideways";
    }

    private static String strongestLink(CorrelationRecord record) {
        return String.format(
                Locale.US,
                "article %s -> %s on %s (confidence %.2f, %s)",
                record.sentiment().articleId(),
                record.pattern().label(),
                record.pattern().anchorDate(),
                record.confidence(),
                offsetText(record.offsetDays())
        );
    }

    private static ReportSection section(CorrelationRecord record, NewsArticle article) {
        SentimentRecord s = record.sentiment();
        TechnicalPattern p = record.pattern();
        String heading = String.format(
                Locale.US,
                "%s: %s news -> %s",
                s.eventDate(),
                polarityWord(s.polarity()),
                p.label()
        );

        StringBuilder body = new StringBuilder();
        if (article != null && !article.title().isEmpty()) {
            body.append('"').append(article.title()).append('"');
            if (!article.source().isEmpty()) {
                body.append(" (").append(article.source()).append(')');
            }
        } else {
            body.append("Article ").append(s.articleId());
        }
        body.append(String.format(
                Locale.US,
                " read as %s (impact %.2f, confidence %.2f",
                polarityWord(s.polarity()).toLowerCase(Locale.ROOT),
                s.magnitude(),
                s.confidence()
        ));
        if (!s.eventTags().isEmpty()) {
            body.append("; tags: ").append(String.join(", ", s.eventTags()));
        }
        body.append("). ");
        body.append(String.format(
                Locale.US,
                "%s anchored on %s, %s",
                p.label(),
                p.anchorDate(),
                offsetText(record.offsetDays())
        ));
        if (!p.note().isEmpty()) {
            body.append(": ").append(p.note());
        }
        body.append(". ");
        body.append(record.directionalAgreement()
                ? "The price move agrees with the news"
                : "The price move does not agree with the news");
        body.append(String.format(Locale.US, "; link confidence %.2f.", record.confidence()));
        if (!s.reasoning().isEmpty()) {
            body.append(' ').append(s.reasoning());
        }
        return new ReportSection(s.eventDate(), heading, body.toString(), record.confidence());
    }

    static String offsetText(int offsetDays) {
        if (offsetDays == 0) {
            return "same day as the news";
        }
        int days = Math.abs(offsetDays);
        return days + (days == 1 ? " day " : " days ") + (offsetDays > 0 ? "after the news" : "before the news");
    }

    private static String polarityWord(Polarity polarity) {
        String name = polarity.name();
        return name.charAt(0) + name.substring(1).toLowerCase(Locale.ROOT);
    }
}
