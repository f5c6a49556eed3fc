package com.stockpulse.extract;

import com.stockpulse.model.NewsArticle;

import java.time.format.DateTimeFormatter;

/**
 * System and user messages sent to the model for one article.
 */
public final class SentimentPrompts {
    private SentimentPrompts() {
    }

    public static String systemPrompt() {
        return "You are an expert financial news analyst.\n"
                + "Read a news article about a specific stock and extract how the news is likely to move its price.\n"
                + "Focus only on information relevant to the stock. Distinguish impactful events from noise.\n"
                + "Respond ONLY with one JSON object, no prose and no code fences.";
    }

    public static String userPrompt(String articleText) {
        StringBuilder sb = new StringBuilder(1024 + (articleText == null ? 0 : articleText.length()));
        sb.append("Analyze the following news article.\n\n");
        sb.append("Return a JSON object with keys:\n");
        sb.append("- sentiment: \"positive\", \"neutral\" or \"negative\"\n");
        sb.append("- confidence: number between 0 and 1\n");
        sb.append("- event_tags: list of short tags such as [\"earnings\", \"merger\", \"guidance\", \"lawsuit\", \"downgrade\"]\n");
        sb.append("- impact_score: number between 0 and 1, how strongly this news is likely to affect the price\n");
        sb.append("- reasoning: one or two plain English sentences\n\n");
        sb.append("Article:\n---\n");
        sb.append(articleText == null ? "" : articleText.trim());
        sb.append("\n---\n");
        return sb.toString();
    }

    /**
     * Text handed to the analyzer: article metadata followed by the body.
     */
    public static String articleText(NewsArticle article) {
        StringBuilder sb = new StringBuilder(512 + article.text().length());
        sb.append("Ticker: ").append(oneLine(article.ticker())).append('\n');
        if (!article.title().isEmpty()) {
            sb.append("Title: ").append(oneLine(article.title())).append('\n');
        }
        if (!article.source().isEmpty()) {
            sb.append("Source: ").append(oneLine(article.source())).append('\n');
        }
        if (article.publishedAt() != null) {
            sb.append("Published at: ").append(DateTimeFormatter.ISO_INSTANT.format(article.publishedAt())).append('\n');
        }
        sb.append('\n').append(article.text().trim());
        return sb.toString();
    }

    private static String oneLine(String text) {
        return text == null ? "" : text.replace("\r", " ").replace("\n", " ").trim();
    }
}
