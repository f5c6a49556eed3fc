package com.stockpulse.model;

import java.time.Instant;

/**
 * One news item as fetched, with a stable id of the form {@code TICKER-i}.
 */
public record NewsArticle(
        String id,
        String ticker,
        String title,
        String url,
        String source,
        Instant publishedAt,
        String text
) {
    public NewsArticle {
        id = id == null ? "" : id.trim();
        ticker = ticker == null ? "" : ticker.trim();
        title = title == null ? "" : title.trim();
        url = url == null ? "" : url.trim();
        source = source == null ? "" : source.trim();
        text = text == null ? "" : text;
    }

    public boolean hasText() {
        return !text.isBlank();
    }
}
