package com.stockpulse.data.rss;

import java.time.Instant;

/**
 * One {@code <item>} of an RSS channel. {@code description} may still contain HTML.
 */
public record RssItem(String title, String link, String source, Instant publishedAt, String description) {
    public RssItem {
        title = title == null ? "" : title.trim();
        link = link == null ? "" : link.trim();
        source = source == null ? "" : source.trim();
        description = description == null ? "" : description;
    }
}
