package com.stockpulse.data;

import com.stockpulse.config.Config;
import com.stockpulse.core.error.FetchException;
import com.stockpulse.data.http.HttpClientEx;
import com.stockpulse.data.rss.RssItem;
import com.stockpulse.model.DateRange;
import com.stockpulse.model.NewsArticle;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RssNewsSourceTest {
    private static final DateRange RANGE = new DateRange(LocalDate.of(2024, 3, 1), LocalDate.of(2024, 3, 7));

    private static final String YAHOO_FEED = "<rss><channel>"
            + item("Apple (AAPL) beats estimates", "https://finance.yahoo.com/a1", "Tue, 05 Mar 2024 15:00:00 GMT",
            "<p>Apple <b>reported</b> record revenue.</p>")
            + item("AAPL late evening note", "https://finance.yahoo.com/a2", "Fri, 08 Mar 2024 03:00:00 GMT", "")
            + item("AAPL after the range", "https://finance.yahoo.com/a3", "Fri, 08 Mar 2024 06:00:00 GMT", "")
            + item("Markets wrap", "https://finance.yahoo.com/a4", "Wed, 06 Mar 2024 12:00:00 GMT", "Stocks rose.")
            + "</channel></rss>";

    private static final String GOOGLE_FEED = "<rss><channel>"
            + item("Apple (AAPL) beats estimates", "https://news.google.com/x1", "Tue, 05 Mar 2024 16:00:00 GMT", "")
            + item("Apple faces EU fine - Reuters", "https://news.google.com/x2", "Mon, 04 Mar 2024 09:00:00 GMT",
            "Regulators fined Apple.")
            + item("AAPL weeks ago", "https://news.google.com/x3", "Tue, 20 Feb 2024 09:00:00 GMT", "")
            + "</channel></rss>";

    @Test
    void fetchNews_shouldMergeFilterAndOrderArticles() throws Exception {
        RoutingHttp http = new RoutingHttp(YAHOO_FEED, GOOGLE_FEED);
        RssNewsSource source = new RssNewsSource(http, config("apple"));

        List<NewsArticle> articles = source.fetchNews("aapl", RANGE);

        assertEquals(3, articles.size());
        assertEquals("AAPL-0", articles.get(0).id());
        assertEquals("Apple faces EU fine - Reuters", articles.get(0).title());
        assertEquals("Reuters", articles.get(0).source());
        assertEquals("Apple (AAPL) beats estimates", articles.get(1).title());
        assertEquals(Instant.parse("2024-03-05T16:00:00Z"), articles.get(1).publishedAt());
        assertEquals("AAPL late evening note", articles.get(2).title());
        for (NewsArticle article : articles) {
            assertEquals("AAPL", article.ticker());
            assertTrue(article.hasText());
        }
        assertEquals("YahooFinanceRSS+GoogleNewsRSS", source.sourceLabel());
    }

    @Test
    void fetchNews_shouldBoundGoogleQueryByRange() throws Exception {
        RoutingHttp http = new RoutingHttp(YAHOO_FEED, GOOGLE_FEED);
        new RssNewsSource(http, config("")).fetchNews("AAPL", RANGE);

        String google = URLDecoder.decode(http.urls.get(1), StandardCharsets.UTF_8);
        assertTrue(google.contains("AAPL stock"));
        assertTrue(google.contains("after:2024-02-29"));
        assertTrue(google.contains("before:2024-03-08"));
    }

    @Test
    void fetchNews_shouldToleratePartialSourceFailure() throws Exception {
        RoutingHttp http = new RoutingHttp(null, GOOGLE_FEED);
        RssNewsSource source = new RssNewsSource(http, config(""));

        List<NewsArticle> articles = source.fetchNews("AAPL", RANGE);

        assertEquals(1, articles.size());
        assertEquals("Apple (AAPL) beats estimates", articles.get(0).title());
    }

    @Test
    void fetchNews_shouldFailWhenEverySourceFails() {
        RssNewsSource source = new RssNewsSource(new RoutingHttp(null, null), config(""));

        assertThrows(FetchException.class, () -> source.fetchNews("AAPL", RANGE));
    }

    @Test
    void isRelevant_shouldMatchWholeWordsOnly() {
        Set<String> tokens = RssNewsSource.relevanceTokens("AAPL", List.of("\"Apple Inc\""));

        assertTrue(RssNewsSource.isRelevant(new RssItem("Shares of AAPL slide", "", "", null, ""), tokens));
        assertTrue(RssNewsSource.isRelevant(new RssItem("Apple Inc. earnings", "", "", null, ""), tokens));
        assertFalse(RssNewsSource.isRelevant(new RssItem("AAPLX fund update", "", "", null, ""), tokens));
    }

    private static Config config(String keywords) {
        return Config.fromMap(Path.of("."), Map.of("news", Map.of("sources", "yahoo,google", "keywords", keywords)));
    }

    private static String item(String title, String link, String pubDate, String description) {
        return "<item><title>" + title + "</title><link>" + link + "</link><pubDate>" + pubDate + "</pubDate>"
                + "<description><![CDATA[" + description + "]]></description></item>";
    }

    /**
     * Serves the yahoo or google feed by URL; a null feed answers with HTTP 503.
     */
    private static final class RoutingHttp extends HttpClientEx {
        private final String yahoo;
        private final String google;
        private final List<String> urls = new ArrayList<>();

        private RoutingHttp(String yahoo, String google) {
            this.yahoo = yahoo;
            this.google = google;
        }

        @Override
        public String getText(String url, int timeoutSeconds) throws IOException {
            urls.add(url);
            String body = url.contains("yahoo") ? yahoo : google;
            if (body == null) {
                throw new HttpStatusException(503, url);
            }
            return body;
        }
    }
}
