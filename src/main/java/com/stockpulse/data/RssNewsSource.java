package com.stockpulse.data;

import com.stockpulse.config.Config;
import com.stockpulse.core.error.FetchException;
import com.stockpulse.data.http.HttpClientEx;
import com.stockpulse.data.rss.RssItem;
import com.stockpulse.data.rss.RssParser;
import com.stockpulse.data.text.ArticleTextCleaner;
import com.stockpulse.model.DateRange;
import com.stockpulse.model.NewsArticle;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * News from Yahoo Finance and Google News RSS feeds.
 * <p>
 * Items are merged by title, kept only when they mention the ticker or a configured keyword,
 * and clipped to the requested range in the market zone. Ids are {@code TICKER-index} in
 * publication order.
 */
public final class RssNewsSource implements NewsSource {
    private static final Logger LOG = LogManager.getLogger(RssNewsSource.class);
    private static final Set<String> SUPPORTED_SOURCES = Set.of("yahoo", "google");
    private static final Instant MIN_INSTANT = Instant.EPOCH;

    private final HttpClientEx http;
    private final ArticleTextCleaner cleaner;
    private final List<String> sources;
    private final List<String> keywords;
    private final String lang;
    private final String region;
    private final int maxItems;
    private final int timeoutSec;
    private final ZoneId zone;

    public RssNewsSource(Config config) {
        this(new HttpClientEx(), config);
    }

    public RssNewsSource(HttpClientEx http, Config config) {
        this.http = http;
        this.cleaner = new ArticleTextCleaner();
        this.sources = parseSources(config.getList("news.sources"));
        this.keywords = config.getList("news.keywords");
        this.lang = config.getString("news.lang", "en");
        this.region = config.getString("news.region", "US");
        this.maxItems = Math.max(1, config.getInt("news.max_items", 20));
        this.timeoutSec = Math.max(3, config.getInt("news.timeout_sec", 30));
        this.zone = ZoneId.of(config.getString("app.zone", "America/New_York"));
    }

    public String sourceLabel() {
        List<String> names = new ArrayList<>();
        for (String source : sources) {
            names.add("yahoo".equals(source) ? "YahooFinanceRSS" : "GoogleNewsRSS");
        }
        return String.join("+", names);
    }

    @Override
    public List<NewsArticle> fetchNews(String ticker, DateRange range) throws FetchException {
        String symbol = ticker == null ? "" : ticker.trim().toUpperCase(Locale.ROOT);
        if (symbol.isEmpty()) {
            return List.of();
        }
        Set<String> tokens = relevanceTokens(symbol, keywords);
        Map<String, RssItem> merged = new LinkedHashMap<>();
        int failures = 0;
        FetchException lastFailure = null;
        for (String source : sources) {
            String url = "yahoo".equals(source) ? yahooUrl(symbol) : googleUrl(symbol, range);
            try {
                String xml = http.getText(url, timeoutSec);
                List<RssItem> items = RssParser.parse(xml, maxItems * 4);
                LOG.debug("news source={} ticker={} items={}", source, symbol, items.size());
                merge(merged, items);
            } catch (IOException e) {
                failures++;
                lastFailure = new FetchException(source, "news feed request failed: " + e.getMessage(), e);
                LOG.warn("news source {} failed for {}: {}", source, symbol, e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new FetchException(source, "interrupted while fetching news", e);
            }
        }
        if (failures == sources.size() && lastFailure != null) {
            throw lastFailure;
        }

        List<RssItem> kept = new ArrayList<>();
        for (RssItem item : merged.values()) {
            if (item.publishedAt() == null || !range.contains(item.publishedAt().atZone(zone).toLocalDate())) {
                continue;
            }
            if (!isRelevant(item, tokens)) {
                continue;
            }
            kept.add(item);
        }
        kept.sort(Comparator.comparing(RssNewsSource::timeOrMin));
        if (kept.size() > maxItems) {
            kept = new ArrayList<>(kept.subList(kept.size() - maxItems, kept.size()));
        }

        List<NewsArticle> out = new ArrayList<>(kept.size());
        for (int i = 0; i < kept.size(); i++) {
            RssItem item = kept.get(i);
            out.add(new NewsArticle(
                    symbol + "-" + i,
                    symbol,
                    item.title(),
                    item.link(),
                    item.source(),
                    item.publishedAt(),
                    cleaner.articleBody(item.title(), item.description())
            ));
        }
        LOG.info("fetched {} relevant articles for {} in {} from {}", out.size(), symbol, range, sourceLabel());
        return out;
    }

    private String yahooUrl(String symbol) {
        String langTag = lang.toLowerCase(Locale.ROOT) + "-" + region.toUpperCase(Locale.ROOT);
        return "https://feeds.finance.yahoo.com/rss/2.0/headline?s=" + encode(symbol)
                + "&region=" + region.toUpperCase(Locale.ROOT) + "&lang=" + langTag;
    }

    private String googleUrl(String symbol, DateRange range) {
        StringBuilder query = new StringBuilder(symbol).append(" stock");
        for (String keyword : keywords) {
            query.append(" OR \"").append(keyword).append('"');
        }
        // Google News operators bound the search; the exact range is enforced again after parsing
        query.append(" after:").append(range.start().minusDays(1)).append(" before:").append(range.end().plusDays(1));
        return "https://news.google.com/rss/search?q=" + encode(query.toString())
                + "&hl=" + lang + "&gl=" + region + "&ceid=" + region + ":" + lang;
    }

    private static String encode(String text) {
        return URLEncoder.encode(text, StandardCharsets.UTF_8);
    }

    private static Instant timeOrMin(RssItem item) {
        return item.publishedAt() == null ? MIN_INSTANT : item.publishedAt();
    }

    private static void merge(Map<String, RssItem> merged, List<RssItem> items) {
        for (RssItem item : items) {
            String key = dedupKey(item);
            if (key.isEmpty()) {
                continue;
            }
            RssItem old = merged.get(key);
            if (old == null || isNewer(item, old)) {
                merged.put(key, item);
            }
        }
    }

    private static boolean isNewer(RssItem a, RssItem b) {
        if (a.publishedAt() == null) {
            return false;
        }
        return b.publishedAt() == null || a.publishedAt().isAfter(b.publishedAt());
    }

    private static String dedupKey(RssItem item) {
        String title = item.title().toLowerCase(Locale.ROOT);
        return title.isEmpty() ? item.link().toLowerCase(Locale.ROOT) : title;
    }

    static boolean isRelevant(RssItem item, Set<String> tokens) {
        String text = (item.title() + " " + item.description() + " " + item.link()).toLowerCase(Locale.ROOT);
        for (String token : tokens) {
            if (containsWord(text, token)) {
                return true;
            }
        }
        return false;
    }

    private static boolean containsWord(String text, String token) {
        int from = 0;
        while (true) {
            int idx = text.indexOf(token, from);
            if (idx < 0) {
                return false;
            }
            int end = idx + token.length();
            boolean leftOk = idx == 0 || !Character.isLetterOrDigit(text.charAt(idx - 1));
            boolean rightOk = end >= text.length() || !Character.isLetterOrDigit(text.charAt(end));
            if (leftOk && rightOk) {
                return true;
            }
            from = idx + 1;
        }
    }

    static Set<String> relevanceTokens(String ticker, List<String> keywords) {
        Set<String> out = new LinkedHashSet<>();
        addToken(out, ticker);
        if (keywords != null) {
            for (String keyword : keywords) {
                addToken(out, keyword);
            }
        }
        return out;
    }

    private static void addToken(Set<String> out, String raw) {
        if (raw == null) {
            return;
        }
        String t = raw.trim().toLowerCase(Locale.ROOT);
        if (t.startsWith("\"") && t.endsWith("\"") && t.length() > 1) {
            t = t.substring(1, t.length() - 1).trim();
        }
        if (!t.isEmpty()) {
            out.add(t);
        }
    }

    private static List<String> parseSources(List<String> raw) {
        Set<String> out = new LinkedHashSet<>();
        for (String s : raw) {
            String name = s.trim().toLowerCase(Locale.ROOT);
            if (SUPPORTED_SOURCES.contains(name)) {
                out.add(name);
            } else {
                LOG.warn("ignoring unsupported news source '{}'", s);
            }
        }
        if (out.isEmpty()) {
            out.add("yahoo");
        }
        return new ArrayList<>(out);
    }
}
