package com.stockpulse.data;

import com.stockpulse.config.Config;
import com.stockpulse.core.error.FetchException;
import com.stockpulse.data.http.HttpClientEx;
import com.stockpulse.model.DateRange;
import com.stockpulse.model.PricePoint;
import com.stockpulse.model.PriceSeries;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.net.http.HttpTimeoutException;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Daily OHLCV bars from the Stooq CSV endpoint.
 */
public final class StooqPriceSource implements MarketDataSource {
    private static final Logger LOG = LogManager.getLogger(StooqPriceSource.class);
    private static final String SOURCE = "stooq";

    private final HttpClientEx http;
    private final String baseUrl;
    private final String symbolSuffix;
    private final int timeoutSec;
    private final int retryCount;
    private final long retrySleepMs;

    public StooqPriceSource(Config config) {
        this(new HttpClientEx(), config);
    }

    public StooqPriceSource(HttpClientEx http, Config config) {
        this.http = http;
        this.baseUrl = config.getString("stooq.base_url", "https://stooq.com/q/d/l/?s=%s&i=d");
        this.symbolSuffix = config.getString("stooq.symbol_suffix", ".us").toLowerCase(Locale.ROOT);
        this.timeoutSec = Math.max(3, config.getInt("stooq.request_timeout_sec", 20));
        this.retryCount = Math.max(0, config.getInt("stooq.retry_count", 2));
        this.retrySleepMs = Math.max(0L, config.getLong("stooq.retry_sleep_ms", 700L));
    }

    @Override
    public PriceSeries fetchPrices(String ticker, DateRange range) throws FetchException {
        String symbol = stooqSymbol(ticker);
        if (symbol.isEmpty()) {
            throw new FetchException(SOURCE, "blank ticker");
        }
        String url = String.format(baseUrl, symbol)
                + "&d1=" + range.start().toString().replace("-", "")
                + "&d2=" + range.end().toString().replace("-", "");
        String lastError = "";
        Exception lastCause = null;
        for (int attempt = 0; attempt <= retryCount; attempt++) {
            try {
                String body = http.getText(url, timeoutSec);
                PriceSeries series = parseCsv(body).within(range);
                LOG.info("fetched {} bars for {} in {}", series.size(), symbol, range);
                return series;
            } catch (IOException e) {
                lastError = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
                lastCause = e;
                if (attempt >= retryCount || !isRetryable(e)) {
                    break;
                }
                LOG.warn("stooq attempt {}/{} failed for {}: {}", attempt + 1, retryCount + 1, symbol, lastError);
            } catch (IllegalStateException e) {
                throw new FetchException(SOURCE, e.getMessage(), e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new FetchException(SOURCE, "stooq_fetch_interrupted", e);
            }
            try {
                Thread.sleep(retrySleepMs * (attempt + 1));
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw new FetchException(SOURCE, "stooq_fetch_interrupted", ie);
            }
        }
        throw new FetchException(SOURCE, lastError.isEmpty() ? "stooq_fetch_failed" : lastError, lastCause);
    }

    String stooqSymbol(String ticker) {
        String t = ticker == null ? "" : ticker.trim().toLowerCase(Locale.ROOT);
        if (t.isEmpty() || t.contains(".") || symbolSuffix.isEmpty()) {
            return t;
        }
        return t + symbolSuffix;
    }

    private static boolean isRetryable(IOException e) {
        if (e instanceof HttpClientEx.HttpStatusException status) {
            return status.isRetryable();
        }
        if (e instanceof HttpTimeoutException) {
            return true;
        }
        String msg = e.getMessage() == null ? "" : e.getMessage().toLowerCase(Locale.ROOT);
        return msg.contains("timed out") || msg.contains("timeout") || msg.contains("connection reset");
    }

    /**
     * Parses the {@code Date,Open,High,Low,Close,Volume} CSV. "No data" is an empty series;
     * a rate-limit notice or an unknown header is an error. Rows with a non-positive close are skipped.
     */
    static PriceSeries parseCsv(String body) {
        if (body == null) {
            return PriceSeries.empty();
        }
        String text = body.trim();
        if (text.isEmpty() || text.equalsIgnoreCase("No data")) {
            return PriceSeries.empty();
        }
        if (text.toLowerCase(Locale.ROOT).contains("exceeded the daily hits limit")) {
            throw new IllegalStateException("stooq_rate_limit");
        }

        String[] lines = text.split("\\r?\\n");
        String header = lines[0].trim().toLowerCase(Locale.ROOT);
        if (!header.startsWith("date,open,high,low,close")) {
            String sample = text.length() > 120 ? text.substring(0, 120) : text;
            throw new IllegalStateException("unexpected_stooq_payload:" + sample);
        }

        List<PricePoint> all = new ArrayList<>(Math.max(64, lines.length));
        for (int i = 1; i < lines.length; i++) {
            String line = lines[i].trim();
            if (line.isEmpty()) {
                continue;
            }
            String[] cols = line.split(",");
            if (cols.length < 5) {
                continue;
            }
            try {
                LocalDate date = LocalDate.parse(cols[0].trim());
                double close = parseDouble(cols[4]);
                if (close <= 0) {
                    continue;
                }
                all.add(new PricePoint(
                        date,
                        parseDouble(cols[1]),
                        parseDouble(cols[2]),
                        parseDouble(cols[3]),
                        close,
                        cols.length >= 6 ? parseDouble(cols[5]) : 0.0
                ));
            } catch (DateTimeParseException | NumberFormatException e) {
                LOG.debug("skipping malformed stooq row '{}'", line);
            }
        }
        return PriceSeries.of(all);
    }

    private static double parseDouble(String input) {
        String v = input == null ? "" : input.trim();
        if (v.isEmpty() || v.equalsIgnoreCase("null")) {
            return 0.0;
        }
        return Double.parseDouble(v);
    }
}
