package com.stockpulse.data;

import com.stockpulse.config.Config;
import com.stockpulse.core.error.FetchException;
import com.stockpulse.data.http.HttpClientEx;
import com.stockpulse.model.DateRange;
import com.stockpulse.model.PriceSeries;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StooqPriceSourceTest {
    private static final String CSV = "Date,Open,High,Low,Close,Volume\n"
            + "2024-02-29,99,101,98,100,1000\n"
            + "2024-03-01,100,102,99,101,1200\n"
            + "2024-03-04,101,103,100,0,0\n"
            + "2024-03-05,101,104,100,103.5,1500\n"
            + "garbage,row\n";
    private static final DateRange RANGE = new DateRange(LocalDate.of(2024, 3, 1), LocalDate.of(2024, 3, 7));

    @Test
    void parseCsv_shouldSkipNonPositiveClosesAndMalformedRows() {
        PriceSeries series = StooqPriceSource.parseCsv(CSV);

        assertEquals(3, series.size());
        assertEquals(LocalDate.of(2024, 3, 5), series.get(2).date());
        assertEquals(103.5, series.get(2).close(), 1e-9);
        assertEquals(1500, series.get(2).volume(), 1e-9);
    }

    @Test
    void parseCsv_shouldTreatNoDataAsEmptyAndRejectOtherPayloads() {
        assertTrue(StooqPriceSource.parseCsv("No data").isEmpty());
        assertThrows(IllegalStateException.class,
                () -> StooqPriceSource.parseCsv("Exceeded the daily hits limit"));
        assertThrows(IllegalStateException.class,
                () -> StooqPriceSource.parseCsv("<html>maintenance</html>"));
    }

    @Test
    void fetchPrices_shouldRetryServerErrorsAndClipToRange() throws Exception {
        ScriptedHttp http = new ScriptedHttp(new HttpClientEx.HttpStatusException(503, "stooq"), CSV);
        StooqPriceSource source = new StooqPriceSource(http, config());

        PriceSeries series = source.fetchPrices("AAPL", RANGE);

        assertEquals(2, series.size());
        assertEquals(LocalDate.of(2024, 3, 1), series.get(0).date());
        assertEquals(2, http.urls.size());
        assertTrue(http.urls.get(0).contains("s=aapl.us"));
        assertTrue(http.urls.get(0).endsWith("&d1=20240301&d2=20240307"));
    }

    @Test
    void fetchPrices_shouldNotRetryClientErrors() {
        ScriptedHttp http = new ScriptedHttp(new HttpClientEx.HttpStatusException(404, "stooq"), CSV);
        StooqPriceSource source = new StooqPriceSource(http, config());

        FetchException e = assertThrows(FetchException.class, () -> source.fetchPrices("AAPL", RANGE));

        assertEquals("stooq", e.source());
        assertTrue(e.getMessage().contains("404"));
        assertEquals(1, http.urls.size());
    }

    @Test
    void fetchPrices_shouldSurfaceRateLimitAsFetchError() {
        StooqPriceSource source = new StooqPriceSource(new ScriptedHttp("Exceeded the daily hits limit"), config());

        FetchException e = assertThrows(FetchException.class, () -> source.fetchPrices("AAPL", RANGE));

        assertEquals("stooq_rate_limit", e.getMessage());
    }

    @Test
    void stooqSymbol_shouldKeepExplicitMarketSuffix() {
        StooqPriceSource source = new StooqPriceSource(new ScriptedHttp(), config());

        assertEquals("msft.us", source.stooqSymbol(" MSFT "));
        assertEquals("7203.jp", source.stooqSymbol("7203.JP"));
    }

    private static Config config() {
        return Config.fromMap(Path.of("."), Map.of("stooq", Map.of("retry_sleep_ms", 0, "retry_count", 2)));
    }

    /**
     * Answers from a script of bodies and exceptions; the last entry repeats.
     */
    static final class ScriptedHttp extends HttpClientEx {
        private final Deque<Object> script = new ArrayDeque<>();
        private Object last = "";
        final List<String> urls = new ArrayList<>();

        ScriptedHttp(Object... steps) {
            for (Object step : steps) {
                script.add(step);
            }
        }

        @Override
        public String getText(String url, int timeoutSeconds) throws IOException {
            urls.add(url);
            Object step = script.isEmpty() ? last : script.poll();
            last = step;
            if (step instanceof IOException io) {
                throw io;
            }
            return String.valueOf(step);
        }
    }
}
