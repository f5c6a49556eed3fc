package com.stockpulse.data.http;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Thin GET wrapper over {@link HttpClient} shared by the news and market data sources.
 */
public class HttpClientEx {
    private static final String USER_AGENT = "StockPulse/1.0";

    private final HttpClient client;

    public HttpClientEx() {
        this(20);
    }

    public HttpClientEx(int connectTimeoutSeconds) {
        this.client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(Math.max(1, connectTimeoutSeconds)))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    /**
     * Returns the response body of a 2xx answer.
     *
     * @throws HttpStatusException for any other status code
     */
    public String getText(String url, int timeoutSeconds) throws IOException, InterruptedException {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(Duration.ofSeconds(Math.max(1, timeoutSeconds)))
                .GET()
                .header("User-Agent", USER_AGENT)
                .build();
        HttpResponse<String> resp = client.send(req, HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() >= 200 && resp.statusCode() < 300) {
            return resp.body();
        }
        throw new HttpStatusException(resp.statusCode(), url);
    }

    public static final class HttpStatusException extends IOException {
        private final int statusCode;

        public HttpStatusException(int statusCode, String url) {
            super("http status=" + statusCode + " for " + url);
            this.statusCode = statusCode;
        }

        public int statusCode() {
            return statusCode;
        }

        public boolean isRetryable() {
            return statusCode == 429 || statusCode >= 500;
        }
    }
}
