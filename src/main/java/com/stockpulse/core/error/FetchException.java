package com.stockpulse.core.error;

/**
 * News or price retrieval failed at the transport or payload level.
 */
public class FetchException extends Exception {
    private final String source;

    public FetchException(String source, String message) {
        super(message);
        this.source = source == null ? "" : source;
    }

    public FetchException(String source, String message, Throwable cause) {
        super(message, cause);
        this.source = source == null ? "" : source;
    }

    public String source() {
        return source;
    }
}
