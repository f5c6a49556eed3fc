package com.stockpulse.extract;

import java.util.Locale;

/**
 * Why one article produced no sentiment record. Non-fatal: the article is dropped from the sentiment set.
 */
public final class ExtractionError {
    public enum Kind {
        EMPTY_TEXT,
        MALFORMED_OUTPUT,
        CAPABILITY_FAILURE,
        INTERRUPTED,
        TIMED_OUT
    }

    public final String articleId;
    public final Kind kind;
    public final int attempts;
    public final String message;

    public ExtractionError(String articleId, Kind kind, int attempts, String message) {
        this.articleId = articleId == null ? "" : articleId;
        this.kind = kind == null ? Kind.CAPABILITY_FAILURE : kind;
        this.attempts = Math.max(0, attempts);
        this.message = message == null ? "" : message;
    }

    public String describe() {
        StringBuilder sb = new StringBuilder();
        sb.append("article ").append(articleId).append(" failed extraction: ")
                .append(kind.name().toLowerCase(Locale.ROOT));
        if (attempts > 0) {
            sb.append(" after ").append(attempts).append(attempts == 1 ? " attempt" : " attempts");
        }
        if (!message.isEmpty()) {
            sb.append(" (").append(message).append(')');
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return describe();
    }
}
