package com.stockpulse.extract;

import com.stockpulse.model.SentimentRecord;

import java.util.Objects;

/**
 * Either a sentiment record or an {@link ExtractionError}, never both.
 */
public final class ExtractionResult {
    public final boolean success;
    public final SentimentRecord record;
    public final ExtractionError error;

    private ExtractionResult(boolean success, SentimentRecord record, ExtractionError error) {
        this.success = success;
        this.record = record;
        this.error = error;
    }

    public static ExtractionResult success(SentimentRecord record) {
        return new ExtractionResult(true, Objects.requireNonNull(record, "record"), null);
    }

    public static ExtractionResult failure(ExtractionError error) {
        return new ExtractionResult(false, null, Objects.requireNonNull(error, "error"));
    }
}
