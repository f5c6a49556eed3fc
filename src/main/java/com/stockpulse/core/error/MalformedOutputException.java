package com.stockpulse.core.error;

/**
 * The structured-analysis capability answered, but the answer does not match the expected record shape.
 */
public class MalformedOutputException extends Exception {
    private final String rawOutput;

    public MalformedOutputException(String message, String rawOutput) {
        super(message);
        this.rawOutput = rawOutput == null ? "" : rawOutput;
    }

    public MalformedOutputException(String message, String rawOutput, Throwable cause) {
        super(message, cause);
        this.rawOutput = rawOutput == null ? "" : rawOutput;
    }

    public String rawOutput() {
        return rawOutput;
    }
}
