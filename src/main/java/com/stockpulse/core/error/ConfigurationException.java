package com.stockpulse.core.error;

/**
 * Invalid settings or run request. Raised before any pipeline stage executes.
 */
public class ConfigurationException extends RuntimeException {
    private final String key;

    public ConfigurationException(String key, String message) {
        super(key == null || key.isEmpty() ? message : key + ": " + message);
        this.key = key == null ? "" : key;
    }

    public String key() {
        return key;
    }
}
