package com.pitchscope.exception;

/**
 * Thrown when an audio configuration or provider setting is invalid.
 * Raised at construction time, before any network or session work begins.
 */
public class ConfigurationException extends PitchScopeException {

    private final String field;

    public ConfigurationException(String message) {
        super(message);
        this.field = "unknown";
    }

    public ConfigurationException(String message, String field) {
        super(message + " (field: " + field + ")");
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
