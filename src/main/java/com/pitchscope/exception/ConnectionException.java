package com.pitchscope.exception;

/**
 * Thrown when the provider cannot be reached, a socket fails, or an HTTP call returns
 * a non-success status.
 */
public class ConnectionException extends PitchScopeException {

    private final String endpoint;

    public ConnectionException(String message, String endpoint) {
        super(message + " (endpoint: " + endpoint + ")");
        this.endpoint = endpoint;
    }

    public ConnectionException(String message, String endpoint, Throwable cause) {
        super(message + " (endpoint: " + endpoint + ")", cause);
        this.endpoint = endpoint;
    }

    public String getEndpoint() {
        return endpoint;
    }
}
