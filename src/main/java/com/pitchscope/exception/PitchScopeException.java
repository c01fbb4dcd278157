package com.pitchscope.exception;

/**
 * Base exception for all PitchScope application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class PitchScopeException extends RuntimeException {

    public PitchScopeException(String message) {
        super(message);
    }

    public PitchScopeException(String message, Throwable cause) {
        super(message, cause);
    }

    public PitchScopeException(Throwable cause) {
        super(cause);
    }
}
