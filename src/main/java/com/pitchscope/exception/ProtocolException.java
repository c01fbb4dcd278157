package com.pitchscope.exception;

/**
 * Thrown when the provider sends a malformed payload or reports an error on the realtime channel.
 */
public class ProtocolException extends PitchScopeException {

    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
