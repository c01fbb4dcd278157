package com.pitchscope.exception;

/**
 * Thrown when an operation names a session id that is not registered.
 */
public class SessionNotFoundException extends PitchScopeException {

    private final String sessionId;

    public SessionNotFoundException(String sessionId) {
        super("Session not found: " + sessionId);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
