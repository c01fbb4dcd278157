package com.pitchscope.exception;

/**
 * Thrown when stopping a session fails for a reason neither transcription path could absorb.
 * The session has already been moved to ERROR when this is raised.
 */
public class SessionFailedException extends PitchScopeException {

    private final String sessionId;

    public SessionFailedException(String sessionId, Throwable cause) {
        super("Session " + sessionId + " failed: " + cause.getMessage(), cause);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
