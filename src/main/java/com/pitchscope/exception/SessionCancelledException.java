package com.pitchscope.exception;

/**
 * Thrown from a transcription loop when its session has been cancelled.
 */
public class SessionCancelledException extends PitchScopeException {

    public SessionCancelledException(String sessionId) {
        super("Session cancelled: " + sessionId);
    }
}
