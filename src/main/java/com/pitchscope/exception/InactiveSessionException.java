package com.pitchscope.exception;

import com.pitchscope.domain.SessionStatus;

/**
 * Thrown when a transcript segment is added to a session that is no longer active.
 */
public class InactiveSessionException extends PitchScopeException {

    private final SessionStatus status;

    public InactiveSessionException(String sessionId, SessionStatus status) {
        super("Session " + sessionId + " is not active (status: " + status + ")");
        this.status = status;
    }

    public SessionStatus getStatus() {
        return status;
    }
}
