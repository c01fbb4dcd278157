package com.pitchscope.exception;

import com.pitchscope.domain.SessionStatus;

/**
 * Thrown when a session is asked to move to a state the transition table does not allow.
 * The session keeps its current state.
 */
public class InvalidTransitionException extends PitchScopeException {

    private final SessionStatus from;
    private final SessionStatus to;

    public InvalidTransitionException(String sessionId, SessionStatus from, SessionStatus to) {
        super("Invalid transition " + from + " -> " + to + " for session " + sessionId);
        this.from = from;
        this.to = to;
    }

    public SessionStatus getFrom() {
        return from;
    }

    public SessionStatus getTo() {
        return to;
    }
}
