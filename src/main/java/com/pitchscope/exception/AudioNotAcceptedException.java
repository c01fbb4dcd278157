package com.pitchscope.exception;

import com.pitchscope.domain.SessionStatus;

/**
 * Thrown when audio is fed to a session that is not CONNECTED or RECORDING.
 */
public class AudioNotAcceptedException extends PitchScopeException {

    private final SessionStatus status;

    public AudioNotAcceptedException(String sessionId, SessionStatus status) {
        super("Session " + sessionId + " cannot receive audio (status: " + status + ")");
        this.status = status;
    }

    public SessionStatus getStatus() {
        return status;
    }
}
