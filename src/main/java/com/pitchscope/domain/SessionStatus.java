package com.pitchscope.domain;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle states of an {@link AudioSession} and the transitions allowed between them.
 *
 * <pre>
 * INITIALIZING → CONNECTED | ERROR
 * CONNECTED    → RECORDING | STOPPING | ERROR
 * RECORDING    → STOPPING | ERROR
 * STOPPING     → STOPPED | ERROR
 * STOPPED, ERROR are terminal
 * </pre>
 */
public enum SessionStatus {
    INITIALIZING,
    CONNECTED,
    RECORDING,
    STOPPING,
    STOPPED,
    ERROR;

    /**
     * States reachable from this one in a single transition.
     */
    public Set<SessionStatus> allowedTargets() {
        switch (this) {
            case INITIALIZING:
                return Collections.unmodifiableSet(EnumSet.of(CONNECTED, ERROR));
            case CONNECTED:
                return Collections.unmodifiableSet(EnumSet.of(RECORDING, STOPPING, ERROR));
            case RECORDING:
                return Collections.unmodifiableSet(EnumSet.of(STOPPING, ERROR));
            case STOPPING:
                return Collections.unmodifiableSet(EnumSet.of(STOPPED, ERROR));
            default:
                return Collections.unmodifiableSet(EnumSet.noneOf(SessionStatus.class));
        }
    }

    public boolean canTransitionTo(SessionStatus target) {
        return allowedTargets().contains(target);
    }

    public boolean isTerminal() {
        return this == STOPPED || this == ERROR;
    }

    /** Segments may be attached to the session in these states. */
    public boolean isActive() {
        return this == INITIALIZING || this == CONNECTED || this == RECORDING;
    }

    /** Raw audio may be fed to the session in these states. */
    public boolean canReceiveAudio() {
        return this == CONNECTED || this == RECORDING;
    }
}
