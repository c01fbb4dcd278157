package com.pitchscope.service.stt.streaming;

/**
 * Why the realtime receive loop stopped.
 */
public enum StreamTermination {
    /** Provider signalled the end of the session. */
    SESSION_ENDED,
    /** Provider sent an error message. */
    PROVIDER_ERROR,
    /** Connection closed before the session ended. */
    CONNECTION_CLOSED,
    /** Transport failure mid-stream. */
    CONNECTION_FAILED,
    /** Message budget reached. */
    MAX_MESSAGES,
    /** Too many consecutive read timeouts. */
    IDLE_TIMEOUT,
    /** Session was cancelled. */
    CANCELLED
}
