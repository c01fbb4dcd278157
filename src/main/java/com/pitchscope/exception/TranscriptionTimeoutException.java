package com.pitchscope.exception;

import java.time.Duration;

/**
 * Thrown when a transcription path exhausts its wait budget: consecutive receive timeouts
 * on the realtime channel, or the maximum number of poll attempts for a batch job.
 */
public class TranscriptionTimeoutException extends PitchScopeException {

    private final String path;
    private final int attempts;
    private final Duration waited;

    public TranscriptionTimeoutException(String path, int attempts, Duration waited) {
        super("Transcription timed out on " + path + " path after " + attempts
                + " attempts (" + waited.toMillis() + "ms)");
        this.path = path;
        this.attempts = attempts;
        this.waited = waited;
    }

    public String getPath() {
        return path;
    }

    public int getAttempts() {
        return attempts;
    }

    public Duration getWaited() {
        return waited;
    }
}
