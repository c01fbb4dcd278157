package com.pitchscope.service.stt.provider;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Snapshot of a batch job as reported by one poll.
 *
 * @param state        job state
 * @param result       parsed transcript when {@code state} is {@link State#DONE} (nullable)
 * @param errorMessage provider error text when {@code state} is {@link State#ERROR} (nullable)
 */
public record JobStatus(State state, BatchTranscript result, String errorMessage) {

    public enum State {
        QUEUED,
        PROCESSING,
        DONE,
        ERROR;

        /** Unrecognized wire values are treated as still processing. */
        public static State fromWire(String status) {
            if (status == null) {
                return PROCESSING;
            }
            switch (status.toLowerCase(Locale.ROOT)) {
                case "queued":
                    return QUEUED;
                case "done":
                    return DONE;
                case "error":
                    return ERROR;
                default:
                    return PROCESSING;
            }
        }
    }

    public JobStatus {
        Objects.requireNonNull(state, "state");
    }

    public static JobStatus pending(State state) {
        return new JobStatus(state, null, null);
    }

    public static JobStatus done(BatchTranscript result) {
        return new JobStatus(State.DONE, Objects.requireNonNull(result, "result"), null);
    }

    public static JobStatus failed(String errorMessage) {
        return new JobStatus(State.ERROR, null, errorMessage);
    }

    public boolean isTerminal() {
        return state == State.DONE || state == State.ERROR;
    }

    public Optional<BatchTranscript> transcript() {
        return Optional.ofNullable(result);
    }
}
