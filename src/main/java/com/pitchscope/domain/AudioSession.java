package com.pitchscope.domain;

import com.pitchscope.exception.InactiveSessionException;
import com.pitchscope.exception.InvalidTransitionException;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Thread-safe state machine for one recording session.
 *
 * <p>Status changes follow {@link SessionStatus#allowedTargets()}. A rejected transition throws
 * {@link InvalidTransitionException} and leaves every field unchanged. Segments can only be
 * attached while the session {@linkplain SessionStatus#isActive() is active}, which includes
 * INITIALIZING so that results arriving before the audio channel is confirmed are not lost.
 *
 * <p><b>Thread Safety:</b> All public methods use a {@link ReentrantLock}; status, timestamp,
 * error message and transcript are updated together under it.
 *
 * @since 1.0
 */
public final class AudioSession {

    private final Lock lock = new ReentrantLock();
    private final String sessionId;
    private final String sessionName;
    private final AudioConfiguration configuration;
    private final Clock clock;
    private final Instant createdAt;

    private SessionStatus status = SessionStatus.INITIALIZING;
    private Instant updatedAt;
    private ProviderSession providerSession;
    private TranscriptCollection transcript;
    private String errorMessage;

    public AudioSession(String sessionId, String sessionName, AudioConfiguration configuration, Clock clock) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId must not be null");
        this.sessionName = sessionName;
        this.configuration = Objects.requireNonNull(configuration, "configuration must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.createdAt = clock.instant();
        this.updatedAt = createdAt;
        this.transcript = new TranscriptCollection(List.of(), createdAt);
    }

    public AudioSession(String sessionId, AudioConfiguration configuration) {
        this(sessionId, null, configuration, Clock.systemUTC());
    }

    /**
     * Moves the session to {@code target}.
     *
     * @param target       requested status
     * @param errorMessage message to record (nullable); replaces any previous message when non-null
     * @return the status before the transition
     * @throws InvalidTransitionException if the transition table does not allow it
     */
    public SessionStatus transitionTo(SessionStatus target, String errorMessage) {
        Objects.requireNonNull(target, "target must not be null");
        lock.lock();
        try {
            if (!status.canTransitionTo(target)) {
                throw new InvalidTransitionException(sessionId, status, target);
            }
            SessionStatus previous = status;
            status = target;
            updatedAt = clock.instant();
            if (errorMessage != null) {
                this.errorMessage = errorMessage;
            }
            return previous;
        } finally {
            lock.unlock();
        }
    }

    public SessionStatus transitionTo(SessionStatus target) {
        return transitionTo(target, null);
    }

    /** CONNECTED → RECORDING. */
    public SessionStatus startRecording() {
        return transitionTo(SessionStatus.RECORDING);
    }

    /** CONNECTED or RECORDING → STOPPING. */
    public SessionStatus beginStopping() {
        return transitionTo(SessionStatus.STOPPING);
    }

    /** STOPPING → STOPPED. */
    public SessionStatus markStopped() {
        return transitionTo(SessionStatus.STOPPED);
    }

    /** Any non-terminal state → ERROR. */
    public SessionStatus fail(String message) {
        return transitionTo(SessionStatus.ERROR, message);
    }

    /**
     * Attaches a segment to the current transcript.
     *
     * @throws InactiveSessionException if the session is not active; nothing is applied
     */
    public void addSegment(TranscriptSegment segment) {
        Objects.requireNonNull(segment, "segment must not be null");
        lock.lock();
        try {
            if (!status.isActive()) {
                throw new InactiveSessionException(sessionId, status);
            }
            transcript = transcript.addSegment(segment);
            updatedAt = clock.instant();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Replaces the transcript with {@code assembled}. Used once the stop sequence has merged
     * the results of both paths.
     */
    public void replaceTranscript(TranscriptCollection assembled) {
        Objects.requireNonNull(assembled, "assembled must not be null");
        lock.lock();
        try {
            transcript = assembled;
            updatedAt = clock.instant();
        } finally {
            lock.unlock();
        }
    }

    public void bindProvider(ProviderSession provider) {
        Objects.requireNonNull(provider, "provider must not be null");
        lock.lock();
        try {
            this.providerSession = provider;
            updatedAt = clock.instant();
        } finally {
            lock.unlock();
        }
    }

    public boolean canReceiveAudio() {
        return getStatus().canReceiveAudio();
    }

    public boolean isActive() {
        return getStatus().isActive();
    }

    public SessionStatus getStatus() {
        lock.lock();
        try {
            return status;
        } finally {
            lock.unlock();
        }
    }

    public TranscriptCollection getTranscript() {
        lock.lock();
        try {
            return transcript;
        } finally {
            lock.unlock();
        }
    }

    public Instant getUpdatedAt() {
        lock.lock();
        try {
            return updatedAt;
        } finally {
            lock.unlock();
        }
    }

    public String getSessionId() {
        return sessionId;
    }

    public AudioConfiguration getConfiguration() {
        return configuration;
    }

    public SessionSnapshot snapshot() {
        lock.lock();
        try {
            return new SessionSnapshot(sessionId, sessionName, status, configuration, createdAt, updatedAt,
                    providerSession, transcript, errorMessage);
        } finally {
            lock.unlock();
        }
    }
}
