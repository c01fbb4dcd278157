package com.pitchscope.domain;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Point-in-time, immutable view of an {@link AudioSession}.
 */
public record SessionSnapshot(
        String sessionId,
        String sessionName,
        SessionStatus status,
        AudioConfiguration configuration,
        Instant createdAt,
        Instant updatedAt,
        ProviderSession providerSession,
        TranscriptCollection transcript,
        String errorMessage
) {

    public Optional<ProviderSession> provider() {
        return Optional.ofNullable(providerSession);
    }

    public Optional<String> error() {
        return Optional.ofNullable(errorMessage);
    }

    /** Time between creation and the last update. */
    public Duration duration() {
        return Duration.between(createdAt, updatedAt);
    }

    public boolean hasTranscripts() {
        return !transcript.isEmpty();
    }
}
