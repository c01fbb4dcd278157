package com.pitchscope.service.orchestration;

import com.pitchscope.domain.SessionStatus;

import java.time.Instant;

/**
 * Returned by {@link SessionOrchestrator#createSession}; identifies the session in later calls.
 *
 * @param sessionId         registry key
 * @param sessionName       display name
 * @param status            status right after creation (normally CONNECTED)
 * @param streamingAvailable {@code false} when no realtime session could be bound and the session
 *                          will be transcribed by the batch path only
 * @param createdAt         creation time
 */
public record SessionHandle(
        String sessionId,
        String sessionName,
        SessionStatus status,
        boolean streamingAvailable,
        Instant createdAt
) {}
