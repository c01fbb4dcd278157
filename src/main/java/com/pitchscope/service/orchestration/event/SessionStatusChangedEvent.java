package com.pitchscope.service.orchestration.event;

import com.pitchscope.domain.SessionStatus;

import java.time.Instant;

/**
 * Emitted after every successful session status transition.
 *
 * @param sessionId    session that changed
 * @param previous     status before the transition
 * @param current      status after the transition
 * @param errorMessage message recorded with the transition (nullable, set for ERROR)
 * @param timestamp    when the transition happened
 */
public record SessionStatusChangedEvent(
        String sessionId,
        SessionStatus previous,
        SessionStatus current,
        String errorMessage,
        Instant timestamp
) {}
