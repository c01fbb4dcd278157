package com.pitchscope.service.orchestration.event;

import com.pitchscope.domain.TranscriptSegment;
import com.pitchscope.service.orchestration.TranscriptionPath;

import java.time.Instant;

/**
 * Emitted for each segment attached to a session, interim or final.
 *
 * @param sessionId owning session
 * @param segment   the segment as attached
 * @param source    path that delivered it
 * @param timestamp when it was attached
 */
public record TranscriptSegmentReceivedEvent(
        String sessionId,
        TranscriptSegment segment,
        TranscriptionPath source,
        Instant timestamp
) {}
