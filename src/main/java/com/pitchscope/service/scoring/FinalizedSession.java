package com.pitchscope.service.scoring;

import com.pitchscope.domain.TranscriptCollection;
import com.pitchscope.service.intelligence.AudioIntelligenceReport;

import java.time.Instant;
import java.util.Objects;

/**
 * What a stopped session hands to downstream scoring.
 *
 * @param sessionId   the stopped session
 * @param sessionName display name
 * @param transcript  assembled transcript (all segments)
 * @param report      delivery metrics computed from the analysis view
 * @param completedAt when the session reached STOPPED
 */
public record FinalizedSession(
        String sessionId,
        String sessionName,
        TranscriptCollection transcript,
        AudioIntelligenceReport report,
        Instant completedAt
) {
    public FinalizedSession {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(transcript, "transcript must not be null");
        Objects.requireNonNull(report, "report must not be null");
        Objects.requireNonNull(completedAt, "completedAt must not be null");
    }
}
