package com.pitchscope.service.orchestration;

import com.pitchscope.domain.IntelligenceAnnotations;
import com.pitchscope.domain.SessionSnapshot;
import com.pitchscope.domain.TranscriptCollection;
import com.pitchscope.service.intelligence.AudioIntelligenceReport;

import java.util.Objects;

/**
 * Outcome of a successful {@link SessionOrchestrator#stopSession}.
 *
 * @param snapshot    session state after reaching STOPPED
 * @param transcript  assembled transcript, interim and final segments
 * @param report      metrics computed from the analysis view of {@code transcript}
 * @param path        path that produced the segments
 * @param annotations provider annotations; empty unless the batch path ran successfully
 */
public record SessionResult(
        SessionSnapshot snapshot,
        TranscriptCollection transcript,
        AudioIntelligenceReport report,
        TranscriptionPath path,
        IntelligenceAnnotations annotations
) {
    public SessionResult {
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        Objects.requireNonNull(transcript, "transcript must not be null");
        Objects.requireNonNull(report, "report must not be null");
        Objects.requireNonNull(path, "path must not be null");
        annotations = annotations == null ? IntelligenceAnnotations.empty() : annotations;
    }

    public String sessionId() {
        return snapshot.sessionId();
    }

    public boolean hasAnnotations() {
        return !annotations.isEmpty();
    }
}
