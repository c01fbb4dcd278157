package com.pitchscope.service.stt.batch;

import com.pitchscope.domain.IntelligenceAnnotations;
import com.pitchscope.domain.TranscriptSegment;

import java.util.List;
import java.util.Objects;

/**
 * Successful batch transcription: final segments, provider annotations, and the job that
 * produced them.
 */
public record BatchOutcome(List<TranscriptSegment> segments, IntelligenceAnnotations annotations,
                           String jobId, int pollAttempts) {
    public BatchOutcome {
        segments = List.copyOf(segments);
        Objects.requireNonNull(annotations, "annotations");
        Objects.requireNonNull(jobId, "jobId");
    }
}
