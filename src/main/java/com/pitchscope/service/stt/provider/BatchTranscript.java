package com.pitchscope.service.stt.provider;

import com.pitchscope.domain.IntelligenceAnnotations;
import com.pitchscope.domain.TranscriptSegment;

import java.util.List;
import java.util.Objects;

/**
 * Completed batch result: final segments plus provider annotations.
 */
public record BatchTranscript(List<TranscriptSegment> segments, IntelligenceAnnotations annotations) {
    public BatchTranscript {
        segments = List.copyOf(segments);
        Objects.requireNonNull(annotations, "annotations");
    }
}
