package com.pitchscope.service.transcript;

import java.util.Set;

/**
 * Aggregates derived from a transcript at the moment they were requested.
 */
public record TranscriptSummary(
        String fullText,
        int wordCount,
        double totalDurationSeconds,
        int segmentCount,
        int finalSegmentCount,
        Set<Integer> channels
) {
    public TranscriptSummary {
        channels = Set.copyOf(channels);
    }
}
