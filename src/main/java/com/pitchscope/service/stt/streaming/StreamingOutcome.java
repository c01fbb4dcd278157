package com.pitchscope.service.stt.streaming;

import com.pitchscope.domain.TranscriptSegment;
import com.pitchscope.exception.PitchScopeException;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of one realtime streaming run. Segments gathered before a failure are always kept.
 *
 * @param segments          segments in arrival order
 * @param termination       why the receive loop stopped
 * @param failure           error that ended the loop, if any (nullable)
 * @param messagesReceived  text frames read
 * @param malformedMessages frames that failed to parse and were skipped
 */
public record StreamingOutcome(
        List<TranscriptSegment> segments,
        StreamTermination termination,
        PitchScopeException failure,
        int messagesReceived,
        int malformedMessages
) {

    public StreamingOutcome {
        segments = List.copyOf(segments);
        Objects.requireNonNull(termination, "termination");
    }

    public Optional<PitchScopeException> error() {
        return Optional.ofNullable(failure);
    }

    public boolean hasSegments() {
        return !segments.isEmpty();
    }
}
