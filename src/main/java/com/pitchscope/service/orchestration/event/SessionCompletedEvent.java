package com.pitchscope.service.orchestration.event;

import com.pitchscope.service.orchestration.TranscriptionPath;

import java.time.Duration;
import java.time.Instant;

/**
 * Emitted once a session reaches STOPPED with its report computed.
 *
 * @param sessionId     the session
 * @param path          path that produced the transcript
 * @param segmentCount  segments in the assembled transcript
 * @param wordCount     words in the analysis view
 * @param deliveryScore composite delivery score (0-25)
 * @param elapsed       wall time of the stop sequence
 * @param timestamp     completion time
 */
public record SessionCompletedEvent(
        String sessionId,
        TranscriptionPath path,
        int segmentCount,
        int wordCount,
        double deliveryScore,
        Duration elapsed,
        Instant timestamp
) {}
