/**
 * Domain models for capture sessions and transcripts.
 *
 * <p>Value objects ({@link com.pitchscope.domain.AudioConfiguration},
 * {@link com.pitchscope.domain.TranscriptSegment}, {@link com.pitchscope.domain.TranscriptCollection},
 * {@link com.pitchscope.domain.IntelligenceAnnotations}) are immutable records that validate
 * themselves on construction. {@link com.pitchscope.domain.AudioSession} is the one mutable
 * entity: a lock-guarded state machine driven by the session orchestrator.
 *
 * @since 1.0
 */
package com.pitchscope.domain;
