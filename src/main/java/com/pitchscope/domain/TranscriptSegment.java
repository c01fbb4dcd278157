package com.pitchscope.domain;

import com.pitchscope.util.TokenizerUtil;

import java.util.Objects;

/**
 * Immutable transcript segment as produced by either transcription path.
 *
 * @param id         provider or path-assigned identifier
 * @param text       non-blank transcript text
 * @param startTime  start offset in seconds (&gt;= 0)
 * @param endTime    end offset in seconds (&gt;= startTime)
 * @param language   language code reported by the provider (may be empty)
 * @param channel    audio channel index (nullable, &gt;= 0 when present)
 * @param confidence provider confidence in [0,1] (nullable)
 * @param isFinal    true for final segments, false for interim results
 */
public record TranscriptSegment(
        String id,
        String text,
        double startTime,
        double endTime,
        String language,
        Integer channel,
        Double confidence,
        boolean isFinal
) {

    public TranscriptSegment {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(text, "text must not be null");
        if (text.isBlank()) {
            throw new IllegalArgumentException("Segment text must not be empty");
        }
        if (startTime < 0) {
            throw new IllegalArgumentException("startTime must be >= 0, got: " + startTime);
        }
        if (endTime < startTime) {
            throw new IllegalArgumentException(
                    "endTime must be >= startTime, got: " + endTime + " < " + startTime);
        }
        if (channel != null && channel < 0) {
            throw new IllegalArgumentException("channel must be >= 0, got: " + channel);
        }
        if (confidence != null && (confidence < 0.0 || confidence > 1.0)) {
            throw new IllegalArgumentException("confidence must be between 0.0 and 1.0, got: " + confidence);
        }
        language = language == null ? "" : language;
    }

    public double duration() {
        return endTime - startTime;
    }

    public int wordCount() {
        return TokenizerUtil.countWords(text);
    }

    /**
     * A segment without a reported confidence is treated as high confidence.
     */
    public boolean hasHighConfidence(double threshold) {
        return confidence == null || confidence >= threshold;
    }

    public TranscriptSegment withFinal(boolean finalFlag) {
        return new TranscriptSegment(id, text, startTime, endTime, language, channel, confidence, finalFlag);
    }
}
