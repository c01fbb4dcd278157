package com.pitchscope.service.intelligence;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable delivery report produced once per finalized session.
 *
 * @param speech            pace and pause metrics
 * @param filler            filler-word analysis
 * @param confidence        confidence and readiness metrics
 * @param deliveryScore     weighted score on a 0-25 scale, one decimal
 * @param strengths         ordered strength statements
 * @param improvementAreas  ordered improvement areas
 * @param coaching          ordered coaching suggestions
 * @param dominantSentiment most frequent provider sentiment (nullable)
 */
public record AudioIntelligenceReport(
        SpeechMetrics speech,
        FillerAnalysis filler,
        ConfidenceMetrics confidence,
        double deliveryScore,
        List<String> strengths,
        List<String> improvementAreas,
        List<String> coaching,
        String dominantSentiment
) {

    public static final double MAX_DELIVERY_SCORE = 25.0;

    public AudioIntelligenceReport {
        Objects.requireNonNull(speech, "speech");
        Objects.requireNonNull(filler, "filler");
        Objects.requireNonNull(confidence, "confidence");
        if (deliveryScore < 0.0 || deliveryScore > MAX_DELIVERY_SCORE) {
            throw new IllegalArgumentException("deliveryScore must be between 0 and 25, got: " + deliveryScore);
        }
        strengths = List.copyOf(strengths);
        improvementAreas = List.copyOf(improvementAreas);
        coaching = List.copyOf(coaching);
    }

    public Optional<String> sentiment() {
        return Optional.ofNullable(dominantSentiment);
    }
}
