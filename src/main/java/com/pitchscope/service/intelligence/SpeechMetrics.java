package com.pitchscope.service.intelligence;

/**
 * Pace and pause measurements for a finalized transcript.
 *
 * @param totalWords              whitespace-delimited word count
 * @param totalDurationSeconds    max end minus min start
 * @param speakingDurationSeconds sum of segment durations
 * @param pauseDurationSeconds    total minus speaking, floored at zero
 * @param pauseCount              number of gaps between consecutive segments
 * @param wordsPerMinute          words per minute over the total duration
 * @param speakingRate            classification against the target
 * @param pauseEffectiveness      0.0-1.0 score from the pause share
 * @param pacingConsistency       0.0-1.0 score from the speaking share
 */
public record SpeechMetrics(
        int totalWords,
        double totalDurationSeconds,
        double speakingDurationSeconds,
        double pauseDurationSeconds,
        int pauseCount,
        double wordsPerMinute,
        SpeakingRate speakingRate,
        double pauseEffectiveness,
        double pacingConsistency
) {

    public double pausePercentage() {
        return totalDurationSeconds == 0 ? 0.0 : pauseDurationSeconds / totalDurationSeconds * 100;
    }
}
