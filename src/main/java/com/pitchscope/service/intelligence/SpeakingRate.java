package com.pitchscope.service.intelligence;

/**
 * Speaking pace relative to the configured target words-per-minute (±20% band).
 */
public enum SpeakingRate {
    TOO_SLOW,
    APPROPRIATE,
    TOO_FAST;

    /**
     * Classifies {@code wordsPerMinute} against a target; the band edges count as appropriate.
     */
    public static SpeakingRate classify(double wordsPerMinute, int targetWpm) {
        double variance = targetWpm * 0.2;
        if (wordsPerMinute < targetWpm - variance) {
            return TOO_SLOW;
        }
        if (wordsPerMinute > targetWpm + variance) {
            return TOO_FAST;
        }
        return APPROPRIATE;
    }
}
