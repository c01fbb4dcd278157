package com.pitchscope.service.intelligence;

/**
 * Presentation energy inferred from the words-per-minute band.
 */
public enum EnergyLevel {
    HIGH(1.0),
    MODERATE(0.7),
    LOW(0.4);

    private final double score;

    EnergyLevel(double score) {
        this.score = score;
    }

    public double score() {
        return score;
    }

    public static EnergyLevel fromWordsPerMinute(double wordsPerMinute) {
        if (wordsPerMinute > 160) {
            return HIGH;
        }
        if (wordsPerMinute > 120) {
            return MODERATE;
        }
        return LOW;
    }
}
