package com.pitchscope.service.intelligence;

/**
 * Grade derived from filler-word percentage, with the professionalism score used in the
 * delivery blend.
 */
public enum ProfessionalismGrade {
    EXCELLENT(1.0),
    GOOD(0.8),
    FAIR(0.6),
    NEEDS_IMPROVEMENT(0.3);

    private final double score;

    ProfessionalismGrade(double score) {
        this.score = score;
    }

    public double score() {
        return score;
    }

    public static ProfessionalismGrade fromFillerPercentage(double fillerPercentage) {
        if (fillerPercentage <= 1.0) {
            return EXCELLENT;
        }
        if (fillerPercentage <= 2.5) {
            return GOOD;
        }
        if (fillerPercentage <= 5.0) {
            return FAIR;
        }
        return NEEDS_IMPROVEMENT;
    }
}
