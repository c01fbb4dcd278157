package com.pitchscope.service.intelligence;

/**
 * Vocal confidence and readiness estimates.
 *
 * @param confidenceScore   mean segment confidence, or a filler-based heuristic
 * @param energyLevel       energy inferred from pace
 * @param vocalStability    1 − 2×stddev of segment confidences, clamped to [0,1]
 * @param paceConsistency   pacing-consistency score
 * @param readiness         weighted blend of the above
 */
public record ConfidenceMetrics(
        double confidenceScore,
        EnergyLevel energyLevel,
        double vocalStability,
        double paceConsistency,
        double readiness
) {

    public String assessment() {
        if (confidenceScore >= 0.8) {
            return "high";
        }
        if (confidenceScore >= 0.6) {
            return "moderate";
        }
        return "low";
    }
}
