package com.pitchscope.service.intelligence;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Filler-word usage for a finalized transcript.
 *
 * @param totalWords        whitespace-delimited word count
 * @param fillerCount       number of lexicon matches
 * @param fillerPercentage  fillerCount / totalWords × 100
 * @param detectedFillers   distinct fillers in first-seen order
 * @param fillerCounts      occurrences per filler, in lexicon order, zero counts omitted
 * @param mostCommonFiller  most frequent filler, or null when none were found
 * @param fillersPerMinute  fillers per minute of total duration
 * @param grade             professionalism grade
 */
public record FillerAnalysis(
        int totalWords,
        int fillerCount,
        double fillerPercentage,
        List<String> detectedFillers,
        Map<String, Integer> fillerCounts,
        String mostCommonFiller,
        double fillersPerMinute,
        ProfessionalismGrade grade
) {

    public FillerAnalysis {
        detectedFillers = List.copyOf(detectedFillers);
        fillerCounts = Collections.unmodifiableMap(new LinkedHashMap<>(fillerCounts));
    }

    public double professionalismScore() {
        return grade.score();
    }
}
