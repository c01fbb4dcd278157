package com.pitchscope.service.intelligence;

import com.pitchscope.domain.IntelligenceAnnotations;
import com.pitchscope.domain.TranscriptCollection;
import com.pitchscope.domain.TranscriptSegment;
import com.pitchscope.util.TokenizerUtil;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Derives delivery metrics and a 0-25 delivery score from a finalized transcript.
 *
 * <p>The computation is deterministic and side-effect free: identical input always yields an
 * identical {@link AudioIntelligenceReport}. Score weights:
 * <ul>
 *   <li>Pace: 25% (1.0 when appropriate, 0.7 otherwise)</li>
 *   <li>Pause effectiveness: 20%</li>
 *   <li>Filler control (professionalism): 30%</li>
 *   <li>Confidence/readiness: 25%</li>
 * </ul>
 *
 * @since 1.0
 */
public class AudioIntelligenceExtractor {

    public static final int DEFAULT_TARGET_WPM = 150;

    /** Filler lexicon in reporting order. */
    public static final List<String> FILLER_LEXICON =
            List.of("um", "uh", "like", "you know", "actually", "basically", "literally");

    private static final List<List<String>> FILLER_TOKENS = FILLER_LEXICON.stream()
            .map(f -> List.of(f.split(" ")))
            .toList();

    private static final double PACE_WEIGHT = 0.25;
    private static final double PAUSE_WEIGHT = 0.20;
    private static final double FILLER_WEIGHT = 0.30;
    private static final double READINESS_WEIGHT = 0.25;

    private final int targetWpm;

    public AudioIntelligenceExtractor() {
        this(DEFAULT_TARGET_WPM);
    }

    public AudioIntelligenceExtractor(int targetWpm) {
        if (targetWpm <= 0) {
            throw new IllegalArgumentException("targetWpm must be positive, got: " + targetWpm);
        }
        this.targetWpm = targetWpm;
    }

    /**
     * Builds the report for a finalized transcript.
     *
     * @param transcript  finalized transcript (typically finals only)
     * @param annotations provider annotations from the batch path (nullable)
     * @return immutable delivery report
     */
    public AudioIntelligenceReport extract(TranscriptCollection transcript, IntelligenceAnnotations annotations) {
        SpeechMetrics speech = speechMetrics(transcript);
        FillerAnalysis filler = fillerAnalysis(transcript, speech.totalDurationSeconds());
        ConfidenceMetrics confidence = confidenceMetrics(transcript, speech, filler);
        double score = deliveryScore(speech, filler, confidence);
        String sentiment = annotations == null ? null : annotations.dominantSentiment().orElse(null);

        return new AudioIntelligenceReport(
                speech,
                filler,
                confidence,
                score,
                strengths(speech, filler, confidence, sentiment),
                improvementAreas(speech, filler, confidence),
                coaching(speech, filler, confidence, sentiment),
                sentiment);
    }

    public AudioIntelligenceReport extract(TranscriptCollection transcript) {
        return extract(transcript, null);
    }

    SpeechMetrics speechMetrics(TranscriptCollection transcript) {
        int words = transcript.wordCount();
        double total = transcript.totalDuration();
        double speaking = transcript.segments().stream().mapToDouble(TranscriptSegment::duration).sum();
        double pause = Math.max(0.0, total - speaking);

        int pauseCount = 0;
        List<TranscriptSegment> segments = transcript.segments();
        for (int i = 1; i < segments.size(); i++) {
            if (segments.get(i).startTime() > segments.get(i - 1).endTime()) {
                pauseCount++;
            }
        }

        double wpm = total > 0 ? words / (total / 60.0) : 0.0;
        return new SpeechMetrics(words, total, speaking, pause, pauseCount, wpm,
                SpeakingRate.classify(wpm, targetWpm),
                pauseEffectiveness(total, pause),
                pacingConsistency(total, speaking));
    }

    FillerAnalysis fillerAnalysis(TranscriptCollection transcript, double totalDurationSeconds) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        Set<String> detected = new LinkedHashSet<>();

        for (TranscriptSegment segment : transcript.segments()) {
            List<String> tokens = TokenizerUtil.tokenize(segment.text());
            int i = 0;
            while (i < tokens.size()) {
                int matched = matchFiller(tokens, i);
                if (matched >= 0) {
                    String filler = FILLER_LEXICON.get(matched);
                    counts.merge(filler, 1, Integer::sum);
                    detected.add(filler);
                    i += FILLER_TOKENS.get(matched).size();
                } else {
                    i++;
                }
            }
        }

        int totalWords = transcript.wordCount();
        int fillerCount = counts.values().stream().mapToInt(Integer::intValue).sum();
        double percentage = totalWords > 0 ? (double) fillerCount / totalWords * 100 : 0.0;
        double perMinute = totalDurationSeconds > 0 ? fillerCount / (totalDurationSeconds / 60.0) : 0.0;

        Map<String, Integer> ordered = new LinkedHashMap<>();
        String mostCommon = null;
        int best = 0;
        for (String filler : FILLER_LEXICON) {
            Integer count = counts.get(filler);
            if (count == null) {
                continue;
            }
            ordered.put(filler, count);
            if (count > best) {
                best = count;
                mostCommon = filler;
            }
        }

        return new FillerAnalysis(totalWords, fillerCount, percentage, new ArrayList<>(detected), ordered,
                mostCommon, perMinute, ProfessionalismGrade.fromFillerPercentage(percentage));
    }

    ConfidenceMetrics confidenceMetrics(TranscriptCollection transcript, SpeechMetrics speech, FillerAnalysis filler) {
        double[] confidences = transcript.segments().stream()
                .filter(s -> s.confidence() != null)
                .mapToDouble(TranscriptSegment::confidence)
                .toArray();

        double confidence;
        if (confidences.length > 0) {
            double sum = 0.0;
            for (double c : confidences) {
                sum += c;
            }
            confidence = sum / confidences.length;
        } else {
            confidence = Math.max(0.3, 1.0 - 2.0 * (filler.fillerPercentage() / 100.0));
        }

        double stability = 0.5;
        if (confidences.length >= 2) {
            double mean = 0.0;
            for (double c : confidences) {
                mean += c;
            }
            mean /= confidences.length;
            double variance = 0.0;
            for (double c : confidences) {
                variance += (c - mean) * (c - mean);
            }
            double stddev = Math.sqrt(variance / confidences.length);
            stability = clamp(1.0 - 2.0 * stddev, 0.0, 1.0);
        }

        EnergyLevel energy = EnergyLevel.fromWordsPerMinute(speech.wordsPerMinute());
        double paceConsistency = speech.pacingConsistency();
        double readiness = confidence * 0.4 + energy.score() * 0.3 + stability * 0.2 + paceConsistency * 0.1;
        return new ConfidenceMetrics(confidence, energy, stability, paceConsistency, readiness);
    }

    double deliveryScore(SpeechMetrics speech, FillerAnalysis filler, ConfidenceMetrics confidence) {
        double pace = speech.speakingRate() == SpeakingRate.APPROPRIATE ? 1.0 : 0.7;
        double blended = pace * PACE_WEIGHT
                + speech.pauseEffectiveness() * PAUSE_WEIGHT
                + filler.professionalismScore() * FILLER_WEIGHT
                + confidence.readiness() * READINESS_WEIGHT;
        double scaled = BigDecimal.valueOf(blended * AudioIntelligenceReport.MAX_DELIVERY_SCORE)
                .setScale(1, RoundingMode.HALF_UP)
                .doubleValue();
        return clamp(scaled, 0.0, AudioIntelligenceReport.MAX_DELIVERY_SCORE);
    }

    private List<String> strengths(SpeechMetrics speech, FillerAnalysis filler, ConfidenceMetrics confidence,
                                   String sentiment) {
        List<String> strengths = new ArrayList<>();
        if (speech.speakingRate() == SpeakingRate.APPROPRIATE) {
            strengths.add(format("Excellent pacing at %.0f WPM", speech.wordsPerMinute()));
        }
        if (filler.fillerPercentage() <= 2.0) {
            strengths.add(format("Professional delivery with only %.1f%% filler words", filler.fillerPercentage()));
        }
        if (confidence.confidenceScore() >= 0.8) {
            strengths.add("High vocal confidence and presentation energy");
        }
        if (speech.pauseEffectiveness() >= 0.8) {
            strengths.add("Effective use of strategic pauses for emphasis");
        }
        if ("positive".equals(sentiment)) {
            strengths.add("Positive overall tone throughout the presentation");
        }
        if (strengths.isEmpty()) {
            strengths.add("Completed full presentation delivery");
        }
        return strengths;
    }

    private List<String> improvementAreas(SpeechMetrics speech, FillerAnalysis filler, ConfidenceMetrics confidence) {
        List<String> areas = new ArrayList<>();
        if (speech.speakingRate() == SpeakingRate.TOO_SLOW) {
            areas.add(format("Speaking pace below target range (%.0f WPM)", speech.wordsPerMinute()));
        } else if (speech.speakingRate() == SpeakingRate.TOO_FAST) {
            areas.add(format("Speaking pace above target range (%.0f WPM)", speech.wordsPerMinute()));
        }
        if (filler.fillerPercentage() > 2.5) {
            areas.add(format("Filler word control (%.1f%% of words)", filler.fillerPercentage()));
        }
        if (confidence.confidenceScore() < 0.7) {
            areas.add("Vocal confidence and stability");
        }
        if (speech.pauseEffectiveness() < 0.7) {
            areas.add("Strategic use of pauses");
        }
        return areas;
    }

    private List<String> coaching(SpeechMetrics speech, FillerAnalysis filler, ConfidenceMetrics confidence,
                                  String sentiment) {
        List<String> insights = new ArrayList<>();
        if (speech.speakingRate() == SpeakingRate.TOO_SLOW) {
            insights.add(format("Increase speaking pace from %.0f to 140-160 WPM for better engagement",
                    speech.wordsPerMinute()));
        } else if (speech.speakingRate() == SpeakingRate.TOO_FAST) {
            insights.add(format("Slow down from %.0f to 140-160 WPM for better comprehension",
                    speech.wordsPerMinute()));
        }
        if (filler.fillerPercentage() > 3.0) {
            insights.add(format("Reduce filler words from %.1f%% to under 2%% (practice with pauses instead)",
                    filler.fillerPercentage()));
        }
        if (confidence.confidenceScore() < 0.7) {
            insights.add("Practice delivery to improve vocal confidence and stability");
        }
        if (speech.pauseEffectiveness() < 0.7) {
            insights.add("Use more strategic pauses for emphasis and audience engagement");
        }
        if ("negative".equals(sentiment)) {
            insights.add("Reframe challenges around outcomes to lift the overall tone of the pitch");
        }
        return insights;
    }

    private static int matchFiller(List<String> tokens, int from) {
        int bestIndex = -1;
        int bestLength = 0;
        for (int f = 0; f < FILLER_TOKENS.size(); f++) {
            List<String> filler = FILLER_TOKENS.get(f);
            if (filler.size() > bestLength && from + filler.size() <= tokens.size()
                    && tokens.subList(from, from + filler.size()).equals(filler)) {
                bestIndex = f;
                bestLength = filler.size();
            }
        }
        return bestIndex;
    }

    static double pauseEffectiveness(double totalDuration, double pauseDuration) {
        if (totalDuration == 0) {
            return 0.0;
        }
        double pct = pauseDuration / totalDuration * 100;
        if (pct >= 10 && pct <= 20) {
            return 1.0;
        }
        if ((pct >= 5 && pct < 10) || (pct > 20 && pct <= 30)) {
            return 0.7;
        }
        return 0.4;
    }

    static double pacingConsistency(double totalDuration, double speakingDuration) {
        if (totalDuration == 0) {
            return 0.0;
        }
        double pct = speakingDuration / totalDuration * 100;
        if (pct >= 75 && pct <= 85) {
            return 1.0;
        }
        if ((pct >= 65 && pct < 75) || (pct > 85 && pct <= 90)) {
            return 0.8;
        }
        return 0.5;
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    private static String format(String pattern, double value) {
        return String.format(Locale.ROOT, pattern, value);
    }

    public int getTargetWpm() {
        return targetWpm;
    }
}
