package com.pitchscope.service.intelligence;

import com.pitchscope.domain.IntelligenceAnnotations;
import com.pitchscope.domain.IntelligenceAnnotations.SentimentEntry;
import com.pitchscope.domain.TranscriptCollection;
import com.pitchscope.domain.TranscriptSegment;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.pitchscope.testutil.TestSegments.finalSegment;
import static com.pitchscope.testutil.TestSegments.onChannel;
import static com.pitchscope.testutil.TestSegments.words;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;
import static org.assertj.core.api.Assertions.within;

class AudioIntelligenceExtractorTest {

    private final AudioIntelligenceExtractor extractor = new AudioIntelligenceExtractor();

    @Test
    void shouldReportAppropriatePaceForOneHundredFiftyWordsPerMinute() {
        // Arrange: 300 words over 0-120s
        TranscriptCollection transcript = TranscriptCollection.of(List.of(
                finalSegment("a", words("word", 100), 0.0, 40.0),
                finalSegment("b", words("word", 100), 40.0, 80.0),
                finalSegment("c", words("word", 100), 80.0, 120.0)));

        // Act
        AudioIntelligenceReport report = extractor.extract(transcript);

        // Assert
        assertThat(report.speech().totalWords()).isEqualTo(300);
        assertThat(report.speech().totalDurationSeconds()).isCloseTo(120.0, within(1e-9));
        assertThat(report.speech().wordsPerMinute()).isCloseTo(150.0, within(1e-9));
        assertThat(report.speech().speakingRate()).isEqualTo(SpeakingRate.APPROPRIATE);
        assertThat(report.speech().pauseCount()).isZero();
        assertThat(report.strengths()).anyMatch(s -> s.contains("150 WPM"));
    }

    @Test
    void shouldGradeSixPercentFillersAsNeedsImprovement() {
        // Arrange: 94 plain words + 6 "um"
        String text = words("word", 94) + " " + words("um", 6);
        TranscriptCollection transcript = TranscriptCollection.of(List.of(finalSegment("a", text, 0.0, 60.0)));

        // Act
        FillerAnalysis filler = extractor.extract(transcript).filler();

        // Assert
        assertThat(filler.totalWords()).isEqualTo(100);
        assertThat(filler.fillerCount()).isEqualTo(6);
        assertThat(filler.fillerPercentage()).isCloseTo(6.0, within(1e-9));
        assertThat(filler.grade()).isEqualTo(ProfessionalismGrade.NEEDS_IMPROVEMENT);
        assertThat(filler.mostCommonFiller()).isEqualTo("um");
        assertThat(filler.fillersPerMinute()).isCloseTo(6.0, within(1e-9));
    }

    @Test
    void shouldMatchMultiWordFillersAndIgnorePunctuation() {
        TranscriptCollection transcript = TranscriptCollection.of(List.of(
                finalSegment("a", "So, you know, it's basically... Um, like, done.", 0.0, 10.0)));

        FillerAnalysis filler = extractor.extract(transcript).filler();

        assertThat(filler.fillerCounts()).containsExactly(
                entry("um", 1),
                entry("like", 1),
                entry("you know", 1),
                entry("basically", 1));
        assertThat(filler.detectedFillers()).containsExactly("you know", "basically", "um", "like");
    }

    @Test
    void identicalInputShouldYieldIdenticalReports() {
        TranscriptCollection transcript = TranscriptCollection.of(List.of(
                finalSegment("a", "we um grew revenue", 0.0, 2.0),
                finalSegment("b", "three times this year", 3.0, 5.0)));

        AudioIntelligenceReport first = extractor.extract(transcript);
        AudioIntelligenceReport second = extractor.extract(transcript);

        assertThat(first).isEqualTo(second);
    }

    @Test
    void emptyTranscriptShouldProduceZeroMetrics() {
        AudioIntelligenceReport report = extractor.extract(TranscriptCollection.empty());

        assertThat(report.speech().wordsPerMinute()).isZero();
        assertThat(report.speech().speakingRate()).isEqualTo(SpeakingRate.TOO_SLOW);
        assertThat(report.filler().fillerPercentage()).isZero();
        assertThat(report.filler().grade()).isEqualTo(ProfessionalismGrade.EXCELLENT);
        assertThat(report.deliveryScore()).isBetween(0.0, AudioIntelligenceReport.MAX_DELIVERY_SCORE);
    }

    @Test
    void shouldCountPausesBetweenSegments() {
        TranscriptCollection transcript = TranscriptCollection.of(List.of(
                finalSegment("a", "one two", 0.0, 4.0),
                finalSegment("b", "three four", 5.0, 9.0),
                finalSegment("c", "five six", 9.0, 10.0)));

        SpeechMetrics speech = extractor.extract(transcript).speech();

        assertThat(speech.pauseCount()).isEqualTo(1);
        assertThat(speech.pauseDurationSeconds()).isCloseTo(1.0, within(1e-9));
        assertThat(speech.pausePercentage()).isCloseTo(10.0, within(1e-9));
        assertThat(speech.pauseEffectiveness()).isEqualTo(1.0);
    }

    @Test
    void shouldFallBackToFillerHeuristicWithoutSegmentConfidence() {
        // 1 filler in 10 words = 10% -> 1.0 - 0.2
        TranscriptCollection transcript = TranscriptCollection.of(List.of(
                onChannel("a", "um " + words("word", 9), 0.0, 5.0, 0)));

        ConfidenceMetrics confidence = extractor.extract(transcript).confidence();

        assertThat(confidence.confidenceScore()).isCloseTo(0.8, within(1e-9));
        assertThat(confidence.vocalStability()).isEqualTo(0.5);
    }

    @Test
    void shouldAverageSegmentConfidences() {
        TranscriptCollection transcript = TranscriptCollection.of(List.of(
                new TranscriptSegment("a", "hello", 0, 1, "en", 0, 0.8, true),
                new TranscriptSegment("b", "there", 1, 2, "en", 0, 1.0, true)));

        ConfidenceMetrics confidence = extractor.extract(transcript).confidence();

        assertThat(confidence.confidenceScore()).isCloseTo(0.9, within(1e-9));
        // stddev 0.1 -> 1 - 0.2
        assertThat(confidence.vocalStability()).isCloseTo(0.8, within(1e-9));
    }

    @Test
    void shouldRoundDeliveryScoreToOneDecimal() {
        TranscriptCollection transcript = TranscriptCollection.of(List.of(
                finalSegment("a", words("word", 130), 0.0, 50.0),
                finalSegment("b", words("word", 20), 56.0, 60.0)));

        double score = extractor.extract(transcript).deliveryScore();

        assertThat(score * 10).isCloseTo(Math.rint(score * 10), within(1e-6));
        assertThat(score).isBetween(0.0, 25.0);
    }

    @Test
    void shouldSurfaceDominantSentimentFromAnnotations() {
        IntelligenceAnnotations annotations = new IntelligenceAnnotations(
                List.of(new SentimentEntry("great", "negative", "sad", 0, 1, 0),
                        new SentimentEntry("bad", "Negative", "sad", 1, 2, 0),
                        new SentimentEntry("fine", "positive", "happy", 2, 3, 0)),
                List.of(), List.of(), null);
        TranscriptCollection transcript = TranscriptCollection.of(List.of(finalSegment("a", "hello", 0, 3)));

        AudioIntelligenceReport report = extractor.extract(transcript, annotations);

        assertThat(report.sentiment()).contains("negative");
        assertThat(report.coaching()).anyMatch(s -> s.contains("tone"));
    }

    @Test
    void shouldClassifyPaceAgainstCustomTarget() {
        AudioIntelligenceExtractor slowTarget = new AudioIntelligenceExtractor(100);
        TranscriptCollection transcript = TranscriptCollection.of(List.of(
                finalSegment("a", words("word", 150), 0.0, 60.0)));

        assertThat(slowTarget.extract(transcript).speech().speakingRate()).isEqualTo(SpeakingRate.TOO_FAST);
        assertThat(extractor.extract(transcript).speech().speakingRate()).isEqualTo(SpeakingRate.APPROPRIATE);
    }

    @Test
    void shouldRejectNonPositiveTarget() {
        assertThatThrownBy(() -> new AudioIntelligenceExtractor(0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void gradeAndRateBoundariesShouldBeInclusive() {
        assertThat(ProfessionalismGrade.fromFillerPercentage(1.0)).isEqualTo(ProfessionalismGrade.EXCELLENT);
        assertThat(ProfessionalismGrade.fromFillerPercentage(2.5)).isEqualTo(ProfessionalismGrade.GOOD);
        assertThat(ProfessionalismGrade.fromFillerPercentage(5.0)).isEqualTo(ProfessionalismGrade.FAIR);
        assertThat(SpeakingRate.classify(120.0, 150)).isEqualTo(SpeakingRate.APPROPRIATE);
        assertThat(SpeakingRate.classify(180.0, 150)).isEqualTo(SpeakingRate.APPROPRIATE);
        assertThat(SpeakingRate.classify(119.9, 150)).isEqualTo(SpeakingRate.TOO_SLOW);
    }
}
