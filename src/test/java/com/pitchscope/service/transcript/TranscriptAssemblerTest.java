package com.pitchscope.service.transcript;

import com.pitchscope.domain.TranscriptCollection;
import com.pitchscope.domain.TranscriptSegment;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static com.pitchscope.testutil.TestSegments.finalSegment;
import static com.pitchscope.testutil.TestSegments.interim;
import static com.pitchscope.testutil.TestSegments.onChannel;
import static org.assertj.core.api.Assertions.assertThat;

class TranscriptAssemblerTest {

    private final TranscriptAssembler assembler = new TranscriptAssembler();

    @Test
    void shouldMergeAndSortAcrossCollections() {
        // Arrange
        TranscriptCollection streaming = TranscriptCollection.of(List.of(
                finalSegment("s1", "opening", 0.0, 1.0),
                finalSegment("s3", "closing", 4.0, 5.0)));
        TranscriptCollection batch = TranscriptCollection.of(List.of(
                finalSegment("b1", "middle", 2.0, 3.0)));

        // Act
        TranscriptCollection merged = assembler.merge(streaming, batch);

        // Assert
        assertThat(merged.segments()).extracting(TranscriptSegment::id).containsExactly("s1", "b1", "s3");
        assertThat(streaming.size()).isEqualTo(2);
        assertThat(batch.size()).isEqualTo(1);
    }

    @Test
    void finalShouldReplaceInterimWithSameId() {
        TranscriptCollection first = TranscriptCollection.of(List.of(interim("u1", "we sel", 0.0, 1.0)));
        TranscriptCollection second = TranscriptCollection.of(List.of(finalSegment("u1", "we sell", 0.0, 1.2)));

        TranscriptCollection merged = assembler.merge(first, second);

        assertThat(merged.segments()).singleElement()
                .satisfies(s -> {
                    assertThat(s.text()).isEqualTo("we sell");
                    assertThat(s.isFinal()).isTrue();
                });
    }

    @Test
    void laterInterimShouldNotReplaceFinal() {
        TranscriptCollection first = TranscriptCollection.of(List.of(finalSegment("u1", "final words", 0.0, 1.0)));
        TranscriptCollection second = TranscriptCollection.of(List.of(interim("u1", "final wor", 0.0, 1.0)));

        TranscriptCollection merged = assembler.merge(first, second);

        assertThat(merged.segments()).singleElement()
                .satisfies(s -> assertThat(s.text()).isEqualTo("final words"));
    }

    @Test
    void laterOccurrenceShouldWinBetweenEqualFinality() {
        TranscriptCollection merged = assembler.merge(List.of(
                TranscriptCollection.of(List.of(interim("u1", "first draft", 0.0, 1.0))),
                TranscriptCollection.of(List.of(interim("u1", "second draft", 0.0, 1.0)))));

        assertThat(merged.fullText()).isEqualTo("second draft");
    }

    @Test
    void shouldKeepEarliestCreationTimeAndSkipNulls() {
        Instant early = Instant.parse("2024-03-01T09:00:00Z");
        Instant late = Instant.parse("2024-03-01T10:00:00Z");
        TranscriptCollection a = new TranscriptCollection(List.of(finalSegment("a", "x", 0, 1)), late);
        TranscriptCollection b = new TranscriptCollection(List.of(finalSegment("b", "y", 1, 2)), early);

        TranscriptCollection merged = assembler.merge(Arrays.asList(a, null, b));

        assertThat(merged.createdAt()).isEqualTo(early);
        assertThat(merged.size()).isEqualTo(2);
    }

    @Test
    void mergingNothingShouldYieldEmptyTranscript() {
        assertThat(assembler.merge(List.of()).isEmpty()).isTrue();
    }

    @Test
    void analysisViewShouldPreferFinals() {
        TranscriptCollection mixed = TranscriptCollection.of(List.of(
                finalSegment("a", "kept", 0, 1),
                interim("b", "dropped", 1, 2)));
        TranscriptCollection interimOnly = TranscriptCollection.of(List.of(interim("c", "partial", 0, 1)));

        assertThat(assembler.analysisView(mixed).segments()).extracting(TranscriptSegment::id).containsExactly("a");
        assertThat(assembler.analysisView(interimOnly).size()).isEqualTo(1);
    }

    @Test
    void shouldSplitByChannelInAscendingOrder() {
        TranscriptCollection transcript = TranscriptCollection.of(List.of(
                onChannel("a", "right one", 0, 1, 1),
                onChannel("b", "left one", 0.5, 1.5, 0),
                onChannel("c", "right two", 2, 3, 1)));

        Map<Integer, TranscriptCollection> channels = assembler.byChannel(transcript);

        assertThat(channels).containsOnlyKeys(0, 1);
        assertThat(channels.keySet()).containsExactly(0, 1);
        assertThat(channels.get(1).segments()).extracting(TranscriptSegment::id).containsExactly("a", "c");
    }

    @Test
    void summaryShouldReflectTranscriptAtCallTime() {
        TranscriptCollection transcript = TranscriptCollection.of(List.of(
                finalSegment("a", "hello world", 0, 2),
                interim("b", "again", 3, 4)));

        TranscriptSummary summary = assembler.summarize(transcript);

        assertThat(summary.fullText()).isEqualTo("hello world again");
        assertThat(summary.wordCount()).isEqualTo(3);
        assertThat(summary.totalDurationSeconds()).isEqualTo(4.0);
        assertThat(summary.segmentCount()).isEqualTo(2);
        assertThat(summary.finalSegmentCount()).isEqualTo(1);
        assertThat(summary.channels()).containsExactly(0);
        assertThat(assembler.finalsOnly(transcript).size()).isEqualTo(1);
    }
}
