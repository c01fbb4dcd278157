package com.pitchscope.service.transcript;

import com.pitchscope.domain.AudioConfiguration;
import com.pitchscope.domain.TranscriptCollection;
import com.pitchscope.domain.TranscriptSegment;
import com.pitchscope.exception.ConfigurationException;
import com.pitchscope.exception.ProtocolException;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TranscriptJsonCodecTest {

    @Test
    void transcriptShouldSurviveSerialization() {
        // Arrange
        TranscriptCollection original = new TranscriptCollection(List.of(
                new TranscriptSegment("a", "hello", 0.0, 1.0, "en", 0, 0.9, true),
                new TranscriptSegment("b", "world", 1.0, 2.5, "", null, null, false)),
                Instant.parse("2024-06-01T12:00:00Z"));

        // Act
        TranscriptCollection restored = TranscriptJsonCodec.transcriptFromJson(
                new JSONObject(TranscriptJsonCodec.toJson(original).toString()));

        // Assert
        assertThat(restored).isEqualTo(original);
        assertThat(restored.fullText()).isEqualTo("hello world");
    }

    @Test
    void shouldOmitAbsentOptionalFields() {
        TranscriptCollection transcript = TranscriptCollection.of(List.of(
                new TranscriptSegment("a", "hi", 0, 1, "en", null, null, true)));

        JSONObject segment = TranscriptJsonCodec.toJson(transcript).getJSONArray("segments").getJSONObject(0);

        assertThat(segment.has("channel")).isFalse();
        assertThat(segment.has("confidence")).isFalse();
        assertThat(segment.getBoolean("is_final")).isTrue();
    }

    @Test
    void configurationShouldSurviveSerialization() {
        AudioConfiguration original = AudioConfiguration.builder()
                .sampleRate(44100)
                .channels(2)
                .summarization(true)
                .translation(true)
                .targetLanguage("de")
                .build();

        AudioConfiguration restored = TranscriptJsonCodec.configurationFromJson(TranscriptJsonCodec.toJson(original));

        assertThat(restored).isEqualTo(original);
    }

    @Test
    void missingConfigurationFieldsShouldUseDefaults() {
        assertThat(TranscriptJsonCodec.configurationFromJson(new JSONObject("{}")))
                .isEqualTo(AudioConfiguration.defaults());
    }

    @Test
    void invalidConfigurationShouldBeRejected() {
        assertThatThrownBy(() -> TranscriptJsonCodec.configurationFromJson(new JSONObject("{\"channels\":12}")))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void invalidSegmentShouldRaiseProtocolException() {
        JSONObject json = new JSONObject("{\"segments\":[{\"id\":\"a\",\"text\":\"x\",\"start_time\":3,\"end_time\":1}]}");

        assertThatThrownBy(() -> TranscriptJsonCodec.transcriptFromJson(json))
                .isInstanceOf(ProtocolException.class);
    }

    @Test
    void missingRequiredFieldShouldRaiseProtocolException() {
        JSONObject json = new JSONObject("{\"segments\":[{\"id\":\"a\",\"start_time\":0,\"end_time\":1}]}");

        assertThatThrownBy(() -> TranscriptJsonCodec.transcriptFromJson(json))
                .isInstanceOf(ProtocolException.class);
    }
}
