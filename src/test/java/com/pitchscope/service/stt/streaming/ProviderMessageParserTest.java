package com.pitchscope.service.stt.streaming;

import com.pitchscope.domain.TranscriptSegment;
import com.pitchscope.exception.ProtocolException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProviderMessageParserTest {

    @Test
    void shouldParseFinalTranscript() {
        String raw = "{\"type\":\"transcript\",\"data\":{\"id\":\"00_00000001\",\"is_final\":true,"
                + "\"utterance\":{\"text\":\" Our market is huge \",\"start\":0.1,\"end\":1.9,"
                + "\"language\":\"en\",\"channel\":1,\"confidence\":0.93}}}";

        ProviderMessage message = ProviderMessageParser.parse(raw, 1);

        assertThat(message.kind()).isEqualTo(MessageKind.TRANSCRIPT);
        TranscriptSegment segment = message.transcriptSegment().orElseThrow();
        assertThat(segment.id()).isEqualTo("00_00000001");
        assertThat(segment.text()).isEqualTo("Our market is huge");
        assertThat(segment.startTime()).isEqualTo(0.1);
        assertThat(segment.endTime()).isEqualTo(1.9);
        assertThat(segment.channel()).isEqualTo(1);
        assertThat(segment.confidence()).isEqualTo(0.93);
        assertThat(segment.isFinal()).isTrue();
    }

    @Test
    void shouldNameUnnamedSegmentsBySequenceAndDefaultToInterim() {
        String raw = "{\"type\":\"transcript\",\"data\":{\"utterance\":{\"text\":\"hi\",\"start\":0,\"end\":1}}}";

        TranscriptSegment segment = ProviderMessageParser.parse(raw, 7).transcriptSegment().orElseThrow();

        assertThat(segment.id()).isEqualTo("stream-7");
        assertThat(segment.isFinal()).isFalse();
        assertThat(segment.channel()).isNull();
        assertThat(segment.confidence()).isNull();
    }

    @Test
    void emptyTranscriptShouldHaveNoSegment() {
        String raw = "{\"type\":\"transcript\",\"data\":{\"utterance\":{\"text\":\"\"}}}";

        ProviderMessage message = ProviderMessageParser.parse(raw, 1);

        assertThat(message.kind()).isEqualTo(MessageKind.TRANSCRIPT);
        assertThat(message.transcriptSegment()).isEmpty();
    }

    @Test
    void shouldExtractErrorMessageFromDataOrTopLevel() {
        assertThat(ProviderMessageParser.parse("{\"type\":\"error\",\"data\":{\"message\":\"bad key\"}}", 1)
                .errorMessage()).isEqualTo("bad key");
        assertThat(ProviderMessageParser.parse("{\"type\":\"error\",\"message\":\"rate limited\"}", 1)
                .errorMessage()).isEqualTo("rate limited");
        assertThat(ProviderMessageParser.parse("{\"type\":\"error\"}", 1)
                .errorMessage()).isEqualTo("Unknown provider error");
    }

    @Test
    void unknownTypesShouldKeepTheirWireName() {
        ProviderMessage message = ProviderMessageParser.parse("{\"type\":\"something_new\",\"data\":{}}", 1);

        assertThat(message.kind()).isEqualTo(MessageKind.UNKNOWN);
        assertThat(message.wireType()).isEqualTo("something_new");
    }

    @Test
    void shouldRejectNonJsonAndEmptyPayloads() {
        assertThatThrownBy(() -> ProviderMessageParser.parse("<html>", 1)).isInstanceOf(ProtocolException.class);
        assertThatThrownBy(() -> ProviderMessageParser.parse(" ", 1)).isInstanceOf(ProtocolException.class);
    }

    @Test
    void shouldRejectTranscriptWithoutUtteranceOrWithBadTimes() {
        assertThatThrownBy(() -> ProviderMessageParser.parse("{\"type\":\"transcript\",\"data\":{}}", 1))
                .isInstanceOf(ProtocolException.class);
        String backwards = "{\"type\":\"transcript\",\"data\":{\"utterance\":"
                + "{\"text\":\"x\",\"start\":2.0,\"end\":1.0}}}";
        assertThatThrownBy(() -> ProviderMessageParser.parse(backwards, 1))
                .isInstanceOf(ProtocolException.class)
                .hasMessageContaining("Malformed utterance");
    }
}
