package com.pitchscope.service.stt.streaming;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class MessageKindTest {

    @Test
    void shouldMapCoreWireTypes() {
        assertThat(MessageKind.fromWireType("transcript")).isEqualTo(MessageKind.TRANSCRIPT);
        assertThat(MessageKind.fromWireType("session_ends")).isEqualTo(MessageKind.SESSION_ENDS);
        assertThat(MessageKind.fromWireType("end_session")).isEqualTo(MessageKind.SESSION_ENDS);
        assertThat(MessageKind.fromWireType("error")).isEqualTo(MessageKind.ERROR);
    }

    @ParameterizedTest
    @ValueSource(strings = {"sentiment_analysis", "named_entity_recognition", "post_summarization",
            "post_chapterization", "speech_start", "speech_end", "translation", "start_recording"})
    void shouldClassifyAnnotationTypes(String type) {
        assertThat(MessageKind.fromWireType(type)).isEqualTo(MessageKind.FEATURE_ANNOTATION);
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "TRANSCRIPT", "acknowledgment", "keep_alive"})
    void shouldTreatAnythingElseAsUnknown(String type) {
        assertThat(MessageKind.fromWireType(type)).isEqualTo(MessageKind.UNKNOWN);
    }

    @Test
    void missingTypeShouldBeUnknown() {
        assertThat(MessageKind.fromWireType(null)).isEqualTo(MessageKind.UNKNOWN);
    }
}
