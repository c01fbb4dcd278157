package com.pitchscope.service.stt.streaming;

import java.util.Set;

/**
 * Kinds of message the provider sends on the realtime channel.
 */
public enum MessageKind {
    TRANSCRIPT,
    SESSION_ENDS,
    ERROR,
    FEATURE_ANNOTATION,
    UNKNOWN;

    private static final Set<String> ANNOTATION_TYPES = Set.of(
            "sentiment_analysis",
            "named_entity_recognition",
            "post_summarization",
            "post_chapterization",
            "post_final_transcript",
            "post_transcript",
            "speech_start",
            "speech_end",
            "translation",
            "start_session",
            "start_recording",
            "end_recording",
            "audio_chunk",
            "stop_recording");

    /**
     * Maps a wire {@code type} value to its kind; anything unrecognized is {@link #UNKNOWN}.
     */
    public static MessageKind fromWireType(String type) {
        if (type == null) {
            return UNKNOWN;
        }
        switch (type) {
            case "transcript":
                return TRANSCRIPT;
            case "session_ends":
            case "end_session":
                return SESSION_ENDS;
            case "error":
                return ERROR;
            default:
                return ANNOTATION_TYPES.contains(type) ? FEATURE_ANNOTATION : UNKNOWN;
        }
    }
}
