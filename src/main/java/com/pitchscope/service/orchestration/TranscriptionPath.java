package com.pitchscope.service.orchestration;

import java.util.Locale;

/**
 * Which path produced the segments in a session's final transcript.
 */
public enum TranscriptionPath {
    STREAMING,
    BATCH,
    /** Neither path produced a segment. */
    NONE;

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
