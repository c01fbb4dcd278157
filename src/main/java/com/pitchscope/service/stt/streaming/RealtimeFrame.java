package com.pitchscope.service.stt.streaming;

import java.util.Objects;

/**
 * Inbound event from a realtime connection: a text message, an orderly close, or a failure.
 *
 * @param type    frame kind
 * @param payload text payload for {@link Type#TEXT}, close reason otherwise (nullable)
 * @param failure transport error for {@link Type#FAILURE} (nullable)
 */
public record RealtimeFrame(Type type, String payload, Throwable failure) {

    public enum Type {
        TEXT,
        CLOSED,
        FAILURE
    }

    public RealtimeFrame {
        Objects.requireNonNull(type, "type");
    }

    public static RealtimeFrame text(String payload) {
        return new RealtimeFrame(Type.TEXT, Objects.requireNonNull(payload, "payload"), null);
    }

    public static RealtimeFrame closed(int code, String reason) {
        return new RealtimeFrame(Type.CLOSED, code + " " + (reason == null ? "" : reason), null);
    }

    public static RealtimeFrame failure(Throwable failure) {
        return new RealtimeFrame(Type.FAILURE, failure == null ? null : failure.getMessage(), failure);
    }
}
