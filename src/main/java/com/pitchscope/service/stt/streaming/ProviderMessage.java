package com.pitchscope.service.stt.streaming;

import com.pitchscope.domain.TranscriptSegment;

import java.util.Objects;
import java.util.Optional;

/**
 * A realtime provider message, classified once at the protocol boundary.
 *
 * <p>Only the field matching {@link #kind()} is populated: a {@code segment} for non-empty
 * {@link MessageKind#TRANSCRIPT} messages, an {@code errorMessage} for {@link MessageKind#ERROR}.
 * Empty transcripts keep kind TRANSCRIPT with no segment.
 *
 * @param kind         message kind
 * @param wireType     raw {@code type} value as sent by the provider (nullable)
 * @param segment      transcript segment (nullable)
 * @param errorMessage provider error text (nullable)
 */
public record ProviderMessage(MessageKind kind, String wireType, TranscriptSegment segment, String errorMessage) {

    public ProviderMessage {
        Objects.requireNonNull(kind, "kind");
    }

    public static ProviderMessage transcript(String wireType, TranscriptSegment segment) {
        return new ProviderMessage(MessageKind.TRANSCRIPT, wireType, segment, null);
    }

    public static ProviderMessage error(String wireType, String message) {
        return new ProviderMessage(MessageKind.ERROR, wireType, null, message);
    }

    public static ProviderMessage of(MessageKind kind, String wireType) {
        return new ProviderMessage(kind, wireType, null, null);
    }

    public Optional<TranscriptSegment> transcriptSegment() {
        return Optional.ofNullable(segment);
    }
}
