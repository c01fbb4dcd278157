package com.pitchscope.service.stt.streaming;

import com.pitchscope.domain.TranscriptSegment;
import com.pitchscope.exception.ProtocolException;
import org.json.JSONException;
import org.json.JSONObject;

/**
 * Parses realtime provider JSON into {@link ProviderMessage}s.
 *
 * <p>Transcript messages look like:
 * <pre>{@code
 * {"type":"transcript","data":{"id":"00_00000001","is_final":true,
 *   "utterance":{"text":"...","start":0.1,"end":1.9,"language":"en","channel":0,"confidence":0.93}}}
 * }</pre>
 * Errors carry {@code data.message} (or a top-level {@code message}).
 */
public final class ProviderMessageParser {

    private ProviderMessageParser() {}

    /**
     * Parses one text frame.
     *
     * @param raw      frame payload
     * @param sequence 1-based arrival index, used to name segments the provider left unnamed
     * @return classified message
     * @throws ProtocolException if the payload is not a JSON object or a transcript is malformed
     */
    public static ProviderMessage parse(String raw, int sequence) {
        if (raw == null || raw.isBlank()) {
            throw new ProtocolException("Empty realtime message");
        }
        JSONObject obj;
        try {
            obj = new JSONObject(raw);
        } catch (JSONException e) {
            throw new ProtocolException("Realtime message is not a JSON object", e);
        }

        String type = obj.optString("type", null);
        MessageKind kind = MessageKind.fromWireType(type);
        switch (kind) {
            case TRANSCRIPT:
                return parseTranscript(type, obj, sequence);
            case ERROR:
                return ProviderMessage.error(type, errorMessage(obj));
            default:
                return ProviderMessage.of(kind, type);
        }
    }

    private static ProviderMessage parseTranscript(String type, JSONObject obj, int sequence) {
        JSONObject data = obj.optJSONObject("data");
        if (data == null) {
            throw new ProtocolException("Transcript message without data");
        }
        JSONObject utterance = data.optJSONObject("utterance");
        if (utterance == null) {
            throw new ProtocolException("Transcript message without utterance");
        }
        String text = utterance.optString("text", "").trim();
        if (text.isEmpty()) {
            return ProviderMessage.transcript(type, null);
        }

        String id = data.optString("id", "");
        if (id.isBlank()) {
            id = "stream-" + sequence;
        }
        Integer channel = utterance.has("channel") && !utterance.isNull("channel")
                ? utterance.optInt("channel") : null;
        Double confidence = utterance.has("confidence") && !utterance.isNull("confidence")
                ? utterance.optDouble("confidence") : null;
        try {
            TranscriptSegment segment = new TranscriptSegment(
                    id,
                    text,
                    utterance.optDouble("start", 0.0),
                    utterance.optDouble("end", 0.0),
                    utterance.optString("language", ""),
                    channel,
                    confidence,
                    data.optBoolean("is_final", false));
            return ProviderMessage.transcript(type, segment);
        } catch (IllegalArgumentException e) {
            throw new ProtocolException("Malformed utterance in transcript " + id + ": " + e.getMessage(), e);
        }
    }

    private static String errorMessage(JSONObject obj) {
        JSONObject data = obj.optJSONObject("data");
        if (data != null && data.has("message")) {
            return data.optString("message");
        }
        JSONObject error = obj.optJSONObject("error");
        if (error != null && error.has("message")) {
            return error.optString("message");
        }
        return obj.optString("message", "Unknown provider error");
    }
}
