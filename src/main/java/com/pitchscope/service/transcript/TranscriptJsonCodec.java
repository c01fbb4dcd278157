package com.pitchscope.service.transcript;

import com.pitchscope.domain.AudioConfiguration;
import com.pitchscope.domain.AudioEncoding;
import com.pitchscope.domain.TranscriptCollection;
import com.pitchscope.domain.TranscriptSegment;
import com.pitchscope.exception.ConfigurationException;
import com.pitchscope.exception.ProtocolException;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * org.json serialization for configurations and transcripts handed to storage collaborators.
 *
 * <p>Only source fields are written; derived values (full text, word count, duration) are
 * recomputed after reading.
 */
public final class TranscriptJsonCodec {

    private TranscriptJsonCodec() {}

    public static JSONObject toJson(AudioConfiguration config) {
        JSONObject json = new JSONObject();
        json.put("encoding", config.encoding().wireName());
        json.put("sample_rate", config.sampleRate());
        json.put("bit_depth", config.bitDepth());
        json.put("channels", config.channels());
        json.put("sentiment_analysis", config.sentimentAnalysis());
        json.put("emotion_analysis", config.emotionAnalysis());
        json.put("summarization", config.summarization());
        json.put("named_entity_recognition", config.entityExtraction());
        json.put("chapterization", config.chapterization());
        json.put("speaker_identification", config.speakerIdentification());
        json.put("translation", config.translation());
        if (config.targetLanguage() != null) {
            json.put("target_language", config.targetLanguage());
        }
        return json;
    }

    /**
     * Reads a configuration; missing fields take the default profile's values.
     *
     * @throws ConfigurationException if a value is out of range
     */
    public static AudioConfiguration configurationFromJson(JSONObject json) {
        return AudioConfiguration.builder()
                .encoding(AudioEncoding.fromWireName(json.optString("encoding", AudioEncoding.WAV_PCM.wireName())))
                .sampleRate(json.optInt("sample_rate", 16000))
                .bitDepth(json.optInt("bit_depth", 16))
                .channels(json.optInt("channels", 1))
                .sentimentAnalysis(json.optBoolean("sentiment_analysis", false))
                .emotionAnalysis(json.optBoolean("emotion_analysis", false))
                .summarization(json.optBoolean("summarization", false))
                .entityExtraction(json.optBoolean("named_entity_recognition", false))
                .chapterization(json.optBoolean("chapterization", false))
                .speakerIdentification(json.optBoolean("speaker_identification", false))
                .translation(json.optBoolean("translation", false))
                .targetLanguage(json.optString("target_language", null))
                .build();
    }

    public static JSONObject toJson(TranscriptCollection transcript) {
        JSONArray segments = new JSONArray();
        for (TranscriptSegment s : transcript.segments()) {
            JSONObject json = new JSONObject();
            json.put("id", s.id());
            json.put("text", s.text());
            json.put("start_time", s.startTime());
            json.put("end_time", s.endTime());
            json.put("language", s.language());
            if (s.channel() != null) {
                json.put("channel", s.channel().intValue());
            }
            if (s.confidence() != null) {
                json.put("confidence", s.confidence().doubleValue());
            }
            json.put("is_final", s.isFinal());
            segments.put(json);
        }
        JSONObject json = new JSONObject();
        json.put("segments", segments);
        json.put("created_at", transcript.createdAt().toString());
        return json;
    }

    /**
     * @throws ProtocolException if a segment is missing required fields or violates invariants
     */
    public static TranscriptCollection transcriptFromJson(JSONObject json) {
        try {
            JSONArray array = json.optJSONArray("segments");
            List<TranscriptSegment> segments = new ArrayList<>();
            if (array != null) {
                for (int i = 0; i < array.length(); i++) {
                    JSONObject s = array.getJSONObject(i);
                    segments.add(new TranscriptSegment(
                            s.getString("id"),
                            s.getString("text"),
                            s.getDouble("start_time"),
                            s.getDouble("end_time"),
                            s.optString("language", ""),
                            s.has("channel") ? s.getInt("channel") : null,
                            s.has("confidence") ? s.getDouble("confidence") : null,
                            s.optBoolean("is_final", false)));
                }
            }
            Instant createdAt = json.has("created_at") ? Instant.parse(json.getString("created_at")) : Instant.now();
            return new TranscriptCollection(segments, createdAt);
        } catch (JSONException | DateTimeParseException | IllegalArgumentException e) {
            throw new ProtocolException("Invalid transcript JSON: " + e.getMessage(), e);
        }
    }
}
