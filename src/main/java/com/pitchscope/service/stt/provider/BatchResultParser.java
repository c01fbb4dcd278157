package com.pitchscope.service.stt.provider;

import com.pitchscope.domain.IntelligenceAnnotations;
import com.pitchscope.domain.IntelligenceAnnotations.Chapter;
import com.pitchscope.domain.IntelligenceAnnotations.NamedEntity;
import com.pitchscope.domain.IntelligenceAnnotations.SentimentEntry;
import com.pitchscope.domain.TranscriptSegment;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts a completed batch job body into final segments and annotations.
 *
 * <p>Utterances are read from {@code result.transcription.utterances}, falling back to the older
 * {@code result.utterances} and {@code prediction.utterances} layouts. Utterances with blank text
 * or inconsistent timings are skipped. Segment ids are {@code batch-1}, {@code batch-2}, ... in
 * provider order.
 */
final class BatchResultParser {

    private static final Logger LOG = LogManager.getLogger(BatchResultParser.class);

    private BatchResultParser() {}

    static BatchTranscript parse(JSONObject body) {
        JSONObject result = body.optJSONObject("result");
        return new BatchTranscript(segments(body, result), annotations(result));
    }

    private static List<TranscriptSegment> segments(JSONObject body, JSONObject result) {
        JSONArray utterances = null;
        if (result != null) {
            JSONObject transcription = result.optJSONObject("transcription");
            if (transcription != null) {
                utterances = transcription.optJSONArray("utterances");
            }
            if (utterances == null) {
                utterances = result.optJSONArray("utterances");
            }
        }
        if (utterances == null) {
            JSONObject prediction = body.optJSONObject("prediction");
            if (prediction != null) {
                utterances = prediction.optJSONArray("utterances");
            }
        }
        if (utterances == null) {
            return List.of();
        }

        List<TranscriptSegment> segments = new ArrayList<>();
        for (int i = 0; i < utterances.length(); i++) {
            JSONObject u = utterances.optJSONObject(i);
            if (u == null) {
                continue;
            }
            String text = u.optString("text", "").trim();
            if (text.isEmpty()) {
                continue;
            }
            Integer channel = u.has("channel") && !u.isNull("channel") ? u.optInt("channel") : null;
            Double confidence = u.has("confidence") && !u.isNull("confidence") ? u.optDouble("confidence") : null;
            try {
                segments.add(new TranscriptSegment(
                        "batch-" + (segments.size() + 1),
                        text,
                        u.optDouble("start", 0.0),
                        u.optDouble("end", 0.0),
                        u.optString("language", ""),
                        channel,
                        confidence,
                        true));
            } catch (IllegalArgumentException e) {
                LOG.warn("Skipping invalid batch utterance #{}: {}", i, e.getMessage());
            }
        }
        return segments;
    }

    private static IntelligenceAnnotations annotations(JSONObject result) {
        if (result == null) {
            return IntelligenceAnnotations.empty();
        }
        List<SentimentEntry> sentiments = new ArrayList<>();
        for (JSONObject r : results(result, "sentiment_analysis")) {
            sentiments.add(new SentimentEntry(
                    r.optString("text", ""),
                    r.optString("sentiment", null),
                    r.optString("emotion", null),
                    r.optDouble("start", 0.0),
                    r.optDouble("end", 0.0),
                    r.has("channel") && !r.isNull("channel") ? r.optInt("channel") : null));
        }

        List<NamedEntity> entities = new ArrayList<>();
        for (JSONObject r : results(result, "named_entity_recognition")) {
            entities.add(new NamedEntity(
                    r.optString("entity_type", r.optString("type", "")),
                    r.optString("text", ""),
                    r.optDouble("start", 0.0),
                    r.optDouble("end", 0.0)));
        }

        List<Chapter> chapters = new ArrayList<>();
        for (JSONObject r : results(result, "chapterization")) {
            chapters.add(new Chapter(
                    r.optString("headline", ""),
                    r.optString("summary", r.optString("abstractive_summary", "")),
                    r.optDouble("start", 0.0),
                    r.optDouble("end", 0.0)));
        }

        String summary = null;
        JSONObject summarization = result.optJSONObject("summarization");
        if (summarization != null && summarization.opt("results") instanceof String) {
            summary = summarization.optString("results");
        }
        return new IntelligenceAnnotations(sentiments, entities, chapters, summary);
    }

    private static List<JSONObject> results(JSONObject result, String feature) {
        JSONObject section = result.optJSONObject(feature);
        JSONArray array = section == null ? null : section.optJSONArray("results");
        if (array == null) {
            return List.of();
        }
        List<JSONObject> out = new ArrayList<>();
        for (int i = 0; i < array.length(); i++) {
            JSONObject item = array.optJSONObject(i);
            if (item != null) {
                out.add(item);
            }
        }
        return out;
    }
}
