package com.pitchscope.service.transcript;

import com.pitchscope.domain.TranscriptCollection;
import com.pitchscope.domain.TranscriptSegment;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Merges transcripts from the streaming and batch paths and derives read-only views.
 *
 * <p>Stateless: every method builds a new {@link TranscriptCollection} and leaves its inputs
 * untouched. Aggregates are recomputed on each call.
 */
public class TranscriptAssembler {

    /**
     * Concatenates the given collections and re-sorts by start time. When an id repeats, a final
     * segment replaces an interim one and otherwise the later occurrence wins. The earliest
     * creation timestamp is kept.
     */
    public TranscriptCollection merge(List<TranscriptCollection> collections) {
        Map<String, TranscriptSegment> byId = new LinkedHashMap<>();
        Instant createdAt = null;
        for (TranscriptCollection collection : collections) {
            if (collection == null) {
                continue;
            }
            if (createdAt == null || collection.createdAt().isBefore(createdAt)) {
                createdAt = collection.createdAt();
            }
            for (TranscriptSegment segment : collection.segments()) {
                TranscriptSegment existing = byId.get(segment.id());
                if (existing == null || segment.isFinal() || !existing.isFinal()) {
                    byId.put(segment.id(), segment);
                }
            }
        }
        return new TranscriptCollection(new ArrayList<>(byId.values()),
                createdAt == null ? Instant.now() : createdAt);
    }

    public TranscriptCollection merge(TranscriptCollection first, TranscriptCollection second) {
        List<TranscriptCollection> both = new ArrayList<>();
        both.add(first);
        both.add(second);
        return merge(both);
    }

    public TranscriptCollection finalsOnly(TranscriptCollection transcript) {
        return transcript.finalsOnly();
    }

    /**
     * One collection per channel present, keyed by channel index in ascending order. Segments
     * without a channel are not included.
     */
    public Map<Integer, TranscriptCollection> byChannel(TranscriptCollection transcript) {
        Map<Integer, TranscriptCollection> channels = new TreeMap<>();
        for (Integer channel : transcript.channels()) {
            channels.put(channel, transcript.byChannel(channel));
        }
        return channels;
    }

    /**
     * The view to analyze: final segments when any exist, otherwise everything received, so an
     * interim-only stream still yields metrics.
     */
    public TranscriptCollection analysisView(TranscriptCollection transcript) {
        return transcript.hasFinalSegments() ? transcript.finalsOnly() : transcript;
    }

    public TranscriptSummary summarize(TranscriptCollection transcript) {
        int finals = (int) transcript.segments().stream().filter(TranscriptSegment::isFinal).count();
        return new TranscriptSummary(
                transcript.fullText(),
                transcript.wordCount(),
                transcript.totalDuration(),
                transcript.size(),
                finals,
                transcript.channels());
    }
}
