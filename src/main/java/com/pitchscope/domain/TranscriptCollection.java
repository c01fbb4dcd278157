package com.pitchscope.domain;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Immutable, start-time ordered sequence of transcript segments.
 *
 * <p>Every operation returns a new collection; the receiver is never modified. Segments with
 * equal start times keep their relative insertion order.
 *
 * @param segments  segments sorted by start time
 * @param createdAt when the collection was first created
 */
public record TranscriptCollection(List<TranscriptSegment> segments, Instant createdAt) {

    private static final Comparator<TranscriptSegment> BY_START =
            Comparator.comparingDouble(TranscriptSegment::startTime);

    public TranscriptCollection {
        Objects.requireNonNull(createdAt, "createdAt must not be null");
        List<TranscriptSegment> sorted = new ArrayList<>(segments == null ? List.of() : segments);
        sorted.forEach(s -> Objects.requireNonNull(s, "segment must not be null"));
        sorted.sort(BY_START);
        segments = List.copyOf(sorted);
    }

    public static TranscriptCollection empty() {
        return new TranscriptCollection(List.of(), Instant.now());
    }

    public static TranscriptCollection of(List<TranscriptSegment> segments) {
        return new TranscriptCollection(segments, Instant.now());
    }

    public TranscriptCollection addSegment(TranscriptSegment segment) {
        Objects.requireNonNull(segment, "segment must not be null");
        List<TranscriptSegment> next = new ArrayList<>(segments);
        next.add(segment);
        return new TranscriptCollection(next, createdAt);
    }

    public TranscriptCollection finalsOnly() {
        return filter(TranscriptSegment::isFinal);
    }

    public TranscriptCollection byChannel(int channel) {
        return filter(s -> s.channel() != null && s.channel() == channel);
    }

    /**
     * Returns a collection with the segments of both, re-sorted by start time. The earlier
     * creation timestamp is kept.
     */
    public TranscriptCollection merge(TranscriptCollection other) {
        Objects.requireNonNull(other, "other must not be null");
        List<TranscriptSegment> next = new ArrayList<>(segments);
        next.addAll(other.segments);
        Instant created = createdAt.isBefore(other.createdAt) ? createdAt : other.createdAt;
        return new TranscriptCollection(next, created);
    }

    public boolean isEmpty() {
        return segments.isEmpty();
    }

    public int size() {
        return segments.size();
    }

    public boolean hasFinalSegments() {
        return segments.stream().anyMatch(TranscriptSegment::isFinal);
    }

    /** Max end minus min start, in seconds; 0 when empty. */
    public double totalDuration() {
        if (segments.isEmpty()) {
            return 0.0;
        }
        double minStart = segments.stream().mapToDouble(TranscriptSegment::startTime).min().orElse(0.0);
        double maxEnd = segments.stream().mapToDouble(TranscriptSegment::endTime).max().orElse(0.0);
        return maxEnd - minStart;
    }

    public int wordCount() {
        return segments.stream().mapToInt(TranscriptSegment::wordCount).sum();
    }

    public String fullText() {
        return segments.stream().map(s -> s.text().trim()).collect(Collectors.joining(" "));
    }

    /** Distinct channel indices present, ascending. */
    public Set<Integer> channels() {
        Set<Integer> channels = new TreeSet<>();
        for (TranscriptSegment s : segments) {
            if (s.channel() != null) {
                channels.add(s.channel());
            }
        }
        return channels;
    }

    private TranscriptCollection filter(Predicate<TranscriptSegment> predicate) {
        return new TranscriptCollection(segments.stream().filter(predicate).toList(), createdAt);
    }
}
