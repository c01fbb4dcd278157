package com.pitchscope.domain;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Provider-supplied annotations that only the batch path returns.
 *
 * <p>Sentiments, entities and chapters are segment-scoped (they carry time offsets); the
 * summary is document-scoped.
 *
 * @param sentiments sentiment/emotion entries
 * @param entities   named entities
 * @param chapters   chapter breakdown
 * @param summary    document summary (nullable)
 */
public record IntelligenceAnnotations(
        List<SentimentEntry> sentiments,
        List<NamedEntity> entities,
        List<Chapter> chapters,
        String summary
) {

    private static final List<String> SENTIMENT_PRIORITY = List.of("positive", "neutral", "negative");

    public IntelligenceAnnotations {
        sentiments = sentiments == null ? List.of() : List.copyOf(sentiments);
        entities = entities == null ? List.of() : List.copyOf(entities);
        chapters = chapters == null ? List.of() : List.copyOf(chapters);
        summary = summary == null || summary.isBlank() ? null : summary;
    }

    public static IntelligenceAnnotations empty() {
        return new IntelligenceAnnotations(List.of(), List.of(), List.of(), null);
    }

    public boolean isEmpty() {
        return sentiments.isEmpty() && entities.isEmpty() && chapters.isEmpty() && summary == null;
    }

    public Optional<String> summaryText() {
        return Optional.ofNullable(summary);
    }

    /**
     * Most frequent sentiment label (lower-cased). Ties favour positive, then neutral, then
     * negative, then alphabetical order.
     */
    public Optional<String> dominantSentiment() {
        if (sentiments.isEmpty()) {
            return Optional.empty();
        }
        Map<String, Integer> counts = new HashMap<>();
        for (SentimentEntry entry : sentiments) {
            if (entry.sentiment() != null && !entry.sentiment().isBlank()) {
                counts.merge(entry.sentiment().toLowerCase(Locale.ROOT), 1, Integer::sum);
            }
        }
        return counts.entrySet().stream()
                .sorted((a, b) -> {
                    int byCount = Integer.compare(b.getValue(), a.getValue());
                    if (byCount != 0) {
                        return byCount;
                    }
                    int byPriority = Integer.compare(priority(a.getKey()), priority(b.getKey()));
                    return byPriority != 0 ? byPriority : a.getKey().compareTo(b.getKey());
                })
                .map(Map.Entry::getKey)
                .findFirst();
    }

    private static int priority(String sentiment) {
        int idx = SENTIMENT_PRIORITY.indexOf(sentiment);
        return idx < 0 ? SENTIMENT_PRIORITY.size() : idx;
    }

    /** Sentiment and emotion for a stretch of speech. */
    public record SentimentEntry(String text, String sentiment, String emotion,
                                 double start, double end, Integer channel) {
    }

    /** Named entity detected in the transcript. */
    public record NamedEntity(String type, String text, double start, double end) {
    }

    /** Chapter with headline and optional summary. */
    public record Chapter(String headline, String summary, double start, double end) {
    }
}
