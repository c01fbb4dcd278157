package com.pitchscope.util;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Utility for splitting transcript text into words and normalized tokens.
 *
 * <p>Two views are offered:
 * <ul>
 *   <li>{@link #countWords(String)} - whitespace-delimited words, the basis for pace and
 *       percentage metrics</li>
 *   <li>{@link #tokenize(String)} - lowercase alphabetic tokens (apostrophes kept), used for
 *       lexicon matching</li>
 * </ul>
 */
public final class TokenizerUtil {

    private TokenizerUtil() {
        // Prevent instantiation
    }

    /**
     * Counts whitespace-delimited words.
     *
     * @param text input text (may be null or blank)
     * @return number of words, 0 for null or blank text
     */
    public static int countWords(String text) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        return text.trim().split("\\s+").length;
    }

    /**
     * Tokenizes text into normalized tokens.
     *
     * @param text input text to tokenize (may be null or blank)
     * @return immutable list of lowercase tokens (empty if no valid tokens)
     */
    public static List<String> tokenize(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        String[] parts = text.toLowerCase(Locale.ROOT).split("[^\\p{Alpha}']+");
        List<String> tokens = new ArrayList<>();
        for (String part : parts) {
            String token = stripApostrophes(part);
            if (!token.isBlank()) {
                tokens.add(token);
            }
        }
        return List.copyOf(tokens);
    }

    private static String stripApostrophes(String part) {
        int start = 0;
        int end = part.length();
        while (start < end && part.charAt(start) == '\'') {
            start++;
        }
        while (end > start && part.charAt(end - 1) == '\'') {
            end--;
        }
        return part.substring(start, end);
    }
}
