package com.mystery.analysis;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Crude lexical overlap between two pieces of text
 */
public final class TextOverlap {
    private static final Set<String> STOP_WORDS = Set.of(
        "the", "and", "that", "this", "with", "from", "have", "were", "what", "when", "where", "which",
        "your", "about", "there", "their", "they", "them", "then", "than", "been", "into", "just",
        "would", "could", "should", "does", "did", "was", "you", "for", "are", "but", "not", "who", "why", "how"
    );
    private static final int MIN_WORD_LENGTH = 4;
    private static final int MIN_SHARED_WORDS = 2;

    private TextOverlap() {
    }

    public static Set<String> significantWords(String text) {
        Set<String> words = new LinkedHashSet<>();
        if (text == null) {
            return words;
        }
        for (String raw : text.toLowerCase(Locale.ROOT).split("[^a-z0-9']+")) {
            String word = raw.replaceAll("^'+|'+$", "");
            if (word.length() >= MIN_WORD_LENGTH && !STOP_WORDS.contains(word)) {
                words.add(word);
            }
        }
        return words;
    }

    /**
     * True when the haystack contains the needle outright, or contains at least half of the needle's
     * significant words and at least two of them
     */
    public static boolean overlaps(String needle, String haystack) {
        if (needle == null || haystack == null) {
            return false;
        }
        String cleanNeedle = needle.trim().replaceAll("[?.!]+$", "").toLowerCase(Locale.ROOT);
        String lowerHaystack = haystack.toLowerCase(Locale.ROOT);
        if (!cleanNeedle.isEmpty() && lowerHaystack.contains(cleanNeedle)) {
            return true;
        }
        Set<String> needleWords = significantWords(needle);
        if (needleWords.size() < MIN_SHARED_WORDS) {
            return false;
        }
        Set<String> haystackWords = significantWords(haystack);
        int shared = 0;
        for (String word : needleWords) {
            if (haystackWords.contains(word)) {
                shared++;
            }
        }
        return shared >= MIN_SHARED_WORDS && shared * 2 >= needleWords.size();
    }
}
