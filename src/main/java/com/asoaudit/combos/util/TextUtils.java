package com.asoaudit.combos.util;

import java.util.Locale;

/**
 * Utilities for normalizing short metadata strings (title, subtitle, keyword field)
 * before tokenization.
 *
 * <p>Normalization is intentionally conservative: it lowercases, normalizes
 * non-breaking spaces, and removes punctuation. Hyphens survive only between two
 * letters or digits ("step-by-step" stays one word, "- learn -" loses its dashes).
 */
public final class TextUtils {
    private TextUtils() {}

    /**
     * Returns the normalized form of the given text.
     *
     * <p>Rules applied in order:
     * <ol>
     *   <li>Convert non-breaking spaces to regular spaces</li>
     *   <li>Lowercase using {@link Locale#ROOT}</li>
     *   <li>Drop apostrophes so contractions stay one word ("don't" becomes "dont")</li>
     *   <li>Replace every other non letter/digit/hyphen character with a space</li>
     *   <li>Remove hyphens that are not between two letters or digits</li>
     *   <li>Collapse repeated whitespace and trim</li>
     * </ol>
     *
     * <p>{@code null} yields an empty string.
     */
    public static String normalize(String input) {
        if (input == null) return "";
        String s = input.replace('\u00A0', ' ');
        s = s.toLowerCase(Locale.ROOT);
        s = s.replaceAll("['\u2019`]", "");
        // Unicode dashes count as hyphens
        s = s.replaceAll("[\u2010\u2011\u2012\u2013\u2014]", "-");
        s = s.replaceAll("[^\\p{L}\\p{N}\\s-]", " ");
        s = s.replaceAll("(?<![\\p{L}\\p{N}])-+|-+(?![\\p{L}\\p{N}])", " ");
        s = s.replaceAll("\\s+", " ").trim();
        return s;
    }

    /**
     * Returns true when the text is null, empty or whitespace only (including
     * non-breaking spaces).
     */
    public static boolean isBlank(String input) {
        return input == null || input.replace('\u00A0', ' ').isBlank();
    }

    /** True when the word consists of digits only. */
    public static boolean isNumeric(String word) {
        if (word == null || word.isEmpty()) return false;
        for (int i = 0; i < word.length(); i++) {
            if (!Character.isDigit(word.charAt(i))) return false;
        }
        return true;
    }
}
