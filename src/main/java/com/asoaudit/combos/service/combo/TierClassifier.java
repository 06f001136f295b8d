package com.asoaudit.combos.service.combo;

import com.asoaudit.combos.model.ComboSource;
import com.asoaudit.combos.model.StrengthTier;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;

/**
 * Assigns a {@link StrengthTier} to a word list.
 *
 * <p>Every word is attributed to exactly one element with priority title, subtitle,
 * keyword pool; since the pool already excludes title and subtitle words, the
 * attribution is a partition and the rules below are mutually exclusive:
 * <ol>
 *   <li>any unattributed word: MISSING</li>
 *   <li>all title: TITLE_CONSECUTIVE when adjacent in some order, else TITLE_NON_CONSECUTIVE</li>
 *   <li>title and pool only: TITLE_KEYWORDS_CROSS</li>
 *   <li>title and subtitle only: CROSS_ELEMENT</li>
 *   <li>all pool: KEYWORDS_CONSECUTIVE / KEYWORDS_NON_CONSECUTIVE</li>
 *   <li>all subtitle: SUBTITLE_CONSECUTIVE / SUBTITLE_NON_CONSECUTIVE</li>
 *   <li>subtitle and pool only: KEYWORDS_SUBTITLE_CROSS</li>
 *   <li>all three: THREE_WAY_CROSS</li>
 * </ol>
 *
 * <p>Adjacency is measured on stopword-filtered positions, so "learn spanish" is
 * consecutive in "Learn the Spanish". The incoming word order carries no meaning:
 * every arrangement is tried, and an adjacent one becomes the order of
 * {@link TierResult#keywords()}. Otherwise the incoming order is kept.
 */
public class TierClassifier {

    public TierResult classify(List<String> keywords, ElementTokens elements) {
        List<String> words = new ArrayList<>(keywords.size());
        for (String k : keywords) words.add(k.toLowerCase(Locale.ROOT));

        List<String> titleWords = new ArrayList<>();
        List<String> subtitleWords = new ArrayList<>();
        List<String> poolWords = new ArrayList<>();
        for (String w : words) {
            if (elements.inTitle(w)) titleWords.add(w);
            else if (elements.inSubtitle(w)) subtitleWords.add(w);
            else if (elements.inPool(w)) poolWords.add(w);
            else return new TierResult(words, StrengthTier.MISSING, ComboSource.MISSING, null);
        }

        boolean t = !titleWords.isEmpty();
        boolean s = !subtitleWords.isEmpty();
        boolean k = !poolWords.isEmpty();

        if (t && !s && !k) {
            ComboSource source = allInSubtitle(words, elements) ? ComboSource.BOTH : ComboSource.TITLE;
            List<String> adjacent = adjacentOrder(words, elements::consecutiveInTitle);
            if (adjacent != null) {
                return new TierResult(adjacent, StrengthTier.TITLE_CONSECUTIVE, source, null);
            }
            return new TierResult(words, StrengthTier.TITLE_NON_CONSECUTIVE, source,
                    "Place these words next to each other in the title");
        }
        if (t && k && !s) {
            return new TierResult(words, StrengthTier.TITLE_KEYWORDS_CROSS, ComboSource.CROSS,
                    "Add " + quote(poolWords) + " to the title next to " + quote(titleWords));
        }
        if (t && s && !k) {
            return new TierResult(words, StrengthTier.CROSS_ELEMENT, ComboSource.CROSS,
                    "Move the subtitle word(s) " + quote(subtitleWords) + " into the title");
        }
        if (!t && !s) {
            List<String> adjacent = adjacentOrder(words, elements::consecutiveInPool);
            if (adjacent != null) {
                return new TierResult(adjacent, StrengthTier.KEYWORDS_CONSECUTIVE, ComboSource.KEYWORDS,
                        "Move this phrase from the keyword field into the title");
            }
            return new TierResult(words, StrengthTier.KEYWORDS_NON_CONSECUTIVE, ComboSource.KEYWORDS,
                    "Place these words together in the title");
        }
        if (!t && !k) {
            List<String> adjacent = adjacentOrder(words, elements::consecutiveInSubtitle);
            if (adjacent != null) {
                return new TierResult(adjacent, StrengthTier.SUBTITLE_CONSECUTIVE, ComboSource.SUBTITLE,
                        "Move this phrase from the subtitle into the title");
            }
            return new TierResult(words, StrengthTier.SUBTITLE_NON_CONSECUTIVE, ComboSource.SUBTITLE,
                    "Place these words next to each other in the subtitle or move them into the title");
        }
        if (!t) {
            return new TierResult(words, StrengthTier.KEYWORDS_SUBTITLE_CROSS, ComboSource.CROSS,
                    "Move " + quote(poolWords) + " from the keyword field next to " + quote(subtitleWords));
        }
        return new TierResult(words, StrengthTier.THREE_WAY_CROSS, ComboSource.CROSS,
                "Consolidate all words into the title");
    }

    /**
     * First arrangement of {@code words} accepted by {@code consecutive}, trying the
     * given order first; {@code null} when none is adjacent. Combos have at most four
     * words, so at most 24 arrangements are tried.
     */
    static List<String> adjacentOrder(List<String> words, Predicate<List<String>> consecutive) {
        return permute(new ArrayList<>(words), 0, consecutive);
    }

    private static List<String> permute(List<String> words, int from, Predicate<List<String>> consecutive) {
        if (from == words.size()) {
            return consecutive.test(words) ? List.copyOf(words) : null;
        }
        for (int i = from; i < words.size(); i++) {
            swap(words, from, i);
            List<String> found = permute(words, from + 1, consecutive);
            swap(words, from, i);
            if (found != null) return found;
        }
        return null;
    }

    private static void swap(List<String> words, int i, int j) {
        String w = words.get(i);
        words.set(i, words.get(j));
        words.set(j, w);
    }

    private static boolean allInSubtitle(List<String> words, ElementTokens elements) {
        for (String w : words) {
            if (!elements.inSubtitle(w)) return false;
        }
        return true;
    }

    private static String quote(List<String> words) {
        return "'" + String.join(" ", words) + "'";
    }
}
