package com.asoaudit.combos.service.combo;

import com.asoaudit.combos.util.TextUtils;

import java.util.*;

/**
 * Estimates how much of a combo is filler.
 *
 * <p>A word is filler when it is a configured low-value term, purely numeric, or
 * shorter than three characters. The confidence is the filler ratio, raised to at
 * least 0.75 when no more than one word carries meaning.
 */
public class NoiseScorer {

    public static final List<String> DEFAULT_LOW_VALUE_TERMS = List.of(
        "app", "apps", "application", "best", "free", "new", "top", "get",
        "download", "more", "now", "pro", "plus", "online", "easy"
    );

    public static final double DEFAULT_THRESHOLD = 0.6;

    private static final double SINGLE_MEANINGFUL_FLOOR = 0.75;

    private final Set<String> lowValueTerms;
    private final double threshold;

    public NoiseScorer(Collection<String> lowValueTerms, double threshold) {
        Set<String> terms = new HashSet<>();
        for (String t : lowValueTerms != null ? lowValueTerms : DEFAULT_LOW_VALUE_TERMS) {
            if (t == null) continue;
            String n = t.trim().toLowerCase(Locale.ROOT);
            if (!n.isEmpty()) terms.add(n);
        }
        this.lowValueTerms = Collections.unmodifiableSet(terms);
        this.threshold = threshold;
    }

    public double confidence(List<String> keywords) {
        if (keywords.isEmpty()) return 1.0;
        int filler = 0;
        for (String w : keywords) {
            if (isFiller(w)) filler++;
        }
        double ratio = (double) filler / keywords.size();
        int meaningful = keywords.size() - filler;
        return meaningful <= 1 ? Math.max(ratio, SINGLE_MEANINGFUL_FLOOR) : ratio;
    }

    public boolean isNoise(double confidence) {
        return confidence >= threshold;
    }

    public boolean isFiller(String word) {
        return word.length() < 3 || TextUtils.isNumeric(word) || lowValueTerms.contains(word);
    }

    public double getThreshold() { return threshold; }
}
