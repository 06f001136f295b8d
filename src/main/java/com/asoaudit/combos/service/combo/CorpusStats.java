package com.asoaudit.combos.service.combo;

import com.asoaudit.combos.model.Token;

import java.util.*;

/**
 * Raw word frequencies across title, subtitle and the full keyword field.
 */
public final class CorpusStats {
    private final Map<String, Integer> frequency;
    private final int maxFrequency;

    private CorpusStats(Map<String, Integer> frequency) {
        this.frequency = Collections.unmodifiableMap(frequency);
        int max = 0;
        for (int f : frequency.values()) max = Math.max(max, f);
        this.maxFrequency = max;
    }

    public static CorpusStats of(ElementTokens elements) {
        Map<String, Integer> freq = new LinkedHashMap<>();
        count(freq, elements.getTitleTokens());
        count(freq, elements.getSubtitleTokens());
        count(freq, elements.getRawKeywordTokens());
        return new CorpusStats(freq);
    }

    private static void count(Map<String, Integer> freq, List<Token> tokens) {
        for (Token t : tokens) {
            if (t.isStopword()) continue;
            freq.merge(t.getText(), 1, Integer::sum);
        }
    }

    public int frequency(String word) {
        return frequency.getOrDefault(word, 0);
    }

    public int getMaxFrequency() { return maxFrequency; }

    /** Mean frequency of the words divided by the corpus maximum; 0 for an empty corpus. */
    public double frequencyNorm(List<String> words) {
        if (maxFrequency == 0 || words.isEmpty()) return 0.0;
        double sum = 0;
        for (String w : words) sum += frequency(w);
        return (sum / words.size()) / maxFrequency;
    }
}
