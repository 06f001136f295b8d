package com.asoaudit.combos.service.combo;

import com.asoaudit.combos.model.Token;
import com.asoaudit.combos.model.TokenSource;

import java.util.*;

/**
 * Tokens of the three metadata elements with the derived word sets used by
 * classification.
 *
 * <p>The keyword pool holds keyword-field tokens whose word is in neither title nor
 * subtitle; pool tokens keep their keyword-field positions so adjacency in the
 * field is still visible.
 */
public final class ElementTokens {
    private final List<Token> titleTokens;
    private final List<Token> subtitleTokens;
    private final List<Token> poolTokens;
    private final List<Token> rawKeywordTokens;

    private final Map<String, List<Integer>> titlePositions;
    private final Map<String, List<Integer>> subtitlePositions;
    private final Map<String, List<Integer>> poolPositions;

    public ElementTokens(List<Token> titleTokens, List<Token> subtitleTokens, List<Token> keywordTokens) {
        this.titleTokens = List.copyOf(titleTokens != null ? titleTokens : List.of());
        this.subtitleTokens = List.copyOf(subtitleTokens != null ? subtitleTokens : List.of());
        this.rawKeywordTokens = List.copyOf(keywordTokens != null ? keywordTokens : List.of());
        this.titlePositions = positions(this.titleTokens);
        this.subtitlePositions = positions(this.subtitleTokens);

        List<Token> pool = new ArrayList<>();
        for (Token t : this.rawKeywordTokens) {
            if (titlePositions.containsKey(t.getText()) || subtitlePositions.containsKey(t.getText())) continue;
            pool.add(t);
        }
        this.poolTokens = List.copyOf(pool);
        this.poolPositions = positions(this.poolTokens);
    }

    public static ElementTokens of(List<Token> titleTokens, List<Token> subtitleTokens) {
        return new ElementTokens(titleTokens, subtitleTokens, List.of());
    }

    public List<Token> getTitleTokens() { return titleTokens; }
    public List<Token> getSubtitleTokens() { return subtitleTokens; }
    public List<Token> getPoolTokens() { return poolTokens; }

    /** Keyword-field tokens before removal of title and subtitle words. */
    public List<Token> getRawKeywordTokens() { return rawKeywordTokens; }

    public boolean inTitle(String word) { return titlePositions.containsKey(word); }
    public boolean inSubtitle(String word) { return subtitlePositions.containsKey(word); }
    public boolean inPool(String word) { return poolPositions.containsKey(word); }

    /** Distinct title words in title order. */
    public List<String> titleWords() { return new ArrayList<>(titlePositions.keySet()); }

    public List<String> subtitleWords() { return new ArrayList<>(subtitlePositions.keySet()); }

    public List<String> poolWords() { return new ArrayList<>(poolPositions.keySet()); }

    public boolean consecutiveInTitle(List<String> words) {
        return consecutive(words, titlePositions);
    }

    public boolean consecutiveInSubtitle(List<String> words) {
        return consecutive(words, subtitlePositions);
    }

    public boolean consecutiveInPool(List<String> words) {
        return consecutive(words, poolPositions);
    }

    /**
     * True when some occurrence of the first word at position {@code p} is followed by
     * the i-th word at {@code p + i} for every i.
     */
    static boolean consecutive(List<String> words, Map<String, List<Integer>> positions) {
        if (words.isEmpty()) return false;
        List<Integer> starts = positions.get(words.get(0));
        if (starts == null) return false;
        for (int start : starts) {
            boolean ok = true;
            for (int i = 1; i < words.size(); i++) {
                List<Integer> p = positions.get(words.get(i));
                if (p == null || !p.contains(start + i)) {
                    ok = false;
                    break;
                }
            }
            if (ok) return true;
        }
        return false;
    }

    private static Map<String, List<Integer>> positions(List<Token> tokens) {
        Map<String, List<Integer>> out = new LinkedHashMap<>();
        for (Token t : tokens) {
            if (t.isStopword()) continue;
            out.computeIfAbsent(t.getText(), k -> new ArrayList<>()).add(t.getPosition());
        }
        return out;
    }

    /** Tokens of one element. */
    public List<Token> tokens(TokenSource source) {
        switch (source) {
            case TITLE: return titleTokens;
            case SUBTITLE: return subtitleTokens;
            default: return poolTokens;
        }
    }
}
