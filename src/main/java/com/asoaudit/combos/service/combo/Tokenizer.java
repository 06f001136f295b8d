package com.asoaudit.combos.service.combo;

import com.asoaudit.combos.model.Token;
import com.asoaudit.combos.model.TokenSource;
import com.asoaudit.combos.util.TextUtils;

import java.util.*;

/**
 * Splits a metadata element into ordered, source-tagged keyword tokens.
 *
 * <p>Text is normalized with {@link TextUtils#normalize(String)}, split on whitespace,
 * and stopwords plus words shorter than two characters are dropped. Positions are
 * assigned over the filtered sequence, so "learn spanish and french" gives
 * {@code spanish#1} and {@code french#2}.
 *
 * <p>Instances are immutable and safe to share between threads.
 */
public class Tokenizer {

    /** Articles, conjunctions, prepositions and auxiliaries that never form a keyword. */
    public static final Set<String> DEFAULT_STOPWORDS = Collections.unmodifiableSet(new LinkedHashSet<>(Arrays.asList(
        "a", "an", "the", "and", "or", "but", "nor", "&",
        "in", "on", "at", "to", "for", "of", "with", "by", "from", "as", "into", "via",
        "is", "was", "are", "be", "been", "have", "has", "had", "do", "does", "did",
        "will", "would", "should", "could", "may", "might", "can", "must", "shall",
        "your", "you", "our", "its"
    )));

    private static final int MIN_TOKEN_LENGTH = 2;

    private final Set<String> stopwords;

    public Tokenizer() {
        this(DEFAULT_STOPWORDS);
    }

    /**
     * @param stopwords words to drop; normalized to lowercase. {@code null} means the defaults.
     */
    public Tokenizer(Collection<String> stopwords) {
        if (stopwords == null) {
            this.stopwords = DEFAULT_STOPWORDS;
        } else {
            Set<String> s = new HashSet<>();
            for (String w : stopwords) {
                if (w == null) continue;
                String n = w.trim().toLowerCase(Locale.ROOT);
                if (!n.isEmpty()) s.add(n);
            }
            this.stopwords = Collections.unmodifiableSet(s);
        }
    }

    /**
     * Returns the keyword tokens of {@code text}; empty input yields an empty list.
     */
    public List<Token> tokenize(String text, TokenSource source) {
        List<Token> out = new ArrayList<>();
        int position = 0;
        for (String word : words(text)) {
            if (isDropped(word)) continue;
            out.add(new Token(word, source, position++, false));
        }
        return out;
    }

    /**
     * Like {@link #tokenize(String, TokenSource)} but keeps stopwords, flagged with
     * {@code isStopword = true} and position {@code -1}. Words shorter than two
     * characters are still dropped.
     */
    public List<Token> tokenizeAll(String text, TokenSource source) {
        List<Token> out = new ArrayList<>();
        int position = 0;
        for (String word : words(text)) {
            if (word.length() < MIN_TOKEN_LENGTH && !stopwords.contains(word)) continue;
            if (stopwords.contains(word)) {
                out.add(new Token(word, source, -1, true));
            } else {
                out.add(new Token(word, source, position++, false));
            }
        }
        return out;
    }

    /**
     * Tokenizes an App Store keyword field, where commas separate entries as well as
     * whitespace ("spanish,french lessons,audio").
     */
    public List<Token> parseKeywordField(String text) {
        if (text == null) return List.of();
        return tokenize(text.replace(',', ' '), TokenSource.KEYWORDS);
    }

    public boolean isStopword(String word) {
        return word != null && stopwords.contains(word.toLowerCase(Locale.ROOT));
    }

    public Set<String> getStopwords() {
        return stopwords;
    }

    private boolean isDropped(String word) {
        return word.length() < MIN_TOKEN_LENGTH || stopwords.contains(word);
    }

    private static String[] words(String text) {
        String normalized = TextUtils.normalize(text);
        if (normalized.isEmpty()) return new String[0];
        return normalized.split(" ");
    }
}
