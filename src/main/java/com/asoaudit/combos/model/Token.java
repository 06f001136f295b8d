package com.asoaudit.combos.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A normalized word extracted from one metadata element.
 *
 * <p>{@code position} is zero-based within the filtered (stopword-free) sequence of
 * the element. Stopwords kept by diagnostic tokenization carry position {@code -1}.
 */
public final class Token {
    private final String text;
    private final TokenSource source;
    private final int position;
    private final boolean stopword;

    public Token(String text, TokenSource source, int position, boolean stopword) {
        this.text = Objects.requireNonNull(text, "text");
        this.source = Objects.requireNonNull(source, "source");
        this.position = position;
        this.stopword = stopword;
    }

    public String getText() { return text; }
    public TokenSource getSource() { return source; }
    public int getPosition() { return position; }

    @JsonProperty("isStopword")
    public boolean isStopword() { return stopword; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Token other)) return false;
        return position == other.position && stopword == other.stopword
                && text.equals(other.text) && source == other.source;
    }

    @Override
    public int hashCode() {
        return Objects.hash(text, source, position, stopword);
    }

    @Override
    public String toString() {
        return source.getWireName() + "#" + position + ":" + text;
    }
}
