package com.asoaudit.combos.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Metadata element a token was extracted from.
 */
public enum TokenSource {
    TITLE("title"),
    SUBTITLE("subtitle"),
    /** App Store keyword field (the generic keyword pool). */
    KEYWORDS("keywords");

    private final String wireName;

    TokenSource(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
