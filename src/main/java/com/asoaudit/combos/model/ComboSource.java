package com.asoaudit.combos.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Where a combo was found, or {@link #MISSING} when it does not exist.
 */
public enum ComboSource {
    TITLE("title"),
    SUBTITLE("subtitle"),
    KEYWORDS("keywords"),
    /** Title tier whose words are all present in the subtitle as well. */
    BOTH("both"),
    CROSS("cross"),
    MISSING("missing");

    private final String wireName;

    ComboSource(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
