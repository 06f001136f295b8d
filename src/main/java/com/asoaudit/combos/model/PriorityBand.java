package com.asoaudit.combos.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Coarse bucket of a priority score, used by the dashboard filters.
 */
public enum PriorityBand {
    HIGH("high"),
    MEDIUM("medium"),
    LOW("low");

    private final String wireName;

    PriorityBand(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public static PriorityBand of(double score) {
        if (score >= 70) return HIGH;
        if (score >= 40) return MEDIUM;
        return LOW;
    }
}
