package com.asoaudit.combos.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum BrandTag {
    BRAND("brand"),
    GENERIC("generic"),
    COMPETITOR("competitor");

    private final String wireName;

    BrandTag(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
