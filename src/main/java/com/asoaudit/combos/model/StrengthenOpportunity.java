package com.asoaudit.combos.model;

/**
 * An existing combo that a metadata edit could move to a stronger tier.
 */
public record StrengthenOpportunity(String text, StrengthTier currentTier, int currentRank, String suggestion) {
}
