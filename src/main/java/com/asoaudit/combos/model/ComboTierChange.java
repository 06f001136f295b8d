package com.asoaudit.combos.model;

/**
 * A combo present in both baseline and draft whose coarse tier rank changed.
 *
 * @param improvement {@code baselineRank - draftRank}; positive means the draft is stronger
 */
public record ComboTierChange(String text,
                              int baselineRank,
                              int draftRank,
                              StrengthTier baselineTier,
                              StrengthTier draftTier,
                              int baselineScore,
                              int draftScore,
                              int improvement) {
}
