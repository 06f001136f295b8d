package com.asoaudit.combos.model;

import java.util.List;

/**
 * Differences between a baseline analysis and a draft analysis of edited metadata.
 */
public record ComboDiff(List<Combo> added,
                        List<Combo> removed,
                        List<ComboTierChange> tierUpgrades,
                        List<ComboTierChange> tierDowngrades,
                        List<Combo> unchanged,
                        TierDistribution tierDistribution,
                        List<KeywordImpact> keywordImpact,
                        int baselineCoveragePct,
                        int draftCoveragePct) {
}
