package com.asoaudit.combos.model;

import java.util.List;

/**
 * Effect of adding or removing one keyword between two analyses.
 *
 * @param change       "added" or "removed"
 * @param comboCount   combos containing the keyword in the analysis that has it
 * @param avgTierRank  mean coarse rank of those combos, one decimal
 * @param sampleCombos up to three combo texts
 */
public record KeywordImpact(String keyword, String change, int comboCount, double avgTierRank, List<String> sampleCombos) {
}
