package com.asoaudit.combos.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Complete, serializable result of one combo audit.
 *
 * <p>Contains no behavior; two analyses of the same input and configuration are equal
 * field by field, which makes the structure safe to cache and diff across edits.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ComboAnalysis {
    private final List<Combo> combos;
    private final BrandTypeStats statsByBrandType;
    private final KeywordCoverage keywordCoverage;
    private final List<Combo> recommendedToAdd;
    private final List<StrengthenOpportunity> strengthenOpportunities;
    private final List<AuditWarning> warnings;

    public ComboAnalysis(List<Combo> combos,
                         BrandTypeStats statsByBrandType,
                         KeywordCoverage keywordCoverage,
                         List<Combo> recommendedToAdd,
                         List<StrengthenOpportunity> strengthenOpportunities,
                         List<AuditWarning> warnings) {
        this.combos = List.copyOf(combos);
        this.statsByBrandType = statsByBrandType;
        this.keywordCoverage = keywordCoverage;
        this.recommendedToAdd = List.copyOf(recommendedToAdd);
        this.strengthenOpportunities = List.copyOf(strengthenOpportunities);
        this.warnings = List.copyOf(warnings);
    }

    public List<Combo> getCombos() { return combos; }

    /** Headline statistics; same object as {@code statsByBrandType.all}. */
    public CoverageStats getStats() { return statsByBrandType.all(); }

    public BrandTypeStats getStatsByBrandType() { return statsByBrandType; }
    public KeywordCoverage getKeywordCoverage() { return keywordCoverage; }
    public List<Combo> getRecommendedToAdd() { return recommendedToAdd; }
    public List<StrengthenOpportunity> getStrengthenOpportunities() { return strengthenOpportunities; }
    public List<AuditWarning> getWarnings() { return warnings; }

    public Combo find(String text) {
        if (text == null) return null;
        for (Combo c : combos) {
            if (c.getText().equals(text)) return c;
        }
        return null;
    }
}
