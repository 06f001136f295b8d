package com.asoaudit.combos.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;

import java.util.List;
import java.util.Map;

public class AuditDtos {
    public static class AnalyzeRequestBody {
        // Required but may be empty: an empty element is a warning, not an error
        @NotNull
        private String title;
        @NotNull
        private String subtitle;
        private String keywordField; // App Store keyword field, comma separated
        private String brandName;
        private List<String> brandAliases;
        private List<String> competitorAliases;
        private List<String> seedKeywords; // target keywords not yet in the metadata
        private List<String> stopwords;
        @DecimalMin("0.0") @DecimalMax("1.0")
        private Double noiseThreshold;
        @Valid
        private RuleSetBody ruleSet;

        public String getTitle() { return title; }
        public void setTitle(String title) { this.title = title; }
        public String getSubtitle() { return subtitle; }
        public void setSubtitle(String subtitle) { this.subtitle = subtitle; }
        public String getKeywordField() { return keywordField; }
        public void setKeywordField(String keywordField) { this.keywordField = keywordField; }
        public String getBrandName() { return brandName; }
        public void setBrandName(String brandName) { this.brandName = brandName; }
        public List<String> getBrandAliases() { return brandAliases; }
        public void setBrandAliases(List<String> brandAliases) { this.brandAliases = brandAliases; }
        public List<String> getCompetitorAliases() { return competitorAliases; }
        public void setCompetitorAliases(List<String> competitorAliases) { this.competitorAliases = competitorAliases; }
        public List<String> getSeedKeywords() { return seedKeywords; }
        public void setSeedKeywords(List<String> seedKeywords) { this.seedKeywords = seedKeywords; }
        public List<String> getStopwords() { return stopwords; }
        public void setStopwords(List<String> stopwords) { this.stopwords = stopwords; }
        public Double getNoiseThreshold() { return noiseThreshold; }
        public void setNoiseThreshold(Double noiseThreshold) { this.noiseThreshold = noiseThreshold; }
        public RuleSetBody getRuleSet() { return ruleSet; }
        public void setRuleSet(RuleSetBody ruleSet) { this.ruleSet = ruleSet; }
    }

    public static class RuleSetBody {
        private String verticalId;
        private Map<String, Double> weights; // relevance, length, hybrid, novelty, noiseInverse
        private Map<String, Double> verticalTerms;

        public String getVerticalId() { return verticalId; }
        public void setVerticalId(String verticalId) { this.verticalId = verticalId; }
        public Map<String, Double> getWeights() { return weights; }
        public void setWeights(Map<String, Double> weights) { this.weights = weights; }
        public Map<String, Double> getVerticalTerms() { return verticalTerms; }
        public void setVerticalTerms(Map<String, Double> verticalTerms) { this.verticalTerms = verticalTerms; }
    }

    public static class DiffRequestBody {
        @Valid @NotNull
        private AnalyzeRequestBody baseline;
        @Valid @NotNull
        private AnalyzeRequestBody draft;

        public AnalyzeRequestBody getBaseline() { return baseline; }
        public void setBaseline(AnalyzeRequestBody baseline) { this.baseline = baseline; }
        public AnalyzeRequestBody getDraft() { return draft; }
        public void setDraft(AnalyzeRequestBody draft) { this.draft = draft; }
    }
}
