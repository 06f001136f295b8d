package com.asoaudit.combos.service.combo;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Immutable engine settings for one analysis. Built per request so that concurrent
 * audits of different apps never share mutable configuration.
 */
public final class EngineConfig {
    /** Fits about 33 distinct words, a full title, subtitle and 100-character keyword field. */
    public static final int DEFAULT_MAX_COMBOS = 50_000;
    public static final int DEFAULT_RECOMMENDATION_LIMIT = 10;

    private final Set<String> stopwords;
    private final List<String> lowValueTerms;
    private final double noiseThreshold;
    private final int maxCombos;
    private final int recommendationLimit;
    private final RuleSet ruleSet;

    private EngineConfig(Builder b) {
        this.stopwords = b.stopwords != null ? Set.copyOf(clean(b.stopwords)) : Tokenizer.DEFAULT_STOPWORDS;
        this.lowValueTerms = b.lowValueTerms != null ? List.copyOf(clean(b.lowValueTerms)) : NoiseScorer.DEFAULT_LOW_VALUE_TERMS;
        if (Double.isNaN(b.noiseThreshold) || b.noiseThreshold < 0 || b.noiseThreshold > 1) {
            throw new IllegalArgumentException("noiseThreshold must be within [0,1], got " + b.noiseThreshold);
        }
        if (b.maxCombos < 0) throw new IllegalArgumentException("maxCombos must be >= 0");
        if (b.recommendationLimit < 0) throw new IllegalArgumentException("recommendationLimit must be >= 0");
        this.noiseThreshold = b.noiseThreshold;
        this.maxCombos = b.maxCombos;
        this.recommendationLimit = b.recommendationLimit;
        this.ruleSet = b.ruleSet != null ? b.ruleSet : RuleSet.DEFAULT;
    }

    /** Trimmed, lowercased, distinct entries; null and blank entries are dropped. */
    private static Set<String> clean(Collection<String> words) {
        Set<String> out = new LinkedHashSet<>();
        for (String w : words) {
            if (w == null || w.isBlank()) continue;
            out.add(w.trim().toLowerCase(Locale.ROOT));
        }
        return out;
    }

    public static EngineConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Copy of this config for further per-request overrides. */
    public Builder toBuilder() {
        return new Builder()
                .stopwords(stopwords)
                .lowValueTerms(lowValueTerms)
                .noiseThreshold(noiseThreshold)
                .maxCombos(maxCombos)
                .recommendationLimit(recommendationLimit)
                .ruleSet(ruleSet);
    }

    public Set<String> getStopwords() { return stopwords; }
    public List<String> getLowValueTerms() { return lowValueTerms; }
    public double getNoiseThreshold() { return noiseThreshold; }
    public int getMaxCombos() { return maxCombos; }
    public int getRecommendationLimit() { return recommendationLimit; }
    public RuleSet getRuleSet() { return ruleSet; }

    public static final class Builder {
        private Set<String> stopwords;
        private List<String> lowValueTerms;
        private double noiseThreshold = NoiseScorer.DEFAULT_THRESHOLD;
        private int maxCombos = DEFAULT_MAX_COMBOS;
        private int recommendationLimit = DEFAULT_RECOMMENDATION_LIMIT;
        private RuleSet ruleSet;

        private Builder() {}

        public Builder stopwords(Collection<String> stopwords) {
            this.stopwords = stopwords != null ? new LinkedHashSet<>(stopwords) : null;
            return this;
        }
        public Builder lowValueTerms(List<String> lowValueTerms) { this.lowValueTerms = lowValueTerms; return this; }
        public Builder noiseThreshold(double noiseThreshold) { this.noiseThreshold = noiseThreshold; return this; }
        public Builder maxCombos(int maxCombos) { this.maxCombos = maxCombos; return this; }
        public Builder recommendationLimit(int limit) { this.recommendationLimit = limit; return this; }
        public Builder ruleSet(RuleSet ruleSet) { this.ruleSet = ruleSet; return this; }

        public EngineConfig build() {
            return new EngineConfig(this);
        }
    }
}
