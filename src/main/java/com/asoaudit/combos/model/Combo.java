package com.asoaudit.combos.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * A classified keyword combination.
 *
 * <p>Combos are assembled once per analysis by
 * {@link com.asoaudit.combos.service.combo.ComboEngine} and never change afterwards.
 * {@code text} follows the positional order of the words where they are adjacent;
 * {@code canonicalKey} (sorted words) identifies the same combo across analyses.
 *
 * <h3>Field groups</h3>
 * <ul>
 *   <li><strong>Identity</strong>: text, canonicalKey, keywords, length</li>
 *   <li><strong>Existence</strong>: exists, source, strengthTier, strengthScore, isConsecutive</li>
 *   <li><strong>Brand</strong>: brandTag, matchedAlias, noiseConfidence, noise</li>
 *   <li><strong>Priority</strong>: priorityScore, priorityBand, priorityFactors</li>
 *   <li><strong>Advice</strong>: canStrengthen, strengtheningSuggestion</li>
 * </ul>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Combo {
    private final String text;
    private final String canonicalKey;
    private final List<String> keywords;
    private final ComboSource source;
    private final StrengthTier strengthTier;
    private final BrandTag brandTag;
    private final String matchedAlias;
    private final double noiseConfidence;
    private final boolean noise;
    private final PriorityFactors priorityFactors;
    private final String strengtheningSuggestion;

    private Combo(Builder b) {
        this.keywords = List.copyOf(Objects.requireNonNull(b.keywords, "keywords"));
        if (keywords.size() < 2 || keywords.size() > 4) {
            throw new IllegalArgumentException("combo length must be 2..4, got " + keywords.size());
        }
        this.text = String.join(" ", keywords);
        this.canonicalKey = canonicalKey(keywords);
        this.strengthTier = Objects.requireNonNull(b.strengthTier, "strengthTier");
        this.source = Objects.requireNonNull(b.source, "source");
        this.brandTag = b.brandTag;
        this.matchedAlias = b.matchedAlias;
        this.noiseConfidence = b.noiseConfidence;
        this.noise = b.noise;
        this.priorityFactors = b.priorityFactors;
        this.strengtheningSuggestion = strengthTier.canStrengthen() ? b.strengtheningSuggestion : null;
    }

    public String getText() { return text; }

    /** Lowercased words in lexicographic order, independent of word order. */
    public String getCanonicalKey() { return canonicalKey; }

    public List<String> getKeywords() { return keywords; }
    public int getLength() { return keywords.size(); }

    @JsonProperty("exists")
    public boolean exists() { return strengthTier.exists(); }

    public ComboSource getSource() { return source; }
    public StrengthTier getStrengthTier() { return strengthTier; }

    /** Pure function of the tier. */
    public int getStrengthScore() { return strengthTier.getScore(); }

    public int getTierRank() { return strengthTier.getRank(); }

    @JsonProperty("isConsecutive")
    public boolean isConsecutive() { return strengthTier.isConsecutive(); }

    public BrandTag getBrandTag() { return brandTag; }
    public String getMatchedAlias() { return matchedAlias; }
    public double getNoiseConfidence() { return noiseConfidence; }

    @JsonProperty("noise")
    public boolean isNoise() { return noise; }

    /** Composite 0-100 score; 0 when the combo was not scored. */
    public double getPriorityScore() { return priorityFactors != null ? priorityFactors.score() : 0.0; }

    public PriorityBand getPriorityBand() { return PriorityBand.of(getPriorityScore()); }

    public PriorityFactors getPriorityFactors() { return priorityFactors; }

    @JsonProperty("canStrengthen")
    public boolean canStrengthen() { return strengthTier.canStrengthen(); }

    public String getStrengtheningSuggestion() { return strengtheningSuggestion; }

    public boolean containsKeyword(String keyword) {
        return keyword != null && keywords.contains(keyword);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Combo other)) return false;
        return text.equals(other.text) && strengthTier == other.strengthTier && source == other.source
                && brandTag == other.brandTag && noise == other.noise
                && Double.compare(noiseConfidence, other.noiseConfidence) == 0
                && Objects.equals(matchedAlias, other.matchedAlias)
                && Objects.equals(priorityFactors, other.priorityFactors)
                && Objects.equals(strengtheningSuggestion, other.strengtheningSuggestion);
    }

    @Override
    public int hashCode() {
        return Objects.hash(text, strengthTier, source, brandTag, noise, noiseConfidence, matchedAlias, priorityFactors);
    }

    @Override
    public String toString() {
        return "Combo{" + text + ", " + strengthTier + ", " + brandTag + ", priority=" + getPriorityScore() + "}";
    }

    public static String canonicalKey(List<String> words) {
        List<String> sorted = new ArrayList<>(words.size());
        for (String w : words) sorted.add(w.toLowerCase(Locale.ROOT));
        Collections.sort(sorted);
        return String.join(" ", sorted);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private List<String> keywords;
        private ComboSource source;
        private StrengthTier strengthTier;
        private BrandTag brandTag;
        private String matchedAlias;
        private double noiseConfidence;
        private boolean noise;
        private PriorityFactors priorityFactors;
        private String strengtheningSuggestion;

        private Builder() {}

        public Builder keywords(List<String> keywords) { this.keywords = keywords; return this; }
        public Builder source(ComboSource source) { this.source = source; return this; }
        public Builder strengthTier(StrengthTier strengthTier) { this.strengthTier = strengthTier; return this; }
        public Builder brandTag(BrandTag brandTag) { this.brandTag = brandTag; return this; }
        public Builder matchedAlias(String matchedAlias) { this.matchedAlias = matchedAlias; return this; }
        public Builder noiseConfidence(double noiseConfidence) { this.noiseConfidence = noiseConfidence; return this; }
        public Builder noise(boolean noise) { this.noise = noise; return this; }
        public Builder priorityFactors(PriorityFactors priorityFactors) { this.priorityFactors = priorityFactors; return this; }
        public Builder strengtheningSuggestion(String suggestion) { this.strengtheningSuggestion = suggestion; return this; }

        public Combo build() {
            return new Combo(this);
        }
    }
}
