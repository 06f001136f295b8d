package com.asoaudit.combos.service.combo;

import com.asoaudit.combos.model.BrandTag;
import com.asoaudit.combos.model.PriorityFactors;
import com.asoaudit.combos.model.PriorityWeights;
import com.asoaudit.combos.model.StrengthTier;

import java.util.List;
import java.util.Map;

/**
 * Composite 0-100 priority of a combo, independent of whether it exists.
 *
 * <h3>Factors</h3>
 * <ul>
 *   <li><strong>relevance</strong> - {@code 0.7 * verticalMatch + 0.3 * frequencyNorm}</li>
 *   <li><strong>length</strong> - three words 1.0, two 0.7, four 0.6</li>
 *   <li><strong>hybrid</strong> - brand plus generic 1.0, generic 0.5, brand 0.3, competitor 0.2</li>
 *   <li><strong>novelty</strong> - cross-element placements score higher than single-element duplicates</li>
 *   <li><strong>noiseInverse</strong> - {@code 1 - noiseConfidence}</li>
 * </ul>
 *
 * <p>Weights come from the rule set and are renormalized, so the score stays in range
 * for any configuration.
 */
public class PriorityScorer {

    private static final double NEUTRAL_VERTICAL_MATCH = 0.5;

    private final PriorityWeights weights;
    private final Map<String, Double> verticalTerms;

    public PriorityScorer(RuleSet ruleSet) {
        RuleSet rs = ruleSet != null ? ruleSet : RuleSet.DEFAULT;
        this.weights = rs.effectiveWeights().normalized();
        this.verticalTerms = rs.verticalTerms();
    }

    public PriorityFactors score(List<String> keywords,
                                 StrengthTier tier,
                                 BrandResult brand,
                                 double noiseConfidence,
                                 CorpusStats corpus) {
        double relevance = clamp(0.7 * verticalMatch(keywords) + 0.3 * corpus.frequencyNorm(keywords));
        double length = clamp(lengthFactor(keywords.size()));
        double hybrid = clamp(hybridFactor(brand));
        double novelty = clamp(noveltyFactor(tier));
        double noiseInverse = clamp(1.0 - noiseConfidence);

        double sum = weights.relevance() * relevance
                + weights.length() * length
                + weights.hybrid() * hybrid
                + weights.novelty() * novelty
                + weights.noiseInverse() * noiseInverse;
        double score = Math.max(0, Math.min(100, Math.round(100 * sum)));
        return new PriorityFactors(relevance, length, hybrid, novelty, noiseInverse, weights, score);
    }

    double verticalMatch(List<String> keywords) {
        if (verticalTerms.isEmpty()) return NEUTRAL_VERTICAL_MATCH;
        double sum = 0;
        for (String w : keywords) {
            sum += clamp(verticalTerms.getOrDefault(w, 0.0));
        }
        return sum / keywords.size();
    }

    static double lengthFactor(int length) {
        switch (length) {
            case 3: return 1.0;
            case 2: return 0.7;
            case 4: return 0.6;
            default: return 0.0;
        }
    }

    static double hybridFactor(BrandResult brand) {
        if (brand == null) return 0.5;
        if (brand.tag() == BrandTag.COMPETITOR) return 0.2;
        if (brand.tag() == BrandTag.BRAND) return brand.isHybrid() ? 1.0 : 0.3;
        return 0.5;
    }

    static double noveltyFactor(StrengthTier tier) {
        switch (tier) {
            case TITLE_KEYWORDS_CROSS:
            case CROSS_ELEMENT:
                return 1.0;
            case KEYWORDS_SUBTITLE_CROSS:
            case THREE_WAY_CROSS:
                return 0.8;
            case MISSING:
                return 0.6;
            case TITLE_NON_CONSECUTIVE:
            case KEYWORDS_NON_CONSECUTIVE:
            case SUBTITLE_NON_CONSECUTIVE:
                return 0.4;
            default:
                return 0.2;
        }
    }

    public PriorityWeights getWeights() { return weights; }

    private static double clamp(double v) {
        if (Double.isNaN(v)) return 0.0;
        return Math.max(0.0, Math.min(1.0, v));
    }
}
