package com.asoaudit.combos.model;

/**
 * Normalized sub-signals behind a priority score. Each factor is in [0, 1]; the
 * weights are the effective (renormalized) weights that produced {@code score}.
 *
 * @param relevance    semantic relevance to the app's vertical
 * @param length       combo length preference (three words favored)
 * @param hybrid       brand/generic mix bonus
 * @param novelty      how far the combo is from a single-element duplicate
 * @param noiseInverse {@code 1 - noiseConfidence}
 * @param weights      effective weights applied to the factors
 * @param score        {@code round(100 * sum(weight * factor))}
 */
public record PriorityFactors(double relevance,
                              double length,
                              double hybrid,
                              double novelty,
                              double noiseInverse,
                              PriorityWeights weights,
                              double score) {
}
