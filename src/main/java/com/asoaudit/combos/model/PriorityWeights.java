package com.asoaudit.combos.model;

import java.util.Locale;
import java.util.Map;

/**
 * Weights of the five priority sub-signals.
 *
 * <p>Weights need not sum to one: {@link #normalized()} rescales them by their positive
 * sum so that any configuration keeps the composite score within 0-100. Negative or
 * non-finite weights count as zero.
 */
public record PriorityWeights(double relevance,
                              double length,
                              double hybrid,
                              double novelty,
                              double noiseInverse) {

    public static final PriorityWeights DEFAULTS = new PriorityWeights(0.30, 0.25, 0.20, 0.15, 0.10);

    public PriorityWeights normalized() {
        double r = positive(relevance);
        double l = positive(length);
        double h = positive(hybrid);
        double n = positive(novelty);
        double ni = positive(noiseInverse);
        double sum = r + l + h + n + ni;
        if (sum <= 0.0) {
            return new PriorityWeights(0, 0, 0, 0, 0);
        }
        return new PriorityWeights(r / sum, l / sum, h / sum, n / sum, ni / sum);
    }

    /**
     * Builds weights from a rule-set map, falling back to {@code base} for absent keys.
     * Accepted keys (case-insensitive, '-' and '_' ignored): relevance, length, hybrid,
     * novelty, noiseinverse. Unknown keys are ignored.
     */
    public static PriorityWeights fromMap(Map<String, Double> values, PriorityWeights base) {
        if (values == null || values.isEmpty()) return base;
        double r = base.relevance;
        double l = base.length;
        double h = base.hybrid;
        double n = base.novelty;
        double ni = base.noiseInverse;
        for (Map.Entry<String, Double> e : values.entrySet()) {
            if (e.getKey() == null || e.getValue() == null) continue;
            String key = e.getKey().toLowerCase(Locale.ROOT).replace("_", "").replace("-", "");
            double v = e.getValue();
            switch (key) {
                case "relevance", "semanticrelevance" -> r = v;
                case "length" -> l = v;
                case "hybrid", "brandhybrid" -> h = v;
                case "novelty" -> n = v;
                case "noiseinverse", "noise" -> ni = v;
                default -> { }
            }
        }
        return new PriorityWeights(r, l, h, n, ni);
    }

    private static double positive(double v) {
        return (!Double.isFinite(v) || v < 0) ? 0.0 : v;
    }
}
