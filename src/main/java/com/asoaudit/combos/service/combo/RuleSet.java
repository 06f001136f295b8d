package com.asoaudit.combos.service.combo;

import com.asoaudit.combos.model.PriorityWeights;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Vertical-specific scoring data supplied by the caller.
 *
 * <p>Consumed as data only: {@code weights} overrides the priority weights by key,
 * {@code verticalTerms} maps words to their relevance (0-1) for the vertical.
 */
public record RuleSet(String verticalId, Map<String, Double> weights, Map<String, Double> verticalTerms) {

    public static final RuleSet DEFAULT = new RuleSet(null, Map.of(), Map.of());

    public RuleSet {
        weights = weights != null ? Collections.unmodifiableMap(new LinkedHashMap<>(weights)) : Map.of();
        Map<String, Double> terms = new LinkedHashMap<>();
        if (verticalTerms != null) {
            verticalTerms.forEach((k, v) -> {
                if (k != null && v != null) terms.put(k.trim().toLowerCase(Locale.ROOT), v);
            });
        }
        verticalTerms = Collections.unmodifiableMap(terms);
    }

    public PriorityWeights effectiveWeights() {
        return PriorityWeights.fromMap(weights, PriorityWeights.DEFAULTS);
    }
}
