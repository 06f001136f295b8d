package com.asoaudit.combos.service.combo;

import com.asoaudit.combos.model.*;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Folds classified combos into coverage statistics. Reads tiers and tags only; never
 * re-classifies.
 */
public class CoverageAggregator {

    public CoverageStats aggregate(List<Combo> combos) {
        return aggregate(combos, c -> true);
    }

    public BrandTypeStats aggregateByBrandType(List<Combo> combos) {
        return new BrandTypeStats(
                aggregate(combos),
                aggregate(combos, c -> c.getBrandTag() == BrandTag.GENERIC),
                aggregate(combos, c -> c.getBrandTag() == BrandTag.BRAND));
    }

    CoverageStats aggregate(List<Combo> combos, Predicate<Combo> filter) {
        int total = 0;
        int existing = 0;
        int noise = 0;
        int nonNoiseTotal = 0;
        int nonNoiseExisting = 0;
        Map<StrengthTier, Integer> tiers = new EnumMap<>(StrengthTier.class);
        Map<Integer, Integer> byLength = new HashMap<>();
        for (Combo c : combos) {
            if (!filter.test(c)) continue;
            total++;
            if (c.exists()) existing++;
            tiers.merge(c.getStrengthTier(), 1, Integer::sum);
            byLength.merge(c.getLength(), 1, Integer::sum);
            if (c.isNoise()) {
                noise++;
            } else {
                nonNoiseTotal++;
                if (c.exists()) nonNoiseExisting++;
            }
        }
        return new CoverageStats(total, existing, tiers, byLength, noise, nonNoiseTotal, nonNoiseExisting);
    }
}
