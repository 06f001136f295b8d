package com.asoaudit.combos.model;

/**
 * Baseline vs draft counts in three coarse buckets: rank 1 (excellent), rank 2 (good)
 * and ranks 3-7 (everything that exists below those).
 */
public record TierDistribution(Bucket tier1, Bucket tier2, Bucket tier3Plus) {

    public record Bucket(int baseline, int draft, int delta) {
        public static Bucket of(int baseline, int draft) {
            return new Bucket(baseline, draft, draft - baseline);
        }
    }
}
