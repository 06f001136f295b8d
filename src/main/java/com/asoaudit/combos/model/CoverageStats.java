package com.asoaudit.combos.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Coverage totals and tier histogram over one set of classified combos.
 *
 * <p>{@code tierCounts} always holds every {@link StrengthTier} key, in tier order,
 * zeros included. {@code byLength} always holds the keys 2, 3 and 4.
 */
public final class CoverageStats {
    private final int totalPossible;
    private final int existing;
    private final Map<StrengthTier, Integer> tierCounts;
    private final Map<Integer, Integer> byLength;
    private final int noiseCount;
    private final int nonNoiseTotal;
    private final int nonNoiseExisting;

    public CoverageStats(int totalPossible,
                         int existing,
                         Map<StrengthTier, Integer> tierCounts,
                         Map<Integer, Integer> byLength,
                         int noiseCount,
                         int nonNoiseTotal,
                         int nonNoiseExisting) {
        this.totalPossible = totalPossible;
        this.existing = existing;
        EnumMap<StrengthTier, Integer> tiers = new EnumMap<>(StrengthTier.class);
        for (StrengthTier tier : StrengthTier.values()) {
            tiers.put(tier, tierCounts != null ? tierCounts.getOrDefault(tier, 0) : 0);
        }
        this.tierCounts = Collections.unmodifiableMap(tiers);
        Map<Integer, Integer> lengths = new LinkedHashMap<>();
        for (int len = 2; len <= 4; len++) {
            lengths.put(len, byLength != null ? byLength.getOrDefault(len, 0) : 0);
        }
        this.byLength = Collections.unmodifiableMap(lengths);
        this.noiseCount = noiseCount;
        this.nonNoiseTotal = nonNoiseTotal;
        this.nonNoiseExisting = nonNoiseExisting;
    }

    public static CoverageStats empty() {
        return new CoverageStats(0, 0, null, null, 0, 0, 0);
    }

    public int getTotalPossible() { return totalPossible; }
    public int getExisting() { return existing; }
    public int getMissing() { return totalPossible - existing; }
    public int getCoveragePct() { return percent(existing, totalPossible); }
    public Map<StrengthTier, Integer> getTierCounts() { return tierCounts; }
    public Map<Integer, Integer> getByLength() { return byLength; }
    public int getNoiseCount() { return noiseCount; }
    public int getNonNoiseTotal() { return nonNoiseTotal; }
    public int getNonNoiseExisting() { return nonNoiseExisting; }
    public int getNonNoiseCoveragePct() { return percent(nonNoiseExisting, nonNoiseTotal); }

    public int count(StrengthTier tier) {
        return tierCounts.get(tier);
    }

    /** {@code round(100 * part / whole)}, or 0 for an empty whole. */
    static int percent(int part, int whole) {
        if (whole <= 0) return 0;
        return (int) Math.round(100.0 * part / whole);
    }
}
