package com.asoaudit.combos.service.combo;

import com.asoaudit.combos.model.*;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CoverageAggregatorTest {

    private static Combo combo(StrengthTier tier, BrandTag tag, boolean noise, String... words) {
        return Combo.builder()
                .keywords(List.of(words))
                .strengthTier(tier)
                .source(tier.exists() ? ComboSource.TITLE : ComboSource.MISSING)
                .brandTag(tag)
                .noise(noise)
                .build();
    }

    private final List<Combo> combos = List.of(
            combo(StrengthTier.TITLE_CONSECUTIVE, BrandTag.GENERIC, false, "learn", "spanish"),
            combo(StrengthTier.MISSING, BrandTag.BRAND, false, "pimsleur", "german"),
            combo(StrengthTier.CROSS_ELEMENT, BrandTag.COMPETITOR, true, "duolingo", "app"),
            combo(StrengthTier.MISSING, BrandTag.GENERIC, false, "learn", "german", "grammar"));

    @Test
    public void countsTotalsAndHistogram() {
        CoverageStats s = new CoverageAggregator().aggregate(combos);
        assertEquals(4, s.getTotalPossible());
        assertEquals(2, s.getExisting());
        assertEquals(2, s.getMissing());
        assertEquals(50, s.getCoveragePct());
        assertEquals(StrengthTier.values().length, s.getTierCounts().size());
        assertEquals(1, s.count(StrengthTier.TITLE_CONSECUTIVE));
        assertEquals(1, s.count(StrengthTier.CROSS_ELEMENT));
        assertEquals(2, s.count(StrengthTier.MISSING));
        assertEquals(0, s.count(StrengthTier.THREE_WAY_CROSS));
        assertEquals(3, s.getByLength().get(2));
        assertEquals(1, s.getByLength().get(3));
        assertEquals(0, s.getByLength().get(4));
    }

    @Test
    public void noiseIsExcludedFromHeadlineCountsOnly() {
        CoverageStats s = new CoverageAggregator().aggregate(combos);
        assertEquals(1, s.getNoiseCount());
        assertEquals(3, s.getNonNoiseTotal());
        assertEquals(1, s.getNonNoiseExisting());
        assertEquals(33, s.getNonNoiseCoveragePct());
    }

    @Test
    public void competitorCombosOnlyCountInAll() {
        BrandTypeStats s = new CoverageAggregator().aggregateByBrandType(combos);
        assertEquals(4, s.all().getTotalPossible());
        assertEquals(2, s.generic().getTotalPossible());
        assertEquals(1, s.brand().getTotalPossible());
        assertEquals(0, s.brand().getExisting());
        assertTrue(s.generic().getTotalPossible() + s.brand().getTotalPossible() <= s.all().getTotalPossible());
    }

    @Test
    public void emptyInputHasZeroCoverageAndAllKeys() {
        CoverageStats s = new CoverageAggregator().aggregate(List.of());
        assertEquals(0, s.getTotalPossible());
        assertEquals(0, s.getCoveragePct());
        assertEquals(StrengthTier.values().length, s.getTierCounts().size());
        assertTrue(s.getTierCounts().values().stream().allMatch(v -> v == 0));
    }
}
