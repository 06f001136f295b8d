package com.asoaudit.combos.service.combo;

import com.asoaudit.combos.model.*;

import java.util.*;

/**
 * Compares a baseline analysis with the analysis of an edited draft.
 *
 * <p>Combos are matched by {@link Combo#getCanonicalKey()}, so reordering words
 * matches the same combo in both analyses. A combo present in both with a different
 * coarse rank is an upgrade (rank number dropped) or a downgrade; same rank counts as
 * unchanged.
 */
public class ComboDiffer {

    private static final int SAMPLE_SIZE = 3;

    public ComboDiff diff(ComboAnalysis baseline, ComboAnalysis draft) {
        Map<String, Combo> baselineByKey = byKey(baseline.getCombos());
        Map<String, Combo> draftByKey = byKey(draft.getCombos());

        List<Combo> added = new ArrayList<>();
        for (Combo c : draft.getCombos()) {
            if (!baselineByKey.containsKey(c.getCanonicalKey())) added.add(c);
        }
        List<Combo> removed = new ArrayList<>();
        List<ComboTierChange> upgrades = new ArrayList<>();
        List<ComboTierChange> downgrades = new ArrayList<>();
        List<Combo> unchanged = new ArrayList<>();
        for (Combo before : baseline.getCombos()) {
            Combo after = draftByKey.get(before.getCanonicalKey());
            if (after == null) {
                removed.add(before);
                continue;
            }
            int improvement = before.getTierRank() - after.getTierRank();
            if (improvement == 0) {
                unchanged.add(after);
                continue;
            }
            ComboTierChange change = new ComboTierChange(after.getText(),
                    before.getTierRank(), after.getTierRank(),
                    before.getStrengthTier(), after.getStrengthTier(),
                    before.getStrengthScore(), after.getStrengthScore(),
                    improvement);
            if (improvement > 0) upgrades.add(change);
            else downgrades.add(change);
        }

        added.sort(Comparator.comparingInt(Combo::getStrengthScore).reversed());
        removed.sort(Comparator.comparingInt(Combo::getStrengthScore).reversed());
        upgrades.sort(Comparator.comparingInt(ComboTierChange::improvement).reversed());
        downgrades.sort(Comparator.comparingInt(ComboTierChange::improvement));

        return new ComboDiff(added, removed, upgrades, downgrades, unchanged,
                tierDistribution(baseline, draft),
                keywordImpact(baseline, draft),
                baseline.getStats().getCoveragePct(),
                draft.getStats().getCoveragePct());
    }

    /** Rank 1, rank 2 and ranks 3-7 counted over generic combos. */
    public TierDistribution tierDistribution(ComboAnalysis baseline, ComboAnalysis draft) {
        CoverageStats b = baseline.getStatsByBrandType().generic();
        CoverageStats d = draft.getStatsByBrandType().generic();
        return new TierDistribution(
                TierDistribution.Bucket.of(rankCount(b, 1, 1), rankCount(d, 1, 1)),
                TierDistribution.Bucket.of(rankCount(b, 2, 2), rankCount(d, 2, 2)),
                TierDistribution.Bucket.of(rankCount(b, 3, 7), rankCount(d, 3, 7)));
    }

    /**
     * Keywords (title, new subtitle and keyword pool) present in only one of the two
     * analyses, with the combos they take part in. Keywords in no combo are skipped.
     */
    public List<KeywordImpact> keywordImpact(ComboAnalysis baseline, ComboAnalysis draft) {
        Set<String> before = keywords(baseline.getKeywordCoverage());
        Set<String> after = keywords(draft.getKeywordCoverage());
        List<KeywordImpact> out = new ArrayList<>();
        for (String k : after) {
            if (!before.contains(k)) addImpact(out, k, "added", draft.getCombos());
        }
        for (String k : before) {
            if (!after.contains(k)) addImpact(out, k, "removed", baseline.getCombos());
        }
        out.sort(Comparator.comparingInt(KeywordImpact::comboCount).reversed());
        return out;
    }

    private static void addImpact(List<KeywordImpact> out, String keyword, String change, List<Combo> combos) {
        List<Combo> matching = new ArrayList<>();
        for (Combo c : combos) {
            for (String w : c.getKeywords()) {
                if (w.toLowerCase(Locale.ROOT).equals(keyword)) {
                    matching.add(c);
                    break;
                }
            }
        }
        if (matching.isEmpty()) return;
        double sum = 0;
        for (Combo c : matching) sum += c.getTierRank();
        double avg = Math.round(sum / matching.size() * 10) / 10.0;
        List<String> samples = new ArrayList<>();
        for (int i = 0; i < Math.min(SAMPLE_SIZE, matching.size()); i++) {
            samples.add(matching.get(i).getText());
        }
        out.add(new KeywordImpact(keyword, change, matching.size(), avg, samples));
    }

    private static Set<String> keywords(KeywordCoverage coverage) {
        Set<String> out = new LinkedHashSet<>();
        if (coverage == null) return out;
        for (String k : coverage.titleKeywords()) out.add(k.toLowerCase(Locale.ROOT));
        for (String k : coverage.subtitleNewKeywords()) out.add(k.toLowerCase(Locale.ROOT));
        for (String k : coverage.keywordPool()) out.add(k.toLowerCase(Locale.ROOT));
        return out;
    }

    private static int rankCount(CoverageStats stats, int fromRank, int toRank) {
        int n = 0;
        for (Map.Entry<StrengthTier, Integer> e : stats.getTierCounts().entrySet()) {
            int rank = e.getKey().getRank();
            if (rank >= fromRank && rank <= toRank) n += e.getValue();
        }
        return n;
    }

    private static Map<String, Combo> byKey(List<Combo> combos) {
        Map<String, Combo> out = new HashMap<>();
        for (Combo c : combos) out.put(c.getCanonicalKey(), c);
        return out;
    }
}
