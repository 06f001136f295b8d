package com.asoaudit.combos.service.combo;

import com.asoaudit.combos.model.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Enumerates every 2, 3 and 4 word combination over the distinct token universe.
 *
 * <p>The universe is title tokens, then subtitle tokens, then keyword-pool tokens,
 * then seed tokens, each in position order, deduplicated by word with the first
 * occurrence winning. Seed words appear in no element, so every combo using one is
 * missing from the metadata.
 * Combinations keep universe order in {@link CandidateCombo#keywords()}. Output is
 * ordered by length, then lexicographically by universe index.
 */
public class ComboGenerator {
    private static final Logger log = LoggerFactory.getLogger(ComboGenerator.class);

    public static final int MIN_LENGTH = 2;
    public static final int MAX_LENGTH = 4;

    private final long maxCombos;

    public ComboGenerator(long maxCombos) {
        if (maxCombos < 0) throw new IllegalArgumentException("maxCombos must be >= 0");
        this.maxCombos = maxCombos;
    }

    public List<CandidateCombo> generateCombos(List<Token> titleTokens,
                                               List<Token> subtitleTokens,
                                               List<Token> keywordTokens) {
        return generateCombos(titleTokens, subtitleTokens, keywordTokens, List.of());
    }

    public List<CandidateCombo> generateCombos(List<Token> titleTokens,
                                               List<Token> subtitleTokens,
                                               List<Token> keywordTokens,
                                               List<Token> seedTokens) {
        List<String> universe = universe(titleTokens, subtitleTokens, keywordTokens, seedTokens);
        long requested = candidateCount(universe.size());
        if (requested > maxCombos) {
            log.warn("Rejecting {} distinct tokens: {} candidates > limit {}", universe.size(), requested, maxCombos);
            throw new ComboCapacityExceededException(requested, maxCombos);
        }

        List<CandidateCombo> out = new ArrayList<>((int) Math.min(requested, 4096));
        Set<String> seen = new HashSet<>();
        for (int size = MIN_LENGTH; size <= MAX_LENGTH; size++) {
            collect(universe, size, 0, new ArrayList<>(size), seen, out);
        }
        log.debug("Generated {} candidate combos from {} distinct tokens", out.size(), universe.size());
        return out;
    }

    /** Distinct words in title, subtitle, pool, seed order. */
    public static List<String> universe(List<Token> titleTokens,
                                        List<Token> subtitleTokens,
                                        List<Token> keywordTokens,
                                        List<Token> seedTokens) {
        LinkedHashSet<String> words = new LinkedHashSet<>();
        addAll(words, titleTokens);
        addAll(words, subtitleTokens);
        addAll(words, keywordTokens);
        addAll(words, seedTokens);
        return new ArrayList<>(words);
    }

    /** {@code C(n,2) + C(n,3) + C(n,4)}. */
    public static long candidateCount(int n) {
        // C(n,4) overflows a long well before this
        if (n > 50_000) return Long.MAX_VALUE;
        long total = 0;
        for (int k = MIN_LENGTH; k <= MAX_LENGTH; k++) {
            total += binomial(n, k);
        }
        return total;
    }

    static long binomial(int n, int k) {
        if (k < 0 || k > n) return 0;
        long r = 1;
        for (int i = 1; i <= k; i++) {
            r = r * (n - k + i) / i;
        }
        return r;
    }

    private static void collect(List<String> universe, int size, int from, List<String> current,
                                Set<String> seen, List<CandidateCombo> out) {
        if (current.size() == size) {
            CandidateCombo candidate = CandidateCombo.of(current);
            if (seen.add(candidate.canonicalKey())) {
                out.add(candidate);
            }
            return;
        }
        for (int i = from; i <= universe.size() - (size - current.size()); i++) {
            current.add(universe.get(i));
            collect(universe, size, i + 1, current, seen, out);
            current.remove(current.size() - 1);
        }
    }

    private static void addAll(Set<String> words, List<Token> tokens) {
        if (tokens == null) return;
        for (Token t : tokens) {
            if (t.isStopword()) continue;
            words.add(t.getText().toLowerCase(Locale.ROOT));
        }
    }
}
