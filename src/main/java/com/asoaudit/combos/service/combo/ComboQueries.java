package com.asoaudit.combos.service.combo;

import com.asoaudit.combos.model.Combo;

import java.util.*;

/** Read-only helpers over the combos of an analysis. */
public final class ComboQueries {
    private ComboQueries() {}

    /** Combos whose text contains {@code keyword}, case-insensitive; blank keyword returns all. */
    public static List<Combo> filterByKeyword(List<Combo> combos, String keyword) {
        if (keyword == null || keyword.isBlank()) return new ArrayList<>(combos);
        String needle = keyword.trim().toLowerCase(Locale.ROOT);
        List<Combo> out = new ArrayList<>();
        for (Combo c : combos) {
            if (c.getText().toLowerCase(Locale.ROOT).contains(needle)) out.add(c);
        }
        return out;
    }

    /** Combos grouped by word count, keys 2, 3, 4 always present. */
    public static Map<Integer, List<Combo>> groupByLength(List<Combo> combos) {
        Map<Integer, List<Combo>> out = new LinkedHashMap<>();
        for (int len = 2; len <= 4; len++) out.put(len, new ArrayList<>());
        for (Combo c : combos) {
            out.computeIfAbsent(c.getLength(), k -> new ArrayList<>()).add(c);
        }
        return out;
    }

    /** Number of combos having {@code keyword} as one of their words. */
    public static int countWithKeyword(List<Combo> combos, String keyword) {
        if (keyword == null) return 0;
        String k = keyword.trim().toLowerCase(Locale.ROOT);
        int n = 0;
        for (Combo c : combos) {
            if (c.containsKeyword(k)) n++;
        }
        return n;
    }

    /** Top {@code n} combos by priority desc, text asc. */
    public static List<Combo> topByPriority(List<Combo> combos, int n) {
        List<Combo> sorted = new ArrayList<>(combos);
        sorted.sort(Comparator.comparingDouble(Combo::getPriorityScore).reversed()
                .thenComparing(Combo::getText));
        return new ArrayList<>(sorted.subList(0, Math.max(0, Math.min(n, sorted.size()))));
    }
}
