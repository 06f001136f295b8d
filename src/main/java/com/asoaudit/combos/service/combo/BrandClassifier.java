package com.asoaudit.combos.service.combo;

import com.asoaudit.combos.model.BrandTag;
import com.asoaudit.combos.util.TextUtils;

import java.util.*;

/**
 * Tags combos as brand, competitor or generic.
 *
 * <p>A combo matches an alias when one of its words equals a single-word alias, or when
 * a multi-word alias occurs with word boundaries inside the space-joined combo text.
 * Brand aliases are tested before competitor aliases.
 */
public class BrandClassifier {

    private static final List<String> ALIAS_SUFFIXES = List.of("app", "language", "learning", "lessons", "course");
    private static final List<String> ALIAS_PREFIXES = List.of("the", "official");

    /**
     * @param brandAliases      normalized brand aliases, see {@link #normalizeAliases(Collection)}
     * @param competitorAliases normalized competitor aliases
     */
    public BrandResult classify(List<String> keywords, List<String> brandAliases, List<String> competitorAliases) {
        BrandResult brand = match(keywords, brandAliases, BrandTag.BRAND);
        if (brand != null) return brand;
        BrandResult competitor = match(keywords, competitorAliases, BrandTag.COMPETITOR);
        if (competitor != null) return competitor;
        return BrandResult.generic(keywords.size());
    }

    private static BrandResult match(List<String> keywords, List<String> aliases, BrandTag tag) {
        if (aliases == null || aliases.isEmpty()) return null;
        String padded = " " + String.join(" ", keywords) + " ";
        String first = null;
        Set<Integer> covered = new HashSet<>();
        for (String alias : aliases) {
            if (!alias.contains(" ")) {
                int idx = keywords.indexOf(alias);
                if (idx < 0) continue;
                if (first == null) first = alias;
                for (int i = 0; i < keywords.size(); i++) {
                    if (keywords.get(i).equals(alias)) covered.add(i);
                }
            } else if (padded.contains(" " + alias + " ")) {
                if (first == null) first = alias;
                List<String> parts = Arrays.asList(alias.split(" "));
                for (int i = 0; i <= keywords.size() - parts.size(); i++) {
                    if (keywords.subList(i, i + parts.size()).equals(parts)) {
                        for (int j = i; j < i + parts.size(); j++) covered.add(j);
                    }
                }
            }
        }
        if (first == null) return null;
        return new BrandResult(tag, first, covered.size(), keywords.size() - covered.size());
    }

    /**
     * Trims, lowercases and collapses whitespace (via {@link TextUtils#normalize(String)}),
     * drops blanks and duplicates. Order of first occurrence is kept.
     */
    public static List<String> normalizeAliases(Collection<String> aliases) {
        if (aliases == null) return List.of();
        LinkedHashSet<String> out = new LinkedHashSet<>();
        for (String a : aliases) {
            String n = TextUtils.normalize(a);
            if (!n.isEmpty()) out.add(n);
        }
        return List.copyOf(out);
    }

    /**
     * Expands a brand name into common search variants: the name itself, the name
     * followed by app/language/learning/lessons/course, and the name preceded by
     * the/official.
     */
    public static List<String> generateBrandAliases(String brand) {
        String base = TextUtils.normalize(brand);
        if (base.isEmpty()) return List.of();
        List<String> out = new ArrayList<>();
        out.add(base);
        for (String suffix : ALIAS_SUFFIXES) {
            out.add(base + " " + suffix);
        }
        for (String prefix : ALIAS_PREFIXES) {
            out.add(prefix + " " + base);
        }
        return out;
    }
}
