package com.asoaudit.combos.model;

/**
 * The same coverage statistics computed over all combos, over generic combos only
 * and over brand combos only. Competitor combos are counted in {@code all} alone.
 *
 * @param all     every classified combo
 * @param generic combos tagged {@link BrandTag#GENERIC}
 * @param brand   combos tagged {@link BrandTag#BRAND}
 */
public record BrandTypeStats(CoverageStats all, CoverageStats generic, CoverageStats brand) {
}
