package com.asoaudit.combos.service.combo;

import com.asoaudit.combos.model.Combo;

import java.util.List;

/**
 * An unclassified combination produced by {@link ComboGenerator}.
 *
 * @param keywords     words in universe (first-seen) order; the classifier settles the final order
 * @param canonicalKey words sorted lexicographically and space-joined; used only to dedupe
 */
public record CandidateCombo(List<String> keywords, String canonicalKey) {

    public CandidateCombo {
        keywords = List.copyOf(keywords);
    }

    public static CandidateCombo of(List<String> keywords) {
        return new CandidateCombo(keywords, Combo.canonicalKey(keywords));
    }

    public String text() {
        return String.join(" ", keywords);
    }

    public int length() {
        return keywords.size();
    }
}
