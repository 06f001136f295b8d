package com.asoaudit.combos.service.combo;

import com.asoaudit.combos.model.BrandTag;

/**
 * Brand classification of one combo.
 *
 * @param matchedAlias  first alias (in normalized list order) found in the combo, or {@code null}
 * @param aliasWords    combo words covered by a matching alias
 * @param genericWords  remaining combo words
 */
public record BrandResult(BrandTag tag, String matchedAlias, int aliasWords, int genericWords) {

    public static BrandResult generic(int words) {
        return new BrandResult(BrandTag.GENERIC, null, 0, words);
    }

    /** Brand combo that also carries at least one generic word. */
    public boolean isHybrid() {
        return tag == BrandTag.BRAND && aliasWords > 0 && genericWords > 0;
    }
}
