package com.asoaudit.combos.service.combo;

import com.asoaudit.combos.model.ComboSource;
import com.asoaudit.combos.model.StrengthTier;

import java.util.List;

/**
 * Outcome of classifying one combo against the element tokens.
 *
 * @param keywords   the combo's words, in their adjacent order when a consecutive tier matched
 * @param suggestion minimal edit that would move the combo up; {@code null} for
 *                   {@link StrengthTier#TITLE_CONSECUTIVE} and {@link StrengthTier#MISSING}
 */
public record TierResult(List<String> keywords, StrengthTier tier, ComboSource source, String suggestion) {

    public boolean exists() { return tier.exists(); }
    public int strengthScore() { return tier.getScore(); }
    public boolean isConsecutive() { return tier.isConsecutive(); }
}
