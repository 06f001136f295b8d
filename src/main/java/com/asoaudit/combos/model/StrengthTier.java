package com.asoaudit.combos.model;

/**
 * Strength classification of a keyword combination.
 *
 * <p>Each tier carries a fixed strength score and a coarse rank. The score expresses
 * ranking power; the tier name expresses provenance. Tiers that share a score
 * (for example {@link #KEYWORDS_CONSECUTIVE} and {@link #SUBTITLE_CONSECUTIVE}) stay
 * distinct because the dashboard explains them differently.
 *
 * <h3>Score table</h3>
 * <ul>
 *   <li>100 - words adjacent in the title</li>
 *   <li>85 - all words in the title, or title plus keyword field</li>
 *   <li>70 - title plus subtitle</li>
 *   <li>50 - adjacent in keyword field or subtitle</li>
 *   <li>35 - keyword field plus subtitle</li>
 *   <li>25 - scattered in keyword field or subtitle</li>
 *   <li>15 - spread across all three elements</li>
 *   <li>0 - missing</li>
 * </ul>
 *
 * <p>Declaration order is the classification order; the constant order is also the
 * key order of every tier histogram.
 */
public enum StrengthTier {
    TITLE_CONSECUTIVE(100, 1, true),
    TITLE_NON_CONSECUTIVE(85, 2, false),
    TITLE_KEYWORDS_CROSS(85, 2, false),
    CROSS_ELEMENT(70, 3, false),
    KEYWORDS_CONSECUTIVE(50, 4, true),
    SUBTITLE_CONSECUTIVE(50, 4, true),
    KEYWORDS_SUBTITLE_CROSS(35, 5, false),
    KEYWORDS_NON_CONSECUTIVE(25, 6, false),
    SUBTITLE_NON_CONSECUTIVE(25, 6, false),
    THREE_WAY_CROSS(15, 7, false),
    MISSING(0, 8, false);

    private final int score;
    private final int rank;
    private final boolean consecutive;

    StrengthTier(int score, int rank, boolean consecutive) {
        this.score = score;
        this.rank = rank;
        this.consecutive = consecutive;
    }

    /** Fixed strength score of this tier (0-100). */
    public int getScore() { return score; }

    /** Coarse rank 1 (best) to 8 (missing); several tiers share a rank. */
    public int getRank() { return rank; }

    public boolean isConsecutive() { return consecutive; }

    public boolean exists() { return this != MISSING; }

    /** True for tiers built from words of more than one element. */
    public boolean isCross() {
        return this == TITLE_KEYWORDS_CROSS || this == CROSS_ELEMENT
                || this == KEYWORDS_SUBTITLE_CROSS || this == THREE_WAY_CROSS;
    }

    /** Every tier except the top one and {@link #MISSING} can still be improved. */
    public boolean canStrengthen() {
        return this != TITLE_CONSECUTIVE && this != MISSING;
    }

    /** Human label for a coarse rank. */
    public static String rankLabel(int rank) {
        if (rank == 1) return "Excellent";
        if (rank == 2) return "Good";
        if (rank <= 4) return "Medium";
        return "Poor";
    }
}
