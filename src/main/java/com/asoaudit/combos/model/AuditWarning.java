package com.asoaudit.combos.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * A degenerate-input notice raised while analyzing combos.
 *
 * <p>Warnings never abort an analysis: empty elements, duplicated words or identical
 * title and subtitle still produce a valid (possibly empty) result. The warning tells
 * the dashboard why the numbers look the way they do.
 *
 * <h3>Warning codes</h3>
 * <ul>
 *   <li><strong>EMPTY_ELEMENT</strong> - title or subtitle has no usable keywords</li>
 *   <li><strong>DUPLICATE_KEYWORD</strong> - a word is repeated within or across elements</li>
 *   <li><strong>IDENTICAL_ELEMENTS</strong> - title and subtitle carry the same keywords</li>
 *   <li><strong>INSUFFICIENT_TOKENS</strong> - fewer than two distinct keywords, no combos possible</li>
 *   <li><strong>ALIASES_NORMALIZED</strong> - alias list contained blanks, duplicates or mixed case</li>
 * </ul>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class AuditWarning {
    public static final String EMPTY_ELEMENT = "EMPTY_ELEMENT";
    public static final String DUPLICATE_KEYWORD = "DUPLICATE_KEYWORD";
    public static final String IDENTICAL_ELEMENTS = "IDENTICAL_ELEMENTS";
    public static final String INSUFFICIENT_TOKENS = "INSUFFICIENT_TOKENS";
    public static final String ALIASES_NORMALIZED = "ALIASES_NORMALIZED";

    /** Warning code for categorization */
    private final String code;

    /** Input field the warning refers to (title, subtitle, keywordField, brandAliases, ...) */
    private final String field;

    /** Human-readable warning message */
    private final String message;

    /** Supporting evidence, e.g. the duplicated word */
    private final String evidence;

    public AuditWarning(String code, String field, String message, String evidence) {
        this.code = code;
        this.field = field;
        this.message = message;
        this.evidence = evidence;
    }

    public String getCode() { return code; }
    public String getField() { return field; }
    public String getMessage() { return message; }
    public String getEvidence() { return evidence; }

    public static AuditWarning emptyElement(String field) {
        return new AuditWarning(EMPTY_ELEMENT, field,
                String.format("Field '%s' contains no usable keywords", field), null);
    }

    public static AuditWarning duplicateKeyword(String field, String word) {
        return new AuditWarning(DUPLICATE_KEYWORD, field,
                String.format("Keyword '%s' is repeated and adds no new combinations", word), word);
    }

    public static AuditWarning identicalElements(String evidence) {
        return new AuditWarning(IDENTICAL_ELEMENTS, "subtitle",
                "Subtitle repeats the title keywords and adds no coverage", evidence);
    }

    public static AuditWarning insufficientTokens(int distinct) {
        return new AuditWarning(INSUFFICIENT_TOKENS, null,
                String.format("Only %d distinct keyword(s); at least 2 are needed to form combinations", distinct),
                null);
    }

    public static AuditWarning aliasesNormalized(String field, int before, int after) {
        return new AuditWarning(ALIASES_NORMALIZED, field,
                String.format("Alias list normalized from %d to %d entries", before, after), null);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AuditWarning other)) return false;
        return Objects.equals(code, other.code) && Objects.equals(field, other.field)
                && Objects.equals(message, other.message) && Objects.equals(evidence, other.evidence);
    }

    @Override
    public int hashCode() {
        return Objects.hash(code, field, message, evidence);
    }

    @Override
    public String toString() {
        return code + ": " + message;
    }
}
