package com.asoaudit.combos.service.combo;

import java.util.List;

/**
 * Metadata of one app under audit.
 *
 * @param keywordField      App Store keyword field, comma or space separated; may be {@code null}
 * @param brandAliases      raw brand aliases; normalized by the engine
 * @param competitorAliases raw competitor aliases; normalized by the engine
 * @param seedKeywords      words the app wants to rank for; combos built with them are
 *                          candidates to add to the metadata
 */
public record ComboAuditInput(String title,
                              String subtitle,
                              String keywordField,
                              List<String> brandAliases,
                              List<String> competitorAliases,
                              List<String> seedKeywords) {

    public ComboAuditInput {
        brandAliases = brandAliases != null ? brandAliases : List.of();
        competitorAliases = competitorAliases != null ? competitorAliases : List.of();
        seedKeywords = seedKeywords != null ? seedKeywords : List.of();
    }

    public ComboAuditInput(String title, String subtitle, String keywordField,
                           List<String> brandAliases, List<String> competitorAliases) {
        this(title, subtitle, keywordField, brandAliases, competitorAliases, List.of());
    }

    public static ComboAuditInput of(String title, String subtitle) {
        return new ComboAuditInput(title, subtitle, null, List.of(), List.of(), List.of());
    }
}
