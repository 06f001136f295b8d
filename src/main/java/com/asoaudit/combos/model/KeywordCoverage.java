package com.asoaudit.combos.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Per-element keyword inventory of one analysis.
 *
 * @param titleKeywords       distinct title keywords in title order
 * @param subtitleKeywords    distinct subtitle keywords in subtitle order
 * @param subtitleNewKeywords subtitle keywords not already in the title
 * @param keywordPool         keyword-field words not present in title or subtitle
 * @param duplicatedKeywords  words occurring more than once across all elements
 * @param ignoredStopwords    number of stopwords dropped, per element
 */
public record KeywordCoverage(List<String> titleKeywords,
                              List<String> subtitleKeywords,
                              List<String> subtitleNewKeywords,
                              List<String> keywordPool,
                              List<String> duplicatedKeywords,
                              Map<TokenSource, Integer> ignoredStopwords) {

    public KeywordCoverage {
        titleKeywords = List.copyOf(titleKeywords);
        subtitleKeywords = List.copyOf(subtitleKeywords);
        subtitleNewKeywords = List.copyOf(subtitleNewKeywords);
        keywordPool = List.copyOf(keywordPool);
        duplicatedKeywords = List.copyOf(duplicatedKeywords);
        EnumMap<TokenSource, Integer> ordered = new EnumMap<>(TokenSource.class);
        ordered.putAll(ignoredStopwords);
        ignoredStopwords = Collections.unmodifiableMap(ordered);
    }
}
