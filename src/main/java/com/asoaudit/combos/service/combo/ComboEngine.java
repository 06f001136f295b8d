package com.asoaudit.combos.service.combo;

import com.asoaudit.combos.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Runs a full combo audit over one app's metadata.
 *
 * <h3>Stages</h3>
 * <ol>
 *   <li><strong>Tokenizer</strong> - title, subtitle and keyword field into filtered tokens</li>
 *   <li><strong>ComboGenerator</strong> - every 2-4 word candidate over the token universe and seed keywords</li>
 *   <li><strong>TierClassifier</strong> - existence and strength tier per candidate</li>
 *   <li><strong>BrandClassifier</strong> / <strong>NoiseScorer</strong> - orthogonal tags</li>
 *   <li><strong>PriorityScorer</strong> - weighted 0-100 priority</li>
 *   <li><strong>CoverageAggregator</strong> - totals and histograms</li>
 * </ol>
 *
 * <p>The engine holds no state; all settings arrive in the {@link EngineConfig} of
 * each call, and each call returns a fresh {@link ComboAnalysis}. Degenerate input
 * produces warnings, never exceptions. The single surfaced failure is
 * {@link ComboCapacityExceededException}.
 *
 * @see ComboDiffer
 * @see ComboQueries
 */
public class ComboEngine {
    private static final Logger log = LoggerFactory.getLogger(ComboEngine.class);

    private final TierClassifier tierClassifier = new TierClassifier();
    private final BrandClassifier brandClassifier = new BrandClassifier();
    private final CoverageAggregator aggregator = new CoverageAggregator();

    public ComboAnalysis analyze(ComboAuditInput input, EngineConfig config) {
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(config, "config");
        List<AuditWarning> warnings = new ArrayList<>();

        Tokenizer tokenizer = new Tokenizer(config.getStopwords());
        List<Token> titleTokens = tokenizer.tokenize(input.title(), TokenSource.TITLE);
        List<Token> subtitleTokens = tokenizer.tokenize(input.subtitle(), TokenSource.SUBTITLE);
        List<Token> keywordTokens = tokenizer.parseKeywordField(input.keywordField());
        ElementTokens elements = new ElementTokens(titleTokens, subtitleTokens, keywordTokens);
        log.debug("Tokens: title={} subtitle={} keywordField={} pool={}",
                titleTokens.size(), subtitleTokens.size(), keywordTokens.size(), elements.getPoolTokens().size());

        List<String> brandAliases = normalizeAliases("brandAliases", input.brandAliases(), warnings);
        List<String> competitorAliases = normalizeAliases("competitorAliases", input.competitorAliases(), warnings);

        collectElementWarnings(input, elements, warnings);

        List<Token> seedTokens = tokenizer.parseKeywordField(String.join(",", nonNull(input.seedKeywords())));
        ComboGenerator generator = new ComboGenerator(config.getMaxCombos());
        List<CandidateCombo> candidates = generator.generateCombos(
                elements.getTitleTokens(), elements.getSubtitleTokens(), elements.getPoolTokens(), seedTokens);
        int distinct = ComboGenerator.universe(
                elements.getTitleTokens(), elements.getSubtitleTokens(), elements.getPoolTokens(), seedTokens).size();
        if (distinct < ComboGenerator.MIN_LENGTH) {
            warnings.add(AuditWarning.insufficientTokens(distinct));
        }

        NoiseScorer noiseScorer = new NoiseScorer(config.getLowValueTerms(), config.getNoiseThreshold());
        PriorityScorer priorityScorer = new PriorityScorer(config.getRuleSet());
        CorpusStats corpus = CorpusStats.of(elements);

        List<Combo> combos = new ArrayList<>(candidates.size());
        for (CandidateCombo candidate : candidates) {
            combos.add(evaluate(candidate.keywords(), elements, brandAliases, competitorAliases,
                    noiseScorer, priorityScorer, corpus));
        }
        log.debug("Classified {} combos", combos.size());

        BrandTypeStats stats = aggregator.aggregateByBrandType(combos);
        KeywordCoverage coverage = keywordCoverage(input, tokenizer, elements);

        ComboAnalysis analysis = new ComboAnalysis(
                combos,
                stats,
                coverage,
                recommendations(combos, config.getRecommendationLimit()),
                strengthenOpportunities(combos),
                warnings);
        log.debug("Coverage {}% ({}/{}), {} warning(s)", stats.all().getCoveragePct(),
                stats.all().getExisting(), stats.all().getTotalPossible(), warnings.size());
        return analysis;
    }

    /**
     * Classifies a single word list, which need not come from the generator (for
     * example a combo typed by a user).
     */
    public Combo classify(List<String> keywords, ComboAuditInput input, EngineConfig config) {
        Tokenizer tokenizer = new Tokenizer(config.getStopwords());
        ElementTokens elements = new ElementTokens(
                tokenizer.tokenize(input.title(), TokenSource.TITLE),
                tokenizer.tokenize(input.subtitle(), TokenSource.SUBTITLE),
                tokenizer.parseKeywordField(input.keywordField()));
        List<String> words = new ArrayList<>(keywords.size());
        for (String k : keywords) words.add(k.toLowerCase(Locale.ROOT));
        return evaluate(words, elements,
                BrandClassifier.normalizeAliases(input.brandAliases()),
                BrandClassifier.normalizeAliases(input.competitorAliases()),
                new NoiseScorer(config.getLowValueTerms(), config.getNoiseThreshold()),
                new PriorityScorer(config.getRuleSet()),
                CorpusStats.of(elements));
    }

    private Combo evaluate(List<String> keywords,
                           ElementTokens elements,
                           List<String> brandAliases,
                           List<String> competitorAliases,
                           NoiseScorer noiseScorer,
                           PriorityScorer priorityScorer,
                           CorpusStats corpus) {
        TierResult tier = tierClassifier.classify(keywords, elements);
        List<String> ordered = tier.keywords();
        BrandResult brand = brandClassifier.classify(ordered, brandAliases, competitorAliases);
        double noiseConfidence = noiseScorer.confidence(ordered);
        PriorityFactors factors = priorityScorer.score(ordered, tier.tier(), brand, noiseConfidence, corpus);
        return Combo.builder()
                .keywords(ordered)
                .source(tier.source())
                .strengthTier(tier.tier())
                .brandTag(brand.tag())
                .matchedAlias(brand.matchedAlias())
                .noiseConfidence(noiseConfidence)
                .noise(noiseScorer.isNoise(noiseConfidence))
                .priorityFactors(factors)
                .strengtheningSuggestion(tier.suggestion())
                .build();
    }

    private static List<String> nonNull(List<String> values) {
        List<String> out = new ArrayList<>(values.size());
        for (String v : values) {
            if (v != null) out.add(v);
        }
        return out;
    }

    private static List<String> normalizeAliases(String field, List<String> raw, List<AuditWarning> warnings) {
        List<String> normalized = BrandClassifier.normalizeAliases(raw);
        if (!normalized.equals(raw)) {
            warnings.add(AuditWarning.aliasesNormalized(field, raw.size(), normalized.size()));
        }
        return normalized;
    }

    private static void collectElementWarnings(ComboAuditInput input, ElementTokens elements, List<AuditWarning> warnings) {
        if (elements.getTitleTokens().isEmpty()) warnings.add(AuditWarning.emptyElement("title"));
        if (elements.getSubtitleTokens().isEmpty()) warnings.add(AuditWarning.emptyElement("subtitle"));

        Set<String> earlier = new HashSet<>();
        duplicates("title", elements.getTitleTokens(), earlier, warnings);
        duplicates("subtitle", elements.getSubtitleTokens(), earlier, warnings);
        if (input.keywordField() != null) {
            duplicates("keywordField", elements.getRawKeywordTokens(), earlier, warnings);
        }

        List<String> titleWords = elements.titleWords();
        List<String> subtitleWords = elements.subtitleWords();
        if (!titleWords.isEmpty() && new HashSet<>(titleWords).equals(new HashSet<>(subtitleWords))) {
            warnings.add(AuditWarning.identicalElements(String.join(" ", titleWords)));
        }
    }

    /**
     * Reports each word of {@code tokens} once when it repeats within the element or
     * already appeared in an earlier one, then adds the element's words to {@code earlier}.
     */
    private static void duplicates(String field, List<Token> tokens, Set<String> earlier, List<AuditWarning> warnings) {
        Set<String> seen = new HashSet<>();
        Set<String> reported = new HashSet<>();
        for (Token t : tokens) {
            String w = t.getText();
            boolean duplicate = !seen.add(w) || earlier.contains(w);
            if (duplicate && reported.add(w)) {
                warnings.add(AuditWarning.duplicateKeyword(field, w));
            }
        }
        earlier.addAll(seen);
    }

    private static KeywordCoverage keywordCoverage(ComboAuditInput input, Tokenizer tokenizer, ElementTokens elements) {
        List<String> titleWords = elements.titleWords();
        List<String> subtitleWords = elements.subtitleWords();
        List<String> subtitleNew = new ArrayList<>();
        for (String w : subtitleWords) {
            if (!elements.inTitle(w)) subtitleNew.add(w);
        }

        Map<String, Integer> counts = new LinkedHashMap<>();
        for (Token t : elements.getTitleTokens()) counts.merge(t.getText(), 1, Integer::sum);
        for (Token t : elements.getSubtitleTokens()) counts.merge(t.getText(), 1, Integer::sum);
        for (Token t : elements.getRawKeywordTokens()) counts.merge(t.getText(), 1, Integer::sum);
        List<String> duplicated = new ArrayList<>();
        counts.forEach((w, n) -> {
            if (n > 1) duplicated.add(w);
        });

        Map<TokenSource, Integer> ignored = new EnumMap<>(TokenSource.class);
        ignored.put(TokenSource.TITLE, stopwordCount(tokenizer.tokenizeAll(input.title(), TokenSource.TITLE)));
        ignored.put(TokenSource.SUBTITLE, stopwordCount(tokenizer.tokenizeAll(input.subtitle(), TokenSource.SUBTITLE)));
        String field = input.keywordField() != null ? input.keywordField().replace(',', ' ') : null;
        ignored.put(TokenSource.KEYWORDS, stopwordCount(tokenizer.tokenizeAll(field, TokenSource.KEYWORDS)));

        return new KeywordCoverage(titleWords, subtitleWords, subtitleNew, elements.poolWords(), duplicated, ignored);
    }

    private static int stopwordCount(List<Token> tokens) {
        int n = 0;
        for (Token t : tokens) {
            if (t.isStopword()) n++;
        }
        return n;
    }

    /** Missing, non-noise, generic combos by priority desc then text asc. */
    static List<Combo> recommendations(List<Combo> combos, int limit) {
        List<Combo> out = new ArrayList<>();
        for (Combo c : combos) {
            if (c.exists() || c.isNoise() || c.getBrandTag() != BrandTag.GENERIC) continue;
            out.add(c);
        }
        out.sort(Comparator.comparingDouble(Combo::getPriorityScore).reversed()
                .thenComparing(Combo::getText));
        return out.size() > limit ? new ArrayList<>(out.subList(0, limit)) : out;
    }

    /** Strengthenable combos, closest to the top tier first. */
    static List<StrengthenOpportunity> strengthenOpportunities(List<Combo> combos) {
        List<Combo> candidates = new ArrayList<>();
        for (Combo c : combos) {
            if (c.canStrengthen()) candidates.add(c);
        }
        candidates.sort(Comparator.comparingInt((Combo c) -> StrengthTier.MISSING.getRank() - c.getTierRank()).reversed()
                .thenComparing(Comparator.comparingDouble(Combo::getPriorityScore).reversed())
                .thenComparing(Combo::getText));
        List<StrengthenOpportunity> out = new ArrayList<>(candidates.size());
        for (Combo c : candidates) {
            out.add(new StrengthenOpportunity(c.getText(), c.getStrengthTier(), c.getTierRank(),
                    c.getStrengtheningSuggestion()));
        }
        return out;
    }
}
