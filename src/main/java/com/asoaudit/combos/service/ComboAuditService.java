package com.asoaudit.combos.service;

import com.asoaudit.combos.config.ComboProperties;
import com.asoaudit.combos.dto.AuditDtos;
import com.asoaudit.combos.model.ComboAnalysis;
import com.asoaudit.combos.model.ComboDiff;
import com.asoaudit.combos.service.combo.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Turns audit requests into engine calls.
 *
 * <p>Application properties supply the defaults of every {@link EngineConfig}; the
 * request may override stopwords, noise threshold and rule set. A {@code brandName}
 * without explicit aliases expands into generated aliases, and a request without
 * competitor aliases gets the configured defaults.
 */
@Service
public class ComboAuditService {
    private static final Logger log = LoggerFactory.getLogger(ComboAuditService.class);

    private final ComboProperties properties;
    private final ComboEngine engine = new ComboEngine();
    private final ComboDiffer differ = new ComboDiffer();

    public ComboAuditService(ComboProperties properties) {
        this.properties = properties;
    }

    public ComboAnalysis analyze(AuditDtos.AnalyzeRequestBody body) {
        long t0 = System.currentTimeMillis();
        ComboAnalysis analysis = engine.analyze(toInput(body), toConfig(body));
        log.info("Combo audit: title='{}' subtitle='{}' combos={} coverage={}% warnings={} ms={}",
                body.getTitle(), body.getSubtitle(), analysis.getCombos().size(),
                analysis.getStats().getCoveragePct(), analysis.getWarnings().size(),
                System.currentTimeMillis() - t0);
        return analysis;
    }

    public ComboDiff diff(AuditDtos.DiffRequestBody body) {
        ComboAnalysis baseline = analyze(body.getBaseline());
        ComboAnalysis draft = analyze(body.getDraft());
        ComboDiff diff = differ.diff(baseline, draft);
        log.info("Combo diff: added={} removed={} upgrades={} downgrades={} coverage {}% -> {}%",
                diff.added().size(), diff.removed().size(), diff.tierUpgrades().size(),
                diff.tierDowngrades().size(), diff.baselineCoveragePct(), diff.draftCoveragePct());
        return diff;
    }

    ComboAuditInput toInput(AuditDtos.AnalyzeRequestBody body) {
        List<String> brandAliases = body.getBrandAliases();
        if ((brandAliases == null || brandAliases.isEmpty()) && body.getBrandName() != null) {
            brandAliases = BrandClassifier.generateBrandAliases(body.getBrandName());
        }
        List<String> competitorAliases = body.getCompetitorAliases();
        if (competitorAliases == null) {
            competitorAliases = properties.getDefaultCompetitorAliases();
        }
        return new ComboAuditInput(body.getTitle(), body.getSubtitle(), body.getKeywordField(),
                brandAliases, competitorAliases, body.getSeedKeywords());
    }

    EngineConfig toConfig(AuditDtos.AnalyzeRequestBody body) {
        EngineConfig.Builder b = EngineConfig.builder()
                .maxCombos(properties.getMaxCombos())
                .recommendationLimit(properties.getRecommendationLimit())
                .noiseThreshold(properties.getNoiseThreshold());
        if (!isEmpty(properties.getStopwords())) b.stopwords(properties.getStopwords());
        if (!isEmpty(properties.getLowValueTerms())) b.lowValueTerms(properties.getLowValueTerms());

        if (body.getStopwords() != null) b.stopwords(body.getStopwords());
        if (body.getNoiseThreshold() != null) b.noiseThreshold(body.getNoiseThreshold());
        AuditDtos.RuleSetBody rs = body.getRuleSet();
        if (rs != null) {
            b.ruleSet(new RuleSet(rs.getVerticalId(), rs.getWeights(), rs.getVerticalTerms()));
        }
        return b.build();
    }

    private static boolean isEmpty(List<String> values) {
        return values == null || values.isEmpty();
    }
}
