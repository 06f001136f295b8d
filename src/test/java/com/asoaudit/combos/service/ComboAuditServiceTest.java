package com.asoaudit.combos.service;

import com.asoaudit.combos.config.ComboProperties;
import com.asoaudit.combos.dto.AuditDtos;
import com.asoaudit.combos.model.BrandTag;
import com.asoaudit.combos.model.ComboAnalysis;
import com.asoaudit.combos.model.ComboDiff;
import com.asoaudit.combos.service.combo.ComboAuditInput;
import com.asoaudit.combos.service.combo.EngineConfig;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ComboAuditServiceTest {

    private static AuditDtos.AnalyzeRequestBody body(String title, String subtitle) {
        AuditDtos.AnalyzeRequestBody b = new AuditDtos.AnalyzeRequestBody();
        b.setTitle(title);
        b.setSubtitle(subtitle);
        return b;
    }

    @Test
    public void brandNameExpandsToAliasesWhenNoneGiven() {
        ComboAuditService service = new ComboAuditService(new ComboProperties());
        AuditDtos.AnalyzeRequestBody b = body("Pimsleur Language Learning", "Learn Spanish");
        b.setBrandName("Pimsleur");
        ComboAuditInput input = service.toInput(b);
        assertTrue(input.brandAliases().contains("pimsleur"));
        assertTrue(input.brandAliases().contains("pimsleur language"));

        ComboAnalysis a = service.analyze(b);
        assertEquals(BrandTag.BRAND, a.find("pimsleur language").getBrandTag());
        assertEquals(BrandTag.GENERIC, a.find("language learning").getBrandTag());
    }

    @Test
    public void explicitAliasesWinOverBrandName() {
        ComboAuditService service = new ComboAuditService(new ComboProperties());
        AuditDtos.AnalyzeRequestBody b = body("Pimsleur Language", "Learn Spanish");
        b.setBrandName("Pimsleur");
        b.setBrandAliases(List.of("Speak Up"));
        assertEquals(List.of("Speak Up"), service.toInput(b).brandAliases());
    }

    @Test
    public void configuredCompetitorsApplyWhenRequestHasNone() {
        ComboProperties props = new ComboProperties();
        props.setDefaultCompetitorAliases(List.of("duolingo"));
        ComboAuditService service = new ComboAuditService(props);

        ComboAnalysis a = service.analyze(body("Duolingo Spanish", "Learn Fast"));
        assertEquals(BrandTag.COMPETITOR, a.find("duolingo spanish").getBrandTag());

        AuditDtos.AnalyzeRequestBody explicit = body("Duolingo Spanish", "Learn Fast");
        explicit.setCompetitorAliases(List.of());
        assertEquals(BrandTag.GENERIC, service.analyze(explicit).find("duolingo spanish").getBrandTag());
    }

    @Test
    public void requestOverridesPropertyDefaults() {
        ComboProperties props = new ComboProperties();
        props.setMaxCombos(500);
        props.setRecommendationLimit(3);
        props.setNoiseThreshold(0.6);
        ComboAuditService service = new ComboAuditService(props);

        AuditDtos.AnalyzeRequestBody b = body("Learn Spanish", "French");
        b.setNoiseThreshold(0.9);
        b.setStopwords(List.of("french"));
        AuditDtos.RuleSetBody rs = new AuditDtos.RuleSetBody();
        rs.setVerticalId("education");
        rs.setWeights(Map.of("relevance", 1.0));
        rs.setVerticalTerms(Map.of("spanish", 1.0));
        b.setRuleSet(rs);

        EngineConfig config = service.toConfig(b);
        assertEquals(500, config.getMaxCombos());
        assertEquals(3, config.getRecommendationLimit());
        assertEquals(0.9, config.getNoiseThreshold());
        assertTrue(config.getStopwords().contains("french"));
        assertEquals("education", config.getRuleSet().verticalId());
    }

    @Test
    public void seedKeywordsProduceRecommendations() {
        ComboProperties props = new ComboProperties();
        props.setRecommendationLimit(3);
        ComboAuditService service = new ComboAuditService(props);
        AuditDtos.AnalyzeRequestBody b = body("Learn Spanish", "Audio Lessons");
        b.setSeedKeywords(List.of("grammar", "vocabulary"));
        ComboAnalysis a = service.analyze(b);
        assertEquals(3, a.getRecommendedToAdd().size());
        assertTrue(a.getStats().getMissing() > 0);
    }

    @Test
    public void diffComparesBothRequests() {
        ComboAuditService service = new ComboAuditService(new ComboProperties());
        AuditDtos.DiffRequestBody d = new AuditDtos.DiffRequestBody();
        d.setBaseline(body("Learn Spanish", "French Lessons"));
        d.setDraft(body("Learn Spanish French", "Lessons"));
        ComboDiff diff = service.diff(d);
        assertTrue(diff.added().isEmpty());
        assertTrue(diff.removed().isEmpty());
        assertFalse(diff.tierUpgrades().isEmpty());
    }
}
