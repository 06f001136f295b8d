package com.asoaudit.combos.controller;

import com.asoaudit.combos.dto.AuditDtos;
import com.asoaudit.combos.model.ComboAnalysis;
import com.asoaudit.combos.model.ComboDiff;
import com.asoaudit.combos.service.ComboAuditService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
public class ComboAuditController {
    private static final Logger log = LoggerFactory.getLogger(ComboAuditController.class);
    private final ComboAuditService auditService;

    public ComboAuditController(ComboAuditService auditService) {
        this.auditService = auditService;
    }

    /**
     * Full combo audit of one title/subtitle pair: every 2-4 word combo with its tier,
     * brand tag and priority, plus coverage statistics and warnings.
     */
    @PostMapping("/combos/analyze")
    public Mono<ComboAnalysis> analyze(@Valid @RequestBody AuditDtos.AnalyzeRequestBody body) {
        log.debug("/combos/analyze keywordField_present={} ruleSet_present={}",
                body.getKeywordField() != null, body.getRuleSet() != null);
        return Mono.fromCallable(() -> auditService.analyze(body));
    }

    /** Baseline vs draft comparison for the metadata editor. */
    @PostMapping("/combos/diff")
    public Mono<ComboDiff> diff(@Valid @RequestBody AuditDtos.DiffRequestBody body) {
        return Mono.fromCallable(() -> auditService.diff(body));
    }
}
