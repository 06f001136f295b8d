package com.asoaudit.combos.controller;

import com.asoaudit.combos.config.ComboProperties;
import com.asoaudit.combos.config.CorsConfig;
import com.asoaudit.combos.dto.AuditDtos;
import com.asoaudit.combos.model.StrengthTier;
import com.asoaudit.combos.service.ComboAuditService;
import com.asoaudit.combos.service.combo.ComboCapacityExceededException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.test.StepVerifier;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ComboAuditControllerTest {

    private static WebTestClient client(ComboProperties props) {
        ComboAuditController controller = new ComboAuditController(new ComboAuditService(props));
        return WebTestClient.bindToController(controller, new HealthController())
                .controllerAdvice(new GlobalErrorHandler())
                .build();
    }

    private static WebTestClient client() {
        return client(new ComboProperties());
    }

    @Test
    public void analyzeReturnsCombosAndStats() {
        client().post().uri("/combos/analyze")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"title\":\"Pimsleur Language Learning\",\"subtitle\":\"Learn Spanish French More\"}")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.stats.totalPossible").isEqualTo(91)
                .jsonPath("$.stats.coveragePct").isEqualTo(100)
                .jsonPath("$.stats.tierCounts.MISSING").isEqualTo(0)
                .jsonPath("$.combos[0].text").isEqualTo("pimsleur language")
                .jsonPath("$.combos[0].strengthTier").isEqualTo("TITLE_CONSECUTIVE")
                .jsonPath("$.combos[0].strengthScore").isEqualTo(100)
                .jsonPath("$.combos[0].isConsecutive").isEqualTo(true)
                .jsonPath("$.combos[0].brandTag").isEqualTo("generic")
                .jsonPath("$.combos[0].source").isEqualTo("title")
                .jsonPath("$.statsByBrandType.generic.totalPossible").isEqualTo(91);
    }

    @Test
    public void nullStopwordEntryIsIgnored() {
        client().post().uri("/combos/analyze")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"title\":\"Learn Spanish French\",\"subtitle\":\"\",\"stopwords\":[\"learn\",null]}")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.stats.totalPossible").isEqualTo(1)
                .jsonPath("$.combos[0].text").isEqualTo("spanish french");
    }

    @Test
    public void preflightFromConfiguredOriginIsAllowed() {
        ComboProperties props = new ComboProperties();
        props.setCorsAllowedOrigins(List.of("https://dashboard.example.com"));
        WebTestClient cors = WebTestClient
                .bindToController(new ComboAuditController(new ComboAuditService(props)))
                .webFilter(new CorsConfig().corsWebFilter(props))
                .build();

        cors.options().uri("/combos/analyze")
                .header("Origin", "https://dashboard.example.com")
                .header("Access-Control-Request-Method", "POST")
                .exchange()
                .expectStatus().isOk()
                .expectHeader().valueEquals("Access-Control-Allow-Origin", "https://dashboard.example.com");

        cors.options().uri("/combos/analyze")
                .header("Origin", "https://elsewhere.example.com")
                .header("Access-Control-Request-Method", "POST")
                .exchange()
                .expectStatus().isForbidden();
    }

    @Test
    public void missingTitleIsBadRequest() {
        client().post().uri("/combos/analyze")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"subtitle\":\"Learn Spanish\"}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("bad_request");
    }

    @Test
    public void outOfRangeNoiseThresholdIsBadRequest() {
        client().post().uri("/combos/analyze")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"title\":\"Learn\",\"subtitle\":\"Spanish\",\"noiseThreshold\":2.0}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("bad_request");
    }

    @Test
    public void malformedJsonIsBadRequest() {
        client().post().uri("/combos/analyze")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"title\":")
                .exchange()
                .expectStatus().isBadRequest();
    }

    @Test
    public void oversizedInputIsUnprocessable() {
        ComboProperties props = new ComboProperties();
        props.setMaxCombos(10);
        client(props).post().uri("/combos/analyze")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"title\":\"one two three\",\"subtitle\":\"four five\"}")
                .exchange()
                .expectStatus().isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY)
                .expectBody()
                .jsonPath("$.error").isEqualTo("capacity_exceeded")
                .jsonPath("$.requested").isEqualTo(25)
                .jsonPath("$.limit").isEqualTo(10);
    }

    @Test
    public void diffReportsUpgrades() {
        String body = "{\"baseline\":{\"title\":\"Learn Spanish\",\"subtitle\":\"French Lessons\"},"
                + "\"draft\":{\"title\":\"Learn Spanish French\",\"subtitle\":\"Lessons Audio\"}}";
        client().post().uri("/combos/diff")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.tierUpgrades.length()").isEqualTo(4)
                .jsonPath("$.tierUpgrades[0].text").isEqualTo("spanish french")
                .jsonPath("$.added.length()").isEqualTo(14)
                .jsonPath("$.tierDistribution.tier1.delta").isEqualTo(2)
                .jsonPath("$.keywordImpact[0].keyword").isEqualTo("audio");
    }

    @Test
    public void diffWithoutDraftIsBadRequest() {
        client().post().uri("/combos/diff")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"baseline\":{\"title\":\"Learn\",\"subtitle\":\"Spanish\"}}")
                .exchange()
                .expectStatus().isBadRequest();
    }

    @Test
    public void healthIsOk() {
        byte[] body = client().get().uri("/healthz")
                .exchange()
                .expectStatus().isOk()
                .expectBody().returnResult().getResponseBody();
        assertNotNull(body);
        assertTrue(new String(body).contains("\"ok\":true"));
    }

    @Test
    public void analyzeMonoEmitsOneAnalysis() {
        ComboAuditController controller = new ComboAuditController(new ComboAuditService(new ComboProperties()));
        AuditDtos.AnalyzeRequestBody body = new AuditDtos.AnalyzeRequestBody();
        body.setTitle("Learn Spanish");
        body.setSubtitle("French Lessons");
        StepVerifier.create(controller.analyze(body))
                .assertNext(a -> {
                    assertEquals(11, a.getCombos().size());
                    assertEquals(StrengthTier.TITLE_CONSECUTIVE, a.find("learn spanish").getStrengthTier());
                })
                .verifyComplete();
    }

    @Test
    public void capacityErrorSurfacesThroughMono() {
        ComboProperties props = new ComboProperties();
        props.setMaxCombos(0);
        ComboAuditController controller = new ComboAuditController(new ComboAuditService(props));
        AuditDtos.AnalyzeRequestBody body = new AuditDtos.AnalyzeRequestBody();
        body.setTitle("Learn Spanish");
        body.setSubtitle("");
        StepVerifier.create(controller.analyze(body))
                .expectError(ComboCapacityExceededException.class)
                .verify();
    }
}
