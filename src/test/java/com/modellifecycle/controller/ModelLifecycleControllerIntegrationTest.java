package com.modellifecycle.controller;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.client.WireMock;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import com.modellifecycle.dto.DriftCheckRequest;
import com.modellifecycle.dto.RecordOutcomeRequest;
import com.modellifecycle.dto.RecordPredictionRequest;
import com.modellifecycle.dto.RegisterModelRequest;
import com.modellifecycle.dto.RetrainingRunRequest;
import com.modellifecycle.repository.ModelVersionRepository;
import com.modellifecycle.repository.PredictionLogRepository;
import org.junit.jupiter.api.*;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.*;
import org.springframework.test.context.ActiveProfiles;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
class ModelLifecycleControllerIntegrationTest {

    private static WireMockServer wireMock;

    @Autowired TestRestTemplate        restTemplate;
    @Autowired ModelVersionRepository  versionRepository;
    @Autowired PredictionLogRepository predictionRepository;

    @BeforeAll
    static void startWireMock() {
        wireMock = new WireMockServer(WireMockConfiguration.wireMockConfig().port(9090));
        wireMock.start();
        WireMock.configureFor("localhost", 9090);
    }

    @AfterAll
    static void stopWireMock() { wireMock.stop(); }

    @BeforeEach
    void cleanState() {
        versionRepository.deleteAll();
        predictionRepository.deleteAll();
    }

    @AfterEach
    void resetStubs() { wireMock.resetAll(); }

    private ResponseEntity<Map> register(String versionId) {
        RegisterModelRequest request = RegisterModelRequest.builder()
            .versionId(versionId).artifactLocation("sha256:" + "0".repeat(64))
            .metrics(Map.of("accuracy", 0.87, "auc_roc", 0.91)).metadata(Map.of("owner", "ml-team"))
            .build();
        return restTemplate.postForEntity("/api/v1/models", request, Map.class);
    }

    private void promote(String versionId, String target) {
        ResponseEntity<Map> resp = restTemplate.postForEntity(
            "/api/v1/models/" + versionId + "/promote/" + target, null, Map.class);
        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
    }

    @Test
    void register_returnsCreatedRegisteredVersion() {
        ResponseEntity<Map> resp = register("v1.0.0");

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        assertThat(resp.getBody().get("state")).isEqualTo("REGISTERED");
        assertThat(resp.getHeaders().getLocation()).hasPath("/api/v1/models/v1.0.0");
    }

    @Test
    void register_duplicate_returns400() {
        register("v1");
        ResponseEntity<Map> resp = register("v1");
        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(resp.getBody().get("errorCode")).isEqualTo("DUPLICATE_VERSION");
    }

    @Test
    void register_invalidVersionId_returns422() {
        ResponseEntity<Map> resp = register("not a valid id");
        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        assertThat(resp.getBody()).containsKey("fieldErrors");
    }

    @Test
    void promotionFlow_exposesProductionAndProtectsDelete() {
        register("v1");
        promote("v1", "staging");
        promote("v1", "production");

        ResponseEntity<Map> production = restTemplate.getForEntity("/api/v1/models/production", Map.class);
        assertThat(production.getBody().get("versionId")).isEqualTo("v1");

        ResponseEntity<Map> delete = restTemplate.exchange("/api/v1/models/v1", HttpMethod.DELETE, null, Map.class);
        assertThat(delete.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(delete.getBody().get("errorCode")).isEqualTo("PROTECTED_VERSION");
    }

    @Test
    void noStagingVersion_returns204() {
        ResponseEntity<Map> resp = restTemplate.getForEntity("/api/v1/models/staging", Map.class);
        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.NO_CONTENT);
    }

    @Test
    void rollbackWithoutArchivedVersion_returns409() {
        ResponseEntity<Map> resp = restTemplate.postForEntity("/api/v1/models/rollback", null, Map.class);
        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(resp.getBody().get("errorCode")).isEqualTo("NO_ROLLBACK_TARGET");
    }

    @Test
    void unknownVersion_returns404() {
        ResponseEntity<Map> resp = restTemplate.getForEntity("/api/v1/models/ghost", Map.class);
        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    }

    @Test
    void requestId_isEchoed() {
        HttpHeaders headers = new HttpHeaders();
        headers.set("X-Request-ID", "trace-42");
        ResponseEntity<Map> resp = restTemplate.exchange("/api/v1/models/summary", HttpMethod.GET,
            new HttpEntity<>(headers), Map.class);
        assertThat(resp.getHeaders().getFirst("X-Request-ID")).isEqualTo("trace-42");
    }

    @Test
    void outcome_isWriteOnce() {
        ResponseEntity<Map> created = restTemplate.postForEntity("/api/v1/monitoring/predictions",
            RecordPredictionRequest.builder().modelVersionId("v1").prediction("1")
                .probability(0.8).confidence(0.9).features(Map.of("glucose", 140.0)).build(),
            Map.class);
        assertThat(created.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        String id = (String) created.getBody().get("predictionId");

        HttpEntity<RecordOutcomeRequest> body = new HttpEntity<>(RecordOutcomeRequest.builder().actualOutcome("1").build());
        ResponseEntity<Map> first = restTemplate.exchange("/api/v1/monitoring/predictions/" + id + "/outcome",
            HttpMethod.PATCH, body, Map.class);
        ResponseEntity<Map> second = restTemplate.exchange("/api/v1/monitoring/predictions/" + id + "/outcome",
            HttpMethod.PATCH, body, Map.class);

        assertThat(first.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(second.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
    }

    @Test
    void accuracyWithoutLabeledData_returnsNoAction() {
        ResponseEntity<Map> resp = restTemplate.getForEntity("/api/v1/monitoring/accuracy?windowDays=7", Map.class);
        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(resp.getBody().get("decision")).isEqualTo("no action");
    }

    @Test
    void driftReport_isCreatedAndRetrievable() {
        DriftCheckRequest request = DriftCheckRequest.builder()
            .modelVersionId("v1")
            .referenceSample(Map.of("glucose", Collections.nCopies(50, 1.0)))
            .currentSample(Map.of("glucose", Collections.nCopies(50, 5.0)))
            .build();
        ResponseEntity<Map> created = restTemplate.postForEntity("/api/v1/drift/reports", request, Map.class);

        assertThat(created.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        assertThat(created.getBody().get("overallDriftDetected")).isEqualTo(true);

        ResponseEntity<Map> fetched = restTemplate.getForEntity(
            "/api/v1/drift/reports/" + created.getBody().get("reportId"), Map.class);
        assertThat(fetched.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat((List<?>) fetched.getBody().get("featureDrift")).hasSize(1);
    }

    @Test
    void retrainingRun_isAcceptedWithEstimatedCompletion() {
        ResponseEntity<Map> resp = restTemplate.postForEntity("/api/v1/retraining/runs",
            RetrainingRunRequest.builder().requestedBy("ops").build(), Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.ACCEPTED);
        assertThat(resp.getBody()).containsKeys("jobId", "estimatedCompletionAt");
        assertThat(resp.getHeaders().getLocation()).isNotNull();
    }

    @Test
    void retrainingCheck_withoutData_recordsSkippedDecision() {
        ResponseEntity<Map> resp = restTemplate.postForEntity("/api/v1/retraining/check",
            Map.of("requestedBy", "ops"), Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(resp.getBody().get("outcome")).isEqualTo("SKIPPED");
        assertThat(resp.getBody().get("reason")).isEqualTo("insufficient data");

        String decisionId = (String) resp.getBody().get("decisionId");
        ResponseEntity<Map> fetched = restTemplate.getForEntity("/api/v1/retraining/decisions/" + decisionId, Map.class);
        assertThat(fetched.getStatusCode()).isEqualTo(HttpStatus.OK);
    }

    @Test
    void mlHealth_returnsUpWhenServiceReportsOk() {
        stubFor(get(urlEqualTo("/health")).willReturn(aResponse()
            .withHeader("Content-Type", "application/json").withBody("{\"status\":\"ok\"}")));
        ResponseEntity<Map> resp = restTemplate.getForEntity("/api/v1/ml/health", Map.class);
        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(resp.getBody().get("mlApi")).isEqualTo("UP");
    }
}
