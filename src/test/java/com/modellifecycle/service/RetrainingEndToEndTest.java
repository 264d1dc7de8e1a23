package com.modellifecycle.service;

import com.modellifecycle.client.Evaluator;
import com.modellifecycle.client.Trainer;
import com.modellifecycle.dto.RecordPredictionRequest;
import com.modellifecycle.entity.DecisionOutcome;
import com.modellifecycle.entity.ModelType;
import com.modellifecycle.entity.ModelVersion;
import com.modellifecycle.entity.PredictionLogEntry;
import com.modellifecycle.entity.RetrainingDecision;
import com.modellifecycle.entity.TriggerReason;
import com.modellifecycle.exception.TrainingFailedException;
import com.modellifecycle.repository.ModelVersionRepository;
import com.modellifecycle.repository.PredictionLogRepository;
import com.modellifecycle.repository.RetrainingDecisionRepository;
import com.modellifecycle.storage.ArtifactStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.test.context.ActiveProfiles;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
class RetrainingEndToEndTest {

    @Autowired RetrainingOrchestratorService orchestrator;
    @Autowired ModelRegistryService          registry;
    @Autowired PerformanceMonitorService     monitor;
    @Autowired ArtifactStore                 artifactStore;
    @Autowired StubTrainingBackend           backend;
    @Autowired ModelVersionRepository        versionRepository;
    @Autowired PredictionLogRepository       predictionRepository;
    @Autowired RetrainingDecisionRepository  decisionRepository;

    @BeforeEach
    void reset() {
        versionRepository.deleteAll();
        predictionRepository.deleteAll();
        backend.failTraining = false;
        backend.candidateMetrics = Map.of();
    }

    private void productionModel(Map<String, Double> metrics) {
        registry.register("prod-1", artifactStore.put("prod-1".getBytes(StandardCharsets.UTF_8)), metrics, Map.of());
        registry.promoteToStaging("prod-1");
        registry.promoteToProduction("prod-1");
    }

    @Test
    void forcedRun_withDominatingCandidate_stagesCandidateAndKeepsProduction() {
        productionModel(Map.of("accuracy", 0.80, "f1_score", 0.76, "auc_roc", 0.84));
        backend.candidateMetrics = Map.of("accuracy", 0.90, "f1_score", 0.86, "auc_roc", 0.93);

        RetrainingDecision decision = orchestrator.run(true, true);

        assertThat(decision.isPromoted()).isTrue();
        assertThat(decision.getCandidateVersionId()).startsWith("retrain_");
        assertThat(registry.getStaging()).map(ModelVersion::getVersionId).contains(decision.getCandidateVersionId());
        assertThat(registry.getProduction()).map(ModelVersion::getVersionId).contains("prod-1");
        assertThat(registry.get(decision.getCandidateVersionId()).getMetrics()).containsEntry("auc_roc", 0.93);

        RetrainingDecision stored = decisionRepository.findById(decision.getId()).orElseThrow();
        assertThat(stored.getOutcome()).isEqualTo(DecisionOutcome.PROMOTED);
        assertThat(stored.getComparisonSummary().get("accuracy").isImproved()).isTrue();
    }

    @Test
    void trainingFailure_persistsFailedDecisionAndRegistersNothing() {
        productionModel(Map.of("accuracy", 0.80, "f1_score", 0.76, "auc_roc", 0.84));
        backend.failTraining = true;

        TrainingFailedException ex = catchThrowableOfType(() -> orchestrator.run(true, true), TrainingFailedException.class);

        assertThat(ex.getDecisionId()).isNotNull();
        RetrainingDecision stored = decisionRepository.findById(ex.getDecisionId()).orElseThrow();
        assertThat(stored.getOutcome()).isEqualTo(DecisionOutcome.FAILED);
        assertThat(stored.isRetrainingPerformed()).isFalse();
        assertThat(registry.list(null)).extracting(ModelVersion::getVersionId).containsExactly("prod-1");
    }

    @Test
    void nonForcedRun_firesOnDegradedAccuracy() {
        productionModel(Map.of("accuracy", 0.85, "f1_score", 0.80, "auc_roc", 0.88));
        for (int i = 0; i < 120; i++) {
            PredictionLogEntry entry = monitor.recordPrediction(RecordPredictionRequest.builder()
                .modelVersionId("prod-1").prediction("1").probability(0.8).confidence(0.8)
                .features(Map.of("glucose", 100.0 + i)).build());
            monitor.recordOutcome(entry.getId(), i % 10 < 6 ? "1" : "0");
        }
        backend.candidateMetrics = Map.of("accuracy", 0.86, "f1_score", 0.79, "auc_roc", 0.87);

        RetrainingDecision decision = orchestrator.run(false, true);

        assertThat(decision.getTriggerReason()).isEqualTo(TriggerReason.PERFORMANCE_DEGRADATION);
        assertThat(decision.isRetrainingPerformed()).isTrue();
        assertThat(decision.getOutcome()).isEqualTo(DecisionOutcome.NOT_PROMOTED);
        assertThat(registry.getStaging()).isEmpty();
    }

    static class StubTrainingBackend implements Trainer, Evaluator {

        private final ArtifactStore artifactStore;
        private final AtomicInteger runs = new AtomicInteger();
        volatile boolean failTraining;
        volatile Map<String, Double> candidateMetrics = Map.of();

        StubTrainingBackend(ArtifactStore artifactStore) {
            this.artifactStore = artifactStore;
        }

        @Override
        public TrainingResult train(String datasetReference) {
            if (failTraining) {
                throw new TrainingFailedException("dataset " + datasetReference + " unavailable", null);
            }
            byte[] artifact = ("candidate-" + runs.incrementAndGet()).getBytes(StandardCharsets.UTF_8);
            return new TrainingResult(artifactStore.put(artifact), ModelType.GRADIENT_BOOSTED, Map.of());
        }

        @Override
        public Map<String, Double> evaluate(String artifactLocation, String testSetReference) {
            return candidateMetrics;
        }
    }

    @TestConfiguration
    static class StubBackendConfig {

        @Bean
        @Primary
        StubTrainingBackend stubTrainingBackend(ArtifactStore artifactStore) {
            return new StubTrainingBackend(artifactStore);
        }
    }
}
