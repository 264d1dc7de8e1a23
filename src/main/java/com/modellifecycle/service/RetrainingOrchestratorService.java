package com.modellifecycle.service;

import com.modellifecycle.client.Evaluator;
import com.modellifecycle.client.Trainer;
import com.modellifecycle.dto.AsyncJobResponse;
import com.modellifecycle.dto.ComparisonResult;
import com.modellifecycle.dto.RetrainVerdict;
import com.modellifecycle.dto.RetrainingCheckRequest;
import com.modellifecycle.dto.RetrainingDecisionResponse;
import com.modellifecycle.dto.RetrainingRunRequest;
import com.modellifecycle.entity.DecisionOutcome;
import com.modellifecycle.entity.DriftReport;
import com.modellifecycle.entity.MetricDelta;
import com.modellifecycle.entity.ModelVersion;
import com.modellifecycle.entity.RetrainingDecision;
import com.modellifecycle.entity.RetrainingPhase;
import com.modellifecycle.entity.TriggerReason;
import com.modellifecycle.exception.DecisionNotFoundException;
import com.modellifecycle.exception.StorageException;
import com.modellifecycle.exception.TrainingFailedException;
import com.modellifecycle.repository.RetrainingDecisionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Decides whether to retrain, drives one training run and records exactly one
 * {@link RetrainingDecision} per invocation, failures included.
 *
 * <p>A run moves through {@code CHECKING_TRIGGERS -> PREPARING -> TRAINING -> EVALUATING ->
 * COMPARING -> (PROMOTING | RECORDED)}. The candidate is only registered once it has been judged
 * better and auto promotion is on; the furthest it is ever moved is {@code STAGING}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RetrainingOrchestratorService {

    static final List<String> KEY_METRICS = List.of("accuracy", "f1_score", "auc_roc");
    static final int REQUIRED_IMPROVEMENTS = 2;
    static final String NO_PRODUCTION = "no production model to compare against";
    static final String CANDIDATE_PREFIX = "retrain_";
    private static final int MAX_FAILURE_REASON = 1000;

    private static final DateTimeFormatter CANDIDATE_SUFFIX =
        DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS").withZone(ZoneOffset.UTC);

    private final ModelRegistryService registry;
    private final PerformanceMonitorService monitor;
    private final DriftDetectorService driftDetector;
    private final Trainer trainer;
    private final Evaluator evaluator;
    private final RetrainingDecisionRepository decisionRepository;
    private final AsyncJobService jobService;
    private final Clock clock;

    @Value("${retraining.dataset-reference:latest}")
    private String datasetReference;

    @Value("${retraining.test-set-reference:holdout}")
    private String testSetReference;

    @Value("${retraining.default-baseline-accuracy:0.85}")
    private double defaultBaselineAccuracy;

    @Value("${retraining.min-predictions:100}")
    private int defaultMinPredictions;

    @Value("${retraining.accuracy-threshold:0.05}")
    private double defaultAccuracyThreshold;

    @Value("${retraining.expected-duration-minutes:30}")
    private long expectedDurationMinutes;

    /**
     * Evaluates the triggers and records the verdict without training anything.
     */
    public RetrainingDecision check(RetrainingCheckRequest request) {
        Instant triggeredAt = clock.instant();
        RetrainingDecision.RetrainingDecisionBuilder decision = RetrainingDecision.builder()
            .triggeredAt(triggeredAt)
            .triggerReason(TriggerReason.MANUAL)
            .requestedBy(request.getRequestedBy())
            .driftReportId(request.getDriftReportId())
            .retrainingPerformed(false)
            .promoted(false);

        Triggers triggers;
        try {
            Optional<ModelVersion> production = registry.getProduction();
            decision.productionVersionId(production.map(ModelVersion::getVersionId).orElse(null));
            double baseline = request.getBaselineAccuracy() != null
                ? request.getBaselineAccuracy()
                : production.map(this::baselineOf).orElse(defaultBaselineAccuracy);
            int minPredictions = request.getMinPredictions() != null ? request.getMinPredictions() : defaultMinPredictions;
            double threshold = request.getAccuracyThreshold() != null ? request.getAccuracyThreshold() : defaultAccuracyThreshold;

            triggers = evaluateTriggers(baseline, minPredictions, threshold, request.getDriftReportId());
            log.info("Retraining check | baseline={} | minPredictions={} | fired={} | reason={}",
                     baseline, minPredictions, triggers.fired, triggers.explanation);
        } catch (RuntimeException ex) {
            throw triggerCheckFailed("check", decision, null, ex);
        }

        return record(decision
            .triggerReason(triggers.fired ? triggers.reason : TriggerReason.MANUAL)
            .reason(triggers.explanation)
            .outcome(triggers.fired ? DecisionOutcome.RETRAIN_RECOMMENDED : DecisionOutcome.SKIPPED)
            .finalPhase(triggers.fired ? RetrainingPhase.CHECKING_TRIGGERS : RetrainingPhase.SKIPPED)
            .build());
    }

    public RetrainingDecision run(boolean force, boolean autoPromote) {
        return run(RetrainingRunRequest.builder().force(force).autoPromote(autoPromote).build(), TriggerReason.MANUAL);
    }

    /**
     * Runs one retraining cycle. {@code origin} is the trigger recorded for forced and skipped
     * runs; a non-forced run that goes ahead records the trigger that actually fired.
     *
     * @throws TrainingFailedException when the trainer produced no artifact; the failed decision
     *                                 has already been recorded and its id travels with the exception
     * @throws RuntimeException        whatever made trigger evaluation fail, after a FAILED decision
     *                                 in phase {@code CHECKING_TRIGGERS} has been recorded
     */
    public RetrainingDecision run(RetrainingRunRequest request, TriggerReason origin) {
        Instant triggeredAt = clock.instant();
        String candidateId = CANDIDATE_PREFIX + CANDIDATE_SUFFIX.format(triggeredAt);
        RunState state = new RunState(candidateId);

        RetrainingDecision.RetrainingDecisionBuilder decision = RetrainingDecision.builder()
            .triggeredAt(triggeredAt)
            .triggerReason(origin)
            .requestedBy(request.getRequestedBy())
            .driftReportId(request.getDriftReportId())
            .retrainingPerformed(false)
            .promoted(false);

        state.enter(RetrainingPhase.CHECKING_TRIGGERS);
        Optional<ModelVersion> production;
        try {
            production = registry.getProduction();
        } catch (RuntimeException ex) {
            throw triggerCheckFailed(candidateId, decision, request.getReason(), ex);
        }
        decision.productionVersionId(production.map(ModelVersion::getVersionId).orElse(null));
        String reason;
        if (request.isForce()) {
            reason = request.getReason() != null ? request.getReason() : "forced retraining";
        } else {
            if (production.isEmpty()) {
                return skip(state, decision, join(request.getReason(), NO_PRODUCTION));
            }
            Triggers triggers;
            try {
                triggers = evaluateTriggers(baselineOf(production.get()), defaultMinPredictions,
                                            defaultAccuracyThreshold, request.getDriftReportId());
            } catch (RuntimeException ex) {
                throw triggerCheckFailed(candidateId, decision, request.getReason(), ex);
            }
            if (!triggers.fired) {
                return skip(state, decision, join(request.getReason(), triggers.explanation));
            }
            decision.triggerReason(triggers.reason);
            reason = join(request.getReason(), triggers.explanation);
        }

        state.enter(RetrainingPhase.PREPARING);
        log.info("Retraining started | run={} | force={} | autoPromote={} | dataset={} | production={}",
                 candidateId, request.isForce(), request.isAutoPromote(), datasetReference,
                 production.map(ModelVersion::getVersionId).orElse(null));

        state.enter(RetrainingPhase.TRAINING);
        Trainer.TrainingResult trained;
        try {
            trained = trainer.train(datasetReference);
        } catch (RuntimeException ex) {
            log.error("Retraining failed | run={} | phase=TRAINING | cause={}", candidateId, ex.getMessage(), ex);
            RetrainingDecision failed = record(decision
                .reason(reason)
                .outcome(DecisionOutcome.FAILED)
                .finalPhase(RetrainingPhase.TRAINING)
                .failureReason(describe(ex))
                .build());
            TrainingFailedException cause = ex instanceof TrainingFailedException
                ? (TrainingFailedException) ex
                : new TrainingFailedException("Training failed: " + describe(ex), ex);
            throw cause.withDecision(failed.getId());
        }

        decision.retrainingPerformed(true)
            .candidateVersionId(candidateId)
            .candidateArtifactLocation(trained.artifactLocation());

        RetrainingDecision outcome;
        try {
            outcome = evaluateAndPromote(state, decision, reason, trained, production, request.isAutoPromote());
        } catch (RuntimeException ex) {
            // the artifact stays in the store but is never registered
            log.error("Retraining failed | run={} | phase={} | cause={}", candidateId, state.phase, ex.getMessage(), ex);
            outcome = decision
                .reason(reason)
                .promoted(false)
                .outcome(DecisionOutcome.FAILED)
                .finalPhase(state.phase)
                .failureReason(describe(ex))
                .build();
        }
        return record(outcome);
    }

    /**
     * Submits a run to the background job runner; the job result is the decision.
     */
    public AsyncJobResponse submitRun(RetrainingRunRequest request, String requestId) {
        UUID jobId = jobService.submit("retraining", requestId, Duration.ofMinutes(expectedDurationMinutes),
            () -> RetrainingDecisionResponse.from(run(request, TriggerReason.MANUAL)));
        log.info("Retraining submitted | jobId={} | force={} | requestedBy={}", jobId, request.isForce(), request.getRequestedBy());
        return jobService.getJob(jobId);
    }

    public RetrainingDecision getDecision(UUID decisionId) {
        return decisionRepository.findById(decisionId)
            .orElseThrow(() -> new DecisionNotFoundException(decisionId));
    }

    public List<RetrainingDecision> listDecisions(int limit, Integer windowDays) {
        if (windowDays != null && windowDays > 0) {
            Instant since = clock.instant().minus(Duration.ofDays(windowDays));
            return decisionRepository.findByTriggeredAtGreaterThanEqualOrderByTriggeredAtDesc(since).stream()
                .limit(Math.max(1, limit))
                .toList();
        }
        return decisionRepository.findAllByOrderByTriggeredAtDesc(PageRequest.of(0, Math.max(1, limit)));
    }

    private RetrainingDecision evaluateAndPromote(RunState state, RetrainingDecision.RetrainingDecisionBuilder decision,
                                                  String reason, Trainer.TrainingResult trained,
                                                  Optional<ModelVersion> production, boolean autoPromote) {
        state.enter(RetrainingPhase.EVALUATING);
        Map<String, Double> candidateMetrics =
            new LinkedHashMap<>(evaluator.evaluate(trained.artifactLocation(), testSetReference));
        decision.candidateMetrics(candidateMetrics);

        state.enter(RetrainingPhase.COMPARING);
        boolean better;
        String verdict;
        if (production.isPresent()) {
            ModelVersion current = production.get();
            ComparisonResult comparison = MetricComparator.compare(
                current.getVersionId(), current.getMetrics(), state.runId, candidateMetrics);
            decision.comparisonSummary(toSummary(comparison));
            long improvements = KEY_METRICS.stream().filter(comparison::improved).count();
            better = improvements >= REQUIRED_IMPROVEMENTS;
            verdict = String.format(Locale.ROOT, "candidate improved on %d of %d key metrics", improvements, KEY_METRICS.size());
        } else {
            better = true;
            verdict = "no production model, candidate accepted";
        }
        log.info("Candidate compared | run={} | better={} | verdict={}", state.runId, better, verdict);

        if (better && autoPromote) {
            state.enter(RetrainingPhase.PROMOTING);
            Map<String, String> metadata = new LinkedHashMap<>();
            metadata.put("dataset_reference", datasetReference);
            metadata.put("test_set_reference", testSetReference);
            production.ifPresent(v -> metadata.put("compared_against", v.getVersionId()));
            registry.register(state.runId, trained.modelType(), trained.artifactLocation(), candidateMetrics, metadata);
            registry.promoteToStaging(state.runId);
            return decision
                .reason(join(reason, verdict + "; promoted to staging"))
                .promoted(true)
                .outcome(DecisionOutcome.PROMOTED)
                .finalPhase(RetrainingPhase.PROMOTING)
                .build();
        }

        state.enter(RetrainingPhase.RECORDED);
        String why = better ? verdict + "; auto promotion disabled" : verdict + "; production kept";
        return decision
            .reason(join(reason, why))
            .promoted(false)
            .outcome(DecisionOutcome.NOT_PROMOTED)
            .finalPhase(RetrainingPhase.RECORDED)
            .build();
    }

    /**
     * Records a FAILED decision for a trigger evaluation that threw and hands the cause back for
     * rethrowing. A failure to record is attached to the cause as suppressed.
     */
    private RuntimeException triggerCheckFailed(String runId, RetrainingDecision.RetrainingDecisionBuilder decision,
                                                String reason, RuntimeException ex) {
        log.error("Retraining failed | run={} | phase=CHECKING_TRIGGERS | cause={}", runId, ex.getMessage(), ex);
        try {
            record(decision
                .reason(join(reason, "trigger evaluation failed"))
                .outcome(DecisionOutcome.FAILED)
                .finalPhase(RetrainingPhase.CHECKING_TRIGGERS)
                .failureReason(describe(ex))
                .build());
        } catch (StorageException storage) {
            ex.addSuppressed(storage);
        }
        return ex;
    }

    private RetrainingDecision skip(RunState state, RetrainingDecision.RetrainingDecisionBuilder decision, String reason) {
        state.enter(RetrainingPhase.SKIPPED);
        return record(decision
            .reason(reason)
            .outcome(DecisionOutcome.SKIPPED)
            .finalPhase(RetrainingPhase.SKIPPED)
            .build());
    }

    /**
     * Performance first; a supplied drift report with drift detected overrides a negative
     * performance verdict.
     */
    private Triggers evaluateTriggers(double baseline, int minPredictions, double threshold, UUID driftReportId) {
        RetrainVerdict verdict = monitor.shouldRetrain(baseline, minPredictions, threshold);
        DriftReport report = driftReportId != null ? driftDetector.get(driftReportId) : null;

        if (verdict.isShouldRetrain()) {
            return new Triggers(true, TriggerReason.PERFORMANCE_DEGRADATION, verdict.getReason());
        }
        if (report != null && report.isOverallDriftDetected()) {
            String explanation = String.format(Locale.ROOT, "drift detected in %d of %d features (performance: %s)",
                report.getDriftedFeatureCount(), report.getAnalyzedFeatureCount(), verdict.getReason());
            return new Triggers(true, TriggerReason.DRIFT, explanation);
        }
        return new Triggers(false, null, verdict.getReason());
    }

    private double baselineOf(ModelVersion production) {
        Double accuracy = production.getMetrics().get("accuracy");
        return accuracy != null ? accuracy : defaultBaselineAccuracy;
    }

    private RetrainingDecision record(RetrainingDecision decision) {
        RetrainingDecision saved;
        try {
            saved = decisionRepository.save(decision);
        } catch (DataAccessException ex) {
            log.error("Decision write failed | candidate={} | cause={}", decision.getCandidateVersionId(), ex.getMessage(), ex);
            throw new StorageException("Failed to append retraining decision", ex);
        }
        log.info("Retraining decision recorded | decision={} | trigger={} | outcome={} | phase={} | candidate={} | promoted={}",
                 saved.getId(), saved.getTriggerReason(), saved.getOutcome(), saved.getFinalPhase(),
                 saved.getCandidateVersionId(), saved.isPromoted());
        return saved;
    }

    private static Map<String, MetricDelta> toSummary(ComparisonResult comparison) {
        Map<String, MetricDelta> summary = new LinkedHashMap<>();
        comparison.getMetrics().forEach((metric, c) -> summary.put(metric, MetricDelta.builder()
            .baselineValue(c.getValueA())
            .candidateValue(c.getValueB())
            .difference(c.getDifference())
            .percentChange(c.getPercentChange())
            .improved(c.isImproved())
            .build()));
        return summary;
    }

    private static String join(String first, String second) {
        if (first == null || first.isBlank()) {
            return second;
        }
        return first + "; " + second;
    }

    private static String describe(Throwable ex) {
        String message = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
        return message.length() > MAX_FAILURE_REASON ? message.substring(0, MAX_FAILURE_REASON) : message;
    }

    private static final class Triggers {
        private final boolean fired;
        private final TriggerReason reason;
        private final String explanation;

        private Triggers(boolean fired, TriggerReason reason, String explanation) {
            this.fired = fired;
            this.reason = reason;
            this.explanation = explanation;
        }
    }

    private static final class RunState {
        private final String runId;
        private RetrainingPhase phase = RetrainingPhase.IDLE;

        private RunState(String runId) {
            this.runId = runId;
        }

        private void enter(RetrainingPhase next) {
            log.info("Retraining phase | run={} | from={} | to={}", runId, phase, next);
            phase = next;
        }
    }
}
