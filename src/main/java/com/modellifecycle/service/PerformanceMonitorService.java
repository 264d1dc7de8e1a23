package com.modellifecycle.service;

import com.modellifecycle.dto.AccuracyReport;
import com.modellifecycle.dto.DegradationResult;
import com.modellifecycle.dto.MonitoringSummaryResponse;
import com.modellifecycle.dto.RecordPredictionRequest;
import com.modellifecycle.dto.RetrainVerdict;
import com.modellifecycle.entity.PredictionLogEntry;
import com.modellifecycle.exception.InsufficientDataException;
import com.modellifecycle.exception.LifecycleValidationException;
import com.modellifecycle.exception.OutcomeAlreadyRecordedException;
import com.modellifecycle.exception.PredictionNotFoundException;
import com.modellifecycle.repository.DriftReportRepository;
import com.modellifecycle.repository.PredictionLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.UUID;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class PerformanceMonitorService {

    static final String INSUFFICIENT_DATA = "insufficient data";

    private static final double[] CALIBRATION_EDGES = {0.0, 0.5, 0.7, 0.9, 1.0};
    private static final String[] CALIBRATION_LABELS = {"low", "medium", "high", "very_high"};

    private final PredictionLogRepository repository;
    private final DriftReportRepository driftReportRepository;
    private final Clock clock;

    @Value("${monitoring.degradation-window-days:30}")
    private int degradationWindowDays;

    @Value("${monitoring.should-retrain-window-days:90}")
    private int shouldRetrainWindowDays;

    @Value("${monitoring.default-accuracy-window-days:30}")
    private int defaultAccuracyWindowDays;

    @Transactional
    public PredictionLogEntry recordPrediction(RecordPredictionRequest req) {
        if (req.getProbability() < 0.0 || req.getProbability() > 1.0
                || req.getConfidence() < 0.0 || req.getConfidence() > 1.0) {
            throw new LifecycleValidationException("probability and confidence must lie in [0, 1]");
        }
        PredictionLogEntry saved = repository.save(PredictionLogEntry.builder()
            .modelVersionId(req.getModelVersionId())
            .features(req.getFeatures() != null ? new LinkedHashMap<>(req.getFeatures()) : new LinkedHashMap<>())
            .prediction(req.getPrediction())
            .probability(req.getProbability())
            .confidence(req.getConfidence())
            .createdAt(clock.instant())
            .build());
        log.debug("Prediction logged | id={} | model={} | prediction={}", saved.getId(), saved.getModelVersionId(), saved.getPrediction());
        return saved;
    }

    /**
     * Attaches the ground truth to a logged prediction. Outcomes are write-once: the update
     * only applies while no outcome is stored, so two racing calls cannot both succeed.
     */
    @Transactional
    public PredictionLogEntry recordOutcome(UUID predictionId, String actualOutcome) {
        if (actualOutcome == null || actualOutcome.isBlank()) {
            throw new LifecycleValidationException("actualOutcome is required");
        }
        int updated = repository.recordOutcomeIfAbsent(predictionId, actualOutcome, clock.instant());
        PredictionLogEntry entry = repository.findById(predictionId)
            .orElseThrow(() -> new PredictionNotFoundException(predictionId));
        if (updated == 0) {
            throw new OutcomeAlreadyRecordedException(predictionId);
        }
        log.info("Actual outcome recorded | id={} | predicted={} | actual={}", predictionId, entry.getPrediction(), actualOutcome);
        return entry;
    }

    @Transactional(readOnly = true)
    public List<PredictionLogEntry> recentPredictions(int limit) {
        return repository.findAllByOrderByCreatedAtDesc(PageRequest.of(0, Math.max(1, limit)));
    }

    @Transactional(readOnly = true)
    public AccuracyReport computeAccuracy(Integer windowDays, String modelVersionId) {
        int window = windowDays != null && windowDays > 0 ? windowDays : defaultAccuracyWindowDays;
        Instant since = clock.instant().minus(Duration.ofDays(window));
        List<PredictionLogEntry> entries = repository.findLabeledSince(since, modelVersionId);
        if (entries.isEmpty()) {
            throw new InsufficientDataException(
                "No predictions with actual outcomes in the last " + window + " days"
                    + (modelVersionId != null ? " for model " + modelVersionId : ""));
        }

        long correct = entries.stream().filter(PredictionLogEntry::isCorrect).count();

        SortedMap<LocalDate, Double> daily = new TreeMap<>();
        entries.stream()
            .collect(Collectors.groupingBy(e -> LocalDate.ofInstant(e.getCreatedAt(), ZoneOffset.UTC)))
            .forEach((day, group) -> daily.put(day, accuracy(group)));

        return AccuracyReport.builder()
            .windowDays(window)
            .modelVersionId(modelVersionId)
            .totalPredictions(entries.size())
            .correctPredictions(correct)
            .overallAccuracy((double) correct / entries.size())
            .dailyAccuracy(daily)
            .calibration(calibration(entries))
            .build();
    }

    @Transactional(readOnly = true)
    public DegradationResult checkDegradation(double baselineAccuracy, Integer windowDays, double threshold) {
        int window = windowDays != null && windowDays > 0 ? windowDays : degradationWindowDays;
        AccuracyReport current = computeAccuracy(window, null);
        double drop = baselineAccuracy - current.getOverallAccuracy();
        boolean degraded = drop > threshold;
        if (degraded) {
            log.warn("Performance degradation detected | baseline={} | current={} | drop={} | threshold={}",
                     format(baselineAccuracy), format(current.getOverallAccuracy()), format(drop), threshold);
        }
        return DegradationResult.builder()
            .degraded(degraded)
            .baselineAccuracy(baselineAccuracy)
            .currentAccuracy(current.getOverallAccuracy())
            .accuracyDrop(drop)
            .threshold(threshold)
            .windowDays(window)
            .totalPredictions(current.getTotalPredictions())
            .build();
    }

    /**
     * Side-effect-free retraining verdict. Requires {@code minPredictions} labeled predictions
     * in the trailing retrain window before it looks at accuracy at all.
     */
    @Transactional(readOnly = true)
    public RetrainVerdict shouldRetrain(double baselineAccuracy, int minPredictions, double accuracyThreshold) {
        Instant since = clock.instant().minus(Duration.ofDays(shouldRetrainWindowDays));
        long labeled = repository.countLabeledSince(since);
        if (labeled < minPredictions) {
            log.info("Retrain check skipped | labeled={} | required={}", labeled, minPredictions);
            return RetrainVerdict.no(INSUFFICIENT_DATA, labeled);
        }

        DegradationResult degradation;
        try {
            degradation = checkDegradation(baselineAccuracy, degradationWindowDays, accuracyThreshold);
        } catch (InsufficientDataException ex) {
            return RetrainVerdict.no(INSUFFICIENT_DATA, labeled);
        }

        if (degradation.isDegraded()) {
            return RetrainVerdict.builder()
                .shouldRetrain(true)
                .reason("performance degraded: accuracy dropped by " + format(degradation.getAccuracyDrop()))
                .labeledPredictions(labeled)
                .degradation(degradation)
                .build();
        }
        return RetrainVerdict.builder()
            .shouldRetrain(false)
            .reason("no retraining needed")
            .labeledPredictions(labeled)
            .degradation(degradation)
            .build();
    }

    @Transactional(readOnly = true)
    public MonitoringSummaryResponse summary() {
        Double recent;
        try {
            recent = computeAccuracy(defaultAccuracyWindowDays, null).getOverallAccuracy();
        } catch (InsufficientDataException ex) {
            recent = null;
        }
        return MonitoringSummaryResponse.builder()
            .totalPredictions(repository.count())
            .predictionsWithOutcomes(repository.countByActualOutcomeIsNotNull())
            .recentAccuracy(recent)
            .driftReports(driftReportRepository.count())
            .build();
    }

    private List<AccuracyReport.CalibrationBucket> calibration(List<PredictionLogEntry> entries) {
        Map<Integer, List<PredictionLogEntry>> byBucket = entries.stream()
            .collect(Collectors.groupingBy(e -> bucketIndex(e.getConfidence())));

        List<AccuracyReport.CalibrationBucket> buckets = new ArrayList<>();
        for (int i = 0; i < CALIBRATION_LABELS.length; i++) {
            List<PredictionLogEntry> group = byBucket.getOrDefault(i, List.of());
            buckets.add(AccuracyReport.CalibrationBucket.builder()
                .label(CALIBRATION_LABELS[i])
                .lowerBound(CALIBRATION_EDGES[i])
                .upperBound(CALIBRATION_EDGES[i + 1])
                .count(group.size())
                .accuracy(group.isEmpty() ? null : accuracy(group))
                .meanConfidence(group.isEmpty() ? null
                    : group.stream().mapToDouble(PredictionLogEntry::getConfidence).average().orElse(0.0))
                .build());
        }
        return buckets;
    }

    // [0,.5) [.5,.7) [.7,.9) [.9,1.0]
    static int bucketIndex(double confidence) {
        for (int i = CALIBRATION_EDGES.length - 2; i > 0; i--) {
            if (confidence >= CALIBRATION_EDGES[i]) {
                return i;
            }
        }
        return 0;
    }

    private static double accuracy(List<PredictionLogEntry> group) {
        return (double) group.stream().filter(PredictionLogEntry::isCorrect).count() / group.size();
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.3f", value);
    }
}
