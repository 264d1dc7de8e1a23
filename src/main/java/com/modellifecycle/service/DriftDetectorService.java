package com.modellifecycle.service;

import com.modellifecycle.entity.DriftReport;
import com.modellifecycle.entity.FeatureDriftScore;
import com.modellifecycle.entity.PredictionLogEntry;
import com.modellifecycle.entity.PsiLevel;
import com.modellifecycle.exception.DriftReportNotFoundException;
import com.modellifecycle.exception.LifecycleValidationException;
import com.modellifecycle.exception.StorageException;
import com.modellifecycle.repository.DriftReportRepository;
import com.modellifecycle.repository.PredictionLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import smile.stat.hypothesis.KSTest;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;

/**
 * Compares a reference feature sample with a current one, feature by feature, using the
 * two-sample Kolmogorov-Smirnov test and the Population Stability Index. A feature is drifted
 * when the KS p-value is below the threshold or its PSI is significant (&gt; 0.25).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DriftDetectorService {

    static final int PSI_BINS = 10;
    static final double PSI_FLOOR = 0.0001;
    static final int MIN_OBSERVATIONS = 2;

    private final DriftReportRepository reportRepository;
    private final PredictionLogRepository predictionLogRepository;
    private final Clock clock;

    @Value("${drift.p-value-threshold:0.05}")
    private double defaultPValueThreshold;

    @Value("${drift.reference-days:90}")
    private int defaultReferenceDays;

    @Value("${drift.current-days:7}")
    private int defaultCurrentDays;

    @Value("${drift.history-window-days:30}")
    private int defaultHistoryWindowDays;

    @Transactional
    public DriftReport detectDrift(String modelVersionId,
                                   Map<String, ? extends Collection<Double>> referenceSample,
                                   Map<String, ? extends Collection<Double>> currentSample,
                                   Double pValueThreshold) {
        double threshold = pValueThreshold != null ? pValueThreshold : defaultPValueThreshold;
        if (threshold <= 0.0 || threshold >= 1.0) {
            throw new LifecycleValidationException("pValueThreshold must lie in (0, 1)");
        }
        if (referenceSample == null || currentSample == null) {
            throw new LifecycleValidationException("reference and current samples are required");
        }

        Map<String, FeatureDriftScore> scores = new LinkedHashMap<>();
        Map<String, String> skipped = new LinkedHashMap<>();

        Set<String> features = new TreeSet<>(referenceSample.keySet());
        features.addAll(currentSample.keySet());
        for (String feature : features) {
            if (!referenceSample.containsKey(feature)) {
                skipped.put(feature, "missing from reference sample");
                continue;
            }
            if (!currentSample.containsKey(feature)) {
                skipped.put(feature, "missing from current sample");
                continue;
            }
            double[] reference = observations(referenceSample.get(feature));
            double[] current = observations(currentSample.get(feature));
            if (reference.length < MIN_OBSERVATIONS) {
                skipped.put(feature, "reference sample has " + reference.length + " non-null observations, need " + MIN_OBSERVATIONS);
                continue;
            }
            if (current.length < MIN_OBSERVATIONS) {
                skipped.put(feature, "current sample has " + current.length + " non-null observations, need " + MIN_OBSERVATIONS);
                continue;
            }
            scores.put(feature, score(reference, current, threshold));
        }

        int drifted = (int) scores.values().stream().filter(FeatureDriftScore::isDrifted).count();
        DriftReport report = DriftReport.builder()
            .modelVersionId(modelVersionId)
            .generatedAt(clock.instant())
            .pValueThreshold(threshold)
            .perFeatureScores(scores)
            .skippedFeatures(skipped)
            .analyzedFeatureCount(scores.size())
            .driftedFeatureCount(drifted)
            .overallDriftDetected(drifted > 0)
            .driftFraction(scores.isEmpty() ? 0.0 : (double) drifted / scores.size())
            .build();

        DriftReport saved;
        try {
            saved = reportRepository.save(report);
        } catch (DataAccessException ex) {
            throw new StorageException("Failed to append drift report", ex);
        }

        if (saved.isOverallDriftDetected()) {
            log.warn("Drift detected | report={} | model={} | drifted={}/{} | skipped={}",
                     saved.getId(), modelVersionId, drifted, scores.size(), skipped.size());
        } else {
            log.info("Drift check clean | report={} | model={} | analyzed={} | skipped={}",
                     saved.getId(), modelVersionId, scores.size(), skipped.size());
        }
        return saved;
    }

    /**
     * Builds both samples from the prediction log: the reference window ends where the
     * current window starts.
     */
    @Transactional
    public DriftReport detectDriftFromPredictionLog(String modelVersionId, Integer referenceDays,
                                                    Integer currentDays, Double pValueThreshold) {
        int refWindow = referenceDays != null && referenceDays > 0 ? referenceDays : defaultReferenceDays;
        int curWindow = currentDays != null && currentDays > 0 ? currentDays : defaultCurrentDays;

        Instant now = clock.instant();
        Instant currentFrom = now.minus(Duration.ofDays(curWindow));
        Instant referenceFrom = currentFrom.minus(Duration.ofDays(refWindow));

        List<PredictionLogEntry> reference = predictionLogRepository.findWindow(referenceFrom, currentFrom, modelVersionId);
        List<PredictionLogEntry> current = predictionLogRepository.findWindow(currentFrom, now.plusMillis(1), modelVersionId);
        log.info("Drift check from prediction log | model={} | referenceRows={} | currentRows={}",
                 modelVersionId, reference.size(), current.size());

        return detectDrift(modelVersionId, featureColumns(reference), featureColumns(current), pValueThreshold);
    }

    @Transactional(readOnly = true)
    public List<DriftReport> history(String modelVersionId, Integer windowDays) {
        int window = windowDays != null && windowDays > 0 ? windowDays : defaultHistoryWindowDays;
        return reportRepository.findHistory(clock.instant().minus(Duration.ofDays(window)), modelVersionId);
    }

    @Transactional(readOnly = true)
    public List<DriftReport> latest(int limit) {
        return reportRepository.findAllByOrderByGeneratedAtDesc(PageRequest.of(0, Math.max(1, limit)));
    }

    @Transactional(readOnly = true)
    public DriftReport get(UUID reportId) {
        return reportRepository.findById(reportId)
            .orElseThrow(() -> new DriftReportNotFoundException(reportId));
    }

    private FeatureDriftScore score(double[] reference, double[] current, double threshold) {
        KSTest ks = KSTest.test(reference, current);
        double psi = populationStabilityIndex(reference, current);
        PsiLevel level = PsiLevel.of(psi);
        boolean drifted = ks.pvalue < threshold || level == PsiLevel.SIGNIFICANT;
        return FeatureDriftScore.builder()
            .statistic(ks.d)
            .pValue(ks.pvalue)
            .populationStabilityIndex(psi)
            .psiLevel(level)
            .referenceCount(reference.length)
            .currentCount(current.length)
            .drifted(drifted)
            .build();
    }

    /**
     * PSI over the reference deciles. Cut points are the reference 10%..90% quantiles with
     * duplicates collapsed, so a degenerate reference still yields a lower and upper bin.
     * Empty bins are floored at {@value #PSI_FLOOR} before taking the log ratio.
     */
    static double populationStabilityIndex(double[] reference, double[] current) {
        double[] cuts = decileCuts(reference);
        double[] refPct = binProportions(reference, cuts);
        double[] curPct = binProportions(current, cuts);
        double psi = 0.0;
        for (int i = 0; i < refPct.length; i++) {
            double r = Math.max(refPct[i], PSI_FLOOR);
            double c = Math.max(curPct[i], PSI_FLOOR);
            psi += (c - r) * Math.log(c / r);
        }
        return psi;
    }

    static double[] decileCuts(double[] reference) {
        double[] sorted = reference.clone();
        Arrays.sort(sorted);
        Set<Double> cuts = new LinkedHashSet<>();
        for (int k = 1; k < PSI_BINS; k++) {
            int idx = Math.min(sorted.length - 1, (int) Math.floor((double) k * sorted.length / PSI_BINS));
            cuts.add(sorted[idx]);
        }
        return cuts.stream().mapToDouble(Double::doubleValue).sorted().toArray();
    }

    // bin i holds values in (cuts[i-1], cuts[i]]; the last bin is open above
    private static double[] binProportions(double[] values, double[] cuts) {
        double[] counts = new double[cuts.length + 1];
        for (double v : values) {
            int bin = Arrays.binarySearch(cuts, v);
            counts[bin >= 0 ? bin : -bin - 1]++;
        }
        for (int i = 0; i < counts.length; i++) {
            counts[i] /= values.length;
        }
        return counts;
    }

    private static double[] observations(Collection<Double> values) {
        if (values == null) {
            return new double[0];
        }
        return values.stream()
            .filter(Objects::nonNull)
            .filter(v -> !v.isNaN() && !v.isInfinite())
            .mapToDouble(Double::doubleValue)
            .toArray();
    }

    private static Map<String, List<Double>> featureColumns(List<PredictionLogEntry> entries) {
        Map<String, List<Double>> columns = new LinkedHashMap<>();
        for (PredictionLogEntry entry : entries) {
            entry.getFeatures().forEach((name, value) ->
                columns.computeIfAbsent(name, k -> new ArrayList<>()).add(value));
        }
        return columns;
    }
}
