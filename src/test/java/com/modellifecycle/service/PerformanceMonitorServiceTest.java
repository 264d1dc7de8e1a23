package com.modellifecycle.service;

import com.modellifecycle.dto.AccuracyReport;
import com.modellifecycle.dto.DegradationResult;
import com.modellifecycle.dto.RecordPredictionRequest;
import com.modellifecycle.dto.RetrainVerdict;
import com.modellifecycle.entity.PredictionLogEntry;
import com.modellifecycle.exception.InsufficientDataException;
import com.modellifecycle.exception.LifecycleValidationException;
import com.modellifecycle.exception.OutcomeAlreadyRecordedException;
import com.modellifecycle.exception.PredictionNotFoundException;
import com.modellifecycle.repository.DriftReportRepository;
import com.modellifecycle.repository.PredictionLogRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PerformanceMonitorServiceTest {

    private static final Instant NOW = Instant.parse("2025-06-15T12:00:00Z");

    @Mock PredictionLogRepository repository;
    @Mock DriftReportRepository   driftReportRepository;

    PerformanceMonitorService service;

    @BeforeEach
    void setUp() {
        service = new PerformanceMonitorService(repository, driftReportRepository, Clock.fixed(NOW, ZoneOffset.UTC));
        ReflectionTestUtils.setField(service, "degradationWindowDays", 30);
        ReflectionTestUtils.setField(service, "shouldRetrainWindowDays", 90);
        ReflectionTestUtils.setField(service, "defaultAccuracyWindowDays", 30);
    }

    private static PredictionLogEntry labeled(String prediction, String actual, double confidence, Instant at) {
        return PredictionLogEntry.builder()
            .id(UUID.randomUUID()).modelVersionId("v1")
            .prediction(prediction).actualOutcome(actual)
            .probability(confidence).confidence(confidence)
            .createdAt(at).outcomeUpdatedAt(at)
            .build();
    }

    private static List<PredictionLogEntry> entries(int total, int correct) {
        List<PredictionLogEntry> out = new ArrayList<>();
        for (int i = 0; i < total; i++) {
            out.add(labeled("1", i < correct ? "1" : "0", 0.8, NOW.minus(Duration.ofHours(i))));
        }
        return out;
    }

    @Test
    void recordPrediction_stampsClockAndPersists() {
        when(repository.save(any())).thenAnswer(inv -> inv.getArgument(0));
        PredictionLogEntry saved = service.recordPrediction(RecordPredictionRequest.builder()
            .modelVersionId("v1").prediction("1").probability(0.7).confidence(0.9)
            .features(Map.of("age", 54.0)).build());

        assertThat(saved.getCreatedAt()).isEqualTo(NOW);
        assertThat(saved.getActualOutcome()).isNull();
        assertThat(saved.getFeatures()).containsEntry("age", 54.0);
    }

    @Test
    void recordPrediction_outOfRangeProbability_throws() {
        RecordPredictionRequest bad = RecordPredictionRequest.builder()
            .modelVersionId("v1").prediction("1").probability(1.2).confidence(0.5).build();
        assertThatThrownBy(() -> service.recordPrediction(bad)).isInstanceOf(LifecycleValidationException.class);
        verify(repository, never()).save(any());
    }

    @Test
    void recordOutcome_firstCall_succeeds() {
        UUID id = UUID.randomUUID();
        when(repository.recordOutcomeIfAbsent(eq(id), eq("1"), eq(NOW))).thenReturn(1);
        when(repository.findById(id)).thenReturn(Optional.of(labeled("1", "1", 0.9, NOW)));

        assertThat(service.recordOutcome(id, "1").getActualOutcome()).isEqualTo("1");
    }

    @Test
    void recordOutcome_secondCall_failsAndKeepsStoredOutcome() {
        UUID id = UUID.randomUUID();
        PredictionLogEntry stored = labeled("1", "0", 0.9, NOW);
        when(repository.recordOutcomeIfAbsent(any(), any(), any())).thenReturn(0);
        when(repository.findById(id)).thenReturn(Optional.of(stored));

        assertThatThrownBy(() -> service.recordOutcome(id, "1"))
            .isInstanceOf(OutcomeAlreadyRecordedException.class);
        assertThat(stored.getActualOutcome()).isEqualTo("0");
    }

    @Test
    void recordOutcome_unknownId_throwsNotFound() {
        UUID id = UUID.randomUUID();
        when(repository.recordOutcomeIfAbsent(any(), any(), any())).thenReturn(0);
        when(repository.findById(id)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.recordOutcome(id, "1"))
            .isInstanceOf(PredictionNotFoundException.class);
    }

    @Test
    void computeAccuracy_noLabeledEntries_throwsInsufficientData() {
        when(repository.findLabeledSince(any(), isNull())).thenReturn(List.of());
        assertThatThrownBy(() -> service.computeAccuracy(7, null))
            .isInstanceOf(InsufficientDataException.class);
    }

    @Test
    void computeAccuracy_dailyAndCalibrationBuckets() {
        Instant dayOne = Instant.parse("2025-06-14T09:00:00Z");
        Instant dayTwo = Instant.parse("2025-06-15T09:00:00Z");
        when(repository.findLabeledSince(eq(NOW.minus(Duration.ofDays(7))), eq("v1"))).thenReturn(List.of(
            labeled("1", "1", 0.30, dayOne),
            labeled("1", "0", 0.60, dayOne),
            labeled("0", "0", 0.80, dayTwo),
            labeled("1", "1", 0.95, dayTwo)));

        AccuracyReport report = service.computeAccuracy(7, "v1");

        assertThat(report.getTotalPredictions()).isEqualTo(4);
        assertThat(report.getOverallAccuracy()).isEqualTo(0.75);
        assertThat(report.getDailyAccuracy())
            .containsEntry(LocalDate.of(2025, 6, 14), 0.5)
            .containsEntry(LocalDate.of(2025, 6, 15), 1.0);
        assertThat(report.getCalibration()).extracting(AccuracyReport.CalibrationBucket::getLabel)
            .containsExactly("low", "medium", "high", "very_high");
        assertThat(report.getCalibration()).extracting(AccuracyReport.CalibrationBucket::getCount)
            .containsExactly(1L, 1L, 1L, 1L);
        assertThat(report.getCalibration().get(1).getAccuracy()).isZero();
    }

    @Test
    void bucketIndex_boundaries() {
        assertThat(PerformanceMonitorService.bucketIndex(0.49)).isZero();
        assertThat(PerformanceMonitorService.bucketIndex(0.5)).isEqualTo(1);
        assertThat(PerformanceMonitorService.bucketIndex(0.7)).isEqualTo(2);
        assertThat(PerformanceMonitorService.bucketIndex(0.9)).isEqualTo(3);
        assertThat(PerformanceMonitorService.bucketIndex(1.0)).isEqualTo(3);
    }

    @Test
    void checkDegradation_accuracyDropAboveThreshold_isDegraded() {
        when(repository.findLabeledSince(eq(NOW.minus(Duration.ofDays(90))), isNull())).thenReturn(entries(200, 150));

        DegradationResult result = service.checkDegradation(0.85, 90, 0.05);

        assertThat(result.isDegraded()).isTrue();
        assertThat(result.getCurrentAccuracy()).isCloseTo(0.75, within(1e-9));
        assertThat(result.getAccuracyDrop()).isCloseTo(0.10, within(1e-9));
    }

    @Test
    void checkDegradation_smallDrop_isNotDegraded() {
        when(repository.findLabeledSince(any(), isNull())).thenReturn(entries(100, 82));
        assertThat(service.checkDegradation(0.85, 30, 0.05).isDegraded()).isFalse();
    }

    @Test
    void shouldRetrain_tooFewLabeled_returnsInsufficientDataWithoutDegradationCheck() {
        when(repository.countLabeledSince(NOW.minus(Duration.ofDays(90)))).thenReturn(40L);

        RetrainVerdict verdict = service.shouldRetrain(0.85, 100, 0.05);

        assertThat(verdict.isShouldRetrain()).isFalse();
        assertThat(verdict.getReason()).isEqualTo("insufficient data");
        assertThat(verdict.getDegradation()).isNull();
        verify(repository, never()).findLabeledSince(any(), any());
    }

    @Test
    void shouldRetrain_degraded_returnsTrueWithReason() {
        when(repository.countLabeledSince(any())).thenReturn(200L);
        when(repository.findLabeledSince(eq(NOW.minus(Duration.ofDays(30))), isNull())).thenReturn(entries(200, 150));

        RetrainVerdict verdict = service.shouldRetrain(0.85, 100, 0.05);

        assertThat(verdict.isShouldRetrain()).isTrue();
        assertThat(verdict.getReason()).isEqualTo("performance degraded: accuracy dropped by 0.100");
    }

    @Test
    void shouldRetrain_labeledOnlyOutsideDegradationWindow_isInsufficientData() {
        when(repository.countLabeledSince(any())).thenReturn(150L);
        when(repository.findLabeledSince(any(), isNull())).thenReturn(List.of());

        RetrainVerdict verdict = service.shouldRetrain(0.85, 100, 0.05);

        assertThat(verdict.isShouldRetrain()).isFalse();
        assertThat(verdict.getReason()).isEqualTo("insufficient data");
    }

    @Test
    void summary_withoutLabeledData_reportsNullAccuracy() {
        when(repository.findLabeledSince(any(), isNull())).thenReturn(List.of());
        when(repository.count()).thenReturn(12L);
        when(repository.countByActualOutcomeIsNotNull()).thenReturn(0L);
        when(driftReportRepository.count()).thenReturn(3L);

        assertThat(service.summary().getRecentAccuracy()).isNull();
        assertThat(service.summary().getDriftReports()).isEqualTo(3L);
    }
}
