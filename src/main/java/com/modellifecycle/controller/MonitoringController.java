package com.modellifecycle.controller;

import com.modellifecycle.config.RequestIdFilter;
import com.modellifecycle.dto.AccuracyReport;
import com.modellifecycle.dto.DegradationResult;
import com.modellifecycle.dto.MonitoringSummaryResponse;
import com.modellifecycle.dto.PredictionLogResponse;
import com.modellifecycle.dto.RecordOutcomeRequest;
import com.modellifecycle.dto.RecordPredictionRequest;
import com.modellifecycle.entity.PredictionLogEntry;
import com.modellifecycle.service.PerformanceMonitorService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/v1/monitoring")
@RequiredArgsConstructor
public class MonitoringController {

    private final PerformanceMonitorService monitorService;

    @PostMapping("/predictions")
    public ResponseEntity<PredictionLogResponse> recordPrediction(@Valid @RequestBody RecordPredictionRequest request) {
        PredictionLogEntry saved = monitorService.recordPrediction(request);
        return ResponseEntity.status(HttpStatus.CREATED)
            .header("Location", "/api/v1/monitoring/predictions/" + saved.getId())
            .body(PredictionLogResponse.from(saved));
    }

    @GetMapping("/predictions")
    public ResponseEntity<List<PredictionLogResponse>> recentPredictions(
            @RequestParam(defaultValue = "50") @Min(1) @Max(1000) int limit) {
        return ResponseEntity.ok(monitorService.recentPredictions(limit).stream()
            .map(PredictionLogResponse::from).toList());
    }

    @PatchMapping("/predictions/{id}/outcome")
    public ResponseEntity<PredictionLogResponse> recordOutcome(
            @PathVariable UUID id, @Valid @RequestBody RecordOutcomeRequest request) {
        log.info("PATCH /monitoring/predictions/{}/outcome | requestId={}", id, RequestIdFilter.currentRequestId());
        return ResponseEntity.ok(PredictionLogResponse.from(monitorService.recordOutcome(id, request.getActualOutcome())));
    }

    @GetMapping("/accuracy")
    public ResponseEntity<AccuracyReport> accuracy(
            @RequestParam(required = false) @Min(1) @Max(3650) Integer windowDays,
            @RequestParam(required = false) String modelVersionId) {
        return ResponseEntity.ok(monitorService.computeAccuracy(windowDays, modelVersionId));
    }

    @GetMapping("/degradation")
    public ResponseEntity<DegradationResult> degradation(
            @RequestParam @DecimalMin("0.0") @DecimalMax("1.0") double baselineAccuracy,
            @RequestParam(required = false) @Min(1) @Max(3650) Integer windowDays,
            @RequestParam(defaultValue = "0.05") @DecimalMin("0.0") double threshold) {
        return ResponseEntity.ok(monitorService.checkDegradation(baselineAccuracy, windowDays, threshold));
    }

    @GetMapping("/summary")
    public ResponseEntity<MonitoringSummaryResponse> summary() {
        return ResponseEntity.ok(monitorService.summary());
    }
}
