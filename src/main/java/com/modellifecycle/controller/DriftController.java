package com.modellifecycle.controller;

import com.modellifecycle.config.RequestIdFilter;
import com.modellifecycle.dto.DriftCheckRequest;
import com.modellifecycle.dto.DriftReportResponse;
import com.modellifecycle.entity.DriftReport;
import com.modellifecycle.service.DriftDetectorService;
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
@RequestMapping("/api/v1/drift")
@RequiredArgsConstructor
public class DriftController {

    private final DriftDetectorService driftService;

    @PostMapping("/reports")
    public ResponseEntity<DriftReportResponse> detect(@Valid @RequestBody DriftCheckRequest request) {
        log.info("POST /drift/reports | model={} | features={} | requestId={}",
                 request.getModelVersionId(), request.getReferenceSample().size(), RequestIdFilter.currentRequestId());
        DriftReport report = driftService.detectDrift(request.getModelVersionId(),
            request.getReferenceSample(), request.getCurrentSample(), request.getPValueThreshold());
        return created(report);
    }

    @PostMapping("/reports/from-log")
    public ResponseEntity<DriftReportResponse> detectFromLog(
            @RequestParam(required = false) String modelVersionId,
            @RequestParam(required = false) @Min(1) @Max(3650) Integer referenceDays,
            @RequestParam(required = false) @Min(1) @Max(3650) Integer currentDays,
            @RequestParam(required = false) @DecimalMin(value = "0.0", inclusive = false)
                @DecimalMax(value = "1.0", inclusive = false) Double pValueThreshold) {
        log.info("POST /drift/reports/from-log | model={} | referenceDays={} | currentDays={} | requestId={}",
                 modelVersionId, referenceDays, currentDays, RequestIdFilter.currentRequestId());
        return created(driftService.detectDriftFromPredictionLog(modelVersionId, referenceDays, currentDays, pValueThreshold));
    }

    @GetMapping("/reports")
    public ResponseEntity<List<DriftReportResponse>> history(
            @RequestParam(required = false) String modelVersionId,
            @RequestParam(required = false) @Min(1) @Max(3650) Integer windowDays,
            @RequestParam(required = false) @Min(1) @Max(500) Integer limit) {
        List<DriftReport> reports = limit != null && modelVersionId == null && windowDays == null
            ? driftService.latest(limit)
            : driftService.history(modelVersionId, windowDays);
        return ResponseEntity.ok(reports.stream().map(DriftReportResponse::from).toList());
    }

    @GetMapping("/reports/{reportId}")
    public ResponseEntity<DriftReportResponse> get(@PathVariable UUID reportId) {
        return ResponseEntity.ok(DriftReportResponse.from(driftService.get(reportId)));
    }

    private static ResponseEntity<DriftReportResponse> created(DriftReport report) {
        return ResponseEntity.status(HttpStatus.CREATED)
            .header("Location", "/api/v1/drift/reports/" + report.getId())
            .body(DriftReportResponse.from(report));
    }
}
