package com.modellifecycle.controller;

import com.modellifecycle.config.RequestIdFilter;
import com.modellifecycle.dto.AsyncJobResponse;
import com.modellifecycle.dto.RetrainingCheckRequest;
import com.modellifecycle.dto.RetrainingDecisionResponse;
import com.modellifecycle.dto.RetrainingRunRequest;
import com.modellifecycle.service.AsyncJobService;
import com.modellifecycle.service.RetrainingOrchestratorService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/v1/retraining")
@RequiredArgsConstructor
public class RetrainingController {

    private final RetrainingOrchestratorService orchestrator;
    private final AsyncJobService asyncJobService;

    @PostMapping("/check")
    public ResponseEntity<RetrainingDecisionResponse> check(
            @Valid @RequestBody(required = false) RetrainingCheckRequest request) {
        RetrainingCheckRequest effective = request != null ? request : RetrainingCheckRequest.builder().build();
        log.info("POST /retraining/check | requestedBy={} | driftReport={} | requestId={}",
                 effective.getRequestedBy(), effective.getDriftReportId(), RequestIdFilter.currentRequestId());
        return ResponseEntity.ok(RetrainingDecisionResponse.from(orchestrator.check(effective)));
    }

    @PostMapping("/runs")
    public ResponseEntity<AsyncJobResponse> run(@Valid @RequestBody(required = false) RetrainingRunRequest request) {
        RetrainingRunRequest effective = request != null ? request : RetrainingRunRequest.builder().build();
        String requestId = RequestIdFilter.currentRequestId();
        log.info("POST /retraining/runs | force={} | autoPromote={} | requestedBy={} | requestId={}",
                 effective.isForce(), effective.isAutoPromote(), effective.getRequestedBy(), requestId);
        AsyncJobResponse job = orchestrator.submitRun(effective, requestId);
        return ResponseEntity.accepted()
            .header("Location", "/api/v1/retraining/jobs/" + job.getJobId())
            .body(job);
    }

    @GetMapping("/jobs/{jobId}")
    public ResponseEntity<AsyncJobResponse> job(@PathVariable UUID jobId) {
        return ResponseEntity.ok(asyncJobService.getJob(jobId));
    }

    @GetMapping("/decisions")
    public ResponseEntity<List<RetrainingDecisionResponse>> decisions(
            @RequestParam(defaultValue = "20") @Min(1) @Max(500) int limit,
            @RequestParam(required = false) @Min(1) @Max(3650) Integer windowDays) {
        return ResponseEntity.ok(orchestrator.listDecisions(limit, windowDays).stream()
            .map(RetrainingDecisionResponse::from).toList());
    }

    @GetMapping("/decisions/{decisionId}")
    public ResponseEntity<RetrainingDecisionResponse> decision(@PathVariable UUID decisionId) {
        return ResponseEntity.ok(RetrainingDecisionResponse.from(orchestrator.getDecision(decisionId)));
    }
}
