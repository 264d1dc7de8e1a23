package com.modellifecycle.controller;

import com.modellifecycle.config.RequestIdFilter;
import com.modellifecycle.dto.ComparisonResult;
import com.modellifecycle.dto.DeletionResponse;
import com.modellifecycle.dto.ModelVersionResponse;
import com.modellifecycle.dto.PromotionRequest;
import com.modellifecycle.dto.RegisterModelRequest;
import com.modellifecycle.dto.RegistryExportResponse;
import com.modellifecycle.dto.RegistrySummaryResponse;
import com.modellifecycle.dto.RollbackResponse;
import com.modellifecycle.entity.ModelState;
import com.modellifecycle.entity.ModelVersion;
import com.modellifecycle.service.ModelRegistryService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Optional;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/v1/models")
@RequiredArgsConstructor
public class ModelRegistryController {

    private final ModelRegistryService registryService;

    @GetMapping
    public ResponseEntity<List<ModelVersionResponse>> list(@RequestParam(required = false) ModelState state) {
        return ResponseEntity.ok(registryService.list(state).stream().map(ModelVersionResponse::from).toList());
    }

    @GetMapping("/summary")
    public ResponseEntity<RegistrySummaryResponse> summary() {
        return ResponseEntity.ok(registryService.summary());
    }

    @GetMapping("/export")
    public ResponseEntity<RegistryExportResponse> export() {
        log.info("GET /models/export | requestId={}", RequestIdFilter.currentRequestId());
        return ResponseEntity.ok(registryService.export());
    }

    @GetMapping("/production")
    public ResponseEntity<ModelVersionResponse> production() {
        return orNoContent(registryService.getProduction());
    }

    @GetMapping("/staging")
    public ResponseEntity<ModelVersionResponse> staging() {
        return orNoContent(registryService.getStaging());
    }

    @GetMapping("/latest")
    public ResponseEntity<ModelVersionResponse> latest() {
        return orNoContent(registryService.getLatest());
    }

    @GetMapping("/compare")
    public ResponseEntity<ComparisonResult> compare(
            @RequestParam String versionA, @RequestParam String versionB) {
        return ResponseEntity.ok(registryService.compare(versionA, versionB));
    }

    @GetMapping("/{versionId}")
    public ResponseEntity<ModelVersionResponse> get(@PathVariable String versionId) {
        return ResponseEntity.ok(ModelVersionResponse.from(registryService.get(versionId)));
    }

    @PostMapping
    public ResponseEntity<ModelVersionResponse> register(
            @Valid @RequestBody RegisterModelRequest request) {
        log.info("POST /models | version={} | type={} | requestId={}",
                 request.getVersionId(), request.getModelType(), RequestIdFilter.currentRequestId());
        ModelVersion saved = registryService.register(request.getVersionId(), request.getModelType(),
            request.getArtifactLocation(), request.getMetrics(), request.getMetadata());
        return ResponseEntity.status(HttpStatus.CREATED)
            .header("Location", "/api/v1/models/" + saved.getVersionId())
            .body(ModelVersionResponse.from(saved));
    }

    @PostMapping("/{versionId}/promote/staging")
    public ResponseEntity<ModelVersionResponse> promoteToStaging(
            @PathVariable String versionId,
            @RequestBody(required = false) PromotionRequest request) {
        logPromotion(versionId, ModelState.STAGING, request);
        return ResponseEntity.ok(ModelVersionResponse.from(registryService.promoteToStaging(versionId)));
    }

    @PostMapping("/{versionId}/promote/production")
    public ResponseEntity<ModelVersionResponse> promoteToProduction(
            @PathVariable String versionId,
            @RequestBody(required = false) PromotionRequest request) {
        logPromotion(versionId, ModelState.PRODUCTION, request);
        return ResponseEntity.ok(ModelVersionResponse.from(registryService.promoteToProduction(versionId)));
    }

    @PostMapping("/rollback")
    public ResponseEntity<RollbackResponse> rollback() {
        log.info("POST /models/rollback | requestId={}", RequestIdFilter.currentRequestId());
        return ResponseEntity.ok(registryService.rollback());
    }

    @DeleteMapping("/{versionId}")
    public ResponseEntity<DeletionResponse> delete(
            @PathVariable String versionId,
            @RequestParam(defaultValue = "false") boolean purgeArtifact) {
        log.info("DELETE /models/{} | purgeArtifact={} | requestId={}",
                 versionId, purgeArtifact, RequestIdFilter.currentRequestId());
        return ResponseEntity.ok(registryService.delete(versionId, purgeArtifact));
    }

    private void logPromotion(String versionId, ModelState target, PromotionRequest request) {
        log.info("POST /models/{}/promote | target={} | requestedBy={} | note={} | requestId={}",
                 versionId, target,
                 request != null ? request.getRequestedBy() : null,
                 request != null ? request.getNote() : null,
                 RequestIdFilter.currentRequestId());
    }

    private static ResponseEntity<ModelVersionResponse> orNoContent(Optional<ModelVersion> version) {
        return version.map(v -> ResponseEntity.ok(ModelVersionResponse.from(v)))
            .orElseGet(() -> ResponseEntity.noContent().build());
    }
}
