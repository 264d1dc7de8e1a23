package com.modellifecycle.service;

import com.modellifecycle.dto.ComparisonResult;
import com.modellifecycle.dto.DeletionResponse;
import com.modellifecycle.dto.ModelVersionResponse;
import com.modellifecycle.dto.RegistryExportResponse;
import com.modellifecycle.dto.RegistrySummaryResponse;
import com.modellifecycle.dto.RollbackResponse;
import com.modellifecycle.entity.ModelState;
import com.modellifecycle.entity.ModelType;
import com.modellifecycle.entity.ModelVersion;
import com.modellifecycle.exception.DuplicateVersionException;
import com.modellifecycle.exception.LifecycleValidationException;
import com.modellifecycle.exception.ModelLifecycleException;
import com.modellifecycle.exception.ModelVersionNotFoundException;
import com.modellifecycle.exception.NoRollbackTargetException;
import com.modellifecycle.exception.ProtectedVersionException;
import com.modellifecycle.exception.StorageException;
import com.modellifecycle.repository.ModelVersionRepository;
import com.modellifecycle.storage.ArtifactStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Catalog of model versions and the only component allowed to change their lifecycle state.
 *
 * <p>Every mutation runs in its own transaction inside a single registry-wide lock, so
 * "read current production, demote it, promote the target" is never interleaved with another
 * promotion. That keeps at most one {@code PRODUCTION} and at most one {@code STAGING} version.
 * A failed commit rolls the whole mutation back and surfaces as {@link StorageException}.
 */
@Slf4j
@Service
public class ModelRegistryService {

    private static final Pattern VERSION_PATTERN = Pattern.compile("^[a-zA-Z0-9._-]{1,64}$");

    private final ModelVersionRepository repository;
    private final ArtifactStore artifactStore;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;
    private final ReentrantLock mutationLock = new ReentrantLock();

    public ModelRegistryService(ModelVersionRepository repository,
                                ArtifactStore artifactStore,
                                PlatformTransactionManager transactionManager,
                                Clock clock) {
        this.repository = repository;
        this.artifactStore = artifactStore;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
    }

    public ModelVersion register(String versionId, String artifactLocation,
                                 Map<String, Double> metrics, Map<String, String> metadata) {
        return register(versionId, null, artifactLocation, metrics, metadata);
    }

    public ModelVersion register(String versionId, ModelType modelType, String artifactLocation,
                                 Map<String, Double> metrics, Map<String, String> metadata) {
        if (versionId == null || !VERSION_PATTERN.matcher(versionId).matches()) {
            throw new LifecycleValidationException("Model version must match ^[a-zA-Z0-9._-]{1,64}$");
        }
        if (artifactLocation == null || artifactLocation.isBlank()) {
            throw new LifecycleValidationException("artifactLocation is required");
        }
        if (metrics == null) {
            throw new LifecycleValidationException("metrics are required");
        }

        ModelVersion saved = mutate(() -> {
            if (repository.existsById(versionId)) {
                throw new DuplicateVersionException(versionId);
            }
            Instant now = clock.instant();
            return repository.save(ModelVersion.builder()
                .versionId(versionId)
                .modelType(modelType != null ? modelType : ModelType.ENSEMBLE)
                .artifactLocation(artifactLocation)
                .metrics(new LinkedHashMap<>(metrics))
                .metadata(metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>())
                .state(ModelState.REGISTERED)
                .createdAt(now)
                .stateChangedAt(now)
                .build());
        });
        log.info("Model registered | version={} | type={} | metrics={}", versionId, saved.getModelType(), metrics.keySet());
        return saved;
    }

    @Transactional(readOnly = true)
    public ModelVersion get(String versionId) {
        return repository.findById(versionId)
            .orElseThrow(() -> new ModelVersionNotFoundException(versionId));
    }

    public ModelVersion promoteToStaging(String versionId) {
        return mutate(() -> {
            ModelVersion target = load(versionId);
            if (target.getState() == ModelState.STAGING) {
                return target;
            }
            requireTransition(target, ModelState.STAGING, false);

            Instant now = clock.instant();
            for (ModelVersion previous : repository.findByStateOrderByCreatedAtDesc(ModelState.STAGING)) {
                requireTransition(previous, ModelState.REGISTERED, false);
                previous.transitionTo(ModelState.REGISTERED, now);
                repository.save(previous);
                log.info("Staging version demoted | version={} | state=REGISTERED", previous.getVersionId());
            }
            target.transitionTo(ModelState.STAGING, now);
            ModelVersion saved = repository.save(target);
            log.info("Model promoted | version={} | state=STAGING", versionId);
            return saved;
        });
    }

    public ModelVersion promoteToProduction(String versionId) {
        return mutate(() -> {
            ModelVersion target = load(versionId);
            if (target.getState() == ModelState.PRODUCTION) {
                return target;
            }
            requireTransition(target, ModelState.PRODUCTION, false);

            Instant now = clock.instant();
            for (ModelVersion previous : repository.findByStateOrderByCreatedAtDesc(ModelState.PRODUCTION)) {
                requireTransition(previous, ModelState.ARCHIVED, false);
                previous.transitionTo(ModelState.ARCHIVED, now);
                repository.save(previous);
                log.info("Production version archived | version={}", previous.getVersionId());
            }
            target.transitionTo(ModelState.PRODUCTION, now);
            ModelVersion saved = repository.save(target);
            log.info("Model promoted | version={} | state=PRODUCTION", versionId);
            return saved;
        });
    }

    /**
     * Restores the most recently archived version. The displaced production version goes
     * back to {@code REGISTERED}, not {@code ARCHIVED}, so a second rollback cannot bounce
     * straight back to it.
     */
    public RollbackResponse rollback() {
        return mutate(() -> {
            ModelVersion restored = repository.findFirstByStateOrderByArchivedAtDesc(ModelState.ARCHIVED)
                .orElseThrow(NoRollbackTargetException::new);
            requireTransition(restored, ModelState.PRODUCTION, true);

            Instant now = clock.instant();
            String demotedId = null;
            for (ModelVersion current : repository.findByStateOrderByCreatedAtDesc(ModelState.PRODUCTION)) {
                requireTransition(current, ModelState.REGISTERED, true);
                current.transitionTo(ModelState.REGISTERED, now);
                repository.save(current);
                demotedId = current.getVersionId();
            }
            restored.transitionTo(ModelState.PRODUCTION, now);
            restored.setRolledBackAt(now);
            repository.save(restored);
            log.warn("Production rolled back | restored={} | demoted={}", restored.getVersionId(), demotedId);
            return RollbackResponse.builder()
                .restoredVersionId(restored.getVersionId())
                .demotedVersionId(demotedId)
                .build();
        });
    }

    @Transactional(readOnly = true)
    public ComparisonResult compare(String versionA, String versionB) {
        ModelVersion a = get(versionA);
        ModelVersion b = get(versionB);
        return MetricComparator.compare(a.getVersionId(), a.getMetrics(), b.getVersionId(), b.getMetrics());
    }

    @Transactional(readOnly = true)
    public Optional<ModelVersion> getProduction() {
        return repository.findByStateOrderByCreatedAtDesc(ModelState.PRODUCTION).stream().findFirst();
    }

    @Transactional(readOnly = true)
    public Optional<ModelVersion> getStaging() {
        return repository.findByStateOrderByCreatedAtDesc(ModelState.STAGING).stream().findFirst();
    }

    @Transactional(readOnly = true)
    public Optional<ModelVersion> getLatest() {
        return repository.findFirstByOrderByCreatedAtDesc();
    }

    @Transactional(readOnly = true)
    public List<ModelVersion> list(ModelState state) {
        return state == null
            ? repository.findAllByOrderByCreatedAtDesc()
            : repository.findByStateOrderByCreatedAtDesc(state);
    }

    @Transactional(readOnly = true)
    public RegistryExportResponse export() {
        List<ModelVersion> all = repository.findAllByOrderByCreatedAtDesc();
        List<ModelVersionResponse> versions = new ArrayList<>();
        for (int i = all.size() - 1; i >= 0; i--) {
            versions.add(ModelVersionResponse.from(all.get(i)));
        }
        RegistryExportResponse snapshot = RegistryExportResponse.builder()
            .exportedAt(clock.instant())
            .productionVersionId(getProduction().map(ModelVersion::getVersionId).orElse(null))
            .stagingVersionId(getStaging().map(ModelVersion::getVersionId).orElse(null))
            .totalVersions(versions.size())
            .versions(versions)
            .build();
        log.info("Registry exported | versions={} | production={}", versions.size(), snapshot.getProductionVersionId());
        return snapshot;
    }

    @Transactional(readOnly = true)
    public RegistrySummaryResponse summary() {
        Map<ModelState, Long> counts = new EnumMap<>(ModelState.class);
        for (ModelState state : ModelState.values()) {
            counts.put(state, 0L);
        }
        long total = 0;
        for (Object[] row : repository.countGroupedByState()) {
            long count = ((Number) row[1]).longValue();
            counts.put((ModelState) row[0], count);
            total += count;
        }

        RegistrySummaryResponse.LatestVersion latest = getLatest()
            .map(v -> RegistrySummaryResponse.LatestVersion.builder()
                .versionId(v.getVersionId())
                .createdAt(v.getCreatedAt())
                .state(v.getState())
                .build())
            .orElse(null);

        return RegistrySummaryResponse.builder()
            .totalVersions(total)
            .productionVersionId(getProduction().map(ModelVersion::getVersionId).orElse(null))
            .stagingVersionId(getStaging().map(ModelVersion::getVersionId).orElse(null))
            .countsByState(counts)
            .latestVersion(latest)
            .build();
    }

    /**
     * Removes a version that is neither in production nor in staging. With {@code purgeArtifact}
     * the blob is deleted too, unless another version still points at the same location. A failed
     * purge is logged and reported as {@code artifactPurged=false}; the row stays deleted.
     */
    public DeletionResponse delete(String versionId, boolean purgeArtifact) {
        DeletionCandidate removed = mutate(() -> {
            ModelVersion target = load(versionId);
            if (target.getState() == ModelState.PRODUCTION || target.getState() == ModelState.STAGING) {
                throw new ProtectedVersionException(versionId, target.getState());
            }
            boolean shared = repository.existsByArtifactLocationAndVersionIdNot(target.getArtifactLocation(), versionId);
            repository.delete(target);
            return new DeletionCandidate(target.getArtifactLocation(), shared);
        });
        log.info("Model deleted | version={} | purgeArtifact={}", versionId, purgeArtifact);

        boolean purged = purgeArtifact && purge(versionId, removed);
        return DeletionResponse.builder()
            .versionId(versionId)
            .artifactLocation(removed.location)
            .artifactPurged(purged)
            .build();
    }

    private boolean purge(String versionId, DeletionCandidate removed) {
        if (removed.shared) {
            log.info("Artifact purge skipped | version={} | location={} | reason=referenced by another version",
                     versionId, removed.location);
            return false;
        }
        try {
            if (!artifactStore.exists(removed.location)) {
                return false;
            }
            artifactStore.delete(removed.location);
            log.info("Artifact purged | version={} | location={}", versionId, removed.location);
            return true;
        } catch (StorageException ex) {
            log.error("Artifact purge failed | version={} | location={} | cause={}",
                      versionId, removed.location, ex.getMessage(), ex);
            return false;
        }
    }

    private ModelVersion load(String versionId) {
        return repository.findById(versionId)
            .orElseThrow(() -> new ModelVersionNotFoundException(versionId));
    }

    private void requireTransition(ModelVersion version, ModelState target, boolean rollback) {
        if (!version.getState().canTransitionTo(target, rollback)) {
            throw new LifecycleValidationException(String.format(
                "Illegal transition for model version '%s': %s -> %s",
                version.getVersionId(), version.getState(), target));
        }
    }

    private <T> T mutate(Supplier<T> work) {
        mutationLock.lock();
        try {
            return transactionTemplate.execute(status -> work.get());
        } catch (ModelLifecycleException ex) {
            throw ex;
        } catch (DataAccessException | TransactionException ex) {
            log.error("Registry write failed | cause={}", ex.getMessage(), ex);
            throw new StorageException("Registry write failed; no changes were applied", ex);
        } finally {
            mutationLock.unlock();
        }
    }

    private static final class DeletionCandidate {
        private final String location;
        private final boolean shared;

        private DeletionCandidate(String location, boolean shared) {
            this.location = location;
            this.shared = shared;
        }
    }
}
