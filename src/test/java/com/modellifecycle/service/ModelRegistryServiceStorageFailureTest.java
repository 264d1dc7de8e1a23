package com.modellifecycle.service;

import com.modellifecycle.dto.DeletionResponse;
import com.modellifecycle.entity.ModelState;
import com.modellifecycle.entity.ModelVersion;
import com.modellifecycle.exception.StorageException;
import com.modellifecycle.repository.ModelVersionRepository;
import com.modellifecycle.storage.ArtifactStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.test.context.ActiveProfiles;

import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;

@SpringBootTest
@ActiveProfiles("test")
class ModelRegistryServiceStorageFailureTest {

    @Autowired ModelRegistryService registry;
    @SpyBean   ModelVersionRepository repository;
    @SpyBean   ArtifactStore artifactStore;

    @BeforeEach
    void cleanRegistry() {
        repository.deleteAll();
    }

    private void register(String id, double accuracy) {
        registry.register(id, artifactStore.put(id.getBytes()), Map.of("accuracy", accuracy), Map.of());
    }

    private ModelState stateOf(String id) {
        return repository.findById(id).map(ModelVersion::getState).orElseThrow();
    }

    @Test
    void promoteToProduction_failedWrite_leavesRegistryUnchanged() {
        register("v1", 0.80);
        register("v2", 0.85);
        registry.promoteToStaging("v1");
        registry.promoteToProduction("v1");
        registry.promoteToStaging("v2");

        // archiving v1 goes through, saving v2 as production does not
        AtomicInteger saves = new AtomicInteger();
        doAnswer(inv -> {
            if (saves.incrementAndGet() > 1) {
                throw new DataAccessResourceFailureException("connection reset");
            }
            return inv.callRealMethod();
        }).when(repository).save(any(ModelVersion.class));

        assertThatThrownBy(() -> registry.promoteToProduction("v2"))
            .isInstanceOf(StorageException.class)
            .hasRootCauseInstanceOf(DataAccessResourceFailureException.class);

        assertThat(saves.get()).isEqualTo(2);
        assertThat(stateOf("v1")).isEqualTo(ModelState.PRODUCTION);
        assertThat(stateOf("v2")).isEqualTo(ModelState.STAGING);
        assertThat(repository.findById("v1").orElseThrow().getArchivedAt()).isNull();
    }

    @Test
    void delete_purgeFailure_isReportedWithoutFailingTheDelete() {
        String location = artifactStore.put("weights".getBytes());
        registry.register("v1", location, Map.of("accuracy", 0.80), Map.of());
        doThrow(new StorageException("permission denied")).when(artifactStore).delete(location);

        DeletionResponse response = registry.delete("v1", true);

        assertThat(response.isArtifactPurged()).isFalse();
        assertThat(response.getArtifactLocation()).isEqualTo(location);
        assertThat(repository.existsById("v1")).isFalse();
        assertThat(artifactStore.exists(location)).isTrue();
    }
}
