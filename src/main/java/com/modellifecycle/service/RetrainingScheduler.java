package com.modellifecycle.service;

import com.modellifecycle.dto.RetrainingRunRequest;
import com.modellifecycle.entity.RetrainingDecision;
import com.modellifecycle.entity.TriggerReason;
import com.modellifecycle.exception.ModelLifecycleException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic non-forced retraining. Enabled with {@code retraining.schedule.enabled=true}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "retraining.schedule", name = "enabled", havingValue = "true")
public class RetrainingScheduler {

    private final RetrainingOrchestratorService orchestrator;

    @Scheduled(cron = "${retraining.schedule.cron:0 0 3 * * *}", zone = "UTC")
    public void scheduledRun() {
        try {
            RetrainingDecision decision = orchestrator.run(
                RetrainingRunRequest.builder().force(false).requestedBy("scheduler").build(),
                TriggerReason.SCHEDULED);
            log.info("Scheduled retraining finished | decision={} | outcome={}", decision.getId(), decision.getOutcome());
        } catch (ModelLifecycleException ex) {
            // the failed decision is already recorded; the next tick tries again
            log.error("Scheduled retraining failed | code={} | cause={}", ex.getErrorCode(), ex.getMessage(), ex);
        }
    }
}
