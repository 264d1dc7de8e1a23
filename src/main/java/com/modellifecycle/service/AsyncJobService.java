package com.modellifecycle.service;

import com.modellifecycle.dto.AsyncJobResponse;
import com.modellifecycle.dto.AsyncJobStatus;
import com.modellifecycle.exception.JobNotFoundException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Supplier;

/**
 * In-memory runner for long operations such as retraining. Job state is kept for the
 * lifetime of the process only; the durable record of a run is its retraining decision.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AsyncJobService {

    private final Clock clock;

    @Value("${jobs.pool-size:2}")
    private int poolSize;

    @Value("${jobs.max-retained:1000}")
    private int maxRetained;

    private ExecutorService executor;
    private final ConcurrentHashMap<UUID, JobState> jobs = new ConcurrentHashMap<>();

    @PostConstruct
    void init() {
        executor = Executors.newFixedThreadPool(Math.max(1, poolSize));
    }

    @PreDestroy
    void shutdown() {
        if (executor != null) {
            executor.shutdown();
        }
    }

    public UUID submit(String jobType, String requestId, Duration expectedDuration, Supplier<Object> task) {
        UUID jobId = UUID.randomUUID();
        Instant now = clock.instant();
        JobState state = new JobState(jobId, jobType, requestId, now,
            expectedDuration != null ? now.plus(expectedDuration) : null);
        jobs.put(jobId, state);
        cleanupIfNeeded();

        CompletableFuture.runAsync(() -> execute(state, task), executor);
        return jobId;
    }

    public AsyncJobResponse getJob(UUID jobId) {
        JobState state = jobs.get(jobId);
        if (state == null) {
            throw new JobNotFoundException(jobId);
        }
        return state.toResponse();
    }

    private void execute(JobState state, Supplier<Object> task) {
        if (state.requestId != null) {
            MDC.put("requestId", state.requestId);
        }
        state.markRunning(clock.instant());
        try {
            Object result = task.get();
            state.markCompleted(clock.instant(), result);
            log.info("Job completed | jobId={} | type={}", state.jobId, state.jobType);
        } catch (RuntimeException ex) {
            String message = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
            state.markFailed(clock.instant(), message);
            log.error("Job failed | jobId={} | type={} | cause={}", state.jobId, state.jobType, message, ex);
        } catch (Error err) {
            state.markFailed(clock.instant(), err.getClass().getSimpleName());
            log.error("Job aborted | jobId={} | type={} | error={}", state.jobId, state.jobType, err.getClass().getName(), err);
            throw err;
        } finally {
            MDC.remove("requestId");
        }
    }

    private void cleanupIfNeeded() {
        if (jobs.size() <= maxRetained) {
            return;
        }
        jobs.entrySet().stream()
            .filter(e -> e.getValue().status == AsyncJobStatus.COMPLETED || e.getValue().status == AsyncJobStatus.FAILED)
            .sorted(Comparator.comparing(e -> e.getValue().createdAt))
            .limit(Math.max(1, jobs.size() - maxRetained))
            .map(Map.Entry::getKey)
            .forEach(jobs::remove);
    }

    private static final class JobState {
        private final UUID jobId;
        private final String jobType;
        private final String requestId;
        private final Instant createdAt;
        private final Instant estimatedCompletionAt;
        private volatile Instant startedAt;
        private volatile Instant completedAt;
        private volatile AsyncJobStatus status;
        private volatile Integer progressPercent;
        private volatile String message;
        private volatile Object result;

        private JobState(UUID jobId, String jobType, String requestId, Instant createdAt, Instant estimatedCompletionAt) {
            this.jobId = jobId;
            this.jobType = jobType;
            this.requestId = requestId;
            this.createdAt = createdAt;
            this.estimatedCompletionAt = estimatedCompletionAt;
            this.status = AsyncJobStatus.QUEUED;
            this.progressPercent = 0;
            this.message = "Queued";
        }

        private synchronized void markRunning(Instant at) {
            this.startedAt = at;
            this.status = AsyncJobStatus.RUNNING;
            this.message = "Job started";
            this.progressPercent = 5;
        }

        private synchronized void markCompleted(Instant at, Object result) {
            this.completedAt = at;
            this.status = AsyncJobStatus.COMPLETED;
            this.result = result;
            this.message = "Job completed";
            this.progressPercent = 100;
        }

        private synchronized void markFailed(Instant at, String message) {
            this.completedAt = at;
            this.status = AsyncJobStatus.FAILED;
            this.message = message;
            this.progressPercent = 100;
        }

        private synchronized AsyncJobResponse toResponse() {
            return AsyncJobResponse.builder()
                .jobId(jobId)
                .jobType(jobType)
                .status(status)
                .createdAt(createdAt)
                .startedAt(startedAt)
                .completedAt(completedAt)
                .estimatedCompletionAt(estimatedCompletionAt)
                .progressPercent(progressPercent)
                .message(message)
                .result(result)
                .requestId(requestId)
                .build();
        }
    }
}
