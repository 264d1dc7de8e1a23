package com.modellifecycle.service;

import com.modellifecycle.dto.AsyncJobResponse;
import com.modellifecycle.dto.AsyncJobStatus;
import com.modellifecycle.exception.JobNotFoundException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class AsyncJobServiceTest {

    private static final Instant NOW = Instant.parse("2025-06-15T12:00:00Z");

    AsyncJobService service;

    @BeforeEach
    void setUp() {
        service = new AsyncJobService(Clock.fixed(NOW, ZoneOffset.UTC));
        ReflectionTestUtils.setField(service, "poolSize", 1);
        ReflectionTestUtils.setField(service, "maxRetained", 100);
        service.init();
    }

    @AfterEach
    void tearDown() {
        service.shutdown();
    }

    @Test
    void submit_reportsEstimatedCompletionAndResult() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        UUID jobId = service.submit("retraining", "req-1", Duration.ofMinutes(30), () -> {
            awaitQuietly(release);
            return "done";
        });

        AsyncJobResponse pending = service.getJob(jobId);
        assertThat(pending.getEstimatedCompletionAt()).isEqualTo(NOW.plus(Duration.ofMinutes(30)));
        assertThat(pending.getRequestId()).isEqualTo("req-1");
        assertThat(pending.getStatus()).isIn(AsyncJobStatus.QUEUED, AsyncJobStatus.RUNNING);

        release.countDown();
        AsyncJobResponse finished = awaitTerminal(jobId);
        assertThat(finished.getStatus()).isEqualTo(AsyncJobStatus.COMPLETED);
        assertThat(finished.getResult()).isEqualTo("done");
        assertThat(finished.getProgressPercent()).isEqualTo(100);
    }

    @Test
    void failingTask_isReportedAsFailed() throws Exception {
        UUID jobId = service.submit("retraining", null, null, () -> {
            throw new IllegalStateException("trainer exploded");
        });

        AsyncJobResponse finished = awaitTerminal(jobId);
        assertThat(finished.getStatus()).isEqualTo(AsyncJobStatus.FAILED);
        assertThat(finished.getMessage()).isEqualTo("trainer exploded");
        assertThat(finished.getEstimatedCompletionAt()).isNull();
    }

    @Test
    void taskThrowingError_isStillMarkedFailed() throws Exception {
        UUID jobId = service.submit("retraining", null, null, () -> {
            throw new StackOverflowError();
        });

        AsyncJobResponse finished = awaitTerminal(jobId);
        assertThat(finished.getStatus()).isEqualTo(AsyncJobStatus.FAILED);
        assertThat(finished.getMessage()).isEqualTo("StackOverflowError");
        assertThat(finished.getCompletedAt()).isEqualTo(NOW);
    }

    @Test
    void unknownJob_throwsNotFound() {
        assertThatThrownBy(() -> service.getJob(UUID.randomUUID())).isInstanceOf(JobNotFoundException.class);
    }

    private AsyncJobResponse awaitTerminal(UUID jobId) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000;
        AsyncJobResponse job = service.getJob(jobId);
        while (job.getStatus() != AsyncJobStatus.COMPLETED && job.getStatus() != AsyncJobStatus.FAILED
                && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
            job = service.getJob(jobId);
        }
        return job;
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
    }
}
