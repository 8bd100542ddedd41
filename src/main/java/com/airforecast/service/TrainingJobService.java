package com.airforecast.service;

import com.airforecast.config.CityCatalog;
import com.airforecast.dto.AsyncJobResponse;
import com.airforecast.dto.AsyncJobStatus;
import com.airforecast.dto.TrainingBatchResponse;
import com.airforecast.dto.TrainingResponse;
import com.airforecast.exception.DataQualityException;
import com.airforecast.exception.JobNotFoundException;
import com.airforecast.model.City;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Trains all configured cities on a worker pool, one task per city, and tracks
 * asynchronous batch jobs. Shutting down interrupts running work, which cancels
 * training between epochs.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TrainingJobService {

    static final String JOB_TYPE = "TRAIN_ALL";

    private final ForecastService forecastService;
    private final CityCatalog cityCatalog;
    private final Clock clock;

    @Value("${forecast.training.pool-size:4}")
    private int poolSize;

    @Value("${forecast.training.max-retained-jobs:100}")
    private int maxRetained;

    private ExecutorService workers;
    private ExecutorService coordinator;
    private final ConcurrentHashMap<UUID, JobState> jobs = new ConcurrentHashMap<>();

    @PostConstruct
    void init() {
        workers = Executors.newFixedThreadPool(Math.max(1, poolSize));
        coordinator = Executors.newSingleThreadExecutor();
    }

    @PreDestroy
    void shutdown() {
        if (coordinator != null) {
            coordinator.shutdownNow();
        }
        if (workers != null) {
            workers.shutdownNow();
        }
    }

    public TrainingBatchResponse trainAll() {
        Instant startedAt = clock.instant();
        Map<String, CompletableFuture<TrainingResponse>> runs = new LinkedHashMap<>();
        for (City city : cityCatalog.all()) {
            runs.put(city.id(), CompletableFuture.supplyAsync(() -> forecastService.train(city.id()), workers));
        }

        List<TrainingResponse> successful = new ArrayList<>();
        Map<String, String> skipped = new LinkedHashMap<>();
        Map<String, String> failed = new LinkedHashMap<>();
        runs.forEach((cityId, run) -> {
            try {
                successful.add(run.join());
            } catch (CompletionException ex) {
                Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
                String reason = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
                if (cause instanceof DataQualityException) {
                    log.warn("Training skipped | city={} | reason={}", cityId, reason);
                    skipped.put(cityId, reason);
                } else {
                    log.error("Training failed | city={} | reason={}", cityId, reason, cause);
                    failed.put(cityId, reason);
                }
            }
        });

        log.info("Training batch finished | successful={} | skipped={} | failed={}",
                 successful.size(), skipped.keySet(), failed.keySet());
        return TrainingBatchResponse.builder()
            .startedAt(startedAt)
            .completedAt(clock.instant())
            .successful(successful)
            .skipped(skipped)
            .failed(failed)
            .build();
    }

    public UUID submitTrainAll(String requestId) {
        UUID jobId = UUID.randomUUID();
        JobState state = new JobState(jobId, requestId, clock.instant());
        jobs.put(jobId, state);
        cleanupIfNeeded();

        CompletableFuture.runAsync(() -> execute(state), coordinator);
        log.info("Training job queued | jobId={} | requestId={}", jobId, requestId);
        return jobId;
    }

    public AsyncJobResponse getJob(UUID jobId) {
        JobState state = jobs.get(jobId);
        if (state == null) {
            throw new JobNotFoundException(jobId);
        }
        return state.toResponse();
    }

    private void execute(JobState state) {
        state.markRunning(clock.instant());
        try {
            TrainingBatchResponse result = trainAll();
            state.markCompleted(result, clock.instant());
        } catch (RuntimeException ex) {
            log.error("Training job failed | jobId={}", state.jobId, ex);
            state.markFailed(ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName(), clock.instant());
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
            .toList()
            .forEach(jobs::remove);
    }

    private static final class JobState {
        private final UUID jobId;
        private final String requestId;
        private final Instant createdAt;
        private volatile Instant startedAt;
        private volatile Instant completedAt;
        private volatile AsyncJobStatus status = AsyncJobStatus.QUEUED;
        private volatile String message = "Queued";
        private volatile Object result;

        private JobState(UUID jobId, String requestId, Instant createdAt) {
            this.jobId = jobId;
            this.requestId = requestId;
            this.createdAt = createdAt;
        }

        private synchronized void markRunning(Instant at) {
            this.startedAt = at;
            this.status = AsyncJobStatus.RUNNING;
            this.message = "Training all cities";
        }

        private synchronized void markCompleted(TrainingBatchResponse batch, Instant at) {
            this.completedAt = at;
            this.status = AsyncJobStatus.COMPLETED;
            this.result = batch;
            this.message = batch.getSuccessful().size() + " trained, " + batch.getSkipped().size()
                + " skipped, " + batch.getFailed().size() + " failed";
        }

        private synchronized void markFailed(String message, Instant at) {
            this.completedAt = at;
            this.status = AsyncJobStatus.FAILED;
            this.message = message;
        }

        private synchronized AsyncJobResponse toResponse() {
            return AsyncJobResponse.builder()
                .jobId(jobId)
                .jobType(JOB_TYPE)
                .status(status)
                .createdAt(createdAt)
                .startedAt(startedAt)
                .completedAt(completedAt)
                .message(message)
                .result(result)
                .requestId(requestId)
                .build();
        }
    }
}
