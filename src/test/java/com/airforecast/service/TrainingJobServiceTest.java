package com.airforecast.service;

import com.airforecast.config.CityCatalog;
import com.airforecast.dto.AsyncJobResponse;
import com.airforecast.dto.AsyncJobStatus;
import com.airforecast.dto.TrainingBatchResponse;
import com.airforecast.dto.TrainingResponse;
import com.airforecast.exception.IrreparableGapException;
import com.airforecast.exception.JobNotFoundException;
import com.airforecast.exception.TrainingDivergedException;
import com.airforecast.model.City;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TrainingJobServiceTest {

    private static final Instant NOW = Instant.parse("2025-06-01T02:30:00Z");

    @Mock ForecastService forecastService;
    @Mock CityCatalog cityCatalog;

    private TrainingJobService jobs;

    @BeforeEach
    void setUp() {
        jobs = new TrainingJobService(forecastService, cityCatalog, Clock.fixed(NOW, ZoneOffset.UTC));
        ReflectionTestUtils.setField(jobs, "poolSize", 2);
        ReflectionTestUtils.setField(jobs, "maxRetained", 10);
        jobs.init();

        lenient().when(cityCatalog.all()).thenReturn(List.of(
            new City("dongguan", "Dongguan", 1001),
            new City("foshan", "Foshan", 1005),
            new City("macao", "Macao", 1011)));
        lenient().when(forecastService.train("dongguan"))
            .thenReturn(TrainingResponse.builder().cityId("dongguan").versionId("dongguan-20250601T023000Z").build());
        lenient().when(forecastService.train("foshan"))
            .thenThrow(new IrreparableGapException("foshan", NOW.minusSeconds(36_000), 5, 2));
        lenient().when(forecastService.train("macao"))
            .thenThrow(new TrainingDivergedException("macao", 12));
    }

    @AfterEach
    void tearDown() {
        jobs.shutdown();
    }

    @Test
    void trainAll_separatesDataQualitySkipsFromFailures() {
        TrainingBatchResponse batch = jobs.trainAll();

        assertThat(batch.getSuccessful()).extracting(TrainingResponse::getCityId).containsExactly("dongguan");
        assertThat(batch.getSkipped()).containsOnlyKeys("foshan");
        assertThat(batch.getFailed()).containsOnlyKeys("macao");
        assertThat(batch.getStartedAt()).isEqualTo(NOW);
        verify(forecastService).train("dongguan");
        verify(forecastService).train("foshan");
        verify(forecastService).train("macao");
    }

    @Test
    void submitTrainAll_completesInBackground() throws InterruptedException {
        UUID jobId = jobs.submitTrainAll("req-batch");

        AsyncJobResponse status = jobs.getJob(jobId);
        long deadline = System.currentTimeMillis() + 10_000;
        while (status.getStatus() != AsyncJobStatus.COMPLETED && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
            status = jobs.getJob(jobId);
        }

        assertThat(status.getStatus()).isEqualTo(AsyncJobStatus.COMPLETED);
        assertThat(status.getJobType()).isEqualTo("TRAIN_ALL");
        assertThat(status.getRequestId()).isEqualTo("req-batch");
        assertThat(status.getMessage()).isEqualTo("1 trained, 1 skipped, 1 failed");
        assertThat(status.getResult()).isInstanceOf(TrainingBatchResponse.class);
    }

    @Test
    void getJob_unknownId_throws() {
        assertThatThrownBy(() -> jobs.getJob(UUID.randomUUID()))
            .isInstanceOf(JobNotFoundException.class);
    }
}
