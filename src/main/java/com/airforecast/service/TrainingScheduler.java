package com.airforecast.service;

import com.airforecast.dto.TrainingBatchResponse;
import com.airforecast.exception.ForecastEngineException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Daily retraining of every city plus a periodic pass over cities with a pending
 * retrain signal.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "forecast.scheduler", name = "enabled", havingValue = "true")
public class TrainingScheduler {

    private final TrainingJobService trainingJobService;
    private final ForecastService forecastService;
    private final RetrainSignalRegistry retrainSignals;

    @Scheduled(cron = "${forecast.scheduler.daily-cron}", zone = "UTC")
    public void dailyTraining() {
        log.info("Scheduled daily training started");
        TrainingBatchResponse batch = trainingJobService.trainAll();
        log.info("Scheduled daily training done | successful={} | skipped={} | failed={}",
                 batch.getSuccessful().size(), batch.getSkipped().size(), batch.getFailed().size());
    }

    @Scheduled(fixedDelayString = "${forecast.scheduler.signal-sweep}",
               initialDelayString = "${forecast.scheduler.signal-sweep}")
    public void sweepRetrainSignals() {
        for (String cityId : retrainSignals.pendingCities()) {
            try {
                forecastService.train(cityId);
            } catch (ForecastEngineException ex) {
                log.warn("Signalled retrain did not complete | city={} | code={} | {}",
                         cityId, ex.getErrorCode(), ex.getMessage());
            }
        }
    }
}
