package com.airforecast.service;

import com.airforecast.config.CityCatalog;
import com.airforecast.config.ForecastProperties;
import com.airforecast.dto.EvaluationReportResponse;
import com.airforecast.dto.EvaluationResponse;
import com.airforecast.dto.ForecastResponse;
import com.airforecast.dto.ModelStatusResponse;
import com.airforecast.dto.TrainingResponse;
import com.airforecast.entity.EvaluationReport;
import com.airforecast.entity.PredictionRecord;
import com.airforecast.exception.PredictionTimeoutException;
import com.airforecast.exception.TrainingCancelledException;
import com.airforecast.model.City;
import com.airforecast.model.ModelLifecycleState;
import com.airforecast.model.ModelVersion;
import com.airforecast.model.ObservationWindow;
import com.airforecast.model.RetrainDecision;
import com.airforecast.model.RetrainSignal;
import com.airforecast.model.TrainingResult;
import com.airforecast.repository.EvaluationReportRepository;
import com.airforecast.repository.PredictionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Entry point for the three engine operations (train, predict, evaluate) and model status.
 * Each call handles one city and can be retried safely.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ForecastService {

    private final CityCatalog cityCatalog;
    private final WindowLoader windowLoader;
    private final NcCqrTrainer trainer;
    private final ModelRegistryService registry;
    private final ForecastPredictor predictor;
    private final ForecastEvaluator evaluator;
    private final RetrainPolicy retrainPolicy;
    private final RetrainSignalRegistry retrainSignals;
    private final ReproducibilityService reproducibility;
    private final PredictionRepository predictionRepository;
    private final EvaluationReportRepository evaluationReportRepository;
    private final ForecastProperties properties;
    private final ExecutorService predictionExecutor;
    private final Clock clock;

    private final ConcurrentHashMap<String, ReentrantLock> trainingLocks = new ConcurrentHashMap<>();

    /**
     * Trains on the newest complete window, registers the result and makes it current.
     * A pending retrain signal is consumed; it is put back if the run fails.
     */
    public TrainingResponse train(String cityId) {
        City city = cityCatalog.require(cityId);
        ReentrantLock lock = trainingLocks.computeIfAbsent(city.id(), id -> new ReentrantLock());
        try {
            lock.lockInterruptibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TrainingCancelledException(cityId);
        }
        Optional<RetrainSignal> signal = retrainSignals.consume(cityId);
        try {
            signal.ifPresent(s -> log.info("Retraining on signal | city={} | reason={}", cityId, s.reason()));
            Instant windowEnd = latestUsableHour();
            ObservationWindow window = windowLoader.load(cityId, windowEnd);
            long seed = reproducibility.seedFor(cityId);
            TrainingResult result = trainer.train(window, seed);

            String versionId = registry.put(cityId, clock.instant(), result);
            registry.promote(cityId, versionId);
            int purged = registry.purgeExpired(cityId, clock.instant());

            log.info("City trained | city={} | version={} | windowEnd={} | imputedHours={}",
                     cityId, versionId, windowEnd, window.imputedHours());
            return toTrainingResponse(registry.load(cityId, versionId), windowEnd,
                signal.map(RetrainSignal::reason).orElse(null), purged);
        } catch (RuntimeException ex) {
            signal.ifPresent(retrainSignals::restore);
            throw ex;
        } finally {
            lock.unlock();
        }
    }

    public ForecastResponse predict(String cityId, String requestId) {
        return predict(cityId, latestUsableHour(), requestId);
    }

    /**
     * Forecasts the H hours after {@code asOf}. A repeat call for the same hour and model
     * version returns the stored forecast instead of a new one.
     */
    public ForecastResponse predict(String cityId, Instant asOf, String requestId) {
        cityCatalog.require(cityId);
        Instant hour = asOf.truncatedTo(ChronoUnit.HOURS);
        Duration timeout = properties.getPrediction().getTimeout();

        Future<PredictionRecord> future = CompletableFuture.supplyAsync(
            () -> predictor.predict(cityId, hour), predictionExecutor);
        PredictionRecord computed;
        try {
            computed = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new PredictionTimeoutException(cityId, timeout, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new PredictionTimeoutException(cityId, timeout, e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Prediction failed for city " + cityId, e.getCause());
        }

        computed.setRequestId(requestId);
        PredictionRecord saved = predictionRepository
            .findFirstByCityIdAndAsOfAndModelVersion(cityId, computed.getAsOf(), computed.getModelVersion())
            .orElseGet(() -> persist(computed));
        log.info("Forecast served | id={} | city={} | asOf={} | version={} | requestId={}",
                 saved.getId(), cityId, saved.getAsOf(), saved.getModelVersion(), requestId);
        return toResponse(saved);
    }

    /**
     * Scores every stored forecast whose horizon has fully elapsed and re-assesses the
     * retrain policy over the most recent reports of the currently promoted version.
     */
    @Transactional
    public EvaluationResponse evaluate(String cityId) {
        cityCatalog.require(cityId);
        Instant cutoff = clock.instant().minus(Duration.ofHours(properties.getHorizonHours()));
        List<PredictionRecord> due = predictionRepository.findDueForEvaluation(cityId, cutoff);

        List<EvaluationReportResponse> reports = new ArrayList<>();
        for (PredictionRecord record : due) {
            EvaluationReport report = evaluator.evaluate(record);
            if (report.getSampleCount() > 0) {
                reports.add(toReportResponse(evaluationReportRepository.save(report)));
            }
            record.setEvaluated(true);
            predictionRepository.save(record);
        }

        // only the serving version's reports count; a fresh promotion starts from zero
        List<EvaluationReport> recent = registry.currentVersionId(cityId)
            .map(current -> evaluationReportRepository.findByCityIdAndModelVersionOrderByEvaluatedAtDesc(
                cityId, current, PageRequest.of(0, properties.getEvaluation().getRollingReports())))
            .orElse(List.of());
        RetrainDecision decision = retrainPolicy.assess(recent);
        if (decision.retrain()) {
            retrainSignals.raise(new RetrainSignal(cityId, decision.reason(), decision.rollingCoverage(),
                decision.rollingMae(), decision.sampleCount(), clock.instant()));
        }

        log.info("Evaluation done | city={} | evaluated={} | coverage={} | mae={} | retrain={}",
                 cityId, due.size(), decision.rollingCoverage(), decision.rollingMae(), decision.retrain());
        return EvaluationResponse.builder()
            .cityId(cityId)
            .evaluatedPredictions(due.size())
            .reports(reports)
            .rollingSampleCount(decision.sampleCount())
            .rollingCoverage(decision.rollingCoverage())
            .rollingMae(decision.rollingMae())
            .retrainRecommended(decision.retrain())
            .reason(decision.reason())
            .build();
    }

    public ModelStatusResponse status(String cityId) {
        City city = cityCatalog.require(cityId);
        Optional<RetrainSignal> signal = retrainSignals.peek(cityId);
        ModelStatusResponse.ModelStatusResponseBuilder status = ModelStatusResponse.builder()
            .cityId(city.id())
            .cityName(city.name())
            .availableVersions(registry.listVersions(cityId))
            .retrainPending(signal.isPresent())
            .retrainReason(signal.map(RetrainSignal::reason).orElse(null));

        Optional<ModelVersion> current = registry.getCurrent(cityId);
        if (current.isEmpty()) {
            return status.state(ModelLifecycleState.UNTRAINED).build();
        }
        ModelVersion version = current.get();
        return status
            .state(ModelLifecycleState.TRAINED)
            .currentVersion(version.versionId())
            .versionTimestamp(version.versionTimestamp())
            .fingerprint(version.diagnostics().fingerprint())
            .calibrationCoverage(version.diagnostics().calibrationCoverage())
            .build();
    }

    public List<ModelStatusResponse> statusAll() {
        return cityCatalog.all().stream().map(c -> status(c.id())).toList();
    }

    @Transactional(readOnly = true)
    public Page<ForecastResponse> getHistory(String cityId, Pageable pageable) {
        cityCatalog.require(cityId);
        return predictionRepository.findByCityIdOrderByAsOfDesc(cityId, pageable).map(this::toResponse);
    }

    /** Newest hour the observation store is expected to hold. */
    Instant latestUsableHour() {
        return clock.instant()
            .truncatedTo(ChronoUnit.HOURS)
            .minus(Duration.ofHours(properties.getWindow().getIngestionLagHours()));
    }

    private PredictionRecord persist(PredictionRecord record) {
        try {
            return predictionRepository.save(record);
        } catch (DataIntegrityViolationException e) {
            log.debug("Concurrent forecast for same hour, reusing stored one | city={} | asOf={}",
                      record.getCityId(), record.getAsOf());
            return predictionRepository
                .findFirstByCityIdAndAsOfAndModelVersion(record.getCityId(), record.getAsOf(), record.getModelVersion())
                .orElseThrow(() -> e);
        }
    }

    private TrainingResponse toTrainingResponse(ModelVersion version, Instant windowEnd,
                                                String consumedReason, int purged) {
        double targetScale = version.scaler().targetScale();
        List<Double> offsets = Arrays.stream(version.offset().perStep())
            .map(o -> o * targetScale)
            .boxed()
            .toList();
        return TrainingResponse.builder()
            .cityId(version.cityId())
            .versionId(version.versionId())
            .versionTimestamp(version.versionTimestamp())
            .windowEnd(windowEnd)
            .seed(version.diagnostics().seed())
            .fingerprint(version.diagnostics().fingerprint())
            .epochsRun(version.diagnostics().epochsRun())
            .finalLoss(version.diagnostics().finalLoss())
            .finalCrossingPenalty(version.diagnostics().finalCrossingPenalty())
            .trainingSamples(version.diagnostics().trainingSamples())
            .calibrationSamples(version.diagnostics().calibrationSamples())
            .calibrationCoverage(version.diagnostics().calibrationCoverage())
            .intervalOffsets(offsets)
            .consumedRetrainReason(consumedReason)
            .purgedVersions(purged)
            .build();
    }

    private ForecastResponse toResponse(PredictionRecord r) {
        return ForecastResponse.builder()
            .predictionId(r.getId())
            .cityId(r.getCityId())
            .asOf(r.getAsOf())
            .modelVersion(r.getModelVersion())
            .generatedAt(r.getGeneratedAt())
            .imputedHours(r.getImputedHours())
            .steps(r.getSteps().stream()
                .map(s -> ForecastResponse.Step.builder()
                    .targetTime(s.getTargetTime())
                    .point(s.getPoint())
                    .lower(s.getLower())
                    .upper(s.getUpper())
                    .build())
                .toList())
            .requestId(r.getRequestId())
            .build();
    }

    private EvaluationReportResponse toReportResponse(EvaluationReport r) {
        return EvaluationReportResponse.builder()
            .predictionId(r.getPredictionId())
            .modelVersion(r.getModelVersion())
            .evaluatedAt(r.getEvaluatedAt())
            .sampleCount(r.getSampleCount())
            .mae(r.getMae())
            .rmse(r.getRmse())
            .coverage(r.getCoverage())
            .meanIntervalWidth(r.getMeanIntervalWidth())
            .build();
    }
}
