package com.airforecast.service;

import com.airforecast.config.CityCatalog;
import com.airforecast.config.ForecastProperties;
import com.airforecast.dto.EvaluationResponse;
import com.airforecast.dto.ForecastResponse;
import com.airforecast.dto.ModelStatusResponse;
import com.airforecast.dto.TrainingResponse;
import com.airforecast.entity.EvaluationReport;
import com.airforecast.entity.ForecastStep;
import com.airforecast.entity.PredictionRecord;
import com.airforecast.exception.PredictionTimeoutException;
import com.airforecast.exception.StaleModelException;
import com.airforecast.exception.TrainingDivergedException;
import com.airforecast.exception.UnknownCityException;
import com.airforecast.model.City;
import com.airforecast.model.ModelLifecycleState;
import com.airforecast.model.ModelVersion;
import com.airforecast.model.ObservationWindow;
import com.airforecast.model.RetrainDecision;
import com.airforecast.model.RetrainSignal;
import com.airforecast.model.TrainingResult;
import com.airforecast.repository.EvaluationReportRepository;
import com.airforecast.repository.PredictionRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ForecastServiceTest {

    private static final String CITY = "guangzhou";
    private static final Instant NOW = Instant.parse("2025-06-01T10:30:00Z");
    private static final Instant LATEST_HOUR = Instant.parse("2025-06-01T09:00:00Z");

    @Mock CityCatalog cityCatalog;
    @Mock WindowLoader windowLoader;
    @Mock NcCqrTrainer trainer;
    @Mock ModelRegistryService registry;
    @Mock ForecastPredictor predictor;
    @Mock ForecastEvaluator evaluator;
    @Mock RetrainPolicy retrainPolicy;
    @Mock ReproducibilityService reproducibility;
    @Mock PredictionRepository predictionRepository;
    @Mock EvaluationReportRepository evaluationReportRepository;

    private final ForecastProperties properties = new ForecastProperties();
    private final RetrainSignalRegistry signals = new RetrainSignalRegistry();
    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private ExecutorService executor;
    private ForecastService service;

    @BeforeEach
    void setUp() {
        executor = Executors.newSingleThreadExecutor();
        service = new ForecastService(cityCatalog, windowLoader, trainer, registry, predictor, evaluator,
            retrainPolicy, signals, reproducibility, predictionRepository, evaluationReportRepository,
            properties, executor, clock);
        lenient().when(cityCatalog.require(CITY)).thenReturn(new City(CITY, "Guangzhou", 1002));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void train_registersPromotesAndPurges_consumingPendingSignal() {
        ObservationWindow window = new ObservationWindow(CITY, LATEST_HOUR, List.of(), 0);
        TrainingResult result = ModelRegistryServiceTest.result(3.0);
        String versionId = "guangzhou-20250601T103000Z";
        signals.raise(new RetrainSignal(CITY, "coverage low", 0.7, 8.0, 48, NOW));

        when(windowLoader.load(CITY, LATEST_HOUR)).thenReturn(window);
        when(reproducibility.seedFor(CITY)).thenReturn(1002L);
        when(trainer.train(window, 1002L)).thenReturn(result);
        when(registry.put(CITY, NOW, result)).thenReturn(versionId);
        when(registry.purgeExpired(CITY, NOW)).thenReturn(2);
        when(registry.load(CITY, versionId)).thenReturn(version(versionId, result));

        TrainingResponse response = service.train(CITY);

        InOrder order = inOrder(registry);
        order.verify(registry).put(CITY, NOW, result);
        order.verify(registry).promote(CITY, versionId);
        order.verify(registry).purgeExpired(CITY, NOW);
        assertThat(response.getVersionId()).isEqualTo(versionId);
        assertThat(response.getWindowEnd()).isEqualTo(LATEST_HOUR);
        assertThat(response.getConsumedRetrainReason()).isEqualTo("coverage low");
        assertThat(response.getPurgedVersions()).isEqualTo(2);
        assertThat(response.getIntervalOffsets()).containsExactly(3.0);
        assertThat(signals.peek(CITY)).isEmpty();
    }

    @Test
    void train_failure_keepsSignalAndRegistryUntouched() {
        ObservationWindow window = new ObservationWindow(CITY, LATEST_HOUR, List.of(), 0);
        signals.raise(new RetrainSignal(CITY, "mae high", 0.9, 40.0, 48, NOW));
        when(windowLoader.load(CITY, LATEST_HOUR)).thenReturn(window);
        when(reproducibility.seedFor(CITY)).thenReturn(1002L);
        when(trainer.train(window, 1002L)).thenThrow(new TrainingDivergedException(CITY, 3));

        assertThatThrownBy(() -> service.train(CITY)).isInstanceOf(TrainingDivergedException.class);

        verifyNoInteractions(registry);
        assertThat(signals.peek(CITY)).map(RetrainSignal::reason).contains("mae high");
    }

    @Test
    void train_unknownCity_isRejectedBeforeAnyWork() {
        when(cityCatalog.require("atlantis")).thenThrow(new UnknownCityException("atlantis"));

        assertThatThrownBy(() -> service.train("atlantis")).isInstanceOf(UnknownCityException.class);
        verifyNoInteractions(windowLoader, trainer, registry);
    }

    @Test
    void predict_firstCall_persistsRecord() {
        PredictionRecord computed = record(null);
        when(predictor.predict(CITY, LATEST_HOUR)).thenReturn(computed);
        when(predictionRepository.findFirstByCityIdAndAsOfAndModelVersion(CITY, LATEST_HOUR, "v"))
            .thenReturn(Optional.empty());
        when(predictionRepository.save(computed)).thenAnswer(inv -> {
            computed.setId(UUID.randomUUID());
            return computed;
        });

        ForecastResponse response = service.predict(CITY, "req-1");

        assertThat(response.getPredictionId()).isNotNull();
        assertThat(response.getRequestId()).isEqualTo("req-1");
        assertThat(response.getSteps()).hasSize(1);
        assertThat(response.getSteps().get(0).getPoint()).isEqualTo(30.0);
    }

    @Test
    void predict_retry_returnsStoredForecast() {
        PredictionRecord stored = record(UUID.randomUUID());
        when(predictor.predict(CITY, LATEST_HOUR)).thenReturn(record(null));
        when(predictionRepository.findFirstByCityIdAndAsOfAndModelVersion(CITY, LATEST_HOUR, "v"))
            .thenReturn(Optional.of(stored));

        ForecastResponse response = service.predict(CITY, LATEST_HOUR.plusSeconds(120), "req-2");

        assertThat(response.getPredictionId()).isEqualTo(stored.getId());
        verify(predictionRepository, never()).save(any());
    }

    @Test
    void predict_slowPredictor_timesOut() {
        properties.getPrediction().setTimeout(Duration.ofMillis(50));
        when(predictor.predict(CITY, LATEST_HOUR)).thenAnswer(inv -> {
            Thread.sleep(5_000);
            return record(null);
        });

        assertThatThrownBy(() -> service.predict(CITY, "req-3"))
            .isInstanceOf(PredictionTimeoutException.class);
        verifyNoInteractions(predictionRepository);
    }

    @Test
    void predict_untrainedCity_surfacesStaleModel() {
        when(predictor.predict(CITY, LATEST_HOUR)).thenThrow(new StaleModelException(CITY));

        assertThatThrownBy(() -> service.predict(CITY, "req-4"))
            .isInstanceOf(StaleModelException.class);
    }

    @Test
    void evaluate_scoresDueForecasts_andRaisesRetrainSignal() {
        PredictionRecord due = record(UUID.randomUUID());
        EvaluationReport report = EvaluationReport.builder()
            .cityId(CITY).predictionId(due.getId()).modelVersion("v").evaluatedAt(NOW)
            .sampleCount(24).mae(3.0).rmse(4.0).coverage(0.5).meanIntervalWidth(6.0).build();
        when(predictionRepository.findDueForEvaluation(CITY, NOW.minus(Duration.ofHours(24))))
            .thenReturn(List.of(due));
        when(evaluator.evaluate(due)).thenReturn(report);
        when(evaluationReportRepository.save(report)).thenReturn(report);
        when(registry.currentVersionId(CITY)).thenReturn(Optional.of("v"));
        when(evaluationReportRepository.findByCityIdAndModelVersionOrderByEvaluatedAtDesc(eq(CITY), eq("v"), any()))
            .thenReturn(List.of(report));
        when(retrainPolicy.assess(List.of(report)))
            .thenReturn(RetrainDecision.retrain("coverage 0.500 below floor 0.800", 0.5, 3.0, 24));

        EvaluationResponse response = service.evaluate(CITY);

        assertThat(response.getEvaluatedPredictions()).isEqualTo(1);
        assertThat(response.getReports()).hasSize(1);
        assertThat(response.isRetrainRecommended()).isTrue();
        assertThat(due.isEvaluated()).isTrue();
        verify(predictionRepository).save(due);
        assertThat(signals.peek(CITY)).map(RetrainSignal::rollingCoverage).contains(0.5);
    }

    @Test
    void evaluate_reportsOfSupersededVersion_doNotRaiseRetrainSignal() {
        String current = "guangzhou-20250601T100000Z";
        String superseded = "guangzhou-20250531T023000Z";
        ForecastService realPolicy = new ForecastService(cityCatalog, windowLoader, trainer, registry, predictor,
            evaluator, new RetrainPolicy(properties), signals, reproducibility, predictionRepository,
            evaluationReportRepository, properties, executor, clock);
        List<EvaluationReport> poor = List.of(poorReport(superseded), poorReport(superseded), poorReport(superseded));
        when(registry.currentVersionId(CITY)).thenReturn(Optional.of(current));
        when(predictionRepository.findDueForEvaluation(eq(CITY), any())).thenReturn(List.of());
        when(evaluationReportRepository.findByCityIdAndModelVersionOrderByEvaluatedAtDesc(eq(CITY), eq(current), any()))
            .thenReturn(List.of());
        lenient().when(evaluationReportRepository.findByCityIdAndModelVersionOrderByEvaluatedAtDesc(
            eq(CITY), eq(superseded), any())).thenReturn(poor);

        EvaluationResponse response = realPolicy.evaluate(CITY);

        assertThat(response.isRetrainRecommended()).isFalse();
        assertThat(response.getRollingSampleCount()).isZero();
        assertThat(signals.peek(CITY)).isEmpty();
        verify(evaluationReportRepository, never())
            .findByCityIdAndModelVersionOrderByEvaluatedAtDesc(eq(CITY), eq(superseded), any());
    }

    @Test
    void evaluate_withoutPromotedVersion_assessesNoReports() {
        when(registry.currentVersionId(CITY)).thenReturn(Optional.empty());
        when(predictionRepository.findDueForEvaluation(eq(CITY), any())).thenReturn(List.of());
        when(retrainPolicy.assess(List.of())).thenReturn(RetrainDecision.keep("no evaluated samples", null, null, 0));

        EvaluationResponse response = service.evaluate(CITY);

        assertThat(response.isRetrainRecommended()).isFalse();
        verifyNoInteractions(evaluationReportRepository);
    }

    @Test
    void status_untrainedCity() {
        when(registry.listVersions(CITY)).thenReturn(List.of());
        when(registry.getCurrent(CITY)).thenReturn(Optional.empty());

        ModelStatusResponse status = service.status(CITY);

        assertThat(status.getState()).isEqualTo(ModelLifecycleState.UNTRAINED);
        assertThat(status.getCurrentVersion()).isNull();
        assertThat(status.isRetrainPending()).isFalse();
    }

    private static PredictionRecord record(UUID id) {
        return PredictionRecord.builder()
            .id(id)
            .cityId(CITY)
            .asOf(LATEST_HOUR)
            .modelVersion("v")
            .generatedAt(NOW)
            .steps(new java.util.ArrayList<>(List.of(
                new ForecastStep(LATEST_HOUR.plus(Duration.ofHours(1)), 30.0, 25.0, 35.0))))
            .build();
    }

    private static EvaluationReport poorReport(String modelVersion) {
        return EvaluationReport.builder()
            .cityId(CITY).predictionId(UUID.randomUUID()).modelVersion(modelVersion).evaluatedAt(NOW)
            .sampleCount(24).mae(3.0).rmse(4.0).coverage(0.4).meanIntervalWidth(6.0).build();
    }

    private static ModelVersion version(String versionId, TrainingResult r) {
        return new ModelVersion(CITY, versionId, NOW, r.model(), r.offset(), r.scaler(), r.diagnostics());
    }
}
