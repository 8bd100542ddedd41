package com.airforecast.service;

import com.airforecast.entity.ForecastStep;
import com.airforecast.entity.PredictionRecord;
import com.airforecast.exception.StaleModelException;
import com.airforecast.model.FeatureMatrix;
import com.airforecast.model.FeatureScaler;
import com.airforecast.model.ModelVersion;
import com.airforecast.model.ObservationWindow;
import com.airforecast.model.QuantileOutput;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Produces H-step forecasts from the current model of a city.
 *
 * <p>The loaded version is cached per city and replaced when the registry's current
 * pointer moves. Each call works on the one {@link ModelVersion} it resolved, so model,
 * offsets and scaler always come from the same version.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ForecastPredictor {

    private final ModelRegistryService registry;
    private final WindowLoader windowLoader;
    private final FeatureTransformer featureTransformer;
    private final Clock clock;

    private final ConcurrentHashMap<String, ModelVersion> cache = new ConcurrentHashMap<>();

    public PredictionRecord predict(String cityId, Instant asOf) {
        ModelVersion version = resolveCurrent(cityId);
        ObservationWindow window = windowLoader.load(cityId, asOf.truncatedTo(ChronoUnit.HOURS));
        return predictWith(version, window);
    }

    PredictionRecord predictWith(ModelVersion version, ObservationWindow window) {
        FeatureScaler scaler = version.scaler();
        FeatureMatrix features = featureTransformer.transform(window, scaler);
        QuantileOutput raw = version.model().forward(features.row(features.rows() - 1));

        Instant origin = window.endHour();
        List<ForecastStep> steps = new ArrayList<>(raw.horizon());
        for (int t = 0; t < raw.horizon(); t++) {
            double offset = version.offset().at(t);
            steps.add(ForecastStep.builder()
                .targetTime(origin.plus(Duration.ofHours(t + 1L)))
                .point(scaler.inverseTarget(raw.point()[t]))
                .lower(scaler.inverseTarget(raw.low()[t] - offset))
                .upper(scaler.inverseTarget(raw.high()[t] + offset))
                .build());
        }

        log.debug("Forecast computed | city={} | asOf={} | version={}", window.cityId(), origin, version.versionId());
        return PredictionRecord.builder()
            .cityId(window.cityId())
            .asOf(origin)
            .modelVersion(version.versionId())
            .generatedAt(clock.instant())
            .imputedHours(window.imputedHours())
            .evaluated(false)
            .steps(steps)
            .build();
    }

    ModelVersion resolveCurrent(String cityId) {
        String versionId = registry.currentVersionId(cityId)
            .orElseThrow(() -> new StaleModelException(cityId));
        ModelVersion cached = cache.get(cityId);
        if (cached != null && cached.versionId().equals(versionId)) {
            return cached;
        }
        ModelVersion loaded = registry.load(cityId, versionId);
        cache.put(cityId, loaded);
        log.info("Model loaded into predictor | city={} | version={}", cityId, versionId);
        return loaded;
    }
}
