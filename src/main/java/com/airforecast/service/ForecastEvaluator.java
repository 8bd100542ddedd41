package com.airforecast.service;

import com.airforecast.entity.EvaluationReport;
import com.airforecast.entity.ForecastStep;
import com.airforecast.entity.PredictionRecord;
import com.airforecast.exception.HorizonNotElapsedException;
import com.airforecast.model.Observation;
import com.airforecast.source.ObservationSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Scores a stored forecast against the observations that have since arrived.
 * Steps without a valid observation are left out of every metric.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ForecastEvaluator {

    private final ObservationSource observationSource;
    private final Clock clock;

    public EvaluationReport evaluate(PredictionRecord record) {
        List<ForecastStep> steps = record.getSteps();
        Instant first = steps.get(0).getTargetTime();
        Instant last = steps.get(steps.size() - 1).getTargetTime();
        Instant now = clock.instant();
        if (last.isAfter(now)) {
            throw new HorizonNotElapsedException(record.getCityId(), last);
        }

        Map<Instant, Double> actuals = new HashMap<>();
        for (Observation o : observationSource.fetch(record.getCityId(), first, last)) {
            if (o.valid() && Double.isFinite(o.no2())) {
                actuals.put(o.observedAt().truncatedTo(ChronoUnit.HOURS), o.no2());
            }
        }

        EvaluationReport.EvaluationReportBuilder report = EvaluationReport.builder()
            .cityId(record.getCityId())
            .predictionId(record.getId())
            .modelVersion(record.getModelVersion())
            .evaluatedAt(now);

        double absErrorSum = 0.0;
        double squaredErrorSum = 0.0;
        double widthSum = 0.0;
        int covered = 0;
        int n = 0;
        for (ForecastStep step : steps) {
            Double actual = actuals.get(step.getTargetTime());
            if (actual == null) {
                continue;
            }
            double error = step.getPoint() - actual;
            absErrorSum += Math.abs(error);
            squaredErrorSum += error * error;
            widthSum += step.getUpper() - step.getLower();
            if (actual >= step.getLower() && actual <= step.getUpper()) {
                covered++;
            }
            n++;
        }

        if (n == 0) {
            log.warn("No realised observations for forecast | city={} | prediction={} | asOf={}",
                     record.getCityId(), record.getId(), record.getAsOf());
            return report.sampleCount(0).build();
        }
        return report
            .sampleCount(n)
            .mae(absErrorSum / n)
            .rmse(Math.sqrt(squaredErrorSum / n))
            .coverage((double) covered / n)
            .meanIntervalWidth(widthSum / n)
            .build();
    }
}
