package com.airforecast.service;

import com.airforecast.config.ForecastProperties;
import com.airforecast.entity.EvaluationReport;
import com.airforecast.model.RetrainDecision;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Decides from recent evaluation reports whether a city's model should be retrained.
 * Coverage and MAE are pooled across reports, weighted by each report's sample count.
 */
@Component
@RequiredArgsConstructor
public class RetrainPolicy {

    private final ForecastProperties properties;

    public RetrainDecision assess(List<EvaluationReport> recent) {
        ForecastProperties.Evaluation cfg = properties.getEvaluation();
        long samples = 0;
        double coverageSum = 0.0;
        double maeSum = 0.0;
        for (EvaluationReport r : recent) {
            if (r.getSampleCount() <= 0 || r.getCoverage() == null || r.getMae() == null) {
                continue;
            }
            samples += r.getSampleCount();
            coverageSum += r.getCoverage() * r.getSampleCount();
            maeSum += r.getMae() * r.getSampleCount();
        }
        if (samples == 0) {
            return RetrainDecision.keep("no evaluated samples", null, null, 0);
        }

        double coverage = coverageSum / samples;
        double mae = maeSum / samples;
        if (samples < cfg.getMinSamples()) {
            return RetrainDecision.keep("only " + samples + " samples, " + cfg.getMinSamples() + " required",
                coverage, mae, samples);
        }
        if (coverage < cfg.getCoverageFloor()) {
            return RetrainDecision.retrain(String.format("coverage %.3f below floor %.3f", coverage, cfg.getCoverageFloor()),
                coverage, mae, samples);
        }
        if (cfg.getMaeCeiling() != null && mae > cfg.getMaeCeiling()) {
            return RetrainDecision.retrain(String.format("MAE %.3f above ceiling %.3f", mae, cfg.getMaeCeiling()),
                coverage, mae, samples);
        }
        return RetrainDecision.keep("within thresholds", coverage, mae, samples);
    }
}
