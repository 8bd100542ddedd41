package com.airforecast.service;

import com.airforecast.config.ForecastProperties;
import com.airforecast.entity.EvaluationReport;
import com.airforecast.model.RetrainDecision;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class RetrainPolicyTest {

    private final ForecastProperties properties = new ForecastProperties();
    private final RetrainPolicy policy = new RetrainPolicy(properties);

    @Test
    void healthyReports_keepModel() {
        RetrainDecision decision = policy.assess(List.of(report(24, 0.92, 5.0), report(24, 0.88, 6.0)));

        assertThat(decision.retrain()).isFalse();
        assertThat(decision.rollingCoverage()).isCloseTo(0.90, within(1e-12));
        assertThat(decision.rollingMae()).isCloseTo(5.5, within(1e-12));
        assertThat(decision.sampleCount()).isEqualTo(48);
    }

    @Test
    void coverageBelowFloor_triggersRetrain_weightedBySamples() {
        // unweighted mean would be 0.85, weighted is (0.95*4 + 0.75*20) / 24 = 0.783
        RetrainDecision decision = policy.assess(List.of(report(4, 0.95, 5.0), report(20, 0.75, 5.0)));

        assertThat(decision.retrain()).isTrue();
        assertThat(decision.rollingCoverage()).isCloseTo(0.7833, within(1e-4));
        assertThat(decision.reason()).contains("coverage");
    }

    @Test
    void maeAboveCeiling_triggersRetrain() {
        RetrainDecision decision = policy.assess(List.of(report(24, 0.95, 30.0)));

        assertThat(decision.retrain()).isTrue();
        assertThat(decision.reason()).contains("MAE");
    }

    @Test
    void maeCeilingDisabled_onlyCoverageCounts() {
        properties.getEvaluation().setMaeCeiling(null);

        assertThat(policy.assess(List.of(report(24, 0.95, 300.0))).retrain()).isFalse();
    }

    @Test
    void tooFewSamples_keepModelEvenWhenPoor() {
        RetrainDecision decision = policy.assess(List.of(report(10, 0.2, 80.0)));

        assertThat(decision.retrain()).isFalse();
        assertThat(decision.sampleCount()).isEqualTo(10);
    }

    @Test
    void emptyReports_areIgnored() {
        RetrainDecision decision = policy.assess(List.of(report(0, null, null)));

        assertThat(decision.retrain()).isFalse();
        assertThat(decision.rollingCoverage()).isNull();
        assertThat(decision.sampleCount()).isZero();
    }

    private static EvaluationReport report(int samples, Double coverage, Double mae) {
        return EvaluationReport.builder().sampleCount(samples).coverage(coverage).mae(mae).build();
    }
}
