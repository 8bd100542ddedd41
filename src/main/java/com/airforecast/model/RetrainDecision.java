package com.airforecast.model;

/**
 * Outcome of applying the retrain policy to recent evaluation reports.
 * "No retrain" is an ordinary value, not an error.
 */
public record RetrainDecision(boolean retrain, String reason, Double rollingCoverage, Double rollingMae, long sampleCount) {

    public static RetrainDecision keep(String reason, Double coverage, Double mae, long samples) {
        return new RetrainDecision(false, reason, coverage, mae, samples);
    }

    public static RetrainDecision retrain(String reason, Double coverage, Double mae, long samples) {
        return new RetrainDecision(true, reason, coverage, mae, samples);
    }
}
