package com.airforecast.model;

/**
 * Figures recorded for a finished training run.
 */
public record TrainingDiagnostics(
    int epochsRun,
    double finalLoss,
    double finalCrossingPenalty,
    int trainingSamples,
    int calibrationSamples,
    double calibrationCoverage,
    long seed,
    String fingerprint
) {
}
