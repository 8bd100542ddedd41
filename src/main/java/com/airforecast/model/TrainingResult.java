package com.airforecast.model;

/**
 * Everything a successful NC-CQR run produces. Nothing is persisted until the registry takes it.
 */
public record TrainingResult(
    String cityId,
    QuantileModel model,
    ConformalOffset offset,
    FeatureScaler scaler,
    TrainingDiagnostics diagnostics
) {
}
