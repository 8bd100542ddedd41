package com.airforecast.model;

import java.time.Instant;

/**
 * A registered, immutable (model, offset, scaler) triple for one city.
 */
public record ModelVersion(
    String cityId,
    String versionId,
    Instant versionTimestamp,
    QuantileModel model,
    ConformalOffset offset,
    FeatureScaler scaler,
    TrainingDiagnostics diagnostics
) {
}
