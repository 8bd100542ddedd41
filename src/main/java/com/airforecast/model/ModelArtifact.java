package com.airforecast.model;

import java.time.Instant;

/**
 * Persisted metadata of a model version. The network and the scaler are stored beside it
 * under the same version id; this record is written last.
 */
public record ModelArtifact(
    String cityId,
    String versionId,
    Instant versionTimestamp,
    String featureSetVersion,
    int horizon,
    double quantileLow,
    double quantileHigh,
    ConformalOffset offset,
    TrainingDiagnostics diagnostics
) {
}
