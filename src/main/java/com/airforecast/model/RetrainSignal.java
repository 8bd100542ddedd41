package com.airforecast.model;

import java.time.Instant;

/**
 * Advisory request to retrain a city, raised by evaluation and consumed once by training.
 */
public record RetrainSignal(
    String cityId,
    String reason,
    Double rollingCoverage,
    Double rollingMae,
    long sampleCount,
    Instant raisedAt
) {
}
