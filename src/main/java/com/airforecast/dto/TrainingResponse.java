package com.airforecast.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TrainingResponse {
    String cityId;
    String versionId;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant versionTimestamp;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant windowEnd;
    long   seed;
    String fingerprint;
    int    epochsRun;
    double finalLoss;
    double finalCrossingPenalty;
    int    trainingSamples;
    int    calibrationSamples;
    double calibrationCoverage;
    /** Conformal widening per horizon step, in concentration units. */
    List<Double> intervalOffsets;
    String consumedRetrainReason;
    int    purgedVersions;
}
