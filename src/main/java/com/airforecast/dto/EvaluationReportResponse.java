package com.airforecast.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class EvaluationReportResponse {
    UUID   predictionId;
    String modelVersion;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant evaluatedAt;
    long   sampleCount;
    Double mae;
    Double rmse;
    Double coverage;
    Double meanIntervalWidth;
}
