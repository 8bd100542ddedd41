package com.airforecast.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ForecastResponse {
    UUID   predictionId;
    String cityId;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant asOf;
    String modelVersion;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant generatedAt;
    int    imputedHours;
    List<Step> steps;
    String requestId;

    @Value
    @Builder
    public static class Step {
        @JsonFormat(shape = JsonFormat.Shape.STRING)
        Instant targetTime;
        double point;
        double lower;
        double upper;
    }
}
