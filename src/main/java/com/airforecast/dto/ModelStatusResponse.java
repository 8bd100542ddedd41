package com.airforecast.dto;

import com.airforecast.model.ModelLifecycleState;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ModelStatusResponse {
    String cityId;
    String cityName;
    ModelLifecycleState state;
    String currentVersion;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant versionTimestamp;
    String fingerprint;
    Double calibrationCoverage;
    List<String> availableVersions;
    boolean retrainPending;
    String retrainReason;
}
