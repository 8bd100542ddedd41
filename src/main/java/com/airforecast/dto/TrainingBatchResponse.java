package com.airforecast.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Outcome of training every configured city. Data-quality rejections are reported as
 * skipped, anything else that stopped a run as failed; both map city id to reason.
 */
@Value
@Builder
public class TrainingBatchResponse {
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant startedAt;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant completedAt;
    List<TrainingResponse> successful;
    Map<String, String> skipped;
    Map<String, String> failed;
}
