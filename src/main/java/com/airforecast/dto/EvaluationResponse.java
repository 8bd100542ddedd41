package com.airforecast.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class EvaluationResponse {
    String  cityId;
    int     evaluatedPredictions;
    List<EvaluationReportResponse> reports;
    long    rollingSampleCount;
    Double  rollingCoverage;
    Double  rollingMae;
    boolean retrainRecommended;
    String  reason;
}
