package com.airforecast.controller;

import com.airforecast.dto.AsyncJobResponse;
import com.airforecast.dto.EvaluationResponse;
import com.airforecast.dto.ForecastResponse;
import com.airforecast.dto.ModelStatusResponse;
import com.airforecast.dto.TrainingResponse;
import com.airforecast.service.ForecastService;
import com.airforecast.service.TrainingJobService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class ForecastController {

    private final ForecastService    forecastService;
    private final TrainingJobService trainingJobService;

    @PostMapping("/cities/{cityId}/train")
    public ResponseEntity<TrainingResponse> train(@PathVariable String cityId, HttpServletRequest httpRequest) {
        String requestId = resolveRequestId(httpRequest);
        log.info("POST /cities/{}/train | requestId={}", cityId, requestId);
        return ResponseEntity.status(HttpStatus.CREATED)
            .header("X-Request-ID", requestId)
            .body(forecastService.train(cityId));
    }

    @GetMapping("/cities/{cityId}/forecast")
    public ResponseEntity<ForecastResponse> forecast(
            @PathVariable String cityId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant asOf,
            HttpServletRequest httpRequest) {
        String requestId = resolveRequestId(httpRequest);
        log.info("GET /cities/{}/forecast | asOf={} | requestId={}", cityId, asOf, requestId);
        ForecastResponse body = asOf != null
            ? forecastService.predict(cityId, asOf, requestId)
            : forecastService.predict(cityId, requestId);
        return ResponseEntity.ok().header("X-Request-ID", requestId).body(body);
    }

    @GetMapping("/cities/{cityId}/forecasts")
    public ResponseEntity<Page<ForecastResponse>> history(
            @PathVariable String cityId,
            @RequestParam(defaultValue = "0") @Min(0) int page,
            @RequestParam(defaultValue = "20") @Min(1) @Max(100) int size) {
        return ResponseEntity.ok(forecastService.getHistory(cityId, PageRequest.of(page, size)));
    }

    @PostMapping("/cities/{cityId}/evaluate")
    public ResponseEntity<EvaluationResponse> evaluate(@PathVariable String cityId) {
        log.info("POST /cities/{}/evaluate", cityId);
        return ResponseEntity.ok(forecastService.evaluate(cityId));
    }

    @GetMapping("/cities/{cityId}/model")
    public ResponseEntity<ModelStatusResponse> model(@PathVariable String cityId) {
        return ResponseEntity.ok(forecastService.status(cityId));
    }

    @GetMapping("/cities")
    public ResponseEntity<List<ModelStatusResponse>> cities() {
        return ResponseEntity.ok(forecastService.statusAll());
    }

    @PostMapping("/training/jobs")
    public ResponseEntity<AsyncJobResponse> trainAll(HttpServletRequest httpRequest) {
        String requestId = resolveRequestId(httpRequest);
        UUID jobId = trainingJobService.submitTrainAll(requestId);
        return ResponseEntity.accepted()
            .header("X-Request-ID", requestId)
            .header("Location", "/api/v1/training/jobs/" + jobId)
            .body(trainingJobService.getJob(jobId));
    }

    @GetMapping("/training/jobs/{jobId}")
    public ResponseEntity<AsyncJobResponse> jobStatus(@PathVariable UUID jobId) {
        return ResponseEntity.ok(trainingJobService.getJob(jobId));
    }

    private String resolveRequestId(HttpServletRequest request) {
        String id = request.getHeader("X-Request-ID");
        return (id != null && !id.isBlank()) ? id : UUID.randomUUID().toString();
    }
}
