package com.airforecast.exception;

import com.airforecast.dto.ApiError;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiError> handleTypeMismatch(
            MethodArgumentTypeMismatchException ex, HttpServletRequest request) {
        String msg = String.format("Parameter '%s' should be of type %s",
                ex.getName(), ex.getRequiredType() != null
                        ? ex.getRequiredType().getSimpleName() : "unknown");
        return build(HttpStatus.BAD_REQUEST, "Type Mismatch", msg, "TYPE_MISMATCH", request);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiError> handleConstraintViolation(
            ConstraintViolationException ex, HttpServletRequest request) {
        return build(HttpStatus.BAD_REQUEST, "Validation Failed", ex.getMessage(), "VALIDATION_FAILED", request);
    }

    @ExceptionHandler({UnknownCityException.class, JobNotFoundException.class})
    public ResponseEntity<ApiError> handleNotFound(
            ForecastEngineException ex, HttpServletRequest request) {
        return build(HttpStatus.NOT_FOUND, "Not Found", ex.getMessage(), ex.getErrorCode(), request);
    }

    @ExceptionHandler(DataQualityException.class)
    public ResponseEntity<ApiError> handleDataQuality(
            DataQualityException ex, HttpServletRequest request) {
        log.warn("Data quality rejection | path={} | code={} | {}",
                 request.getRequestURI(), ex.getErrorCode(), ex.getMessage());
        return build(HttpStatus.UNPROCESSABLE_ENTITY, "Data Quality", ex.getMessage(), ex.getErrorCode(), request);
    }

    @ExceptionHandler({StaleModelException.class, HorizonNotElapsedException.class,
                       ModelPromotionException.class})
    public ResponseEntity<ApiError> handleConflict(
            ForecastEngineException ex, HttpServletRequest request) {
        return build(HttpStatus.CONFLICT, "Conflict", ex.getMessage(), ex.getErrorCode(), request);
    }

    @ExceptionHandler(PredictionTimeoutException.class)
    public ResponseEntity<ApiError> handleTimeout(
            PredictionTimeoutException ex, HttpServletRequest request) {
        log.error("Prediction timed out: {}", ex.getMessage());
        return build(HttpStatus.GATEWAY_TIMEOUT, "Prediction Timeout", ex.getMessage(), ex.getErrorCode(), request);
    }

    @ExceptionHandler(TrainingCancelledException.class)
    public ResponseEntity<ApiError> handleCancelled(
            TrainingCancelledException ex, HttpServletRequest request) {
        return build(HttpStatus.SERVICE_UNAVAILABLE, "Training Cancelled", ex.getMessage(), ex.getErrorCode(), request);
    }

    @ExceptionHandler(ForecastEngineException.class)
    public ResponseEntity<ApiError> handleEngineFailure(
            ForecastEngineException ex, HttpServletRequest request) {
        log.error("Engine failure at {}: [{}] {}", request.getRequestURI(), ex.getErrorCode(), ex.getMessage(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Engine Failure", ex.getMessage(), ex.getErrorCode(), request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGeneric(
            Exception ex, HttpServletRequest request) {
        log.error("Unhandled exception at {}: {}", request.getRequestURI(), ex.getMessage(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                     "An unexpected error occurred", "INTERNAL_ERROR", request);
    }

    private ResponseEntity<ApiError> build(
            HttpStatus status, String error, String message, String errorCode,
            HttpServletRequest request) {

        ApiError body = ApiError.builder()
            .status(status.value())
            .error(error)
            .errorCode(errorCode)
            .message(message)
            .path(request.getRequestURI())
            .requestId(request.getHeader("X-Request-ID"))
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(status).body(body);
    }
}
