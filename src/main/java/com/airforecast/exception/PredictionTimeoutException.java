package com.airforecast.exception;

import java.time.Duration;

public class PredictionTimeoutException extends ForecastEngineException {
    public PredictionTimeoutException(String cityId, Duration timeout, Throwable cause) {
        super("PREDICTION_TIMEOUT",
              "Prediction for city '" + cityId + "' did not complete within " + timeout.toMillis() + " ms.",
              cause);
    }
}
