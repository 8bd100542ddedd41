package com.airforecast.exception;

public class TrainingCancelledException extends ForecastEngineException {
    public TrainingCancelledException(String cityId) {
        super("TRAINING_CANCELLED", "Training for city '" + cityId + "' was cancelled.");
    }
}
