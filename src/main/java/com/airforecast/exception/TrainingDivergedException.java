package com.airforecast.exception;

public class TrainingDivergedException extends ForecastEngineException {
    public TrainingDivergedException(String cityId, int epoch) {
        super("TRAINING_DIVERGED",
              "Training for city '" + cityId + "' produced non-finite values at epoch " + epoch + ".");
    }
}
