package com.airforecast.exception;

public class ScalerMismatchException extends ForecastEngineException {
    public ScalerMismatchException(String expected, String actual) {
        super("SCALER_MISMATCH",
              "Scaler was fitted for feature set '" + actual + "' but '" + expected + "' was requested.");
    }
}
