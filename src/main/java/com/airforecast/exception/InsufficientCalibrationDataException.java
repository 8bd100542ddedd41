package com.airforecast.exception;

public class InsufficientCalibrationDataException extends ForecastEngineException {
    public InsufficientCalibrationDataException(int available, int required) {
        super("INSUFFICIENT_CALIBRATION_DATA",
              "Calibration split holds " + available + " examples; at least " + required + " are required.");
    }
}
