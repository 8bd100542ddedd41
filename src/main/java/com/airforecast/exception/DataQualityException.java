package com.airforecast.exception;

/**
 * Input data cannot support the requested operation. Scheduled training treats these as
 * "skip this city", not as failures.
 */
public abstract class DataQualityException extends ForecastEngineException {
    protected DataQualityException(String errorCode, String message) {
        super(errorCode, message);
    }
}
