package com.airforecast.exception;

public class StaleModelException extends ForecastEngineException {
    public StaleModelException(String cityId) {
        super("STALE_MODEL", "No current model is registered for city '" + cityId + "'.");
    }
}
