package com.airforecast.exception;

public class UnknownCityException extends ForecastEngineException {
    public UnknownCityException(String cityId) {
        super("UNKNOWN_CITY", "City '" + cityId + "' is not configured.");
    }
}
