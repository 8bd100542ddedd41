package com.airforecast.exception;

import java.time.Instant;

public class HorizonNotElapsedException extends ForecastEngineException {
    public HorizonNotElapsedException(String cityId, Instant lastTarget) {
        super("HORIZON_NOT_ELAPSED",
              "Forecast for city '" + cityId + "' covers hours up to " + lastTarget + ", which have not all elapsed.");
    }
}
