package com.airforecast.exception;

import java.time.Instant;

public class DataInsufficientException extends DataQualityException {
    public DataInsufficientException(String cityId, Instant from, Instant to, String detail) {
        super("DATA_INSUFFICIENT",
              "Not enough observations for city '" + cityId + "' in [" + from + ", " + to + "]: " + detail);
    }
}
