package com.airforecast.exception;

public class InvalidObservationStreamException extends DataQualityException {
    public InvalidObservationStreamException(String message) {
        super("INVALID_OBSERVATION_STREAM", message);
    }
}
