package com.airforecast.exception;

import lombok.Getter;

@Getter
public abstract class ForecastEngineException extends RuntimeException {
    private final String errorCode;
    protected ForecastEngineException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    protected ForecastEngineException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
