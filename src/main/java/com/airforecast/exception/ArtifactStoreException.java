package com.airforecast.exception;

public class ArtifactStoreException extends ForecastEngineException {
    public ArtifactStoreException(String message) {
        super("ARTIFACT_STORE_ERROR", message);
    }
    public ArtifactStoreException(String message, Throwable cause) {
        super("ARTIFACT_STORE_ERROR", message, cause);
    }
}
